package com.spotifyimport.importer;

import com.opencsv.CSVWriter;
import com.opencsv.ICSVWriter;

import java.io.IOException;
import java.io.Writer;

/**
 * Writes the match report as CSV using OpenCSV, one row per searched song, flushed as it goes.
 * <p>
 * Columns: source title, source artist, matched track name, matched artist, title distance.
 * Songs without a match only fill the first two and leave the next two empty.
 *
 * @author Spotify Import Team
 * @since 1.0
 */
public class CsvService implements CsvServiceInterface {
    private final ICSVWriter writer;

    public CsvService(Writer out) {
        this.writer = new CSVWriter(out,
            ICSVWriter.DEFAULT_SEPARATOR,
            ICSVWriter.DEFAULT_QUOTE_CHARACTER,
            ICSVWriter.DEFAULT_ESCAPE_CHARACTER,
            "\n");
    }

    @Override
    public void writeMatch(TrackMatch match) throws IOException {
        if (match == null) {
            throw new IllegalArgumentException("match cannot be null");
        }
        String[] row = match.matched()
            ? new String[]{
                safe(match.title()),
                safe(match.artist()),
                safe(match.matchedName()),
                safe(match.matchedArtist()),
                match.distance() == null ? "" : match.distance().toString()
            }
            : new String[]{safe(match.title()), safe(match.artist()), "", ""};
        writer.writeNext(row, false);
        writer.flush();
    }

    private static String safe(String s) {
        return s == null ? "" : s;
    }
}
