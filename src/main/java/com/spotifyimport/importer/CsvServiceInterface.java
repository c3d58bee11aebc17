package com.spotifyimport.importer;

import java.io.IOException;

/**
 * Interface for the CSV match report.
 */
public interface CsvServiceInterface {
    /**
     * Writes one report row for a search result.
     * @param match search result to report
     * @throws IOException if writing fails
     */
    void writeMatch(TrackMatch match) throws IOException;
}
