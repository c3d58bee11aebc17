package com.spotifyimport.importer;

import org.junit.jupiter.api.Test;

import java.io.StringWriter;

import static org.junit.jupiter.api.Assertions.*;

public class CsvServiceTest {

    @Test
    void testWritesMatchedAndUnmatchedRows() throws Exception {
        StringWriter out = new StringWriter();
        CsvService csv = new CsvService(out);

        csv.writeMatch(new TrackMatch("Hey Jude", "The Beatles", "Hey Jude", "The Beatles", 0, "spotify:track:1"));
        csv.writeMatch(TrackMatch.unmatched("Nothing", "Nobody"));

        assertEquals("Hey Jude,The Beatles,Hey Jude,The Beatles,0\nNothing,Nobody,,\n", out.toString());
    }

    @Test
    void testQuotesValuesContainingSeparator() throws Exception {
        StringWriter out = new StringWriter();

        new CsvService(out).writeMatch(TrackMatch.unmatched("Hello, Goodbye", "The Beatles"));

        assertEquals("\"Hello, Goodbye\",The Beatles,,\n", out.toString());
    }

    @Test
    void testRejectsNullMatch() {
        assertThrows(IllegalArgumentException.class, () -> new CsvService(new StringWriter()).writeMatch(null));
    }
}
