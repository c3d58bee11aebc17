package com.spotifyimport.importer;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

public class UtilsTest {

    @Test
    void testCleanTitleRemovesParentheses() {
        assertEquals("Hey Jude", Utils.cleanTitle("Hey Jude (Remastered 2015)"));
        assertEquals("Song  Name", Utils.cleanTitle(" Song (feat. X) Name (Live) "));
        assertEquals("Plain", Utils.cleanTitle("Plain"));
        assertEquals("", Utils.cleanTitle(null));
    }

    @Test
    void testChunks() {
        List<Integer> values = IntStream.range(0, 250).boxed().collect(Collectors.toList());

        List<List<Integer>> chunks = Utils.chunks(values, 100);

        assertEquals(3, chunks.size());
        assertEquals(100, chunks.get(0).size());
        assertEquals(100, chunks.get(1).size());
        assertEquals(50, chunks.get(2).size());
        assertEquals(200, chunks.get(2).get(0));
    }

    @Test
    void testChunksOfEmptyList() {
        assertTrue(Utils.chunks(List.of(), 100).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> Utils.chunks(List.of(1), 0));
    }
}
