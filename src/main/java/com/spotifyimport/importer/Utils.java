package com.spotifyimport.importer;

import java.util.ArrayList;
import java.util.List;

/**
 * Small helpers shared by the importer services.
 *
 * @author Spotify Import Team
 * @since 1.0
 */
public final class Utils {

    private Utils() {}

    /**
     * Removes parenthesised segments such as "(Remastered 2011)" and trims the rest.
     * @param title Source title
     * @return Cleaned title, empty for null
     */
    public static String cleanTitle(String title) {
        return title == null ? "" : title.replaceAll("\\(.*?\\)", "").trim();
    }

    /**
     * Splits a list into consecutive chunks of at most {@code size} elements.
     * @param list Input list
     * @param size Maximum chunk size, positive
     * @param <T> Element type
     * @return Chunks in order; empty for an empty list
     */
    public static <T> List<List<T>> chunks(List<T> list, int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("Chunk size must be positive: " + size);
        }
        List<List<T>> out = new ArrayList<>();
        for (int i = 0; i < list.size(); i += size) {
            out.add(List.copyOf(list.subList(i, Math.min(list.size(), i + size))));
        }
        return out;
    }
}
