package com.spotifyimport.importer;

/**
 * Result of searching Spotify for one {@link Song}.
 *
 * @param title         cleaned source title
 * @param artist        source artist
 * @param matchedName   name of the best Spotify track, null when nothing was found
 * @param matchedArtist first artist of that track
 * @param distance      Levenshtein distance between {@code title} and {@code matchedName}
 * @param uri           Spotify track URI, null when nothing was found
 */
public record TrackMatch(
    String title,
    String artist,
    String matchedName,
    String matchedArtist,
    Integer distance,
    String uri
) {

    public static TrackMatch unmatched(String title, String artist) {
        return new TrackMatch(title, artist, null, null, null, null);
    }

    public boolean matched() {
        return uri != null;
    }
}
