package com.spotifyimport.importer;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Immutable record for one entry of the import file.
 * <p>
 * The file is a JSON array of objects with at least {@code title} and {@code artist}; any other
 * fields are ignored.
 *
 * @param title  song title as exported from the source library, may contain "(Remastered)" style suffixes
 * @param artist artist name
 * @author Spotify Import Team
 * @since 1.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Song(String title, String artist) {}
