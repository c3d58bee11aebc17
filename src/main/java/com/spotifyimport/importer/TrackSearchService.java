package com.spotifyimport.importer;

import com.fasterxml.jackson.databind.JsonNode;
import com.spotifyimport.api.SpotifyApiInterface;
import org.apache.commons.text.similarity.LevenshteinDistance;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Looks up the best Spotify track for a {@link Song}.
 * <p>
 * The query is "artist title" with parenthesised parts of the title removed, limited to one
 * result. The Levenshtein distance between the cleaned title and the found track name is kept so
 * the CSV report shows how close the match is.
 */
public class TrackSearchService {
    private final SpotifyApiInterface api;
    private final LevenshteinDistance levenshtein = LevenshteinDistance.getDefaultInstance();

    public TrackSearchService(SpotifyApiInterface api) {
        this.api = api;
    }

    public TrackMatch search(Song song) {
        String title = Utils.cleanTitle(song.title());
        Map<String, String> params = new LinkedHashMap<>();
        params.put("q", song.artist() + " " + title);
        params.put("type", "track");
        params.put("limit", "1");

        JsonNode items = api.get("search", params).path("tracks").path("items");
        if (!items.isArray() || items.isEmpty()) {
            return TrackMatch.unmatched(title, song.artist());
        }
        JsonNode track = items.get(0);
        String name = track.path("name").asText("");
        return new TrackMatch(
            title,
            song.artist(),
            name,
            track.path("artists").path(0).path("name").asText(""),
            levenshtein.apply(title, name),
            track.path("uri").asText(null)
        );
    }
}
