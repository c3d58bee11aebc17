package com.spotifyimport.importer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.spotifyimport.api.SpotifyApiInterface;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * Adds matched tracks to a playlist. The Web API accepts at most 100 URIs per call, so the list
 * is sent in batches of that size.
 */
public class PlaylistImportService {
    private static final Logger logger = LoggerFactory.getLogger(PlaylistImportService.class);

    public static final int MAX_TRACKS_PER_REQUEST = 100;

    private final SpotifyApiInterface api;
    private final ObjectMapper mapper;

    public PlaylistImportService(SpotifyApiInterface api) {
        this(api, new ObjectMapper());
    }

    public PlaylistImportService(SpotifyApiInterface api, ObjectMapper mapper) {
        this.api = api;
        this.mapper = mapper;
    }

    /**
     * @param playlistId target playlist
     * @param uris       track URIs in the order they should be appended
     * @return number of requests sent
     */
    public int importTracks(String playlistId, List<String> uris) {
        if (playlistId == null || playlistId.isBlank()) {
            throw new IllegalArgumentException("playlistId cannot be empty");
        }
        String path = "playlists/" + pathSegment(playlistId) + "/tracks";
        List<List<String>> batches = Utils.chunks(uris, MAX_TRACKS_PER_REQUEST);
        for (List<String> batch : batches) {
            ObjectNode body = mapper.createObjectNode();
            ArrayNode array = body.putArray("uris");
            batch.forEach(array::add);
            api.post(path, Map.of(), body);
        }
        logger.info("Added {} tracks to playlist {} in {} requests", uris.size(), playlistId, batches.size());
        return batches.size();
    }

    private static String pathSegment(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
