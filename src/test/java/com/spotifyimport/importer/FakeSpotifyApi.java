package com.spotifyimport.importer;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.spotifyimport.api.SpotifyApiInterface;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory Web API: answers {@code me}, answers {@code search} from registered tracks keyed by
 * the query string, and records everything posted.
 */
final class FakeSpotifyApi implements SpotifyApiInterface {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Map<String, ObjectNode> tracksByQuery = new HashMap<>();
    final List<Map<String, String>> searches = new ArrayList<>();
    final List<String> postPaths = new ArrayList<>();
    final List<JsonNode> postBodies = new ArrayList<>();

    FakeSpotifyApi track(String query, String name, String artist, String uri) {
        ObjectNode track = MAPPER.createObjectNode();
        track.put("name", name);
        track.put("uri", uri);
        track.putArray("artists").addObject().put("name", artist);
        tracksByQuery.put(query, track);
        return this;
    }

    @Override
    public JsonNode get(String path, Map<String, String> params) {
        if ("me".equals(path)) {
            return MAPPER.createObjectNode().put("id", "user1").put("display_name", "Test User");
        }
        if ("search".equals(path)) {
            searches.add(new LinkedHashMap<>(params));
            ObjectNode response = MAPPER.createObjectNode();
            ArrayNode items = response.putObject("tracks").putArray("items");
            ObjectNode track = tracksByQuery.get(params.get("q"));
            if (track != null) {
                items.add(track);
            }
            return response;
        }
        throw new IllegalArgumentException("Unexpected GET " + path);
    }

    @Override
    public JsonNode post(String path, Map<String, String> params, JsonNode body) {
        postPaths.add(path);
        postBodies.add(body);
        return MAPPER.createObjectNode().put("snapshot_id", "snap" + postPaths.size());
    }

    @Override
    public List<JsonNode> list(String path, Map<String, String> params) {
        throw new UnsupportedOperationException("list is not used by the importer");
    }
}
