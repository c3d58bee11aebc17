package com.spotifyimport.api;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;

/**
 * Interface for authenticated Spotify Web API calls.
 * Paths are relative to the API base unless they already start with it.
 */
public interface SpotifyApiInterface {

    /**
     * Gets a resource and returns the decoded response.
     * @param path resource path, e.g. {@code me}
     * @param params query parameters, appended in iteration order
     * @return decoded JSON response
     */
    JsonNode get(String path, Map<String, String> params);

    default JsonNode get(String path) {
        return get(path, Map.of());
    }

    /**
     * Posts a JSON body and returns the decoded response.
     * @param path resource path
     * @param params query parameters
     * @param body JSON body, may be null
     * @return decoded JSON response
     */
    JsonNode post(String path, Map<String, String> params, JsonNode body);

    /**
     * Fetches every page of a paginated listing and joins the items.
     * @param path first page path
     * @param params query parameters for the first page
     * @return all items in page order
     */
    List<JsonNode> list(String path, Map<String, String> params);
}
