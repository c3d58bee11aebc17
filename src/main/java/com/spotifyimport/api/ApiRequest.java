package com.spotifyimport.api;

import com.fasterxml.jackson.databind.JsonNode;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * One call against the Web API, built per request and never modified afterwards.
 *
 * @param baseUrl     API base, e.g. {@code https://api.spotify.com/v1/}
 * @param path        path relative to the base, or a full URL that already starts with it
 * @param queryParams query parameters in the order they are appended
 * @param method      HTTP method
 * @param body        JSON body for POST requests
 */
public record ApiRequest(
    String baseUrl,
    String path,
    Map<String, String> queryParams,
    HttpMethod method,
    Optional<JsonNode> body
) {

    public ApiRequest {
        if (baseUrl == null || path == null || method == null) {
            throw new IllegalArgumentException("baseUrl, path and method are required");
        }
        queryParams = queryParams == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(queryParams));
        body = body == null ? Optional.empty() : body;
    }

    public static ApiRequest get(String baseUrl, String path, Map<String, String> queryParams) {
        return new ApiRequest(baseUrl, path, queryParams, HttpMethod.GET, Optional.empty());
    }

    /**
     * A GET for a complete URL handed out by the server, such as a page's {@code next} link.
     * The URL is its own base, so it is never re-prefixed.
     */
    public static ApiRequest absolute(String url) {
        return new ApiRequest(url, url, Map.of(), HttpMethod.GET, Optional.empty());
    }

    public static ApiRequest post(String baseUrl, String path, Map<String, String> queryParams, JsonNode body) {
        return new ApiRequest(baseUrl, path, queryParams, HttpMethod.POST, Optional.ofNullable(body));
    }

    /**
     * Resolves the path against the base and appends the query string.
     *
     * @return the full request URL
     */
    public String url() {
        String url = path.startsWith(baseUrl) ? path : baseUrl + path;
        if (queryParams.isEmpty()) {
            return url;
        }
        String query = queryParams.entrySet().stream()
            .map(e -> encode(e.getKey()) + "=" + encode(e.getValue()))
            .collect(Collectors.joining("&"));
        return url + (url.contains("?") ? "&" : "?") + query;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8);
    }
}
