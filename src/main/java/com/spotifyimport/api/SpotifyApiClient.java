package com.spotifyimport.api;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;

/**
 * Default {@link SpotifyApiInterface}: single calls go through a {@link RetryingRequestExecutor},
 * listings through a {@link PaginationWalker} on top of it.
 *
 * @author Spotify Import Team
 * @since 1.0
 */
public class SpotifyApiClient implements SpotifyApiInterface {
    private final RetryingRequestExecutor executor;
    private final PaginationWalker walker;

    public SpotifyApiClient(SpotifyApiConfig config, BearerSession session, Diagnostics diagnostics) {
        this(new RetryingRequestExecutor(config, session, new JdkHttpTransport(config.requestTimeout()), diagnostics),
            diagnostics);
    }

    public SpotifyApiClient(RetryingRequestExecutor executor, Diagnostics diagnostics) {
        this(executor, new PaginationWalker(executor, diagnostics));
    }

    public SpotifyApiClient(RetryingRequestExecutor executor, PaginationWalker walker) {
        this.executor = executor;
        this.walker = walker;
    }

    @Override
    public JsonNode get(String path, Map<String, String> params) {
        return executor.execute(ApiRequest.get(executor.config().baseUrl(), path, params));
    }

    @Override
    public JsonNode post(String path, Map<String, String> params, JsonNode body) {
        return executor.execute(ApiRequest.post(executor.config().baseUrl(), path, params, body));
    }

    @Override
    public List<JsonNode> list(String path, Map<String, String> params) {
        return walker.listAll(path, params);
    }
}
