package com.spotifyimport.api;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Collects every item of a paginated Web API listing.
 * <p>
 * The Web API splits long lists into pages of {@code {"items", "next", "total"}}. The walker
 * requests the first page, then keeps following {@code next} (a complete URL, requested as is)
 * until the server stops sending one. Items are returned in page order, without deduplication.
 * If any page fails for good the {@link RetriesExhaustedException} propagates and nothing that was
 * collected so far is returned.
 * <p>
 * Progress ({@code Loaded n/total items}) is reported at most once per
 * {@link SpotifyApiConfig#progressInterval()}.
 */
public class PaginationWalker {
    private final RetryingRequestExecutor executor;
    private final Clock clock;
    private final Diagnostics diagnostics;

    public PaginationWalker(RetryingRequestExecutor executor, Diagnostics diagnostics) {
        this(executor, Clock.systemUTC(), diagnostics);
    }

    public PaginationWalker(RetryingRequestExecutor executor, Clock clock, Diagnostics diagnostics) {
        this.executor = executor;
        this.clock = clock;
        this.diagnostics = diagnostics;
    }

    /**
     * @param path   first page, relative to the API base
     * @param params query parameters of the first request only
     * @return all items of all pages
     */
    public List<JsonNode> listAll(String path, Map<String, String> params) {
        String baseUrl = executor.config().baseUrl();
        long intervalMillis = executor.config().progressInterval().toMillis();
        long lastProgressLog = clock.millis();

        Page page = Page.from(executor.execute(ApiRequest.get(baseUrl, path, params)));
        List<JsonNode> accumulated = new ArrayList<>(page.items());
        Optional<String> next = page.next();

        while (next.isPresent()) {
            long now = clock.millis();
            if (now > lastProgressLog + intervalMillis) {
                lastProgressLog = now;
                diagnostics.info("Loaded {}/{} items", accumulated.size(), page.total());
            }
            page = Page.from(executor.execute(ApiRequest.absolute(next.get())));
            accumulated.addAll(page.items());
            next = page.next();
        }
        return accumulated;
    }
}
