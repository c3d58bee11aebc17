package com.spotifyimport.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Issues Web API requests on behalf of a {@link BearerSession}, retrying transient failures.
 * <p>
 * Every request carries the bearer token. A transport error, a non-2xx status or a body that is
 * not JSON counts as a failed attempt; the executor then waits a fixed backoff and tries again, up
 * to {@link SpotifyApiConfig#tries()} attempts in total. There is no exponential growth and no
 * jitter. When the last attempt fails a {@link RetriesExhaustedException} is thrown and the
 * caller decides whether to abort.
 *
 * @author Spotify Import Team
 * @since 1.0
 */
public class RetryingRequestExecutor {
    private final SpotifyApiConfig config;
    private final BearerSession session;
    private final HttpTransport transport;
    private final Diagnostics diagnostics;
    private final ObjectMapper mapper;

    public RetryingRequestExecutor(SpotifyApiConfig config, BearerSession session, HttpTransport transport,
                                   Diagnostics diagnostics) {
        this(config, session, transport, diagnostics, new ObjectMapper());
    }

    public RetryingRequestExecutor(SpotifyApiConfig config, BearerSession session, HttpTransport transport,
                                   Diagnostics diagnostics, ObjectMapper mapper) {
        this.config = config;
        this.session = session;
        this.transport = transport;
        this.diagnostics = diagnostics;
        this.mapper = mapper;
    }

    public SpotifyApiConfig config() {
        return config;
    }

    /**
     * Sends the request, retrying up to the configured number of attempts.
     *
     * @param request request to send
     * @return decoded JSON response; {@link NullNode} for an empty body
     * @throws RetriesExhaustedException if every attempt failed
     * @throws SpotifyApiException       if the URL is malformed or the thread is interrupted while
     *                                   sending or backing off
     */
    public JsonNode execute(ApiRequest request) {
        String url = request.url();
        HttpRequest httpRequest = buildHttpRequest(request, url);
        int tries = config.tries();

        IOException lastFailure = null;
        for (int attempt = 1; attempt <= tries; attempt++) {
            try {
                return send(httpRequest);
            } catch (IOException e) {
                lastFailure = e;
                diagnostics.info("Couldn't load URL: {} ({})", url, e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new SpotifyApiException("Interrupted while requesting " + url, e);
            }
            if (attempt < tries) {
                backoff(url);
                diagnostics.info("Trying again...");
            }
        }
        throw new RetriesExhaustedException(url, tries, lastFailure);
    }

    private JsonNode send(HttpRequest httpRequest) throws IOException, InterruptedException {
        HttpResponse<String> response = transport.send(httpRequest);
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new UnexpectedStatusException(status, response.body());
        }
        String body = response.body();
        if (body == null || body.isBlank()) {
            return NullNode.getInstance();
        }
        return mapper.readTree(body);
    }

    HttpRequest buildHttpRequest(ApiRequest request, String url) {
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            throw new SpotifyApiException("Invalid request URL " + url, e);
        }
        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(uri)
            .timeout(config.requestTimeout())
            .header("Accept", "application/json");
        session.apply(builder);

        if (request.method() == HttpMethod.POST) {
            byte[] payload = request.body().map(this::serialize).orElse(new byte[0]);
            builder.header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofByteArray(payload));
        } else {
            builder.GET();
        }
        return builder.build();
    }

    private byte[] serialize(JsonNode body) {
        try {
            return mapper.writeValueAsString(body).getBytes(StandardCharsets.UTF_8);
        } catch (JsonProcessingException e) {
            throw new SpotifyApiException("Could not serialize request body", e);
        }
    }

    private void backoff(String url) {
        Duration backoff = config.retryBackoff();
        if (backoff.isZero() || backoff.isNegative()) {
            return;
        }
        try {
            Thread.sleep(backoff.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SpotifyApiException("Interrupted while waiting to retry " + url, e);
        }
    }
}
