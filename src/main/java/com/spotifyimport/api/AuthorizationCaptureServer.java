package com.spotifyimport.api;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.apache.commons.text.StringEscapeUtils;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Short-lived local HTTP listener that receives the access token at the end of the implicit
 * grant.
 * <p>
 * Spotify redirects the browser to {@code /redirect#access_token=...}. The fragment never reaches
 * a server, so {@code /redirect} answers with a script that reloads the page as
 * {@code /token?access_token=...}, turning the fragment into a query string. {@code /token} reads
 * the token, answers with a "you may close this window" page and completes the capture. Every
 * other path gets a 404 and the listener keeps waiting.
 * <p>
 * Exchanges are handled one at a time on the server's dispatcher thread. The token is handed over
 * through a single-slot future that is completed once, before the page is written, so a browser
 * that goes away mid-response cannot lose it. {@link #close()} gives a running exchange a second
 * to finish writing.
 *
 * @author Spotify Import Team
 * @since 1.0
 */
public final class AuthorizationCaptureServer implements AutoCloseable {
    private static final Pattern ACCESS_TOKEN = Pattern.compile("access_token=([^&]*)");
    private static final Pattern ERROR = Pattern.compile("(?:^|[?&])error=([^&]*)");

    static final String REDIRECT_PAGE = "<script>location.replace(\"token?\" + location.hash.slice(1));</script>";
    static final String TOKEN_PAGE = "<script>close()</script>Thanks! You may now close this window.";

    private final HttpServer server;
    private final Diagnostics diagnostics;
    private final CompletableFuture<AuthorizationCapture> capture = new CompletableFuture<>();
    private volatile CaptureState state = CaptureState.LISTENING;

    private AuthorizationCaptureServer(HttpServer server, Diagnostics diagnostics) {
        this.server = server;
        this.diagnostics = diagnostics;
    }

    /**
     * Binds the listener and starts serving.
     *
     * @param host        bind address, usually {@code 0.0.0.0}
     * @param port        bind port; 0 picks a free one
     * @param diagnostics where authorization failures are reported
     * @return the running listener
     * @throws AuthorizationException if the address cannot be bound
     */
    public static AuthorizationCaptureServer start(String host, int port, Diagnostics diagnostics) {
        HttpServer server;
        try {
            server = HttpServer.create(new InetSocketAddress(host, port), 0);
        } catch (IOException e) {
            throw new AuthorizationException("Could not listen on " + host + ":" + port
                + " for the authorization redirect", e);
        }
        AuthorizationCaptureServer captureServer = new AuthorizationCaptureServer(server, diagnostics);
        server.createContext("/", captureServer::handle);
        server.setExecutor(null);
        server.start();
        return captureServer;
    }

    public int getPort() {
        return server.getAddress().getPort();
    }

    public CaptureState getState() {
        return state;
    }

    public boolean isCaptured() {
        return capture.isDone();
    }

    /**
     * Blocks until the browser delivers a token.
     *
     * @param timeout how long to wait; empty waits indefinitely
     * @return the captured token
     * @throws AuthorizationException on timeout or interruption
     */
    public AuthorizationCapture awaitCapture(Optional<Duration> timeout) {
        try {
            if (timeout.isPresent()) {
                return capture.get(timeout.get().toMillis(), TimeUnit.MILLISECONDS);
            }
            return capture.get();
        } catch (TimeoutException e) {
            throw new AuthorizationException("No authorization received within "
                + timeout.get().toMillis() + " ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AuthorizationException("Interrupted while waiting for authorization", e);
        } catch (ExecutionException e) {
            throw new AuthorizationException("Authorization capture failed", e.getCause());
        }
    }

    @Override
    public void close() {
        server.stop(1);
    }

    /**
     * Pulls {@code access_token} out of a request target such as
     * {@code /token?access_token=ABC&token_type=Bearer}.
     *
     * @param target request path and query
     * @return the decoded token, or empty if there is none
     */
    public static Optional<String> extractAccessToken(String target) {
        return find(ACCESS_TOKEN, target);
    }

    private static Optional<String> find(Pattern pattern, String target) {
        if (target == null) {
            return Optional.empty();
        }
        Matcher m = pattern.matcher(target);
        if (!m.find() || m.group(1).isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(URLDecoder.decode(m.group(1), StandardCharsets.UTF_8));
    }

    private void handle(HttpExchange exchange) throws IOException {
        try {
            String path = exchange.getRequestURI().getPath();
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                respond(exchange, 405, "Method not allowed");
            } else if ("/redirect".equals(path)) {
                handleRedirect(exchange);
            } else if ("/token".equals(path)) {
                handleToken(exchange);
            } else {
                respond(exchange, 404, "Not found");
            }
        } finally {
            exchange.close();
        }
    }

    private void handleRedirect(HttpExchange exchange) throws IOException {
        if (state == CaptureState.LISTENING) {
            state = CaptureState.REDIRECT_RECEIVED;
        }
        respond(exchange, 200, REDIRECT_PAGE);
    }

    private void handleToken(HttpExchange exchange) throws IOException {
        String query = exchange.getRequestURI().getRawQuery();
        Optional<String> token = extractAccessToken(query);
        if (token.isEmpty()) {
            String error = find(ERROR, query).orElse("no access_token in redirect");
            diagnostics.error("Authorization failed: {}", error);
            respond(exchange, 400, "Authorization failed: " + StringEscapeUtils.escapeHtml4(error)
                + ". Close this window and try again.");
            return;
        }
        deliver(token.get());
        respond(exchange, 200, TOKEN_PAGE);
    }

    private void deliver(String token) {
        if (capture.isDone()) {
            return;
        }
        state = CaptureState.TOKEN_DELIVERED;
        diagnostics.info("Received access token from Spotify: {}", BearerSession.mask(token));
        capture.complete(new AuthorizationCapture(token));
    }

    private static void respond(HttpExchange exchange, int status, String html) throws IOException {
        byte[] bytes = html.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "text/html; charset=utf-8");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
