package com.spotifyimport.api;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Logs the user in with the OAuth2 implicit grant.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Starts an {@link AuthorizationCaptureServer} on the registered redirect port.</li>
 *   <li>Logs the authorization URL, so it can be opened by hand, and asks the browser to open it.
 *       Failing to open a browser is not fatal.</li>
 *   <li>Waits until the listener captures the token (forever unless a timeout is configured),
 *       stops the listener and wraps the token in a {@link BearerSession}.</li>
 * </ul>
 *
 * @author Spotify Import Team
 * @since 1.0
 */
public final class SpotifyAuthService implements AuthServiceInterface {
    private final SpotifyApiConfig config;
    private final BrowserLauncher browser;
    private final Diagnostics diagnostics;

    public SpotifyAuthService(SpotifyApiConfig config, Diagnostics diagnostics) {
        this(config, new DesktopBrowserLauncher(), diagnostics);
    }

    public SpotifyAuthService(SpotifyApiConfig config, BrowserLauncher browser, Diagnostics diagnostics) {
        this.config = config;
        this.browser = browser;
        this.diagnostics = diagnostics;
    }

    @Override
    public String buildAuthorizeUrl(String clientId, List<String> scopes) {
        return buildAuthorizeUrl(clientId, scopes, config.redirectPort());
    }

    String buildAuthorizeUrl(String clientId, List<String> scopes, int port) {
        if (clientId == null || clientId.isBlank()) {
            throw new IllegalArgumentException("clientId must not be empty");
        }
        Map<String, String> params = new LinkedHashMap<>();
        params.put("response_type", "token");
        params.put("client_id", clientId);
        params.put("scope", String.join(" ", scopes == null ? List.of() : scopes));
        params.put("redirect_uri", redirectUri(port));
        return config.authorizeUrl() + "?" + params.entrySet().stream()
            .map(e -> URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8) + "="
                + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
            .collect(Collectors.joining("&"));
    }

    static String redirectUri(int port) {
        return "http://127.0.0.1:" + port + "/redirect";
    }

    @Override
    public BearerSession authorize(String clientId, List<String> scopes) {
        try (AuthorizationCaptureServer server =
                 AuthorizationCaptureServer.start(config.bindHost(), config.redirectPort(), diagnostics)) {
            String url = buildAuthorizeUrl(clientId, scopes, server.getPort());
            diagnostics.info("Logging in (click if it doesn't open automatically): {}", url);
            try {
                browser.open(URI.create(url));
            } catch (IOException | RuntimeException e) {
                diagnostics.warn("Could not open a browser ({}); open the URL above manually.", e.getMessage());
            }
            AuthorizationCapture capture = server.awaitCapture(config.authorizationTimeout());
            return new BearerSession(capture.accessToken());
        }
    }
}
