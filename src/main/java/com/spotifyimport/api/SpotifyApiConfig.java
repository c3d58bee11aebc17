package com.spotifyimport.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * Settings for the Web API client and the local authorization listener.
 * <p>
 * {@link #fromEnvironment()} reads every key as a system property first, then as an environment
 * variable, and falls back to the value from {@link #defaults()}.
 * <p>
 * {@code redirectPort} is not a free choice: Spotify only redirects to URIs registered for the
 * client id, and the registered one is {@code http://127.0.0.1:43019/redirect}. Change it only
 * together with that registration.
 *
 * @param baseUrl              Web API base, ending with a slash
 * @param authorizeUrl         authorization endpoint of the accounts service
 * @param bindHost             address the authorization listener binds
 * @param redirectPort         port the authorization listener binds
 * @param tries                attempts per API request
 * @param retryBackoff         fixed wait between attempts
 * @param requestTimeout       timeout of a single HTTP exchange
 * @param progressInterval     minimum time between pagination progress messages
 * @param authorizationTimeout how long to wait for the browser redirect; empty waits forever
 * @author Spotify Import Team
 * @since 1.0
 */
public record SpotifyApiConfig(
    String baseUrl,
    String authorizeUrl,
    String bindHost,
    int redirectPort,
    int tries,
    Duration retryBackoff,
    Duration requestTimeout,
    Duration progressInterval,
    Optional<Duration> authorizationTimeout
) {
    private static final Logger logger = LoggerFactory.getLogger(SpotifyApiConfig.class);

    public static final String DEFAULT_BASE_URL = "https://api.spotify.com/v1/";
    public static final String DEFAULT_AUTHORIZE_URL = "https://accounts.spotify.com/authorize";
    public static final int DEFAULT_REDIRECT_PORT = 43019;

    public SpotifyApiConfig {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("baseUrl must not be empty");
        }
        if (!baseUrl.endsWith("/")) {
            baseUrl = baseUrl + "/";
        }
        if (tries < 1) {
            throw new IllegalArgumentException("tries must be at least 1, was " + tries);
        }
        if (redirectPort < 0 || redirectPort > 65535) {
            throw new IllegalArgumentException("redirectPort out of range: " + redirectPort);
        }
        if (requestTimeout == null || requestTimeout.isZero() || requestTimeout.isNegative()) {
            throw new IllegalArgumentException("requestTimeout must be positive, was " + requestTimeout);
        }
        authorizationTimeout = authorizationTimeout == null ? Optional.empty() : authorizationTimeout;
    }

    public static SpotifyApiConfig defaults() {
        return new SpotifyApiConfig(
            DEFAULT_BASE_URL,
            DEFAULT_AUTHORIZE_URL,
            "0.0.0.0",
            DEFAULT_REDIRECT_PORT,
            3,
            Duration.ofSeconds(2),
            Duration.ofSeconds(30),
            Duration.ofSeconds(15),
            Optional.empty()
        );
    }

    public static SpotifyApiConfig fromEnvironment() {
        SpotifyApiConfig d = defaults();
        long authTimeoutSeconds = number("SPOTIFY_AUTH_TIMEOUT_SECONDS", 0, 0, Integer.MAX_VALUE);
        return new SpotifyApiConfig(
            setting("SPOTIFY_API_BASE_URL", d.baseUrl()),
            setting("SPOTIFY_AUTHORIZE_URL", d.authorizeUrl()),
            setting("SPOTIFY_BIND_HOST", d.bindHost()),
            (int) number("SPOTIFY_REDIRECT_PORT", d.redirectPort(), 0, 65535),
            (int) number("SPOTIFY_REQUEST_TRIES", d.tries(), 1, Integer.MAX_VALUE),
            Duration.ofMillis(number("SPOTIFY_RETRY_BACKOFF_MS", d.retryBackoff().toMillis(), 0, Long.MAX_VALUE)),
            Duration.ofMillis(number("SPOTIFY_REQUEST_TIMEOUT_MS", d.requestTimeout().toMillis(), 1, Long.MAX_VALUE)),
            Duration.ofMillis(number("SPOTIFY_PROGRESS_INTERVAL_MS", d.progressInterval().toMillis(), 0,
                Long.MAX_VALUE)),
            authTimeoutSeconds > 0 ? Optional.of(Duration.ofSeconds(authTimeoutSeconds)) : Optional.empty()
        );
    }

    /**
     * Looks a setting up as a system property, then an environment variable.
     *
     * @param key          property / variable name
     * @param defaultValue value used when neither is set
     * @return the configured value
     */
    public static String setting(String key, String defaultValue) {
        return System.getProperty(key, System.getenv().getOrDefault(key, defaultValue));
    }

    private static long number(String key, long defaultValue, long min, long max) {
        String raw = setting(key, null);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        long value;
        try {
            value = Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            logger.warn("Ignoring {}='{}': not a number, using {}", key, raw, defaultValue);
            return defaultValue;
        }
        if (value < min || value > max) {
            logger.warn("Ignoring {}='{}': must be between {} and {}, using {}", key, raw, min, max, defaultValue);
            return defaultValue;
        }
        return value;
    }

    public SpotifyApiConfig withBaseUrl(String newBaseUrl) {
        return new SpotifyApiConfig(newBaseUrl, authorizeUrl, bindHost, redirectPort, tries, retryBackoff,
            requestTimeout, progressInterval, authorizationTimeout);
    }

    public SpotifyApiConfig withRetries(int newTries, Duration newBackoff) {
        return new SpotifyApiConfig(baseUrl, authorizeUrl, bindHost, redirectPort, newTries, newBackoff,
            requestTimeout, progressInterval, authorizationTimeout);
    }

    public SpotifyApiConfig withListener(String newBindHost, int newRedirectPort) {
        return new SpotifyApiConfig(baseUrl, authorizeUrl, newBindHost, newRedirectPort, tries, retryBackoff,
            requestTimeout, progressInterval, authorizationTimeout);
    }

    public SpotifyApiConfig withProgressInterval(Duration newInterval) {
        return new SpotifyApiConfig(baseUrl, authorizeUrl, bindHost, redirectPort, tries, retryBackoff,
            requestTimeout, newInterval, authorizationTimeout);
    }

    public SpotifyApiConfig withAuthorizationTimeout(Duration timeout) {
        return new SpotifyApiConfig(baseUrl, authorizeUrl, bindHost, redirectPort, tries, retryBackoff,
            requestTimeout, progressInterval, Optional.ofNullable(timeout));
    }
}
