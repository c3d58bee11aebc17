package com.spotifyimport.api;

/**
 * Thrown by {@link RetryingRequestExecutor} once every attempt for a request has failed.
 * The last failure is kept as the cause.
 */
public class RetriesExhaustedException extends SpotifyApiException {
    private final String url;
    private final int attempts;

    public RetriesExhaustedException(String url, int attempts, Throwable lastFailure) {
        super("Giving up on " + url + " after " + attempts + " attempts", lastFailure);
        this.url = url;
        this.attempts = attempts;
    }

    public String getUrl() {
        return url;
    }

    public int getAttempts() {
        return attempts;
    }
}
