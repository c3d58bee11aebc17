package com.spotifyimport.api;

/**
 * Base runtime exception for failures talking to Spotify, either the Web API or the
 * authorization flow.
 * <p>
 * Callers that only care whether the run can continue catch this type; the subclasses carry the
 * details needed for a useful final log line.
 */
public class SpotifyApiException extends RuntimeException {

    public SpotifyApiException(String message) {
        super(message);
    }

    public SpotifyApiException(String message, Throwable cause) {
        super(message, cause);
    }
}
