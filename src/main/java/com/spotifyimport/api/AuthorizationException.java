package com.spotifyimport.api;

/**
 * Thrown when the browser authorization could not produce a token: the local listener could not
 * be bound, the optional wait timeout elapsed, or the waiting thread was interrupted.
 */
public class AuthorizationException extends SpotifyApiException {

    public AuthorizationException(String message) {
        super(message);
    }

    public AuthorizationException(String message, Throwable cause) {
        super(message, cause);
    }
}
