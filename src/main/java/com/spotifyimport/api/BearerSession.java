package com.spotifyimport.api;

import java.net.http.HttpRequest;

/**
 * Immutable holder of a Spotify access token, created either from a token captured by
 * {@link SpotifyAuthService} or from one supplied on the command line.
 * <p>
 * The token is never printed in full: {@link #toString()} and {@link #maskedToken()} only expose
 * its first characters.
 *
 * @param token OAuth access token, never blank
 */
public record BearerSession(String token) {

    public BearerSession {
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException("Access token must not be empty");
        }
    }

    /**
     * @return value for the {@code Authorization} header
     */
    public String authorizationHeader() {
        return "Bearer " + token;
    }

    /**
     * Stamps the {@code Authorization} header on an outgoing request.
     *
     * @param builder request under construction
     * @return the same builder
     */
    public HttpRequest.Builder apply(HttpRequest.Builder builder) {
        return builder.header("Authorization", authorizationHeader());
    }

    public String maskedToken() {
        return mask(token);
    }

    static String mask(String token) {
        if (token == null) {
            return "";
        }
        return token.length() <= 4 ? "****" : token.substring(0, 4) + "****";
    }

    @Override
    public String toString() {
        return "BearerSession[token=" + maskedToken() + "]";
    }
}
