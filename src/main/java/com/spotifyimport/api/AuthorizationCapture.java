package com.spotifyimport.api;

/**
 * The token delivered to the local listener by the browser. Single use: it is turned into a
 * {@link BearerSession} and dropped.
 *
 * @param accessToken captured OAuth access token
 */
public record AuthorizationCapture(String accessToken) {

    @Override
    public String toString() {
        return "AuthorizationCapture[accessToken=" + BearerSession.mask(accessToken) + "]";
    }
}
