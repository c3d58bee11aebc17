package com.spotifyimport.api;

/**
 * Progress of an {@link AuthorizationCaptureServer}. Requests for unknown paths are answered
 * with 404 and leave the state unchanged.
 */
public enum CaptureState {
    /** Waiting for the browser to come back from the accounts service. */
    LISTENING,
    /** The fragment-reading page was served; waiting for it to call {@code /token}. */
    REDIRECT_RECEIVED,
    /** A token arrived. Terminal. */
    TOKEN_DELIVERED
}
