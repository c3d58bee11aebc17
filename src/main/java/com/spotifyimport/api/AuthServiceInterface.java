package com.spotifyimport.api;

import java.util.List;

/**
 * Interface for obtaining a Spotify session through the browser.
 */
public interface AuthServiceInterface {

    /**
     * Builds the accounts-service URL for the implicit grant.
     * @param clientId registered client id
     * @param scopes requested scopes, joined with spaces
     * @return the URL the user has to open
     */
    String buildAuthorizeUrl(String clientId, List<String> scopes);

    /**
     * Runs the browser login and waits for the token.
     * @param clientId registered client id
     * @param scopes requested scopes
     * @return session for the captured token
     * @throws AuthorizationException if no token could be captured
     */
    BearerSession authorize(String clientId, List<String> scopes);
}
