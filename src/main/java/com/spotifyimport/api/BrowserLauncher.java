package com.spotifyimport.api;

import java.io.IOException;
import java.net.URI;

/**
 * Opens a URL in the user's browser.
 */
@FunctionalInterface
public interface BrowserLauncher {

    void open(URI uri) throws IOException;
}
