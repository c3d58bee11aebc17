package com.spotifyimport.api;

import java.awt.Desktop;
import java.awt.GraphicsEnvironment;
import java.io.IOException;
import java.net.URI;

/**
 * Opens URLs with the platform's default browser through {@link Desktop}.
 * Fails with an {@link IOException} on headless machines.
 */
public final class DesktopBrowserLauncher implements BrowserLauncher {

    @Override
    public void open(URI uri) throws IOException {
        if (GraphicsEnvironment.isHeadless()
            || !Desktop.isDesktopSupported()
            || !Desktop.getDesktop().isSupported(Desktop.Action.BROWSE)) {
            throw new IOException("No desktop browser available");
        }
        Desktop.getDesktop().browse(uri);
    }
}
