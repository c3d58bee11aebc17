package com.spotifyimport.api;

/**
 * Progress and failure reporting used by the API client and the authorization flow.
 * <p>
 * One instance is created at startup and handed to every component that reports something, so
 * nothing depends on a process-wide logger configuration. Messages use SLF4J {@code {}}
 * placeholders.
 */
public interface Diagnostics {

    void info(String message, Object... args);

    void warn(String message, Object... args);

    void error(String message, Object... args);
}
