package com.spotifyimport.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link Diagnostics} backed by an SLF4J logger.
 */
public final class Slf4jDiagnostics implements Diagnostics {
    private final Logger logger;

    public Slf4jDiagnostics(Logger logger) {
        this.logger = logger;
    }

    public static Slf4jDiagnostics named(String name) {
        return new Slf4jDiagnostics(LoggerFactory.getLogger(name));
    }

    @Override
    public void info(String message, Object... args) {
        logger.info(message, args);
    }

    @Override
    public void warn(String message, Object... args) {
        logger.warn(message, args);
    }

    @Override
    public void error(String message, Object... args) {
        logger.error(message, args);
    }
}
