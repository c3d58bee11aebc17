package com.spotifyimport.api;

import java.io.IOException;

/**
 * A non-2xx answer from the Web API. Treated like any other I/O failure by the retry loop.
 */
public class UnexpectedStatusException extends IOException {
    private static final int MAX_BODY_CHARS = 200;

    private final int statusCode;

    public UnexpectedStatusException(int statusCode, String body) {
        super("HTTP " + statusCode + abbreviate(body));
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }

    private static String abbreviate(String body) {
        if (body == null || body.isBlank()) {
            return "";
        }
        String trimmed = body.strip();
        return ": " + (trimmed.length() > MAX_BODY_CHARS ? trimmed.substring(0, MAX_BODY_CHARS) + "..." : trimmed);
    }
}
