package com.spotifyimport.api;

import java.io.IOException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

/**
 * Sends a single HTTP exchange. The production implementation is {@link JdkHttpTransport};
 * tests substitute scripted transports.
 */
@FunctionalInterface
public interface HttpTransport {

    /**
     * @param request fully built request
     * @return the response with its body as a string
     * @throws IOException          on any transport-level failure
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    HttpResponse<String> send(HttpRequest request) throws IOException, InterruptedException;
}
