package com.spotifyimport.api;

public enum HttpMethod {
    GET,
    POST
}
