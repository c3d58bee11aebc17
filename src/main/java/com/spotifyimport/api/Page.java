package com.spotifyimport.api;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * One page of a paginated Web API response: {@code {"items": [...], "next": url|null, "total": n}}.
 *
 * @param items page items in server order
 * @param next  self-contained URL of the following page, empty on the last page
 * @param total number of items across all pages as reported by the server
 */
public record Page(List<JsonNode> items, Optional<String> next, int total) {

    public Page {
        items = List.copyOf(items);
        next = next == null ? Optional.empty() : next;
    }

    /**
     * Reads the page fields from a decoded response.
     *
     * @param response decoded JSON response
     * @return the page
     * @throws SpotifyApiException if the response has no {@code items} array
     */
    public static Page from(JsonNode response) {
        JsonNode items = response == null ? null : response.get("items");
        if (items == null || !items.isArray()) {
            throw new SpotifyApiException("Paginated response has no 'items' array");
        }
        List<JsonNode> list = new ArrayList<>(items.size());
        items.forEach(list::add);

        JsonNode next = response.get("next");
        Optional<String> nextUrl = next == null || next.isNull() || next.asText().isBlank()
            ? Optional.empty()
            : Optional.of(next.asText());
        return new Page(list, nextUrl, response.path("total").asInt(list.size()));
    }
}
