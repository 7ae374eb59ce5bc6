package com.ukboards.network.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

public record ControllerListing(List<ControllerEntry> items, JsonNode raw) {

    public static ControllerListing fromJson(JsonNode json) {
        List<ControllerEntry> items = new ArrayList<>();
        for (JsonNode item : json.path("items")) {
            items.add(ControllerEntry.fromJson(item));
        }
        return new ControllerListing(List.copyOf(items), json);
    }
}
