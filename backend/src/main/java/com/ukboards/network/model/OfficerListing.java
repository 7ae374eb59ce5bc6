package com.ukboards.network.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

public record OfficerListing(List<OfficerEntry> items, JsonNode raw) {

    public static OfficerListing fromJson(JsonNode json) {
        List<OfficerEntry> items = new ArrayList<>();
        for (JsonNode item : json.path("items")) {
            items.add(OfficerEntry.fromJson(item));
        }
        return new OfficerListing(List.copyOf(items), json);
    }
}
