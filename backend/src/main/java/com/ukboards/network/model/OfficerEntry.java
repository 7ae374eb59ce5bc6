package com.ukboards.network.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One row of a company's officer listing. {@code name} is null both when the field is missing
 * and when it is listed as null; {@code nameListed} tells the two apart.
 */
public record OfficerEntry(String officerId, String name, boolean nameListed, JsonNode raw) {

    public static OfficerEntry fromJson(JsonNode json) {
        String appointments = json.path("links").path("officer").path("appointments").asText("");
        String[] parts = appointments.split("/");
        String officerId = parts.length > 2 ? parts[2] : "";
        boolean listed = json.has("name");
        String name = json.hasNonNull("name") ? json.get("name").asText() : null;
        return new OfficerEntry(officerId, name, listed, json);
    }
}
