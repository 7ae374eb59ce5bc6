package com.ukboards.network.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One board position from an officer's appointments listing.
 */
public record Appointment(CompanyId companyId, String name, boolean resigned, JsonNode raw) {

    public static Appointment fromJson(JsonNode json) {
        return new Appointment(
            CompanyId.of(json.path("appointed_to").path("company_number").asText("")),
            json.hasNonNull("name") ? json.get("name").asText() : null,
            json.has("resigned_on"),
            json
        );
    }
}
