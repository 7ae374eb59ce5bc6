package com.ukboards.network.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A {@code /company/{id}} record. {@code status} is null when the registry does not report one,
 * which is common for charitable incorporated organisations.
 */
public record CompanyProfile(CompanyId id, String name, String status, boolean hasOfficersLink, JsonNode raw) {

    public static CompanyProfile fromJson(CompanyId id, JsonNode json) {
        JsonNode links = json.path("links");
        return new CompanyProfile(
            id,
            json.path("company_name").asText(""),
            json.hasNonNull("company_status") ? json.get("company_status").asText() : null,
            links.isObject() && links.has("officers"),
            json
        );
    }

    public boolean isActive() {
        return status == null || "active".equals(status);
    }
}
