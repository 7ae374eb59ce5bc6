package com.ukboards.network.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A registered charity as returned by {@code GetCharityByRegisteredCharityNumber}. The registry
 * blank-pads names; {@code name} is trimmed, {@code raw} keeps the original.
 */
public record CharityRecord(CharityId id, String name, int subsidiaryNumber, JsonNode raw) {

    public static CharityRecord fromJson(CharityId requested, JsonNode json) {
        CharityId id = json.hasNonNull("RegisteredCharityNumber")
            ? CharityId.of(json.get("RegisteredCharityNumber").asText())
            : requested;
        return new CharityRecord(
            id.isEmpty() ? requested : id,
            json.path("CharityName").asText("").trim(),
            Math.max(0, json.path("SubsidiaryNumber").asInt(0)),
            json
        );
    }
}
