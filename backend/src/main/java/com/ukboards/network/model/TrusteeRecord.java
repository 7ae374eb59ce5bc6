package com.ukboards.network.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

public record TrusteeRecord(
    String trusteeNumber,
    String name,
    int relatedCharitiesCount,
    List<RelatedCharity> relatedCharities,
    JsonNode raw
) {

    public static TrusteeRecord fromJson(JsonNode json) {
        List<RelatedCharity> related = new ArrayList<>();
        for (JsonNode charity : json.path("RelatedCharities")) {
            related.add(new RelatedCharity(
                CharityId.of(charity.path("CharityNumber").asText("")),
                charity.path("CharityName").asText("")
            ));
        }
        return new TrusteeRecord(
            json.path("TrusteeNumber").asText("").trim(),
            json.path("TrusteeName").asText("").trim(),
            json.path("RelatedCharitiesCount").asInt(related.size()),
            List.copyOf(related),
            json
        );
    }
}
