package com.ukboards.network.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One control statement from a company's persons-with-significant-control listing. The controller
 * id is the last segment of its self link.
 */
public record ControllerEntry(String controllerId, String name, String selfLink, JsonNode raw) {

    public static ControllerEntry fromJson(JsonNode json) {
        String selfLink = json.path("links").path("self").asText("");
        String[] parts = selfLink.split("/");
        String controllerId = parts.length == 0 ? "" : parts[parts.length - 1];
        return new ControllerEntry(controllerId, json.path("name").asText(""), selfLink, json);
    }

    /**
     * The sub-resource type named by the self link, e.g. {@code individual} or {@code corporate-entity}.
     */
    public String linkType() {
        String[] parts = selfLink.split("/");
        return parts.length >= 2 ? parts[parts.length - 2] : "";
    }

    public String linkCompanyId() {
        String[] parts = selfLink.split("/");
        return parts.length >= 4 ? parts[parts.length - 4] : "";
    }
}
