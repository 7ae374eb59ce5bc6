package com.ukboards.network.graph;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Tie between an organisation and a board member. {@code data} is the appointment or control
 * statement that evidences it, or null for enforced ties.
 */
public record GraphEdge(String organisationId, String memberId, JsonNode data) {

    public boolean touches(String nodeId) {
        return organisationId.equals(nodeId) || memberId.equals(nodeId);
    }

    public String other(String nodeId) {
        return organisationId.equals(nodeId) ? memberId : organisationId;
    }
}
