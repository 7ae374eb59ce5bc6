package com.ukboards.network.graph;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A board network node. {@code bipartite} is 0 for organisations and 1 for the people or
 * entities on their boards; {@code category} is only set for organisations.
 */
public record GraphNode(
    String id,
    String name,
    NodeKind kind,
    int bipartite,
    boolean isPerson,
    String category,
    JsonNode data
) {
    public GraphNode {
        if (id == null || id.isEmpty()) {
            throw new IllegalArgumentException("Node id is required");
        }
        if (bipartite != 0 && bipartite != 1) {
            throw new IllegalArgumentException("bipartite must be 0 or 1, got " + bipartite);
        }
        name = name == null ? "" : name.trim();
    }

    public static GraphNode organisation(String id, String name, NodeKind kind, String category, JsonNode data) {
        return new GraphNode(id, name, kind, 0, false, category, data);
    }

    public static GraphNode member(String id, String name, NodeKind kind, boolean isPerson, JsonNode data) {
        return new GraphNode(id, name, kind, 1, isPerson, null, data);
    }

    public boolean isOrganisation() {
        return bipartite == 0;
    }
}
