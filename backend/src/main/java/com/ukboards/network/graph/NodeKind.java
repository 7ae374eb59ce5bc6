package com.ukboards.network.graph;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

public enum NodeKind {
    COMPANY(0),
    OFFICER(1),
    CONTROLLER(1),
    CHARITY(0),
    TRUSTEE(1);

    public static final Set<NodeKind> COMPANY_NETWORK_KINDS = EnumSet.of(COMPANY, OFFICER, CONTROLLER);
    public static final Set<NodeKind> CHARITY_NETWORK_KINDS = EnumSet.of(CHARITY, TRUSTEE);

    private final int bipartite;

    NodeKind(int bipartite) {
        this.bipartite = bipartite;
    }

    public int bipartite() {
        return bipartite;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static NodeKind fromLabel(String label) {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("Node kind is required");
        }
        return NodeKind.valueOf(label.trim().toUpperCase(Locale.ROOT));
    }
}
