package com.ukboards.network.model;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Provenance of one network query: the settings in force, timing, and what the graph held when it
 * finished. A composition summary lists the records of its seeds in {@code composedRuns}.
 * {@code success} is only set for charity runs.
 */
public record RunRecord(
    String kind,
    List<String> rootIds,
    Map<String, Object> parameterState,
    LocalDateTime startTime,
    LocalDateTime endTime,
    Integer connectedComponentsCount,
    Map<String, Set<String>> kindsIds,
    Boolean success,
    List<RunRecord> composedRuns
) {
    public RunRecord {
        rootIds = rootIds == null ? List.of() : List.copyOf(rootIds);
        parameterState = parameterState == null ? Map.of() : parameterState;
        kindsIds = kindsIds == null ? Map.of() : kindsIds;
        composedRuns = composedRuns == null ? List.of() : List.copyOf(composedRuns);
    }

    public boolean isComposition() {
        return !composedRuns.isEmpty();
    }
}
