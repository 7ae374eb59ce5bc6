package com.ukboards.network.graph;

import com.fasterxml.jackson.databind.JsonNode;
import com.ukboards.network.util.BoardMemberHeuristics;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Strips board members who have left, without re-crawling.
 *
 * <p>A member's leaving date is the {@code resigned_on} or {@code ceased_on} field of its record.
 * For an officer whose record is a full appointments listing, the member has left once every
 * appointment is resigned, on the latest of those dates. Organisations are never removed.
 */
public final class ActiveBoardMemberFilter {

    private ActiveBoardMemberFilter() {
    }

    public static BoardGraph filterActive(BoardGraph graph, LocalDate today) {
        BoardGraph filtered = graph.copy();
        filtered.removeNodes(inactiveMembers(graph, today));
        return filtered;
    }

    public static List<String> inactiveMembers(BoardGraph graph, LocalDate today) {
        List<String> inactive = new ArrayList<>();
        for (GraphNode node : graph.nodes()) {
            if (node.bipartite() != 1) {
                continue;
            }
            Optional<LocalDate> leftOn = leavingDate(node.data());
            if (leftOn.isPresent() && leftOn.get().isBefore(today)) {
                inactive.add(node.id());
            }
        }
        return inactive;
    }

    static Optional<LocalDate> leavingDate(JsonNode record) {
        if (record == null || !record.isObject()) {
            return Optional.empty();
        }
        Optional<LocalDate> resigned = BoardMemberHeuristics.dateField(record, BoardMemberHeuristics.RESIGNED_ON);
        if (resigned.isPresent()) {
            return resigned;
        }
        Optional<LocalDate> ceased = BoardMemberHeuristics.dateField(record, BoardMemberHeuristics.CEASED_ON);
        if (ceased.isPresent()) {
            return ceased;
        }
        JsonNode items = record.get("items");
        if (items == null || !items.isArray() || items.isEmpty()) {
            return Optional.empty();
        }
        LocalDate latest = null;
        for (JsonNode appointment : items) {
            Optional<LocalDate> date = BoardMemberHeuristics.dateField(appointment, BoardMemberHeuristics.RESIGNED_ON);
            if (date.isEmpty()) {
                return Optional.empty();
            }
            if (latest == null || date.get().isAfter(latest)) {
                latest = date.get();
            }
        }
        return Optional.ofNullable(latest);
    }
}
