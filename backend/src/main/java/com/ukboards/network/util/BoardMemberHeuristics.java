package com.ukboards.network.util;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;

public final class BoardMemberHeuristics {
    public static final String RESIGNED_ON = "resigned_on";
    public static final String CEASED_ON = "ceased_on";
    public static final List<String> COMPANY_SUFFIXES = List.of("LTD", "LIMITED", "LLC");

    private BoardMemberHeuristics() {
    }

    /**
     * Board members and controllers count as people unless their name carries a corporate suffix.
     */
    public static boolean isPerson(String name) {
        if (name == null) {
            return true;
        }
        for (String suffix : COMPANY_SUFFIXES) {
            if (name.contains(suffix)) {
                return false;
            }
        }
        return true;
    }

    public static boolean isIndividualControllerLink(String link) {
        return link != null && link.contains("persons") && link.contains("individual");
    }

    public static Optional<LocalDate> dateField(JsonNode record, String keyword) {
        if (record == null || !record.hasNonNull(keyword)) {
            return Optional.empty();
        }
        String text = record.get(keyword).asText("").trim();
        if (text.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(LocalDate.parse(text));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    /**
     * True when {@code record} carries a {@code keyword} date strictly before {@code today}.
     */
    public static boolean isInactive(JsonNode record, String keyword, LocalDate today) {
        return dateField(record, keyword).map(date -> date.isBefore(today)).orElse(false);
    }
}
