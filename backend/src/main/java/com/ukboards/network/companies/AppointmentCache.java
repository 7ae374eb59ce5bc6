package com.ukboards.network.companies;

import com.fasterxml.jackson.databind.JsonNode;
import com.ukboards.network.model.CompanyId;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Most specific known record of each board member's tie to each company: the appointment for
 * officers, the control statement for significant controllers.
 */
public class AppointmentCache {
    private final Map<String, Map<CompanyId, JsonNode>> byMember = new LinkedHashMap<>();

    /**
     * Records that {@code memberId} has been looked up, even if none of its ties survived filtering.
     */
    public void register(String memberId) {
        byMember.computeIfAbsent(memberId, ignored -> new LinkedHashMap<>());
    }

    public void put(String memberId, CompanyId companyId, JsonNode record) {
        byMember.computeIfAbsent(memberId, ignored -> new LinkedHashMap<>()).put(companyId, record);
    }

    public boolean contains(String memberId) {
        return byMember.containsKey(memberId);
    }

    public Optional<JsonNode> get(String memberId, CompanyId companyId) {
        Map<CompanyId, JsonNode> ties = byMember.get(memberId);
        return ties == null ? Optional.empty() : Optional.ofNullable(ties.get(companyId));
    }

    /**
     * Companies tied to {@code memberId} in the order they were cached, or empty when the member
     * was never looked up.
     */
    public Optional<List<CompanyId>> relatedCompanies(String memberId) {
        Map<CompanyId, JsonNode> ties = byMember.get(memberId);
        return ties == null ? Optional.empty() : Optional.of(List.copyOf(ties.keySet()));
    }

    public int size() {
        return byMember.size();
    }

    public void clear() {
        byMember.clear();
    }
}
