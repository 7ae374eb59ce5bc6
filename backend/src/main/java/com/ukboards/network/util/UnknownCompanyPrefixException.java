package com.ukboards.network.util;

public class UnknownCompanyPrefixException extends RuntimeException {
    private final String companyId;

    public UnknownCompanyPrefixException(String companyId) {
        super("Company ID Number " + companyId + " prefix is unlisted.");
        this.companyId = companyId;
    }

    public String getCompanyId() {
        return companyId;
    }
}
