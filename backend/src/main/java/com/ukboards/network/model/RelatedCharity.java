package com.ukboards.network.model;

public record RelatedCharity(CharityId number, String name) {
    public RelatedCharity {
        name = name == null ? "" : name.trim();
    }
}
