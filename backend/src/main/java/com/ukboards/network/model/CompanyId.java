package com.ukboards.network.model;

import com.ukboards.network.util.IdentifierNormalizer;

import java.util.Objects;

public final class CompanyId implements Comparable<CompanyId> {
    private final String value;

    private CompanyId(String value) {
        this.value = value;
    }

    public static CompanyId of(Object raw) {
        return new CompanyId(IdentifierNormalizer.normalizeCompanyId(raw));
    }

    public String value() {
        return value;
    }

    public boolean isEmpty() {
        return value.isEmpty();
    }

    @Override
    public int compareTo(CompanyId other) {
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CompanyId other)) {
            return false;
        }
        return value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
