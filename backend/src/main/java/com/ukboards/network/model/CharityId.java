package com.ukboards.network.model;

import com.ukboards.network.util.IdentifierNormalizer;

import java.util.Objects;

public final class CharityId implements Comparable<CharityId> {
    private final String value;

    private CharityId(String value) {
        this.value = value;
    }

    public static CharityId of(Object raw) {
        return new CharityId(IdentifierNormalizer.normalizeCharityNumber(raw));
    }

    public String value() {
        return value;
    }

    public boolean isEmpty() {
        return value.isEmpty();
    }

    @Override
    public int compareTo(CharityId other) {
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CharityId other)) {
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
