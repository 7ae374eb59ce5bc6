package com.ukboards.network.util;

import java.util.Locale;

/**
 * Canonical string forms for registry identifiers.
 *
 * <p>Companies House numbers are eight characters long. Purely numeric numbers are left padded
 * with zeros, prefixed numbers such as {@code CE010135} are upper cased and otherwise kept as
 * they are. Charity Commission numbers are plain integers. Both forms are idempotent.
 */
public final class IdentifierNormalizer {
    public static final int COMPANY_ID_LENGTH = 8;

    private IdentifierNormalizer() {
    }

    public static String normalizeCompanyId(Object raw) {
        if (raw == null) {
            return "";
        }
        String value = raw.toString().trim();
        if (value.isEmpty()) {
            return "";
        }
        if (isDigits(value)) {
            if (value.length() >= COMPANY_ID_LENGTH) {
                return value;
            }
            return "0".repeat(COMPANY_ID_LENGTH - value.length()) + value;
        }
        return value.toUpperCase(Locale.ROOT);
    }

    public static String normalizeCharityNumber(Object raw) {
        if (raw == null) {
            return "";
        }
        String value = raw.toString().trim();
        if (value.isEmpty() || !isDigits(value)) {
            return value;
        }
        String stripped = value.replaceFirst("^0+", "");
        return stripped.isEmpty() ? "0" : stripped;
    }

    public static boolean isDigits(String value) {
        if (value == null || value.isEmpty()) {
            return false;
        }
        for (int i = 0; i < value.length(); i++) {
            if (!Character.isDigit(value.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
