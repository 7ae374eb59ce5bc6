package com.ukboards.network.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IdentifierNormalizerTest {

    @Test
    void numericCompanyIdsArePaddedToEightDigits() {
        assertEquals("04547069", IdentifierNormalizer.normalizeCompanyId("4547069"));
        assertEquals("04547069", IdentifierNormalizer.normalizeCompanyId(4547069));
        assertEquals("00000001", IdentifierNormalizer.normalizeCompanyId(" 1 "));
    }

    @Test
    void prefixedCompanyIdsAreUpperCased() {
        assertEquals("CE010135", IdentifierNormalizer.normalizeCompanyId("ce010135"));
        assertEquals("SC123456", IdentifierNormalizer.normalizeCompanyId("SC123456"));
    }

    @Test
    void normalizingTwiceChangesNothing() {
        String once = IdentifierNormalizer.normalizeCompanyId("123");
        assertEquals(once, IdentifierNormalizer.normalizeCompanyId(once));
        String charity = IdentifierNormalizer.normalizeCharityNumber("0001172706");
        assertEquals(charity, IdentifierNormalizer.normalizeCharityNumber(charity));
    }

    @Test
    void blankIdentifiersBecomeEmpty() {
        assertEquals("", IdentifierNormalizer.normalizeCompanyId(null));
        assertEquals("", IdentifierNormalizer.normalizeCompanyId("   "));
        assertEquals("", IdentifierNormalizer.normalizeCharityNumber(null));
    }

    @Test
    void charityNumbersDropLeadingZeros() {
        assertEquals("1172706", IdentifierNormalizer.normalizeCharityNumber("01172706"));
        assertEquals("1172706", IdentifierNormalizer.normalizeCharityNumber(1172706));
        assertEquals("0", IdentifierNormalizer.normalizeCharityNumber("000"));
    }

    @Test
    void digitCheckRejectsEmptyAndMixedValues() {
        assertTrue(IdentifierNormalizer.isDigits("0123"));
        assertFalse(IdentifierNormalizer.isDigits(""));
        assertFalse(IdentifierNormalizer.isDigits("CE01"));
    }
}
