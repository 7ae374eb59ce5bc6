package com.ukboards.network.util;

import com.ukboards.network.model.CompanyId;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Legal form of a Companies House registration, derived from the first two characters of its number.
 */
public final class CompanyCategories {
    public static final String DEFAULT_PREFIX = "";

    // Seen on Companies House but missing from its URI customer guide.
    private static final Map<String, String> UNDOCUMENTED = Map.of(
        "CE", "Charitable incorporated organisation",
        "CS", "Scottish charitable incorporated organisation",
        "SG", "Scottish qualifying partnership"
    );

    // Companies House only holds a name and number for these.
    private static final Map<String, String> NAME_AND_NUMBER_ONLY = Map.of(
        "IP", "Industrial & Provident Company",
        "SP", "Scottish Industrial/Provident Company",
        "IC", "ICVC (Investment Company with Variable Capital",
        "SI", "Scottish ICVC (Investment Company with Variable Capital",
        "NP", "Northern Ireland Industrial/Provident Company or Credit Union",
        "NV", "Northern Ireland ICVC (Investment Company with Variable Capital",
        "RC", "Royal Charter Companies (English/Wales",
        "SR", "Scottish Royal Charter Companies",
        "NR", "Northern Ireland Royal Charter Companies",
        "NO", "Northern Ireland Credit Union Industrial/Provident Society"
    );

    private static final Map<String, String> CODES;

    static {
        Map<String, String> codes = new LinkedHashMap<>();
        codes.putAll(UNDOCUMENTED);
        codes.putAll(NAME_AND_NUMBER_ONLY);
        codes.put(DEFAULT_PREFIX, "England & Wales Company");
        codes.put("AC", "Assurance Company for England & Wales");
        codes.put("ZC", "Unregistered Companies (S 1043 - Not Cos Act for England & Wales");
        codes.put("FC", "Overseas Company");
        codes.put("GE", "European Economic Interest Grouping (EEIG for England & Wales");
        codes.put("LP", "Limited for England & Wales");
        codes.put("OC", "Limited Liability Partnership for England & Wales");
        codes.put("SE", "European Company (Societas Europaea for England & Wales");
        codes.put("SA", "Assurance Company for Scotland");
        codes.put("SZ", "Unregistered Companies (S 1043 Not Cos Act for Scotland");
        codes.put("SF", "Overseas Company registered in Scotland (pre 1/10/09");
        codes.put("GS", "European Economic Interest Grouping (EEIG for Scotland");
        codes.put("SL", "Limited Partnership for Scotland");
        codes.put("SO", "Limited Liability Partnership for Scotland");
        codes.put("SC", "Scottish Company");
        codes.put("ES", "European Company (Societas Europaea for Scotland");
        codes.put("NA", "Assurance Company for Northern Ireland");
        codes.put("NZ", "Unregistered Companies (S 1043 Not Cos Act for Northern Ireland");
        codes.put("NF", "Overseas Company registered in Northern Ireland (pre 1/10/09");
        codes.put("GN", "European Economic Interest Grouping (EEIG for Northern Ireland");
        codes.put("NL", "Limited Partnership for Northern Ireland");
        codes.put("NC", "Limited Liability Partnership for Northern Ireland");
        codes.put("R0", "Northern Ireland Company (pre-partition");
        codes.put("NI", "Northern Ireland Company (post-partition");
        codes.put("EN", "European Company (Societas Europaea for Northern Ireland");
        CODES = Collections.unmodifiableMap(codes);
    }

    private CompanyCategories() {
    }

    public static Map<String, String> codes() {
        return CODES;
    }

    public static String categoryOf(CompanyId companyId) {
        String id = companyId.value();
        if (IdentifierNormalizer.isDigits(id)) {
            return CODES.get(DEFAULT_PREFIX);
        }
        String prefix = id.length() >= 2 ? id.substring(0, 2) : id;
        String category = CODES.get(prefix);
        if (category == null) {
            throw new UnknownCompanyPrefixException(id);
        }
        return category;
    }
}
