package com.seedfund.tracker.resolve;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Controlled vocabulary collapsing known spelling and campus-suffix variants of an institution
 * name onto one canonical label. Lookup ignores case and repeated whitespace; values with no entry
 * pass through trimmed.
 */
public class InstitutionAliasTable {

    private final Map<String, String> canonicalByVariant;

    public InstitutionAliasTable(Map<String, String> variantToCanonical) {
        Map<String, String> lookup = new LinkedHashMap<>();
        variantToCanonical.forEach((variant, canonical) -> {
            String label = collapse(canonical);
            lookup.put(key(variant), label);
            lookup.putIfAbsent(key(canonical), label);
        });
        this.canonicalByVariant = Collections.unmodifiableMap(lookup);
    }

    public static InstitutionAliasTable empty() {
        return new InstitutionAliasTable(Map.of());
    }

    public String canonicalize(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String collapsed = collapse(value);
        return canonicalByVariant.getOrDefault(key(collapsed), collapsed);
    }

    public int size() {
        return canonicalByVariant.size();
    }

    private static String collapse(String value) {
        return value.trim().replaceAll("\\s+", " ");
    }

    private static String key(String value) {
        return collapse(value).toLowerCase(Locale.ROOT);
    }
}
