package com.seedfund.tracker.resolve;

import com.seedfund.tracker.parse.AmountSource;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Canonical, deduplicated project built from every raw record sharing one identifier.
 *
 * @param projectYear        year recovered from the identifier, or {@code null} when unextractable
 * @param identityValues     IDENTITY text fields, first value in record order
 * @param amounts            one canonical amount per numeric field
 * @param amountSources      how each canonical amount was obtained
 * @param variants           distinct values of UNION fields, display value first
 * @param recordCount        raw records that contributed
 * @param consistent         whether every IDENTITY field agreed across those records
 * @param inconsistentFields IDENTITY fields whose records disagreed
 */
public record ProjectEntity(
        String key,
        Integer projectYear,
        Map<String, String> identityValues,
        Map<String, BigDecimal> amounts,
        Map<String, AmountSource> amountSources,
        Map<String, List<String>> variants,
        int recordCount,
        boolean consistent,
        List<String> inconsistentFields
) {

    public ProjectEntity {
        identityValues = Collections.unmodifiableMap(new TreeMap<>(identityValues));
        amounts = Collections.unmodifiableMap(new TreeMap<>(amounts));
        amountSources = Collections.unmodifiableMap(new TreeMap<>(amountSources));
        TreeMap<String, List<String>> variantCopy = new TreeMap<>();
        variants.forEach((field, values) -> variantCopy.put(field, List.copyOf(values)));
        variants = Collections.unmodifiableMap(variantCopy);
        inconsistentFields = List.copyOf(inconsistentFields);
    }

    public boolean hasYear() {
        return projectYear != null;
    }

    /**
     * Display value of a text field: the IDENTITY value, or the first UNION variant.
     */
    public String text(String field) {
        String identity = identityValues.get(field);
        if (identity != null) {
            return identity;
        }
        List<String> values = variants.get(field);
        return values == null || values.isEmpty() ? null : values.get(0);
    }

    public List<String> variantsOf(String field) {
        return variants.getOrDefault(field, List.of());
    }

    public BigDecimal amount(String field) {
        return amounts.getOrDefault(field, BigDecimal.ZERO);
    }

    public AmountSource amountSource(String field) {
        return amountSources.getOrDefault(field, AmountSource.ABSENT);
    }
}
