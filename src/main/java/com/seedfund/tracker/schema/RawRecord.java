package com.seedfund.tracker.schema;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * One data row of a source extract keyed by canonical field name. Absent values have no entry.
 *
 * @param provenance source file/vintage the row came from
 * @param rowNumber  1-based data row number inside that source
 */
public record RawRecord(String provenance, int rowNumber, Map<String, String> values) {

    public RawRecord {
        provenance = provenance == null ? "" : provenance;
        TreeMap<String, String> copy = new TreeMap<>();
        if (values != null) {
            values.forEach((field, value) -> {
                if (field != null && value != null && !value.isBlank()) {
                    copy.put(field, value.trim());
                }
            });
        }
        values = Collections.unmodifiableMap(copy);
    }

    /**
     * Returns the trimmed value of a field, or {@code null} when absent.
     */
    public String value(String field) {
        return values.get(field);
    }

    public boolean has(String field) {
        return values.containsKey(field);
    }
}
