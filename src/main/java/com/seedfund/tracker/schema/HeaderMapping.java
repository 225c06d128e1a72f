package com.seedfund.tracker.schema;

import com.seedfund.tracker.quality.QualityIssue;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Result of mapping one source's literal headers onto canonical fields.
 *
 * @param columnFields column index to canonical field name, for mapped columns only
 * @param issues       dropped columns, reported rather than raised
 */
public record HeaderMapping(String sourceName, Map<Integer, String> columnFields, List<QualityIssue> issues) {

    public HeaderMapping {
        columnFields = Collections.unmodifiableMap(new TreeMap<>(columnFields));
        issues = List.copyOf(issues);
    }

    public boolean isMapped(String field) {
        return columnFields.containsValue(field);
    }
}
