package com.seedfund.tracker.quality;

import java.util.List;

/**
 * Project whose records disagreed on at least one IDENTITY field.
 */
public record InconsistentEntity(String key, List<String> fields, int recordCount) {

    public InconsistentEntity {
        fields = List.copyOf(fields);
    }
}
