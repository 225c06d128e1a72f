package com.seedfund.tracker.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Container-neutral view of one extract: the effective header row and its data rows.
 */
public record SourceTable(String sourceName, List<String> headers, List<List<String>> rows) {

    public SourceTable {
        headers = headers == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(headers));
        List<List<String>> copy = new ArrayList<>(rows == null ? 0 : rows.size());
        if (rows != null) {
            for (List<String> row : rows) {
                copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
            }
        }
        rows = Collections.unmodifiableList(copy);
    }
}
