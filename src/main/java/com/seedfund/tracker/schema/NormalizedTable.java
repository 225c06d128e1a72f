package com.seedfund.tracker.schema;

import java.util.List;

/**
 * Renamed view of a source table.
 */
public record NormalizedTable(List<RawRecord> records, HeaderMapping mapping) {

    public NormalizedTable {
        records = List.copyOf(records);
    }
}
