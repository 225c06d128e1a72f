package com.seedfund.tracker.ingest;

import java.util.List;

/**
 * Abstraction for obtaining tracking extracts from any backing store.
 */
public interface ExtractSource {

    /**
     * Returns every extract that makes up the current dataset, in a stable order.
     */
    List<SourceExtract> loadAll();
}
