package com.seedfund.tracker.pipeline;

import com.seedfund.tracker.metrics.AggregateMetrics;
import com.seedfund.tracker.quality.DataQualityReport;

import java.util.List;

/**
 * Output of one pipeline run: metrics per requested window and the quality report they rest on.
 */
public record TrackingReport(
        List<String> sources,
        String track,
        String trackLabel,
        List<AggregateMetrics> metrics,
        DataQualityReport quality
) {

    public TrackingReport {
        sources = List.copyOf(sources);
        metrics = List.copyOf(metrics);
    }
}
