package com.seedfund.tracker.pipeline;

import com.seedfund.tracker.metrics.AggregateMetrics;
import com.seedfund.tracker.metrics.EntityFilter;
import com.seedfund.tracker.metrics.MetricsAggregator;
import com.seedfund.tracker.metrics.PeriodWindow;
import com.seedfund.tracker.quality.DataQualityReport;
import com.seedfund.tracker.quality.DataQualityValidator;
import com.seedfund.tracker.resolve.EntityResolver;
import com.seedfund.tracker.resolve.ResolutionResult;
import com.seedfund.tracker.schema.HeaderMapping;
import com.seedfund.tracker.schema.NormalizedTable;
import com.seedfund.tracker.schema.RawRecord;
import com.seedfund.tracker.schema.SchemaNormalizer;
import com.seedfund.tracker.schema.SourceTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs normalization, resolution and aggregation over a set of source tables. The quality report
 * is always produced with the metrics.
 */
public class TrackingPipeline {

    private static final Logger log = LoggerFactory.getLogger(TrackingPipeline.class);

    private final SchemaNormalizer schemaNormalizer;
    private final EntityResolver entityResolver;
    private final MetricsAggregator metricsAggregator;
    private final DataQualityValidator dataQualityValidator;

    public TrackingPipeline(
            SchemaNormalizer schemaNormalizer,
            EntityResolver entityResolver,
            MetricsAggregator metricsAggregator,
            DataQualityValidator dataQualityValidator) {
        this.schemaNormalizer = schemaNormalizer;
        this.entityResolver = entityResolver;
        this.metricsAggregator = metricsAggregator;
        this.dataQualityValidator = dataQualityValidator;
    }

    public TrackingReport run(List<SourceTable> tables, List<PeriodWindow> windows, EntityFilter track) {
        List<RawRecord> records = new ArrayList<>();
        List<HeaderMapping> mappings = new ArrayList<>(tables.size());
        List<String> sources = new ArrayList<>(tables.size());
        for (SourceTable table : tables) {
            NormalizedTable normalized = schemaNormalizer.normalize(table);
            records.addAll(normalized.records());
            mappings.add(normalized.mapping());
            sources.add(table.sourceName());
        }

        ResolutionResult resolution = entityResolver.resolve(records);

        List<AggregateMetrics> metrics = new ArrayList<>(windows.size());
        for (PeriodWindow window : windows) {
            metrics.add(metricsAggregator.aggregate(resolution.entities(), window, track));
        }

        DataQualityReport quality = dataQualityValidator.validate(records, resolution, mappings, windows, metrics);

        log.info("Tracking run complete. sources={}, rawRecords={}, entities={}, duplicationFactor={}, issues={}",
                sources.size(), quality.rawRecordCount(), quality.entityCount(), quality.duplicationFactor(),
                quality.issues().size());
        for (AggregateMetrics metric : metrics) {
            log.info("Window {} [{}]: projects={}, investment={}, followOn={}, roi={}",
                    metric.window().label(), track.name(), metric.projectCount(), metric.investment(),
                    metric.followOnFunding(), metric.roi());
        }

        return new TrackingReport(sources, track.name(), track.label(), metrics, quality);
    }
}
