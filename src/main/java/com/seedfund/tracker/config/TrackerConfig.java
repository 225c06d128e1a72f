package com.seedfund.tracker.config;

import com.seedfund.tracker.ingest.CsvExtractReader;
import com.seedfund.tracker.metrics.MetricsAggregator;
import com.seedfund.tracker.parse.AmountParser;
import com.seedfund.tracker.pipeline.TrackingPipeline;
import com.seedfund.tracker.quality.DataQualityValidator;
import com.seedfund.tracker.resolve.EntityResolver;
import com.seedfund.tracker.schema.SchemaNormalizer;
import com.seedfund.tracker.temporal.YearExtractor;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

/**
 * Enables binding of tracker properties and assembles the pipeline stages from the validated
 * configuration tables.
 */
@Configuration
@EnableConfigurationProperties(TrackerProperties.class)
public class TrackerConfig {

    @Bean
    public TrackerConfiguration trackerConfiguration(TrackerProperties trackerProperties, ResourceLoader resourceLoader) {
        return new TrackerConfigLoader(trackerProperties, resourceLoader).load();
    }

    @Bean
    public AmountParser amountParser() {
        return new AmountParser();
    }

    @Bean
    public YearExtractor yearExtractor(TrackerConfiguration configuration) {
        return new YearExtractor(configuration.yearPatterns(), configuration.minYear(), configuration.maxYear());
    }

    @Bean
    public SchemaNormalizer schemaNormalizer(TrackerConfiguration configuration) {
        return new SchemaNormalizer(configuration.headerAliases(), configuration.fields().keySet());
    }

    @Bean
    public EntityResolver entityResolver(TrackerConfiguration configuration, AmountParser amountParser, YearExtractor yearExtractor) {
        return new EntityResolver(configuration, amountParser, yearExtractor);
    }

    @Bean
    public MetricsAggregator metricsAggregator(TrackerConfiguration configuration) {
        return new MetricsAggregator(configuration.metricFields());
    }

    @Bean
    public DataQualityValidator dataQualityValidator(TrackerConfiguration configuration) {
        return new DataQualityValidator(configuration.fields().values(), configuration.metricFields().investmentField());
    }

    @Bean
    public CsvExtractReader csvExtractReader(TrackerProperties trackerProperties) {
        return new CsvExtractReader(trackerProperties);
    }

    @Bean
    public TrackingPipeline trackingPipeline(
            SchemaNormalizer schemaNormalizer,
            EntityResolver entityResolver,
            MetricsAggregator metricsAggregator,
            DataQualityValidator dataQualityValidator) {
        return new TrackingPipeline(schemaNormalizer, entityResolver, metricsAggregator, dataQualityValidator);
    }
}
