package com.seedfund.tracker.quality;

import com.seedfund.tracker.TrackerTestSupport;
import com.seedfund.tracker.config.TrackerConfiguration;
import com.seedfund.tracker.metrics.AggregateMetrics;
import com.seedfund.tracker.metrics.MetricsAggregator;
import com.seedfund.tracker.metrics.PeriodWindow;
import com.seedfund.tracker.parse.AmountParser;
import com.seedfund.tracker.parse.AmountSource;
import com.seedfund.tracker.resolve.EntityResolver;
import com.seedfund.tracker.resolve.ResolutionResult;
import com.seedfund.tracker.schema.HeaderMapping;
import com.seedfund.tracker.schema.RawRecord;
import com.seedfund.tracker.temporal.YearExtractor;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.seedfund.tracker.TrackerTestSupport.record;
import static org.junit.jupiter.api.Assertions.assertEquals;

class DataQualityValidatorTest {

    private static final String SOURCE = "IWRC_2020.csv";
    private static final PeriodWindow TEN_YEAR = new PeriodWindow("10yr", 2015, 2024);
    private static final PeriodWindow FIVE_YEAR = new PeriodWindow("5yr", 2020, 2024);

    private final TrackerConfiguration configuration = TrackerTestSupport.configuration();
    private final EntityResolver resolver = new EntityResolver(configuration, new AmountParser(),
            new YearExtractor(configuration.yearPatterns(), configuration.minYear(), configuration.maxYear()));
    private final MetricsAggregator aggregator = new MetricsAggregator(configuration.metricFields());
    private final DataQualityValidator validator = new DataQualityValidator(
            configuration.fields().values(), configuration.metricFields().investmentField());

    private final List<RawRecord> records = List.of(
            record(SOURCE, 1, "project_id", "2020IL103AIS", "award_amount", "1000", "institution", "University of Illinois"),
            record(SOURCE, 2, "project_id", "2020IL103AIS", "award_amount", "1000", "monetary_benefit", "500"),
            record(SOURCE, 3, "project_id", "2020IL103AIS", "award_amount", "1000"),
            record(SOURCE, 4, "project_id", "2016IL01B", "award_amount", "2000"),
            record(SOURCE, 5, "project_id", "SEED-ABC", "award_amount", "pending"),
            record(SOURCE, 6, "award_amount", "3000")
    );

    @Test
    void shouldReportOverallAndPerWindowDuplication() {
        DataQualityReport report = validate(List.of(TEN_YEAR, FIVE_YEAR), List.of());

        assertEquals(6, report.rawRecordCount());
        assertEquals(3, report.entityCount());
        assertEquals(new BigDecimal("2.0000"), report.duplicationFactor());
        WindowDuplication tenYear = report.windowDuplication().get(0);
        assertEquals(4, tenYear.rawRecordCount());
        assertEquals(2, tenYear.entityCount());
        assertEquals(new BigDecimal("2.0000"), tenYear.duplicationFactor());
        WindowDuplication fiveYear = report.windowDuplication().get(1);
        assertEquals(new BigDecimal("3.0000"), fiveYear.duplicationFactor());
    }

    @Test
    void shouldMeasureCompletenessPerCanonicalField() {
        DataQualityReport report = validate(List.of(TEN_YEAR), List.of());

        assertEquals(new BigDecimal("0.6667"), report.completeness().get("award_amount"));
        assertEquals(new BigDecimal("0.3333"), report.completeness().get("institution"));
        assertEquals(new BigDecimal("0.3333"), report.completeness().get("monetary_benefit"));
        assertEquals(new BigDecimal("0.0000"), report.completeness().get("science_priority"));
    }

    @Test
    void shouldCountIssuesByTypeAndKeepProvenanceHistogram() {
        HeaderMapping mapping = new HeaderMapping(SOURCE, Map.of(0, "project_id"),
                List.of(QualityIssue.unmappedHeader(SOURCE, "Internal Notes")));

        ResolutionResult resolution = resolver.resolve(records);
        DataQualityReport report = validator.validate(records, resolution, List.of(mapping), List.of(TEN_YEAR), List.of());

        assertEquals(1, report.issueCount(IssueType.UNMAPPED_HEADER));
        assertEquals(1, report.issueCount(IssueType.MISSING_IDENTIFIER));
        assertEquals(1, report.issueCount(IssueType.UNPARSED_VALUE));
        assertEquals(1, report.issueCount(IssueType.UNEXTRACTABLE_IDENTIFIER));
        assertEquals(0, report.issueCount(IssueType.EMPTY_DENOMINATOR));
        assertEquals(List.of("SEED-ABC"), report.unextractableIdentifiers());

        Map<AmountSource, Integer> awardSources = report.amountSourceCounts().get("award_amount");
        assertEquals(2, awardSources.get(AmountSource.DIRECT));
        assertEquals(1, awardSources.get(AmountSource.DEFAULTED_TO_ZERO));
    }

    @Test
    void shouldListInconsistentEntities() {
        List<RawRecord> conflicting = new ArrayList<>(records);
        conflicting.add(record(SOURCE, 7, "project_id", "2016IL01B", "award_type", "Base Grant (104b)"));
        conflicting.add(record(SOURCE, 8, "project_id", "2016IL01B", "award_type", "Coordination Grant"));

        ResolutionResult resolution = resolver.resolve(conflicting);
        DataQualityReport report = validator.validate(conflicting, resolution, List.of(), List.of(TEN_YEAR), List.of());

        assertEquals(1, report.inconsistentEntities().size());
        InconsistentEntity entity = report.inconsistentEntities().get(0);
        assertEquals("2016IL01B", entity.key());
        assertEquals(List.of("award_type"), entity.fields());
        assertEquals(3, entity.recordCount());
        assertEquals(1, report.issueCount(IssueType.INCONSISTENT_IDENTITY_FIELD));
    }

    @Test
    void shouldNoteEmptyRoiDenominator() {
        PeriodWindow future = new PeriodWindow("future", 2030, 2031);
        DataQualityReport report = validate(List.of(future), List.of(future));

        assertEquals(1, report.issueCount(IssueType.EMPTY_DENOMINATOR));
        QualityIssue issue = report.issues().stream()
                .filter(i -> i.type() == IssueType.EMPTY_DENOMINATOR)
                .findFirst()
                .orElseThrow();
        assertEquals("award_amount", issue.field());
        assertEquals(0, report.windowDuplication().get(0).entityCount());
        assertEquals(0, report.windowDuplication().get(0).duplicationFactor().signum());
    }

    @Test
    void shouldReturnZeroFactorsWithoutEntities() {
        ResolutionResult empty = resolver.resolve(List.of());
        DataQualityReport report = validator.validate(List.of(), empty, List.of(), List.of(TEN_YEAR), List.of());

        assertEquals(0, report.duplicationFactor().signum());
        assertEquals(0, report.completeness().get("award_amount").signum());
        assertEquals(0, report.issues().size());
    }

    private DataQualityReport validate(List<PeriodWindow> windows, List<PeriodWindow> aggregated) {
        ResolutionResult resolution = resolver.resolve(records);
        List<AggregateMetrics> metrics = new ArrayList<>();
        for (PeriodWindow window : aggregated) {
            metrics.add(aggregator.aggregate(resolution.entities(), window));
        }
        DataQualityReport report = validator.validate(records, resolution, List.of(), windows, metrics);
        assertEquals(resolution, resolver.resolve(records));
        return report;
    }
}
