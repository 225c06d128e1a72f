package com.seedfund.tracker.quality;

import com.seedfund.tracker.metrics.AggregateMetrics;
import com.seedfund.tracker.metrics.PeriodWindow;
import com.seedfund.tracker.parse.AmountSource;
import com.seedfund.tracker.resolve.ProjectEntity;
import com.seedfund.tracker.resolve.ResolutionResult;
import com.seedfund.tracker.schema.CanonicalField;
import com.seedfund.tracker.schema.HeaderMapping;
import com.seedfund.tracker.schema.RawRecord;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Computes duplication, completeness and consistency diagnostics. Never alters the entities it
 * inspects.
 */
public class DataQualityValidator {

    private static final int FACTOR_SCALE = 4;

    private final Collection<CanonicalField> fields;
    private final String investmentField;

    public DataQualityValidator(Collection<CanonicalField> fields, String investmentField) {
        this.fields = List.copyOf(fields);
        this.investmentField = investmentField;
    }

    public DataQualityReport validate(
            List<RawRecord> records,
            ResolutionResult resolution,
            List<HeaderMapping> mappings,
            List<PeriodWindow> windows,
            List<AggregateMetrics> metrics) {
        List<ProjectEntity> entities = resolution.entities();

        List<WindowDuplication> windowDuplication = new ArrayList<>(windows.size());
        for (PeriodWindow window : windows) {
            int raw = 0;
            int count = 0;
            for (ProjectEntity entity : entities) {
                if (window.contains(entity.projectYear())) {
                    raw += entity.recordCount();
                    count++;
                }
            }
            windowDuplication.add(new WindowDuplication(window, raw, count, factor(raw, count)));
        }

        Map<String, BigDecimal> completeness = new LinkedHashMap<>();
        Map<String, Map<AmountSource, Integer>> amountSources = new LinkedHashMap<>();
        for (CanonicalField field : fields) {
            int populated = 0;
            Map<AmountSource, Integer> sources = new EnumMap<>(AmountSource.class);
            for (ProjectEntity entity : entities) {
                if (field.isNumeric()) {
                    if (entity.amount(field.name()).signum() > 0) {
                        populated++;
                    }
                    sources.merge(entity.amountSource(field.name()), 1, Integer::sum);
                } else if (entity.text(field.name()) != null) {
                    populated++;
                }
            }
            completeness.put(field.name(), factor(populated, entities.size()));
            if (field.isNumeric()) {
                amountSources.put(field.name(), sources);
            }
        }

        List<InconsistentEntity> inconsistent = new ArrayList<>();
        List<String> unextractable = new ArrayList<>();
        for (ProjectEntity entity : entities) {
            if (!entity.consistent()) {
                inconsistent.add(new InconsistentEntity(entity.key(), entity.inconsistentFields(), entity.recordCount()));
            }
            if (!entity.hasYear()) {
                unextractable.add(entity.key());
            }
        }

        List<QualityIssue> issues = new ArrayList<>();
        for (HeaderMapping mapping : mappings) {
            issues.addAll(mapping.issues());
        }
        issues.addAll(resolution.issues());
        for (AggregateMetrics metric : metrics) {
            if (metric.roiDenominatorEmpty()) {
                issues.add(QualityIssue.emptyDenominator(metric.window().label(), investmentField));
            }
        }

        Map<IssueType, Integer> issueCounts = new EnumMap<>(IssueType.class);
        for (QualityIssue issue : issues) {
            issueCounts.merge(issue.type(), 1, Integer::sum);
        }

        return new DataQualityReport(
                records.size(),
                entities.size(),
                factor(records.size(), entities.size()),
                windowDuplication,
                completeness,
                inconsistent,
                unextractable,
                issueCounts,
                issues,
                amountSources
        );
    }

    private static BigDecimal factor(int numerator, int denominator) {
        if (denominator == 0) {
            return BigDecimal.ZERO.setScale(FACTOR_SCALE);
        }
        return BigDecimal.valueOf(numerator).divide(BigDecimal.valueOf(denominator), FACTOR_SCALE, RoundingMode.HALF_UP);
    }
}
