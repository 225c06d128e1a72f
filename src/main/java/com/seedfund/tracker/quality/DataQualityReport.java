package com.seedfund.tracker.quality;

import com.seedfund.tracker.parse.AmountSource;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only diagnostics produced alongside every set of metrics.
 *
 * @param duplicationFactor  raw records per resolved project; above 1 means multi-row projects
 * @param completeness       share of projects with a non-absent, non-zero value, per canonical field
 * @param amountSourceCounts per numeric field, how many canonical values came from each parse strategy
 */
public record DataQualityReport(
        int rawRecordCount,
        int entityCount,
        BigDecimal duplicationFactor,
        List<WindowDuplication> windowDuplication,
        Map<String, BigDecimal> completeness,
        List<InconsistentEntity> inconsistentEntities,
        List<String> unextractableIdentifiers,
        Map<IssueType, Integer> issueCounts,
        List<QualityIssue> issues,
        Map<String, Map<AmountSource, Integer>> amountSourceCounts
) {

    public DataQualityReport {
        windowDuplication = List.copyOf(windowDuplication);
        completeness = Collections.unmodifiableMap(new LinkedHashMap<>(completeness));
        inconsistentEntities = List.copyOf(inconsistentEntities);
        unextractableIdentifiers = List.copyOf(unextractableIdentifiers);
        issueCounts = issueCounts.isEmpty()
                ? Collections.unmodifiableMap(new EnumMap<>(IssueType.class))
                : Collections.unmodifiableMap(new EnumMap<>(issueCounts));
        issues = List.copyOf(issues);
        Map<String, Map<AmountSource, Integer>> sources = new LinkedHashMap<>();
        amountSourceCounts.forEach((field, counts) -> sources.put(field, counts.isEmpty()
                ? Collections.unmodifiableMap(new EnumMap<>(AmountSource.class))
                : Collections.unmodifiableMap(new EnumMap<>(counts))));
        amountSourceCounts = Collections.unmodifiableMap(sources);
    }

    public int issueCount(IssueType type) {
        return issueCounts.getOrDefault(type, 0);
    }
}
