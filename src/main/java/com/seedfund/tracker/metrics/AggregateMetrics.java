package com.seedfund.tracker.metrics;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Deduplicated metrics for one period window and award-type track.
 *
 * @param projectCount         entities surviving the window and track filters, not raw records
 * @param investment           sum of each project's single canonical award amount
 * @param followOnFunding      sum of each project's canonical follow-on amount
 * @param roi                  follow-on funding divided by investment; zero when investment is zero
 * @param roiDenominatorEmpty  whether the ROI was defined as zero for lack of investment
 * @param trainees             trainee counts per category, in configured order
 * @param institutions         distinct canonical institution labels, sorted
 * @param achievementCounts    grant / award / achievement / other counts
 * @param investmentByInstitution investment summed per canonical institution, sorted by name
 * @param projectsByYear       project count per identifier year
 * @param investmentByYear     investment per identifier year
 * @param followOnByCategory   follow-on funding per project's leading achievement category
 * @param sciencePriorityCounts projects per science priority
 * @param keywordCounts        projects per primary keyword
 */
public record AggregateMetrics(
        PeriodWindow window,
        String track,
        int projectCount,
        BigDecimal investment,
        BigDecimal followOnFunding,
        BigDecimal roi,
        boolean roiDenominatorEmpty,
        Map<String, Long> trainees,
        long totalTrainees,
        int institutionCount,
        List<String> institutions,
        BigDecimal investmentPerProject,
        BigDecimal traineesPerProject,
        BigDecimal investmentPerTrainee,
        Map<String, Integer> achievementCounts,
        Map<String, BigDecimal> investmentByInstitution,
        Map<Integer, Integer> projectsByYear,
        Map<Integer, BigDecimal> investmentByYear,
        Map<String, CategoryTotal> followOnByCategory,
        Map<String, Integer> sciencePriorityCounts,
        Map<String, Integer> keywordCounts
) {

    public AggregateMetrics {
        trainees = Collections.unmodifiableMap(new LinkedHashMap<>(trainees));
        institutions = List.copyOf(institutions);
        achievementCounts = Collections.unmodifiableMap(new LinkedHashMap<>(achievementCounts));
        investmentByInstitution = Collections.unmodifiableMap(new TreeMap<>(investmentByInstitution));
        projectsByYear = Collections.unmodifiableMap(new TreeMap<>(projectsByYear));
        investmentByYear = Collections.unmodifiableMap(new TreeMap<>(investmentByYear));
        followOnByCategory = Collections.unmodifiableMap(new LinkedHashMap<>(followOnByCategory));
        sciencePriorityCounts = Collections.unmodifiableMap(new TreeMap<>(sciencePriorityCounts));
        keywordCounts = Collections.unmodifiableMap(new TreeMap<>(keywordCounts));
    }
}
