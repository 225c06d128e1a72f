package com.seedfund.tracker.metrics;

import com.seedfund.tracker.config.TrackerConstants;
import com.seedfund.tracker.resolve.ProjectEntity;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Computes period-scoped metrics from resolved entities. A pure reduction: the same entities,
 * window and track always give an equal result.
 */
public class MetricsAggregator {

    public static final String CATEGORY_GRANT = "grant";
    public static final String CATEGORY_AWARD = "award";
    public static final String CATEGORY_ACHIEVEMENT = "achievement";
    public static final String CATEGORY_OTHER = "other";

    private static final List<String> CATEGORY_RANK =
            List.of(CATEGORY_GRANT, CATEGORY_AWARD, CATEGORY_ACHIEVEMENT, CATEGORY_OTHER);
    private static final int RATIO_SCALE = 2;

    private final MetricFields fields;

    public MetricsAggregator(MetricFields fields) {
        this.fields = fields;
    }

    public AggregateMetrics aggregate(List<ProjectEntity> entities, PeriodWindow window) {
        return aggregate(entities, window, EntityFilter.all());
    }

    /**
     * Aggregates the entities whose identifier year falls inside {@code window} and that match
     * {@code track}. Entities without a year are left out here only.
     */
    public AggregateMetrics aggregate(List<ProjectEntity> entities, PeriodWindow window, EntityFilter track) {
        List<ProjectEntity> selected = select(entities, window, track);

        BigDecimal investment = BigDecimal.ZERO;
        BigDecimal followOn = BigDecimal.ZERO;
        Map<String, Long> trainees = new LinkedHashMap<>();
        for (String field : fields.traineeFields()) {
            trainees.put(field, 0L);
        }
        TreeSet<String> institutions = new TreeSet<>();
        Map<String, Integer> achievements = new LinkedHashMap<>();
        achievements.put(CATEGORY_GRANT, 0);
        achievements.put(CATEGORY_AWARD, 0);
        achievements.put(CATEGORY_ACHIEVEMENT, 0);
        achievements.put(CATEGORY_OTHER, 0);
        Map<String, BigDecimal> investmentByInstitution = new TreeMap<>();
        Map<Integer, Integer> projectsByYear = new TreeMap<>();
        Map<Integer, BigDecimal> investmentByYear = new TreeMap<>();
        Map<String, CategoryTotal> followOnByCategory = new TreeMap<>(Comparator.comparingInt(CATEGORY_RANK::indexOf));
        Map<String, Integer> sciencePriorities = new TreeMap<>();
        Map<String, Integer> keywords = new TreeMap<>();

        for (ProjectEntity entity : selected) {
            BigDecimal awarded = entity.amount(fields.investmentField());
            BigDecimal reported = entity.amount(fields.followOnField());
            investment = investment.add(awarded);
            followOn = followOn.add(reported);
            projectsByYear.merge(entity.projectYear(), 1, Integer::sum);
            investmentByYear.merge(entity.projectYear(), awarded, BigDecimal::add);
            for (String field : fields.traineeFields()) {
                trainees.merge(field, entity.amount(field).longValue(), Long::sum);
            }
            String institution = entity.text(fields.institutionField());
            if (institution != null) {
                institutions.add(institution);
                investmentByInstitution.merge(institution, awarded, BigDecimal::add);
            }
            List<String> categories = entity.variantsOf(fields.achievementCategoryField());
            for (String category : categories) {
                achievements.merge(classifyAchievement(category), 1, Integer::sum);
            }
            if (!categories.isEmpty()) {
                followOnByCategory.merge(leadingCategory(categories), new CategoryTotal(1, reported), CategoryTotal::plus);
            }
            countText(sciencePriorities, entity.text(fields.sciencePriorityField()));
            countText(keywords, entity.text(fields.keywordField()));
        }

        long totalTrainees = trainees.values().stream().mapToLong(Long::longValue).sum();
        boolean emptyDenominator = investment.signum() == 0;
        BigDecimal projects = BigDecimal.valueOf(selected.size());
        BigDecimal traineeTotal = BigDecimal.valueOf(totalTrainees);

        return new AggregateMetrics(
                window,
                track.name(),
                selected.size(),
                investment,
                followOn,
                ratio(followOn, investment, TrackerConstants.ROI_SCALE),
                emptyDenominator,
                trainees,
                totalTrainees,
                institutions.size(),
                new ArrayList<>(institutions),
                ratio(investment, projects, RATIO_SCALE),
                ratio(traineeTotal, projects, RATIO_SCALE),
                ratio(investment, traineeTotal, RATIO_SCALE),
                achievements,
                investmentByInstitution,
                projectsByYear,
                investmentByYear,
                followOnByCategory,
                sciencePriorities,
                keywords
        );
    }

    public List<ProjectEntity> select(List<ProjectEntity> entities, PeriodWindow window, EntityFilter track) {
        List<ProjectEntity> selected = new ArrayList<>();
        for (ProjectEntity entity : entities) {
            if (window.contains(entity.projectYear()) && track.matches(entity)) {
                selected.add(entity);
            }
        }
        return selected;
    }

    /**
     * Buckets a free-text "Award, Achievement, or Grant" value; the first keyword found wins.
     */
    static String classifyAchievement(String value) {
        String lower = value.toLowerCase(Locale.ROOT);
        if (lower.contains(CATEGORY_GRANT)) {
            return CATEGORY_GRANT;
        }
        if (lower.contains(CATEGORY_AWARD)) {
            return CATEGORY_AWARD;
        }
        if (lower.contains(CATEGORY_ACHIEVEMENT)) {
            return CATEGORY_ACHIEVEMENT;
        }
        return CATEGORY_OTHER;
    }

    /**
     * One project with several reported items is attributed once, to its highest-ranked category
     * (grant, then award, then achievement, then other), so category totals never double count.
     */
    static String leadingCategory(List<String> values) {
        String leading = CATEGORY_OTHER;
        for (String value : values) {
            String category = classifyAchievement(value);
            if (CATEGORY_RANK.indexOf(category) < CATEGORY_RANK.indexOf(leading)) {
                leading = category;
            }
        }
        return leading;
    }

    private static void countText(Map<String, Integer> counts, String value) {
        if (value != null && !value.isBlank()) {
            counts.merge(value.trim(), 1, Integer::sum);
        }
    }

    private static BigDecimal ratio(BigDecimal numerator, BigDecimal denominator, int scale) {
        if (denominator.signum() == 0) {
            return BigDecimal.ZERO.setScale(scale);
        }
        return numerator.divide(denominator, scale, RoundingMode.HALF_UP);
    }
}
