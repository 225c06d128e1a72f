package com.seedfund.tracker.metrics;

import java.util.List;

/**
 * Canonical fields selected for each aggregate metric.
 *
 * @param traineeFields count fields reported per trainee category, in report order
 */
public record MetricFields(
        String investmentField,
        String followOnField,
        List<String> traineeFields,
        String institutionField,
        String awardTypeField,
        String achievementCategoryField,
        String sciencePriorityField,
        String keywordField
) {

    public MetricFields {
        traineeFields = List.copyOf(traineeFields);
    }
}
