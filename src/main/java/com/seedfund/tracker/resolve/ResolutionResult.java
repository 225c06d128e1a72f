package com.seedfund.tracker.resolve;

import com.seedfund.tracker.quality.QualityIssue;

import java.util.List;

/**
 * Resolved entities, sorted by key, plus the conditions flagged while resolving them.
 */
public record ResolutionResult(List<ProjectEntity> entities, List<QualityIssue> issues, int rawRecordCount) {

    public ResolutionResult {
        entities = List.copyOf(entities);
        issues = List.copyOf(issues);
    }
}
