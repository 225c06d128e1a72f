package com.seedfund.tracker.metrics;

import java.math.BigDecimal;

/**
 * Projects attributed to one achievement category and the follow-on funding they reported.
 */
public record CategoryTotal(int projectCount, BigDecimal followOnFunding) {

    CategoryTotal plus(CategoryTotal other) {
        return new CategoryTotal(projectCount + other.projectCount, followOnFunding.add(other.followOnFunding));
    }
}
