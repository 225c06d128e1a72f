package com.seedfund.tracker.parse;

import java.math.BigDecimal;

/**
 * Non-negative amount plus the strategy that produced it.
 */
public record ParsedAmount(BigDecimal amount, AmountSource source) {

    public static ParsedAmount zero(AmountSource source) {
        return new ParsedAmount(BigDecimal.ZERO, source);
    }

    public boolean isPositive() {
        return amount.signum() > 0;
    }
}
