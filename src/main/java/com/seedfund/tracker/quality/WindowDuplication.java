package com.seedfund.tracker.quality;

import com.seedfund.tracker.metrics.PeriodWindow;

import java.math.BigDecimal;

/**
 * Raw rows versus resolved projects inside one period window.
 */
public record WindowDuplication(PeriodWindow window, int rawRecordCount, int entityCount, BigDecimal duplicationFactor) {
}
