package com.seedfund.tracker.metrics;

import com.seedfund.tracker.config.TrackerConstants;

/**
 * Inclusive range of funding years used to scope aggregate metrics.
 */
public record PeriodWindow(String label, int startYear, int endYear) {

    public PeriodWindow {
        if (startYear > endYear) {
            throw new IllegalArgumentException(TrackerConstants.MSG_INVALID_WINDOW.formatted(label, startYear, endYear));
        }
        label = label == null || label.isBlank() ? startYear + "-" + endYear : label;
    }

    public static PeriodWindow of(int startYear, int endYear) {
        return new PeriodWindow(null, startYear, endYear);
    }

    /**
     * Parses a {@code yyyy-yyyy} range such as {@code 2015-2024}.
     */
    public static PeriodWindow parse(String label, String range) {
        String value = range == null ? "" : range.trim();
        String[] parts = value.split("\\s*-\\s*");
        if (parts.length != 2) {
            throw new IllegalArgumentException(TrackerConstants.MSG_INVALID_WINDOW_SPEC.formatted(label, range));
        }
        try {
            return new PeriodWindow(label, Integer.parseInt(parts[0]), Integer.parseInt(parts[1]));
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(TrackerConstants.MSG_INVALID_WINDOW_SPEC.formatted(label, range), ex);
        }
    }

    public boolean contains(Integer year) {
        return year != null && year >= startYear && year <= endYear;
    }
}
