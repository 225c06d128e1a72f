package com.seedfund.tracker.temporal;

import java.util.List;
import java.util.OptionalInt;
import java.util.regex.Matcher;

/**
 * Recovers the funding year from a project identifier using an ordered list of patterns.
 * "2020IL103AIS" and "2015-001" carry a four-digit year; "FY16-XXX" a fiscal-year short form.
 */
public class YearExtractor {

    private final List<YearPattern> patterns;
    private final int minYear;
    private final int maxYear;

    public YearExtractor(List<YearPattern> patterns, int minYear, int maxYear) {
        this.patterns = List.copyOf(patterns);
        this.minYear = minYear;
        this.maxYear = maxYear;
    }

    /**
     * Returns the first plausible year found by the highest-priority matching rule, or empty when
     * the identifier carries none.
     */
    public OptionalInt extract(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            return OptionalInt.empty();
        }
        String value = identifier.trim();
        for (YearPattern pattern : patterns) {
            Matcher matcher = pattern.regex().matcher(value);
            while (matcher.find()) {
                Integer year = toYear(pattern, matcher.groupCount() >= 1 ? matcher.group(1) : matcher.group());
                if (year != null && year >= minYear && year <= maxYear) {
                    return OptionalInt.of(year);
                }
            }
        }
        return OptionalInt.empty();
    }

    private Integer toYear(YearPattern pattern, String digits) {
        if (digits == null || digits.isEmpty() || digits.length() > 4 || !digits.chars().allMatch(Character::isDigit)) {
            return null;
        }
        int parsed = Integer.parseInt(digits);
        if (pattern.isShortForm()) {
            return parsed < 100 ? pattern.century() + parsed : null;
        }
        return digits.length() == 4 ? parsed : null;
    }
}
