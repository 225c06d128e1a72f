package com.seedfund.tracker.temporal;

import java.util.regex.Pattern;

/**
 * One year-extraction rule. Group 1 of {@code regex} holds the digits; when {@code century} is
 * non-null the digits are a two-digit short form added to it (FY16 with century 2000 is 2016).
 */
public record YearPattern(Pattern regex, Integer century) {

    public boolean isShortForm() {
        return century != null;
    }
}
