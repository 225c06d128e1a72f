package com.seedfund.tracker.parse;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts currency amounts and counts from hand-entered spreadsheet cells.
 *
 * <p>Strategies run in a fixed order: direct numeric, sentinel, embedded currency amounts summed
 * within the cell, bare number in the adjacent (swapped) cell, and finally zero. The returned
 * {@link AmountSource} records which one applied. Parsing never throws and never yields a negative
 * amount.
 */
public class AmountParser {

    private static final int CURRENCY_SCALE = 2;
    private static final Set<String> SENTINELS = Set.of("NA", "N/A", "N.A.", "NONE", "NOT APPLICABLE", "-", "TBD");
    private static final Pattern DIRECT_NUMBER = Pattern.compile("^-?\\d+(?:\\.\\d+)?$");
    private static final Pattern STRIP_CHARS = Pattern.compile("[$,\\s]");
    private static final Pattern EMBEDDED_AMOUNT = Pattern.compile(
            "(?<![\\d.,])(\\$\\s*)?(\\d{1,3}(?:,\\d{3})+|\\d+)(?!\\d)(\\.\\d+)?"
                    + "(?:\\s*(million|thousand|mil)\\b|([km])(?![\\w-]|\\.\\w))?"
                    + "(?:\\s*(dollars|usd)\\b)?",
            Pattern.CASE_INSENSITIVE
    );
    private static final BigDecimal THOUSAND = BigDecimal.valueOf(1_000);
    private static final BigDecimal MILLION = BigDecimal.valueOf(1_000_000);

    /**
     * Parses a currency cell with no swap fallback.
     */
    public ParsedAmount parse(String value) {
        return parse(value, null);
    }

    /**
     * Parses a currency cell, consulting {@code adjacentValue} for a bare number when the cell
     * itself yields nothing.
     */
    public ParsedAmount parse(String value, String adjacentValue) {
        String text = value == null ? "" : value.trim();

        if (!text.isEmpty()) {
            BigDecimal direct = directNumber(text);
            if (direct != null) {
                return direct.signum() < 0
                        ? ParsedAmount.zero(AmountSource.DEFAULTED_TO_ZERO)
                        : new ParsedAmount(currency(direct), AmountSource.DIRECT);
            }
            if (isSentinel(text)) {
                return ParsedAmount.zero(AmountSource.SENTINEL);
            }
            BigDecimal embedded = sumEmbeddedAmounts(text);
            if (embedded != null) {
                return new ParsedAmount(currency(embedded), AmountSource.SUMMED_FROM_TEXT);
            }
        }

        BigDecimal swapped = adjacentValue == null ? null : directNumber(adjacentValue.trim());
        if (swapped != null && swapped.signum() > 0) {
            return new ParsedAmount(currency(swapped), AmountSource.RECOVERED_FROM_SWAP);
        }
        return ParsedAmount.zero(text.isEmpty() ? AmountSource.ABSENT : AmountSource.DEFAULTED_TO_ZERO);
    }

    /**
     * Parses a whole-number count cell. Text, fractions and negatives default to zero.
     */
    public ParsedAmount parseCount(String value) {
        String text = value == null ? "" : value.trim();
        if (text.isEmpty()) {
            return ParsedAmount.zero(AmountSource.ABSENT);
        }
        BigDecimal direct = directNumber(text);
        if (direct != null) {
            if (direct.signum() < 0) {
                return ParsedAmount.zero(AmountSource.DEFAULTED_TO_ZERO);
            }
            try {
                return new ParsedAmount(direct.setScale(0, RoundingMode.UNNECESSARY), AmountSource.DIRECT);
            } catch (ArithmeticException ex) {
                return ParsedAmount.zero(AmountSource.DEFAULTED_TO_ZERO);
            }
        }
        if (isSentinel(text)) {
            return ParsedAmount.zero(AmountSource.SENTINEL);
        }
        return ParsedAmount.zero(AmountSource.DEFAULTED_TO_ZERO);
    }

    private BigDecimal directNumber(String text) {
        if (text.isEmpty()) {
            return null;
        }
        String stripped = STRIP_CHARS.matcher(text).replaceAll("");
        if (!DIRECT_NUMBER.matcher(stripped).matches()) {
            return null;
        }
        return new BigDecimal(stripped);
    }

    private boolean isSentinel(String text) {
        return SENTINELS.contains(text.toUpperCase(Locale.ROOT));
    }

    /**
     * Sums every currency-looking substring: a {@code $} prefix, thousands grouping, a magnitude
     * word or a dollars/USD suffix marks a number as money. Plain numbers such as years are ignored.
     * A one-letter {@code k}/{@code m} only counts when glued to the digits, so "K-12" or "M.S."
     * after an amount leave it alone.
     */
    private BigDecimal sumEmbeddedAmounts(String text) {
        Matcher matcher = EMBEDDED_AMOUNT.matcher(text);
        BigDecimal total = null;
        while (matcher.find()) {
            boolean dollarSign = matcher.group(1) != null;
            boolean grouped = matcher.group(2).indexOf(',') >= 0;
            String suffix = matcher.group(4) != null ? matcher.group(4) : matcher.group(5);
            boolean unit = suffix != null || matcher.group(6) != null;
            if (!dollarSign && !grouped && !unit) {
                continue;
            }
            String digits = matcher.group(2).replace(",", "") + (matcher.group(3) == null ? "" : matcher.group(3));
            BigDecimal amount = new BigDecimal(digits).multiply(magnitude(suffix));
            total = total == null ? amount : total.add(amount);
        }
        return total;
    }

    private BigDecimal magnitude(String suffix) {
        if (suffix == null) {
            return BigDecimal.ONE;
        }
        return switch (suffix.toLowerCase(Locale.ROOT)) {
            case "k", "thousand" -> THOUSAND;
            case "m", "mil", "million" -> MILLION;
            default -> BigDecimal.ONE;
        };
    }

    private BigDecimal currency(BigDecimal amount) {
        return amount.setScale(CURRENCY_SCALE, RoundingMode.HALF_UP);
    }
}
