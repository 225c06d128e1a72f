package com.seedfund.tracker.resolve;

import com.seedfund.tracker.config.TrackerConfiguration;
import com.seedfund.tracker.parse.AmountParser;
import com.seedfund.tracker.parse.AmountSource;
import com.seedfund.tracker.parse.ParsedAmount;
import com.seedfund.tracker.quality.QualityIssue;
import com.seedfund.tracker.schema.AggregationPolicy;
import com.seedfund.tracker.schema.CanonicalField;
import com.seedfund.tracker.schema.FieldType;
import com.seedfund.tracker.schema.RawRecord;
import com.seedfund.tracker.temporal.YearExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;
import java.util.TreeMap;

/**
 * Groups raw records by project identifier and materializes one {@link ProjectEntity} per group.
 *
 * <p>Source extracts carry one row per project output (publication, award, reporting period), so
 * per-project values such as the award amount repeat on every row. Each canonical field is derived
 * through its {@link AggregationPolicy}; nothing is ever summed inside a group. Records are put in
 * (provenance, row number) order before "first value wins" applies, which makes the result
 * independent of the order records arrive in.
 */
public class EntityResolver {

    private static final Logger log = LoggerFactory.getLogger(EntityResolver.class);

    static final Comparator<RawRecord> RECORD_ORDER = Comparator
            .comparing(RawRecord::provenance)
            .thenComparingInt(RawRecord::rowNumber)
            .thenComparing(record -> record.values().toString());

    private final TrackerConfiguration configuration;
    private final AmountParser amountParser;
    private final YearExtractor yearExtractor;

    public EntityResolver(TrackerConfiguration configuration, AmountParser amountParser, YearExtractor yearExtractor) {
        this.configuration = configuration;
        this.amountParser = amountParser;
        this.yearExtractor = yearExtractor;
    }

    public ResolutionResult resolve(List<RawRecord> records) {
        List<RawRecord> ordered = new ArrayList<>(records);
        ordered.sort(RECORD_ORDER);

        List<QualityIssue> issues = new ArrayList<>();
        Map<String, List<RawRecord>> groups = new TreeMap<>();
        for (RawRecord record : ordered) {
            String key = record.value(configuration.keyField());
            if (key == null) {
                issues.add(QualityIssue.missingIdentifier(record.provenance(), record.rowNumber()));
                continue;
            }
            groups.computeIfAbsent(key.trim(), ignored -> new ArrayList<>()).add(record);
        }

        List<ProjectEntity> entities = new ArrayList<>(groups.size());
        groups.forEach((key, group) -> entities.add(resolveGroup(key, group, issues)));
        log.debug("Resolved {} raw records into {} entities ({} issues)", records.size(), entities.size(), issues.size());
        return new ResolutionResult(entities, issues, records.size());
    }

    private ProjectEntity resolveGroup(String key, List<RawRecord> group, List<QualityIssue> issues) {
        Map<String, String> identityValues = new LinkedHashMap<>();
        Map<String, BigDecimal> amounts = new LinkedHashMap<>();
        Map<String, AmountSource> amountSources = new LinkedHashMap<>();
        Map<String, List<String>> variants = new LinkedHashMap<>();
        List<String> inconsistentFields = new ArrayList<>();

        for (CanonicalField field : configuration.fields().values()) {
            switch (field.policy()) {
                case IDENTITY -> {
                    if (field.isNumeric()) {
                        resolveNumericIdentity(key, field, group, amounts, amountSources, inconsistentFields, issues);
                    } else {
                        resolveTextIdentity(key, field, group, identityValues, inconsistentFields, issues);
                    }
                }
                case SUM_SAFE -> {
                    ParsedAmount representative = firstRepresentative(key, field, group, issues);
                    amounts.put(field.name(), representative.amount());
                    amountSources.put(field.name(), representative.source());
                }
                case MAX_OF_PARSED -> {
                    ParsedAmount max = maxOfParsed(key, field, group, issues);
                    amounts.put(field.name(), max.amount());
                    amountSources.put(field.name(), max.source());
                }
                case UNION -> {
                    List<String> distinct = distinctValues(field, group);
                    if (!distinct.isEmpty()) {
                        variants.put(field.name(), distinct);
                    }
                }
            }
        }

        OptionalInt year = yearExtractor.extract(key);
        if (year.isEmpty()) {
            issues.add(QualityIssue.unextractableIdentifier(key));
        }

        return new ProjectEntity(
                key,
                year.isPresent() ? year.getAsInt() : null,
                identityValues,
                amounts,
                amountSources,
                variants,
                group.size(),
                inconsistentFields.isEmpty(),
                inconsistentFields
        );
    }

    private void resolveTextIdentity(
            String key,
            CanonicalField field,
            List<RawRecord> group,
            Map<String, String> identityValues,
            List<String> inconsistentFields,
            List<QualityIssue> issues) {
        String kept = null;
        for (RawRecord record : group) {
            String value = textValue(field, record);
            if (value == null) {
                continue;
            }
            if (kept == null) {
                kept = value;
            } else if (!sameText(kept, value) && !inconsistentFields.contains(field.name())) {
                inconsistentFields.add(field.name());
                issues.add(QualityIssue.inconsistentField(key, field.name(), kept, value));
            }
        }
        if (kept != null) {
            identityValues.put(field.name(), kept);
        }
    }

    private void resolveNumericIdentity(
            String key,
            CanonicalField field,
            List<RawRecord> group,
            Map<String, BigDecimal> amounts,
            Map<String, AmountSource> amountSources,
            List<String> inconsistentFields,
            List<QualityIssue> issues) {
        ParsedAmount kept = null;
        for (RawRecord record : group) {
            if (!record.has(field.name())) {
                continue;
            }
            ParsedAmount parsed = parse(key, field, record, issues);
            if (kept == null) {
                kept = parsed;
            } else if (kept.amount().compareTo(parsed.amount()) != 0 && !inconsistentFields.contains(field.name())) {
                inconsistentFields.add(field.name());
                issues.add(QualityIssue.inconsistentField(key, field.name(),
                        kept.amount().toPlainString(), parsed.amount().toPlainString()));
            }
        }
        ParsedAmount value = kept == null ? ParsedAmount.zero(AmountSource.ABSENT) : kept;
        amounts.put(field.name(), value.amount());
        amountSources.put(field.name(), value.source());
    }

    /**
     * One value per entity: the first record that yields a readable amount, else the first
     * non-absent outcome. Never a sum across the group.
     */
    private ParsedAmount firstRepresentative(String key, CanonicalField field, List<RawRecord> group, List<QualityIssue> issues) {
        ParsedAmount fallback = null;
        for (RawRecord record : group) {
            if (!record.has(field.name())) {
                continue;
            }
            ParsedAmount parsed = parse(key, field, record, issues);
            if (isReadable(parsed)) {
                return parsed;
            }
            if (fallback == null) {
                fallback = parsed;
            }
        }
        return fallback == null ? ParsedAmount.zero(AmountSource.ABSENT) : fallback;
    }

    /**
     * Largest non-zero amount across the group; the same external grant mentioned on several
     * output rows is counted once.
     */
    private ParsedAmount maxOfParsed(String key, CanonicalField field, List<RawRecord> group, List<QualityIssue> issues) {
        ParsedAmount best = null;
        ParsedAmount firstPresent = null;
        for (RawRecord record : group) {
            boolean present = record.has(field.name())
                    || (field.fallbackField() != null && record.has(field.fallbackField()));
            if (!present) {
                continue;
            }
            ParsedAmount parsed = parse(key, field, record, issues);
            if (firstPresent == null && parsed.source() != AmountSource.ABSENT) {
                firstPresent = parsed;
            }
            if (parsed.isPositive() && (best == null || parsed.amount().compareTo(best.amount()) > 0)) {
                best = parsed;
            }
        }
        if (best != null) {
            return best;
        }
        return firstPresent == null ? ParsedAmount.zero(AmountSource.ABSENT) : firstPresent;
    }

    private List<String> distinctValues(CanonicalField field, List<RawRecord> group) {
        Set<String> seenKeys = new LinkedHashSet<>();
        List<String> distinct = new ArrayList<>();
        for (RawRecord record : group) {
            String value = textValue(field, record);
            if (value != null && seenKeys.add(comparisonKey(value))) {
                distinct.add(value);
            }
        }
        return distinct;
    }

    private ParsedAmount parse(String key, CanonicalField field, RawRecord record, List<QualityIssue> issues) {
        String raw = record.value(field.name());
        ParsedAmount parsed = field.type() == FieldType.COUNT
                ? amountParser.parseCount(raw)
                : amountParser.parse(raw, field.fallbackField() == null ? null : record.value(field.fallbackField()));
        if (parsed.source().isUnparsed()) {
            issues.add(QualityIssue.unparsedValue(record.provenance(), key, field.name(), raw));
        }
        return parsed;
    }

    private String textValue(CanonicalField field, RawRecord record) {
        String raw = record.value(field.name());
        if (raw == null) {
            return null;
        }
        return field.controlledVocabulary()
                ? configuration.institutionAliases().canonicalize(raw)
                : raw.replaceAll("\\s+", " ");
    }

    private boolean isReadable(ParsedAmount parsed) {
        return parsed.source() == AmountSource.DIRECT
                || parsed.source() == AmountSource.SUMMED_FROM_TEXT
                || parsed.source() == AmountSource.RECOVERED_FROM_SWAP;
    }

    private boolean sameText(String left, String right) {
        return comparisonKey(left).equals(comparisonKey(right));
    }

    private String comparisonKey(String value) {
        return value.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }
}
