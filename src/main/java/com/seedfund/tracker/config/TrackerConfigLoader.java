package com.seedfund.tracker.config;

import com.seedfund.tracker.metrics.EntityFilter;
import com.seedfund.tracker.metrics.MetricFields;
import com.seedfund.tracker.metrics.PeriodWindow;
import com.seedfund.tracker.resolve.InstitutionAliasTable;
import com.seedfund.tracker.schema.AggregationPolicy;
import com.seedfund.tracker.schema.CanonicalField;
import com.seedfund.tracker.schema.FieldType;
import com.seedfund.tracker.schema.HeaderAlias;
import com.seedfund.tracker.temporal.YearPattern;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Reads the four versionable configuration tables and validates them against each other.
 * Any inconsistency is a programming error and fails startup before data is touched.
 */
public class TrackerConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(TrackerConfigLoader.class);

    private static final CSVFormat TABLE_FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setTrim(true)
            .setIgnoreEmptyLines(true)
            .setCommentMarker('#')
            .build();

    private final TrackerProperties properties;
    private final ResourceLoader resourceLoader;

    public TrackerConfigLoader(TrackerProperties properties) {
        this(properties, new DefaultResourceLoader());
    }

    public TrackerConfigLoader(TrackerProperties properties, ResourceLoader resourceLoader) {
        this.properties = properties;
        this.resourceLoader = resourceLoader;
    }

    public TrackerConfiguration load() {
        Map<String, CanonicalField> fields = loadFields(properties.getFieldPolicyFile());
        List<HeaderAlias> aliases = loadHeaderAliases(properties.getHeaderAliasFile());
        InstitutionAliasTable institutions = new InstitutionAliasTable(loadInstitutionAliases(properties.getInstitutionAliasFile()));
        List<YearPattern> yearPatterns = loadYearPatterns(properties.getYearPatternFile());

        validateKeyField(fields);
        validateFields(fields);
        for (HeaderAlias alias : aliases) {
            requireField(fields, alias.field(), properties.getHeaderAliasFile());
        }
        if (properties.getMinYear() > properties.getMaxYear()) {
            throw new IllegalStateException(
                    TrackerConstants.MSG_INVALID_YEAR_RANGE.formatted(properties.getMinYear(), properties.getMaxYear()));
        }

        MetricFields metricFields = metricFields(fields);
        List<PeriodWindow> windows = windows();
        Map<String, EntityFilter> tracks = tracks(metricFields.awardTypeField());

        log.info("Tracker configuration loaded. fields={}, headerAliases={}, institutionAliases={}, yearPatterns={}, windows={}, tracks={}",
                fields.size(), aliases.size(), institutions.size(), yearPatterns.size(), windows.size(), tracks.size());

        return new TrackerConfiguration(
                properties.getKeyField(),
                fields,
                aliases,
                institutions,
                yearPatterns,
                properties.getMinYear(),
                properties.getMaxYear(),
                metricFields,
                windows,
                tracks
        );
    }

    private Map<String, CanonicalField> loadFields(String path) {
        Map<String, CanonicalField> fields = new LinkedHashMap<>();
        for (CSVRecord record : readTable(path)) {
            String name = column(record, TrackerConstants.COLUMN_FIELD);
            try {
                CanonicalField field = new CanonicalField(
                        name,
                        FieldType.valueOf(column(record, TrackerConstants.COLUMN_TYPE).toUpperCase(Locale.ROOT)),
                        AggregationPolicy.valueOf(column(record, TrackerConstants.COLUMN_POLICY).toUpperCase(Locale.ROOT)),
                        column(record, TrackerConstants.COLUMN_FALLBACK_FIELD),
                        Boolean.parseBoolean(column(record, TrackerConstants.COLUMN_CONTROLLED_VOCABULARY))
                );
                if (name.isEmpty()) {
                    throw new IllegalArgumentException("field name is blank");
                }
                if (fields.putIfAbsent(name, field) != null) {
                    throw new IllegalStateException(TrackerConstants.MSG_DUPLICATE_FIELD.formatted(name, path));
                }
            } catch (IllegalArgumentException ex) {
                throw new IllegalStateException(
                        TrackerConstants.MSG_CONFIG_ROW_INVALID.formatted(record.getRecordNumber(), path, ex.getMessage()), ex);
            }
        }
        return fields;
    }

    private List<HeaderAlias> loadHeaderAliases(String path) {
        List<HeaderAlias> aliases = new ArrayList<>();
        for (CSVRecord record : readTable(path)) {
            String header = column(record, TrackerConstants.COLUMN_HEADER);
            String field = column(record, TrackerConstants.COLUMN_FIELD);
            if (header.isEmpty() || field.isEmpty()) {
                throw new IllegalStateException(
                        TrackerConstants.MSG_CONFIG_ROW_INVALID.formatted(record.getRecordNumber(), path, "header and field are required"));
            }
            aliases.add(new HeaderAlias(header, field));
        }
        return aliases;
    }

    private Map<String, String> loadInstitutionAliases(String path) {
        Map<String, String> aliases = new LinkedHashMap<>();
        for (CSVRecord record : readTable(path)) {
            String variant = column(record, TrackerConstants.COLUMN_VARIANT);
            String canonical = column(record, TrackerConstants.COLUMN_CANONICAL);
            if (variant.isEmpty() || canonical.isEmpty()) {
                throw new IllegalStateException(
                        TrackerConstants.MSG_CONFIG_ROW_INVALID.formatted(record.getRecordNumber(), path, "variant and canonical are required"));
            }
            aliases.put(variant, canonical);
        }
        return aliases;
    }

    private List<YearPattern> loadYearPatterns(String path) {
        List<YearPattern> patterns = new ArrayList<>();
        for (CSVRecord record : readTable(path)) {
            String regex = column(record, TrackerConstants.COLUMN_REGEX);
            String century = column(record, TrackerConstants.COLUMN_CENTURY);
            try {
                Pattern compiled = Pattern.compile(regex);
                if (compiled.matcher("").groupCount() < 1) {
                    throw new IllegalStateException(TrackerConstants.MSG_INVALID_YEAR_PATTERN.formatted(regex, "capturing group required"));
                }
                patterns.add(new YearPattern(compiled, century.isEmpty() ? null : Integer.valueOf(century)));
            } catch (PatternSyntaxException | NumberFormatException ex) {
                throw new IllegalStateException(TrackerConstants.MSG_INVALID_YEAR_PATTERN.formatted(regex, ex.getMessage()), ex);
            }
        }
        if (patterns.isEmpty()) {
            throw new IllegalStateException(TrackerConstants.MSG_NO_YEAR_PATTERNS);
        }
        return patterns;
    }

    private void validateKeyField(Map<String, CanonicalField> fields) {
        CanonicalField key = requireField(fields, properties.getKeyField(), "tracker.key-field");
        if (key.policy() != AggregationPolicy.IDENTITY) {
            throw new IllegalStateException(TrackerConstants.MSG_KEY_FIELD_POLICY.formatted(key.name()));
        }
    }

    private void validateFields(Map<String, CanonicalField> fields) {
        String source = properties.getFieldPolicyFile();
        for (CanonicalField field : fields.values()) {
            switch (field.policy()) {
                case SUM_SAFE, MAX_OF_PARSED -> {
                    if (!field.isNumeric()) {
                        throw new IllegalStateException(TrackerConstants.MSG_FIELD_TYPE_MISMATCH
                                .formatted(field.name(), FieldType.CURRENCY + " or " + FieldType.COUNT, field.policy()));
                    }
                }
                case UNION -> {
                    if (field.isNumeric()) {
                        throw new IllegalStateException(TrackerConstants.MSG_FIELD_TYPE_MISMATCH
                                .formatted(field.name(), FieldType.STRING, field.policy()));
                    }
                }
                case IDENTITY -> {
                }
            }
            if (field.fallbackField() != null) {
                if (field.policy() != AggregationPolicy.MAX_OF_PARSED) {
                    throw new IllegalStateException(
                            TrackerConstants.MSG_FALLBACK_WITHOUT_PARSED_POLICY.formatted(field.name(), field.fallbackField()));
                }
                requireField(fields, field.fallbackField(), source);
            }
        }
    }

    private MetricFields metricFields(Map<String, CanonicalField> fields) {
        TrackerProperties.Metrics metrics = properties.getMetrics();
        requireType(fields, metrics.getInvestmentField(), FieldType.CURRENCY);
        requireType(fields, metrics.getFollowOnField(), FieldType.CURRENCY);
        for (String trainee : metrics.getTraineeFields()) {
            requireType(fields, trainee, FieldType.COUNT);
        }
        requireType(fields, metrics.getInstitutionField(), FieldType.STRING);
        requireType(fields, metrics.getAwardTypeField(), FieldType.STRING);
        requireType(fields, metrics.getAchievementCategoryField(), FieldType.STRING);
        requireType(fields, metrics.getSciencePriorityField(), FieldType.STRING);
        requireType(fields, metrics.getKeywordField(), FieldType.STRING);
        return new MetricFields(
                metrics.getInvestmentField(),
                metrics.getFollowOnField(),
                metrics.getTraineeFields(),
                metrics.getInstitutionField(),
                metrics.getAwardTypeField(),
                metrics.getAchievementCategoryField(),
                metrics.getSciencePriorityField(),
                metrics.getKeywordField()
        );
    }

    private List<PeriodWindow> windows() {
        List<PeriodWindow> windows = new ArrayList<>();
        properties.getWindows().forEach((label, range) -> {
            try {
                windows.add(PeriodWindow.parse(label, range));
            } catch (IllegalArgumentException ex) {
                throw new IllegalStateException(ex.getMessage(), ex);
            }
        });
        windows.sort(Comparator.comparingInt(PeriodWindow::startYear)
                .thenComparingInt(PeriodWindow::endYear)
                .thenComparing(PeriodWindow::label));
        return windows;
    }

    private Map<String, EntityFilter> tracks(String awardTypeField) {
        Map<String, EntityFilter> tracks = new LinkedHashMap<>();
        properties.getTracks().forEach((name, track) -> {
            String key = name.trim().toLowerCase(Locale.ROOT);
            tracks.put(key, new EntityFilter(key, track.getLabel(), awardTypeField, track.getMatchExact(), track.getMatchContains()));
        });
        return tracks;
    }

    private CanonicalField requireField(Map<String, CanonicalField> fields, String name, String referencedBy) {
        CanonicalField field = name == null ? null : fields.get(name);
        if (field == null) {
            throw new IllegalStateException(TrackerConstants.MSG_POLICY_MISSING.formatted(name, referencedBy));
        }
        return field;
    }

    private void requireType(Map<String, CanonicalField> fields, String name, FieldType type) {
        CanonicalField field = requireField(fields, name, "tracker.metrics");
        if (field.type() != type) {
            throw new IllegalStateException(TrackerConstants.MSG_FIELD_TYPE_MISMATCH.formatted(name, type, "tracker.metrics"));
        }
    }

    private List<CSVRecord> readTable(String path) {
        Resource resource = resourceLoader.getResource(path);
        if (!resource.exists()) {
            throw new IllegalStateException(TrackerConstants.MSG_RESOURCE_NOT_FOUND.formatted(path));
        }
        try (Reader reader = new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8);
             CSVParser parser = TABLE_FORMAT.parse(reader)) {
            return parser.getRecords();
        } catch (IOException ex) {
            throw new IllegalStateException(TrackerConstants.MSG_RESOURCE_READ_FAILED.formatted(path), ex);
        }
    }

    private static String column(CSVRecord record, String name) {
        if (!record.isMapped(name) || !record.isSet(name)) {
            return "";
        }
        String value = record.get(name);
        return value == null ? "" : value.trim();
    }
}
