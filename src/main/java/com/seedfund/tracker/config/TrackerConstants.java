package com.seedfund.tracker.config;

import java.util.Set;

/**
 * Shared constants for the tracking pipeline.
 */
public final class TrackerConstants {

    private TrackerConstants() {
    }

    public static final String DEFAULT_EXTRACT_FILE_PATTERN = "extracts/*.csv";
    public static final String DEFAULT_HEADER_ALIAS_FILE = "classpath:config/header-aliases.csv";
    public static final String DEFAULT_FIELD_POLICY_FILE = "classpath:config/field-policies.csv";
    public static final String DEFAULT_INSTITUTION_ALIAS_FILE = "classpath:config/institution-aliases.csv";
    public static final String DEFAULT_YEAR_PATTERN_FILE = "classpath:config/year-patterns.csv";
    public static final String DEFAULT_KEY_FIELD = "project_id";
    public static final int DEFAULT_MIN_YEAR = 1990;
    public static final int DEFAULT_MAX_YEAR = 2099;
    public static final int ROI_SCALE = 6;

    public static final String FILE_EXT_ZIP = ".zip";
    public static final String FILE_EXT_TXT = ".txt";
    public static final String FILE_EXT_CSV = ".csv";

    public static final int SIGNIFICANT_TOKEN_MIN_LENGTH = 2;
    public static final Set<String> HEADER_STOPWORDS = Set.of(
            "a", "an", "and", "as", "be", "by", "for", "from", "if", "in", "is", "na", "not", "of", "on",
            "or", "so", "that", "the", "this", "to", "use", "was", "were", "where", "with"
    );
    public static final int MIN_SHARED_TOKENS = 2;

    public static final String COLUMN_FIELD = "field";
    public static final String COLUMN_TYPE = "type";
    public static final String COLUMN_POLICY = "policy";
    public static final String COLUMN_FALLBACK_FIELD = "fallback_field";
    public static final String COLUMN_CONTROLLED_VOCABULARY = "controlled_vocabulary";
    public static final String COLUMN_HEADER = "header";
    public static final String COLUMN_VARIANT = "variant";
    public static final String COLUMN_CANONICAL = "canonical";
    public static final String COLUMN_REGEX = "regex";
    public static final String COLUMN_CENTURY = "century";

    public static final String MSG_RESOURCE_NOT_FOUND = "Resource not found on classpath: %s";
    public static final String MSG_RESOURCE_EMPTY = "Extract file is empty: %s";
    public static final String MSG_RESOURCE_READ_FAILED = "Failed to read resource: %s";
    public static final String MSG_NO_EXTRACTS = "No extract files found matching: %s";
    public static final String MSG_ZIP_READ_FAILED = "Unable to read ZIP content of %s";
    public static final String MSG_ZIP_NO_TEXT_FILE = "No readable text file found inside ZIP %s";
    public static final String MSG_CSV_PARSE_FAILED = "Unable to parse CSV content of %s";
    public static final String MSG_CSV_HEADER_NOT_FOUND = "CSV header row %d not found in %s";
    public static final String MSG_CONFIG_ROW_INVALID = "Invalid row %d in %s: %s";
    public static final String MSG_DUPLICATE_FIELD = "Field %s declared twice in %s";
    public static final String MSG_POLICY_MISSING = "No aggregation policy declared for field %s referenced by %s";
    public static final String MSG_KEY_FIELD_POLICY = "Key field %s must use policy IDENTITY";
    public static final String MSG_FALLBACK_WITHOUT_PARSED_POLICY = "Field %s declares fallback %s but is not MAX_OF_PARSED";
    public static final String MSG_FIELD_TYPE_MISMATCH = "Field %s must be of type %s for %s";
    public static final String MSG_INVALID_YEAR_PATTERN = "Invalid year pattern %s: %s";
    public static final String MSG_NO_YEAR_PATTERNS = "At least one year pattern is required";
    public static final String MSG_INVALID_YEAR_RANGE = "Invalid plausible year range %d-%d";
    public static final String MSG_INVALID_WINDOW = "Invalid period window %s: start year %d is after end year %d";
    public static final String MSG_INVALID_WINDOW_SPEC = "Invalid period window definition %s: %s";
    public static final String MSG_UNKNOWN_TRACK = "Unsupported track: %s";
    public static final String MSG_INVALID_UPLOAD_FILE_NAME = "Invalid file name. Upload a .csv or .zip extract.";
    public static final String MSG_EMPTY_UPLOAD = "Uploaded file is empty";
}
