package com.seedfund.tracker.quality;

/**
 * One flagged data condition. Fields that do not apply to the issue type are {@code null}.
 *
 * @param source    source file the condition was found in
 * @param entityKey entity the condition belongs to
 * @param field     canonical field, or the literal header for header issues
 * @param detail    offending value or short explanation
 */
public record QualityIssue(IssueType type, String source, String entityKey, String field, String detail) {

    public static QualityIssue unmappedHeader(String source, String header) {
        return new QualityIssue(IssueType.UNMAPPED_HEADER, source, null, header, "no canonical field matched");
    }

    public static QualityIssue duplicateHeader(String source, String header, String field) {
        return new QualityIssue(IssueType.DUPLICATE_HEADER, source, null, header, "field already mapped: " + field);
    }

    public static QualityIssue missingIdentifier(String source, int rowNumber) {
        return new QualityIssue(IssueType.MISSING_IDENTIFIER, source, null, null, "row " + rowNumber);
    }

    public static QualityIssue unextractableIdentifier(String entityKey) {
        return new QualityIssue(IssueType.UNEXTRACTABLE_IDENTIFIER, null, entityKey, null, "no year in identifier");
    }

    public static QualityIssue unparsedValue(String source, String entityKey, String field, String value) {
        return new QualityIssue(IssueType.UNPARSED_VALUE, source, entityKey, field, value);
    }

    public static QualityIssue inconsistentField(String entityKey, String field, String keptValue, String otherValue) {
        return new QualityIssue(IssueType.INCONSISTENT_IDENTITY_FIELD, null, entityKey, field,
                "kept '" + keptValue + "', also saw '" + otherValue + "'");
    }

    public static QualityIssue emptyDenominator(String windowLabel, String field) {
        return new QualityIssue(IssueType.EMPTY_DENOMINATOR, null, null, field, "ROI defined as 0 for " + windowLabel);
    }
}
