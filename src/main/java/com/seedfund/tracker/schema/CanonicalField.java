package com.seedfund.tracker.schema;

/**
 * Named, typed canonical slot with its aggregation policy.
 *
 * @param fallbackField adjacent field checked for a bare number when this field cannot be parsed,
 *                      or {@code null}
 * @param controlledVocabulary whether values are collapsed through the institution alias table
 */
public record CanonicalField(
        String name,
        FieldType type,
        AggregationPolicy policy,
        String fallbackField,
        boolean controlledVocabulary
) {

    public CanonicalField {
        fallbackField = fallbackField == null || fallbackField.isBlank() ? null : fallbackField.trim();
    }

    public boolean isNumeric() {
        return type.isNumeric();
    }
}
