package com.seedfund.tracker.schema;

/**
 * Value type of a canonical field.
 */
public enum FieldType {
    STRING,
    CURRENCY,
    COUNT,
    YEAR;

    public boolean isNumeric() {
        return this == CURRENCY || this == COUNT;
    }
}
