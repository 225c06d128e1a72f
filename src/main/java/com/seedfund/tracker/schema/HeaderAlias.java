package com.seedfund.tracker.schema;

/**
 * One literal source header known to carry a canonical field.
 */
public record HeaderAlias(String literal, String field) {
}
