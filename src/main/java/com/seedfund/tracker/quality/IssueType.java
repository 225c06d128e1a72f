package com.seedfund.tracker.quality;

/**
 * Recoverable data conditions flagged during a pipeline run. None of them stops processing.
 */
public enum IssueType {
    UNMAPPED_HEADER,
    DUPLICATE_HEADER,
    MISSING_IDENTIFIER,
    UNEXTRACTABLE_IDENTIFIER,
    UNPARSED_VALUE,
    INCONSISTENT_IDENTITY_FIELD,
    EMPTY_DENOMINATOR
}
