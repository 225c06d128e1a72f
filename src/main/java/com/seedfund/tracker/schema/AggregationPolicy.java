package com.seedfund.tracker.schema;

/**
 * Rule deriving one canonical value from the several raw records sharing an entity key.
 */
public enum AggregationPolicy {

    /**
     * Must agree across records; the first non-absent value is kept and disagreement is flagged.
     */
    IDENTITY,

    /**
     * One representative value per entity; summed across entities only, never within one.
     */
    SUM_SAFE,

    /**
     * Largest non-zero amount parsed from any record; repeated mentions are echoes of one fact.
     */
    MAX_OF_PARSED,

    /**
     * Distinct values collected across records; the first is the display value.
     */
    UNION
}
