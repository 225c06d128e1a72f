package com.seedfund.tracker.parse;

/**
 * How a parsed amount was obtained. Kept with every amount so a zero can always be explained.
 */
public enum AmountSource {
    DIRECT,
    SENTINEL,
    SUMMED_FROM_TEXT,
    RECOVERED_FROM_SWAP,
    ABSENT,
    DEFAULTED_TO_ZERO;

    /**
     * True for a value that was present but could not be read as an amount.
     */
    public boolean isUnparsed() {
        return this == DEFAULTED_TO_ZERO;
    }
}
