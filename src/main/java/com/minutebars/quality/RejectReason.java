package com.minutebars.quality;

/**
 * Why a raw bar was dropped, in the order the filter stages run.
 */
public enum RejectReason {
    BLANK_SYMBOL,
    UNPARSABLE_TIMESTAMP,
    NON_NUMERIC,
    MISSING_FIELD,
    INVARIANT_VIOLATION,
    DUPLICATE
}
