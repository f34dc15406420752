package com.xammer.s3baseline.domain;

/**
 * Final state of a dimension after a run. Adds the two pseudo states that are not
 * compliance classifications: the dimension was switched off for this run, or the
 * store could not be read or written.
 */
public enum DimensionStatus {
    APPLIED,
    NEEDS_CHANGE,
    NOT_APPLIED,
    SKIPPED,
    ERROR;

    public static DimensionStatus of(Classification classification) {
        switch (classification) {
            case APPLIED:
                return APPLIED;
            case NEEDS_CHANGE:
                return NEEDS_CHANGE;
            case NOT_APPLIED:
                return NOT_APPLIED;
            default:
                throw new IllegalArgumentException("Unknown classification: " + classification);
        }
    }
}
