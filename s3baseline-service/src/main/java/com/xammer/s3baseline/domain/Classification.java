package com.xammer.s3baseline.domain;

/**
 * Compliance of one dimension (policy or logging) of a bucket.
 */
public enum Classification {
    APPLIED,
    NEEDS_CHANGE,
    NOT_APPLIED
}
