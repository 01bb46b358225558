package com.botprobe.verify.model;

/**
 * How a single post → wait → validate attempt ended.
 */
public enum AttemptOutcome {
    PASSED,
    POST_FAILED,
    TIMED_OUT,
    VALIDATION_FAILED,
    INTERRUPTED
}
