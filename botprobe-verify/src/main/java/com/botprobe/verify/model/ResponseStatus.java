package com.botprobe.verify.model;

/**
 * Validation state of a {@link ProbeResponse}.
 */
public enum ResponseStatus {
    /** Observed, not yet validated. */
    PENDING,
    PASSED,
    FAILED
}
