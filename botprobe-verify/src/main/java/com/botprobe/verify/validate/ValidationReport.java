package com.botprobe.verify.validate;

import java.util.List;

/**
 * Aggregated result of a {@link ValidatorSet} run.
 *
 * @param passed   {@code true} iff every validator passed
 * @param failures one entry per failing or throwing validator, in set order
 */
public record ValidationReport(boolean passed, List<String> failures) {

    public ValidationReport {
        failures = List.copyOf(failures);
    }

    /**
     * Semicolon-joined failure detail, or {@code null} when passed.
     */
    public String detail() {
        return failures.isEmpty() ? null : String.join("; ", failures);
    }
}
