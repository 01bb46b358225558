package com.botprobe.verify.model;

import java.util.List;

/**
 * Result of a probe run: the final response plus the per-attempt log.
 */
public record ProbeOutcome(ProbeResponse response, List<AttemptRecord> attempts) {

    public ProbeOutcome {
        attempts = List.copyOf(attempts);
    }

    public boolean passed() {
        return response.isPassed();
    }

    public int attemptCount() {
        return attempts.size();
    }
}
