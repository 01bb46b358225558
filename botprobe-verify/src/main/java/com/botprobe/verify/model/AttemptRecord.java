package com.botprobe.verify.model;

import java.util.Optional;

/**
 * Log entry for one attempt of a probe run.
 *
 * @param attempt   1-based attempt number
 * @param triggerId id of the posted trigger, {@code null} if posting failed
 * @param response  the finalized response, {@code null} if none was observed
 * @param outcome   how the attempt ended
 */
public record AttemptRecord(int attempt, Long triggerId, ProbeResponse response, AttemptOutcome outcome) {

    public Optional<ProbeResponse> observed() {
        return Optional.ofNullable(response);
    }
}
