package com.botprobe.verify.retry;

import com.botprobe.channel.ChannelUnavailableException;
import com.botprobe.channel.TriggerChannel;
import com.botprobe.common.infra.Backoff;
import com.botprobe.common.infra.ErrorUtils;
import com.botprobe.common.infra.FormatDuration;
import com.botprobe.common.infra.Ticker;
import com.botprobe.common.logging.SubsystemLogger;
import com.botprobe.verify.config.ProbeSettings;
import com.botprobe.verify.model.AttemptOutcome;
import com.botprobe.verify.model.AttemptRecord;
import com.botprobe.verify.model.ProbeOutcome;
import com.botprobe.verify.model.ProbeResponse;
import com.botprobe.verify.poll.ResponsePoller;
import com.botprobe.verify.validate.ValidatorSet;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Drives up to {@code maxRetries} strictly sequential attempts of
 * post trigger → wait for reply → validate.
 * <p>
 * The first passing response ends the run. A failed attempt optionally
 * deletes its trigger and reply (best effort) and waits the retry delay
 * before the next one. Channel faults and validator faults are absorbed
 * into the outcome; nothing but programming errors escapes {@link #run}.
 */
public class RetryController {

    public static final String DETAIL_EXHAUSTED = "all retry attempts exhausted";
    public static final String DETAIL_POST_FAILED = "trigger post failed";
    public static final String DETAIL_INTERRUPTED = "interrupted";

    private final TriggerChannel channel;
    private final ResponsePoller poller;
    private final ProbeSettings settings;
    private final Ticker ticker;
    private final SubsystemLogger log;

    public RetryController(TriggerChannel channel,
            ResponsePoller poller,
            ProbeSettings settings,
            Ticker ticker,
            SubsystemLogger log) {
        this.channel = channel;
        this.poller = poller;
        this.settings = settings;
        this.ticker = ticker;
        this.log = log;
    }

    /**
     * Run the trigger until a reply passes {@code validators} or attempts run out.
     *
     * @return the passing response, the last observed (failed) response, or a
     *         synthetic failure when no reply was ever observed
     */
    public ProbeOutcome run(String triggerBody, ValidatorSet validators) {
        int maxAttempts = settings.maxRetries();
        List<AttemptRecord> attempts = new ArrayList<>(maxAttempts);
        ProbeResponse lastObserved = null;
        AttemptOutcome lastOutcome = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            log.info("Test attempt " + attempt + "/" + maxAttempts);
            AttemptRecord record = runAttempt(attempt, triggerBody, validators);
            attempts.add(record);
            lastOutcome = record.outcome();
            if (record.response() != null) {
                lastObserved = record.response();
            }

            if (lastOutcome == AttemptOutcome.PASSED) {
                log.info("Test passed", Map.of("attempt", attempt, "messageId", record.response().messageId()));
                return new ProbeOutcome(record.response(), attempts);
            }
            if (lastOutcome == AttemptOutcome.INTERRUPTED) {
                break;
            }
            if (attempt < maxAttempts && !awaitRetryDelay(attempt)) {
                lastOutcome = AttemptOutcome.INTERRUPTED;
                break;
            }
        }

        ProbeResponse terminal = terminalResponse(lastObserved, lastOutcome);
        log.error("Test failed after " + attempts.size() + " attempt(s): " + terminal.failureDetail());
        return new ProbeOutcome(terminal, attempts);
    }

    // =========================================================================
    // Attempt state machine: Posting -> Waiting -> Validating -> Decided
    // =========================================================================

    private AttemptRecord runAttempt(int attempt, String triggerBody, ValidatorSet validators) {
        long triggerId;
        try {
            triggerId = channel.post(triggerBody);
            log.info("Posted trigger", Map.of("messageId", triggerId));
        } catch (ChannelUnavailableException e) {
            log.error("Failed to post trigger: " + ErrorUtils.formatErrorChain(e));
            return new AttemptRecord(attempt, null, null, AttemptOutcome.POST_FAILED);
        }

        var observed = poller.awaitResponse(triggerId, settings.maxWait());
        if (observed.isEmpty()) {
            if (Thread.currentThread().isInterrupted()) {
                return new AttemptRecord(attempt, triggerId, null, AttemptOutcome.INTERRUPTED);
            }
            log.warn("No responder reply received", Map.of("trigger", triggerId));
            if (settings.autoDeleteOnFailure()) {
                deleteQuietly(triggerId);
            }
            return new AttemptRecord(attempt, triggerId, null, AttemptOutcome.TIMED_OUT);
        }

        ProbeResponse response = validators.apply(observed.get());
        if (response.isPassed()) {
            return new AttemptRecord(attempt, triggerId, response, AttemptOutcome.PASSED);
        }

        log.warn("Test failed: " + response.failureDetail(), Map.of("messageId", response.messageId()));
        if (settings.autoDeleteOnFailure()) {
            deleteQuietly(triggerId);
            deleteQuietly(response.messageId());
        }
        return new AttemptRecord(attempt, triggerId, response, AttemptOutcome.VALIDATION_FAILED);
    }

    /**
     * @return {@code false} if interrupted while waiting
     */
    private boolean awaitRetryDelay(int failedAttempt) {
        long delayMs = Backoff.compute(settings.retryPolicy(), failedAttempt);
        log.info("Retrying in " + FormatDuration.format(Duration.ofMillis(delayMs)) + "...");
        try {
            ticker.sleep(delayMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted during retry delay");
            return false;
        }
    }

    /**
     * Best-effort cleanup; failures are logged and otherwise ignored.
     */
    public boolean deleteQuietly(long messageId) {
        try {
            boolean deleted = channel.delete(messageId);
            if (deleted) {
                log.info("Deleted message", Map.of("messageId", messageId));
            } else {
                log.warn("Message to delete was not found", Map.of("messageId", messageId));
            }
            return deleted;
        } catch (ChannelUnavailableException e) {
            log.error("Failed to delete message " + messageId + ": " + ErrorUtils.formatErrorChain(e));
            return false;
        }
    }

    private ProbeResponse terminalResponse(ProbeResponse lastObserved, AttemptOutcome lastOutcome) {
        if (lastOutcome == AttemptOutcome.INTERRUPTED) {
            return ProbeResponse.syntheticFailure(DETAIL_INTERRUPTED, now());
        }
        if (lastObserved != null) {
            return lastObserved;
        }
        if (lastOutcome == AttemptOutcome.POST_FAILED) {
            return ProbeResponse.syntheticFailure(DETAIL_POST_FAILED, now());
        }
        return ProbeResponse.syntheticFailure(DETAIL_EXHAUSTED, now());
    }

    private Instant now() {
        return Instant.ofEpochMilli(ticker.nowMillis());
    }

    public ProbeSettings getSettings() {
        return settings;
    }
}
