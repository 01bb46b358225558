package com.botprobe.verify;

import com.botprobe.channel.TriggerChannel;
import com.botprobe.common.infra.Ticker;
import com.botprobe.common.logging.SubsystemLogger;
import com.botprobe.verify.config.ProbeSettings;
import com.botprobe.verify.model.ProbeOutcome;
import com.botprobe.verify.model.ProbeResponse;
import com.botprobe.verify.poll.ResponsePoller;
import com.botprobe.verify.retry.RetryController;
import com.botprobe.verify.validate.ResponseValidator;
import com.botprobe.verify.validate.ResponseValidators;
import com.botprobe.verify.validate.ValidatorSet;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Tests an automated responder by posting a trigger to a channel, waiting
 * for its reply and judging the reply with validators, with retries.
 * <p>
 * One instance per responder and channel. Instances share no mutable state,
 * so independent probes may run concurrently on separate threads; a single
 * instance runs one probe at a time.
 *
 * <pre>
 * BotProbe probe = BotProbes.create(settings, channel);
 * ProbeResponse result = probe.runWithRetry("@bot fix the typo",
 *         List.of(ResponseValidators.noErrorKeywords(), ResponseValidators.containsText("fixed")));
 * if (!result.isPassed()) {
 *     System.err.println(result.failureDetail());
 * }
 * </pre>
 */
public class BotProbe {

    private final ProbeSettings settings;
    private final TriggerChannel channel;
    private final ResponsePoller poller;
    private final RetryController controller;
    private final SubsystemLogger log;

    public BotProbe(ProbeSettings settings, TriggerChannel channel, Ticker ticker, SubsystemLogger log) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.channel = Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(ticker, "ticker");
        this.log = Objects.requireNonNull(log, "log");
        this.poller = new ResponsePoller(channel, settings.responderIdentity(), settings.pollInterval(),
                ticker, log.child("poller"));
        this.controller = new RetryController(channel, poller, settings, ticker, log.child("retry"));

        if (!settings.channelIdentity().equals(channel.getChannelId())) {
            log.warn("Channel id differs from configured channel identity", Map.of(
                    "configured", settings.channelIdentity(),
                    "channel", String.valueOf(channel.getChannelId())));
        }
    }

    // =========================================================================
    // Runs
    // =========================================================================

    /**
     * Post {@code triggerBody} and retry until a reply passes every validator.
     *
     * @return the passing response, or a failed one; never throws for channel
     *         or validator faults
     */
    public ProbeResponse runWithRetry(String triggerBody, List<ResponseValidator> validators) {
        return runDetailed(triggerBody, validators).response();
    }

    /**
     * Same as {@link #runWithRetry}, also returning the per-attempt log.
     */
    public ProbeOutcome runDetailed(String triggerBody, List<ResponseValidator> validators) {
        Objects.requireNonNull(triggerBody, "triggerBody");
        return controller.run(triggerBody, new ValidatorSet(validators));
    }

    /**
     * Run with the stock checks: no error keywords, plus success indicators
     * when {@code expectSuccess}.
     *
     * @return whether the run passed
     */
    public boolean runSimple(String triggerBody, boolean expectSuccess) {
        List<ResponseValidator> validators = new ArrayList<>();
        validators.add(ResponseValidators.noErrorKeywords());
        if (expectSuccess) {
            validators.add(ResponseValidators.hasSuccessIndicators());
        }
        return runWithRetry(triggerBody, validators).isPassed();
    }

    /**
     * Run on {@code executor}. Cancelling the future does not stop an attempt
     * already in progress; it only discards the result.
     */
    public CompletableFuture<ProbeResponse> runAsync(String triggerBody,
            List<ResponseValidator> validators,
            Executor executor) {
        Objects.requireNonNull(triggerBody, "triggerBody");
        return CompletableFuture.supplyAsync(() -> runDetailed(triggerBody, validators).response(), executor);
    }

    // =========================================================================
    // Single steps
    // =========================================================================

    /**
     * Post a trigger without waiting.
     *
     * @return the trigger's message id
     * @throws com.botprobe.channel.ChannelUnavailableException if the post fails
     */
    public long postTrigger(String triggerBody) {
        long id = channel.post(triggerBody);
        log.info("Posted trigger", Map.of("messageId", id));
        return id;
    }

    /**
     * Wait up to the configured max wait for a reply after {@code watermark}.
     */
    public Optional<ProbeResponse> waitForResponse(long watermark) {
        return poller.awaitResponse(watermark, settings.maxWait());
    }

    /**
     * Wait up to {@code timeout} for a reply after {@code watermark}.
     */
    public Optional<ProbeResponse> waitForResponse(long watermark, Duration timeout) {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be > 0, got " + timeout);
        }
        return poller.awaitResponse(watermark, timeout);
    }

    /**
     * Finalize a pending response against {@code validators}.
     */
    public ProbeResponse validate(ProbeResponse response, List<ResponseValidator> validators) {
        return new ValidatorSet(validators).apply(response);
    }

    /**
     * Delete a message, best effort.
     *
     * @return whether the message was deleted
     */
    public boolean deleteMessage(long messageId) {
        return controller.deleteQuietly(messageId);
    }

    public ProbeSettings getSettings() {
        return settings;
    }

    public TriggerChannel getChannel() {
        return channel;
    }
}
