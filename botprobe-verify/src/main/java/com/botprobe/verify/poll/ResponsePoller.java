package com.botprobe.verify.poll;

import com.botprobe.channel.ChannelUnavailableException;
import com.botprobe.channel.RawMessage;
import com.botprobe.channel.TriggerChannel;
import com.botprobe.common.infra.ErrorUtils;
import com.botprobe.common.infra.FormatDuration;
import com.botprobe.common.infra.Ticker;
import com.botprobe.common.logging.SubsystemLogger;
import com.botprobe.verify.model.ProbeResponse;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Waits for the responder's first reply after a watermark.
 * <p>
 * Each tick lists the channel after the watermark and keeps only messages by
 * the responder; other writers on the channel are ignored. The lowest
 * qualifying id wins and is returned at once. Read failures count as "no
 * reply yet". Between ticks the poller sleeps for the poll interval, cut
 * short so it never sleeps past the deadline.
 */
public class ResponsePoller {

    private final TriggerChannel channel;
    private final String responderIdentity;
    private final Duration pollInterval;
    private final Ticker ticker;
    private final SubsystemLogger log;

    public ResponsePoller(TriggerChannel channel,
            String responderIdentity,
            Duration pollInterval,
            Ticker ticker,
            SubsystemLogger log) {
        if (pollInterval.isZero() || pollInterval.isNegative()) {
            throw new IllegalArgumentException("pollInterval must be > 0");
        }
        this.channel = channel;
        this.responderIdentity = responderIdentity;
        this.pollInterval = pollInterval;
        this.ticker = ticker;
        this.log = log;
    }

    /**
     * Block until the responder replies after {@code watermark} or
     * {@code timeout} elapses.
     *
     * @return the pending response, or empty on timeout or interruption
     *         (the interrupt flag is restored)
     */
    public Optional<ProbeResponse> awaitResponse(long watermark, Duration timeout) {
        long timeoutMs = timeout.toMillis();
        long start = ticker.nowMillis();
        int ticks = 0;

        log.info("Waiting for @" + responderIdentity + " reply", Map.of(
                "after", watermark,
                "timeout", FormatDuration.format(timeout)));

        while (true) {
            ticks++;
            Optional<RawMessage> match = pollOnce(watermark);
            long elapsedMs = ticker.nowMillis() - start;

            if (match.isPresent()) {
                Duration elapsed = Duration.ofMillis(elapsedMs);
                log.info("Responder replied after " + FormatDuration.format(elapsed), Map.of(
                        "messageId", match.get().id(),
                        "ticks", ticks));
                return Optional.of(ProbeResponse.observed(match.get(), elapsed));
            }

            long remaining = timeoutMs - elapsedMs;
            if (remaining <= 0) {
                log.warn("Timeout after " + FormatDuration.format(timeout) + " waiting for responder",
                        Map.of("after", watermark, "ticks", ticks));
                return Optional.empty();
            }

            try {
                ticker.sleep(Math.min(pollInterval.toMillis(), remaining));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for responder", Map.of("after", watermark));
                return Optional.empty();
            }
        }
    }

    /**
     * One channel read. Returns the earliest qualifying message, if any.
     */
    Optional<RawMessage> pollOnce(long watermark) {
        List<RawMessage> messages;
        try {
            messages = channel.listSince(watermark);
        } catch (ChannelUnavailableException e) {
            log.warn("Error polling channel: " + ErrorUtils.formatErrorChain(e));
            return Optional.empty();
        }
        RawMessage earliest = null;
        for (RawMessage message : messages) {
            if (message.id() <= watermark || !message.isAuthoredBy(responderIdentity)) {
                continue;
            }
            if (earliest == null || message.id() < earliest.id()) {
                earliest = message;
            }
        }
        return Optional.ofNullable(earliest);
    }

    public String getResponderIdentity() {
        return responderIdentity;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }
}
