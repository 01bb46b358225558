package com.botprobe.verify.model;

import com.botprobe.channel.RawMessage;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * One observed reply from the responder under test.
 * <p>
 * Created {@link ResponseStatus#PENDING} by the poller and finalized exactly
 * once by validation, which yields a new instance. Synthetic responses stand
 * for runs that never observed a reply; they carry id {@code 0} and an empty
 * body and author.
 *
 * @param messageId     channel-assigned identity
 * @param body          reply text
 * @param createdAt     creation time reported by the channel
 * @param author        author identity
 * @param elapsed       time from trigger post to observation
 * @param status        validation state
 * @param failureDetail why validation failed; {@code null} unless FAILED
 * @param synthetic     {@code true} when not backed by a channel message
 */
public record ProbeResponse(
        long messageId,
        String body,
        Instant createdAt,
        String author,
        Duration elapsed,
        ResponseStatus status,
        String failureDetail,
        boolean synthetic) {

    public ProbeResponse {
        body = body != null ? body : "";
        author = author != null ? author : "";
        Objects.requireNonNull(createdAt, "createdAt");
        elapsed = elapsed != null ? elapsed : Duration.ZERO;
        Objects.requireNonNull(status, "status");
    }

    /**
     * A freshly observed, not yet validated reply.
     */
    public static ProbeResponse observed(RawMessage message, Duration elapsed) {
        return new ProbeResponse(message.id(), message.body(), message.createdAt(), message.author(),
                elapsed, ResponseStatus.PENDING, null, false);
    }

    /**
     * A failing response for a run in which no reply was ever observed.
     */
    public static ProbeResponse syntheticFailure(String detail, Instant now) {
        return new ProbeResponse(0, "", now, "", Duration.ZERO, ResponseStatus.FAILED, detail, true);
    }

    public ProbeResponse markPassed() {
        requirePending();
        return new ProbeResponse(messageId, body, createdAt, author, elapsed, ResponseStatus.PASSED, null, synthetic);
    }

    public ProbeResponse markFailed(String detail) {
        requirePending();
        return new ProbeResponse(messageId, body, createdAt, author, elapsed, ResponseStatus.FAILED, detail, synthetic);
    }

    public boolean isPassed() {
        return status == ResponseStatus.PASSED;
    }

    public boolean isPending() {
        return status == ResponseStatus.PENDING;
    }

    private void requirePending() {
        if (status != ResponseStatus.PENDING) {
            throw new IllegalStateException("response " + messageId + " already validated: " + status);
        }
    }
}
