package com.botprobe.channel;

import java.time.Instant;
import java.util.Objects;

/**
 * A message as listed by a {@link TriggerChannel}.
 *
 * @param id        channel-assigned identity
 * @param author    author identity (login, bot name)
 * @param body      message text, never null
 * @param createdAt creation time reported by the channel
 */
public record RawMessage(long id, String author, String body, Instant createdAt) {

    public RawMessage {
        Objects.requireNonNull(author, "author");
        body = body != null ? body : "";
        Objects.requireNonNull(createdAt, "createdAt");
    }

    public boolean isAuthoredBy(String identity) {
        return author.equals(identity);
    }
}
