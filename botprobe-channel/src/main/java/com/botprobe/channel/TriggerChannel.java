package com.botprobe.channel;

import java.util.List;

/**
 * A thread-like message board that an automated responder watches.
 * <p>
 * Message identities are assigned by the channel and increase monotonically,
 * so "everything after message N" is a well-defined query. The channel may be
 * shared with other writers; callers filter by author.
 */
public interface TriggerChannel {

    /** Channel identifier (e.g. "owner/repo#12"), used for log context. */
    String getChannelId();

    /**
     * Append a new message.
     *
     * @param body message text
     * @return identity of the posted message
     * @throws ChannelUnavailableException if the channel cannot be written to
     */
    long post(String body);

    /**
     * List messages with identity strictly greater than {@code watermark},
     * preferably in ascending identity order.
     *
     * @throws ChannelUnavailableException if the channel cannot be read
     */
    List<RawMessage> listSince(long watermark);

    /**
     * Remove a message.
     *
     * @return {@code true} if the message existed and was removed, {@code false}
     *         if it was not found
     * @throws ChannelUnavailableException on I/O failure (never for "not found")
     */
    boolean delete(long messageId);
}
