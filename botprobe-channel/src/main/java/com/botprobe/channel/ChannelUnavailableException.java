package com.botprobe.channel;

/**
 * Transient failure talking to a {@link TriggerChannel}: network errors,
 * rate limits, outages. Callers treat it as retryable.
 */
public class ChannelUnavailableException extends RuntimeException {

    private final String channelId;

    public ChannelUnavailableException(String channelId, String message) {
        super(message);
        this.channelId = channelId;
    }

    public ChannelUnavailableException(String channelId, String message, Throwable cause) {
        super(message, cause);
        this.channelId = channelId;
    }

    public String getChannelId() {
        return channelId;
    }
}
