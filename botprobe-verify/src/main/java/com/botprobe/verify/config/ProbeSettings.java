package com.botprobe.verify.config;

import com.botprobe.common.infra.Backoff;

import java.time.Duration;

/**
 * Immutable parameters of one probe run.
 *
 * @param responderIdentity   author identity of the responder under test
 * @param channelIdentity     channel the trigger is posted to
 * @param maxWait             how long one attempt waits for a reply
 * @param pollInterval        delay between channel reads; never above maxWait
 * @param maxRetries          total attempts, at least 1
 * @param retryDelay          delay after a failed attempt
 * @param autoDeleteOnFailure delete trigger and reply of failed attempts
 * @param retryBackoffFactor  growth of retryDelay per failed attempt; 1.0 keeps it fixed
 * @param maxRetryDelay       cap on the grown delay, {@code null} for none
 */
public record ProbeSettings(
        String responderIdentity,
        String channelIdentity,
        Duration maxWait,
        Duration pollInterval,
        int maxRetries,
        Duration retryDelay,
        boolean autoDeleteOnFailure,
        double retryBackoffFactor,
        Duration maxRetryDelay) {

    public static final Duration DEFAULT_MAX_WAIT = Duration.ofSeconds(120);
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(5);
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final Duration DEFAULT_RETRY_DELAY = Duration.ofSeconds(60);

    public ProbeSettings {
        if (responderIdentity == null || responderIdentity.isBlank()) {
            throw new ProbeConfigException("responderIdentity must be non-empty");
        }
        if (channelIdentity == null || channelIdentity.isBlank()) {
            throw new ProbeConfigException("channelIdentity must be non-empty");
        }
        if (maxWait == null || maxWait.isNegative() || maxWait.isZero()) {
            throw new ProbeConfigException("maxWait must be > 0, got " + maxWait);
        }
        if (pollInterval == null || pollInterval.isNegative() || pollInterval.isZero()) {
            throw new ProbeConfigException("pollInterval must be > 0, got " + pollInterval);
        }
        if (pollInterval.compareTo(maxWait) > 0) {
            throw new ProbeConfigException(
                    "pollInterval (" + pollInterval + ") must not exceed maxWait (" + maxWait + ")");
        }
        if (maxRetries < 1) {
            throw new ProbeConfigException("maxRetries must be >= 1, got " + maxRetries);
        }
        if (retryDelay == null || retryDelay.isNegative()) {
            throw new ProbeConfigException("retryDelay must be >= 0, got " + retryDelay);
        }
        if (Double.isNaN(retryBackoffFactor) || retryBackoffFactor < 1.0) {
            throw new ProbeConfigException("retryBackoffFactor must be >= 1.0, got " + retryBackoffFactor);
        }
        if (maxRetryDelay != null && maxRetryDelay.compareTo(retryDelay) < 0) {
            throw new ProbeConfigException(
                    "maxRetryDelay (" + maxRetryDelay + ") must not be below retryDelay (" + retryDelay + ")");
        }
    }

    /**
     * Delay schedule between attempts.
     */
    public Backoff.Policy retryPolicy() {
        long cap = maxRetryDelay != null ? maxRetryDelay.toMillis() : 0;
        return new Backoff.Policy(retryDelay.toMillis(), cap, retryBackoffFactor);
    }

    public static Builder builder(String responderIdentity, String channelIdentity) {
        return new Builder(responderIdentity, channelIdentity);
    }

    public Builder toBuilder() {
        return new Builder(responderIdentity, channelIdentity)
                .maxWait(maxWait)
                .pollInterval(pollInterval)
                .maxRetries(maxRetries)
                .retryDelay(retryDelay)
                .autoDeleteOnFailure(autoDeleteOnFailure)
                .retryBackoffFactor(retryBackoffFactor)
                .maxRetryDelay(maxRetryDelay);
    }

    /**
     * Builder pre-filled with the defaults; {@link #build()} validates.
     */
    public static final class Builder {
        private String responderIdentity;
        private String channelIdentity;
        private Duration maxWait = DEFAULT_MAX_WAIT;
        private Duration pollInterval = DEFAULT_POLL_INTERVAL;
        private int maxRetries = DEFAULT_MAX_RETRIES;
        private Duration retryDelay = DEFAULT_RETRY_DELAY;
        private boolean autoDeleteOnFailure = true;
        private double retryBackoffFactor = 1.0;
        private Duration maxRetryDelay;

        private Builder(String responderIdentity, String channelIdentity) {
            this.responderIdentity = responderIdentity;
            this.channelIdentity = channelIdentity;
        }

        public Builder responderIdentity(String responderIdentity) {
            this.responderIdentity = responderIdentity;
            return this;
        }

        public Builder channelIdentity(String channelIdentity) {
            this.channelIdentity = channelIdentity;
            return this;
        }

        public Builder maxWait(Duration maxWait) {
            this.maxWait = maxWait;
            return this;
        }

        public Builder pollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder retryDelay(Duration retryDelay) {
            this.retryDelay = retryDelay;
            return this;
        }

        public Builder autoDeleteOnFailure(boolean autoDeleteOnFailure) {
            this.autoDeleteOnFailure = autoDeleteOnFailure;
            return this;
        }

        public Builder retryBackoffFactor(double retryBackoffFactor) {
            this.retryBackoffFactor = retryBackoffFactor;
            return this;
        }

        public Builder maxRetryDelay(Duration maxRetryDelay) {
            this.maxRetryDelay = maxRetryDelay;
            return this;
        }

        public ProbeSettings build() {
            return new ProbeSettings(responderIdentity, channelIdentity, maxWait, pollInterval,
                    maxRetries, retryDelay, autoDeleteOnFailure, retryBackoffFactor, maxRetryDelay);
        }
    }
}
