package com.botprobe.verify.config;

import lombok.Data;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Root of the probe configuration file. Every field is optional; values left
 * unset fall back to {@code defaults} and then to the built-in defaults of
 * {@link ProbeSettings}.
 */
@Data
public class ProbeConfig {

    /** Logging settings applied to all subsystem loggers. */
    private LoggingConfig logging;

    /** Values shared by every probe profile. */
    private ProbeEntry defaults;

    /** Named probe profiles. */
    private Map<String, ProbeEntry> probes = new LinkedHashMap<>();

    @Data
    public static class LoggingConfig {
        /** Minimum level: "error", "warn", "info", "debug", "trace" or "silent". */
        private String level;
        /** Subsystem prefixes allowed to log; empty means all. */
        private List<String> subsystems;
    }

    /**
     * One probe profile. Boxed types distinguish "unset" from zero.
     */
    @Data
    public static class ProbeEntry {
        private String responderIdentity;
        private String channelIdentity;
        private Integer maxWaitSeconds;
        private Integer pollIntervalSeconds;
        private Integer maxRetries;
        private Integer retryDelaySeconds;
        private Boolean autoDeleteOnFailure;
        private Double retryBackoffFactor;
        private Integer maxRetryDelaySeconds;
    }
}
