package com.botprobe.common.logging;

import java.util.Locale;

/**
 * Log levels understood by {@link SubsystemLogger} and the probe config file,
 * ordered from quietest to most verbose.
 */
public enum LogLevel {
    SILENT(0, "off"),
    ERROR(1),
    WARN(2, "warning"),
    INFO(3),
    DEBUG(4),
    TRACE(5);

    private final int verbosity;
    private final String alias;

    LogLevel(int verbosity) {
        this(verbosity, null);
    }

    LogLevel(int verbosity, String alias) {
        this.verbosity = verbosity;
        this.alias = alias;
    }

    /**
     * Parse a level name or alias, case-insensitively. Unknown or blank input
     * yields {@code fallback}.
     */
    public static LogLevel normalize(String level, LogLevel fallback) {
        if (level == null || level.isBlank()) {
            return fallback;
        }
        String key = level.trim().toLowerCase(Locale.ROOT);
        for (LogLevel candidate : values()) {
            if (candidate.name().toLowerCase(Locale.ROOT).equals(key) || key.equals(candidate.alias)) {
                return candidate;
            }
        }
        return fallback;
    }

    public static LogLevel normalize(String level) {
        return normalize(level, INFO);
    }

    /**
     * Whether a message at this level passes a threshold of {@code minLevel}.
     */
    public boolean isEnabledFor(LogLevel minLevel) {
        return this != SILENT && minLevel != SILENT && verbosity <= minLevel.verbosity;
    }
}
