package com.botprobe.common.infra;

import java.time.Duration;
import java.util.Locale;

/**
 * Compact duration rendering for log lines.
 */
public final class FormatDuration {

    private FormatDuration() {
    }

    /**
     * Format a duration. Shows "Xms" below one second, one-decimal seconds below
     * one minute, and "Xm Ys" above.
     *
     * @return formatted string like "450ms", "2.5s" or "3m 5s"
     */
    public static String format(Duration duration) {
        long ms = duration == null ? 0 : Math.max(0, duration.toMillis());
        if (ms < 1000) {
            return ms + "ms";
        }
        if (ms < 60_000) {
            String formatted = String.format(Locale.ROOT, "%.1f", ms / 1000.0);
            // Trim trailing zeros after decimal
            formatted = formatted.replaceAll("0+$", "").replaceAll("\\.$", "");
            return formatted + "s";
        }
        long totalSeconds = ms / 1000;
        long minutes = totalSeconds / 60;
        long seconds = totalSeconds % 60;
        return seconds == 0 ? minutes + "m" : minutes + "m " + seconds + "s";
    }
}
