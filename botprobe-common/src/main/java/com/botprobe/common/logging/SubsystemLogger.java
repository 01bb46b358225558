package com.botprobe.common.logging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.slf4j.event.Level;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * SLF4J logger bound to a slash-separated subsystem path such as
 * {@code probe/owner/repo#12/poller}.
 *
 * <p>
 * Instances are handed to the components that log, rather than looked up
 * statically, so a probe run can be traced by its subsystem path:
 *
 * <pre>
 * SubsystemLogger log = SubsystemLogger.create("probe/owner-repo");
 * log.info("Posted trigger", Map.of("messageId", 42));
 * SubsystemLogger poller = log.child("poller");
 * poller.debug("No reply yet");
 * </pre>
 *
 * Each line carries the subsystem in the {@code subsystem} MDC key and as a
 * {@code [subsystem]} prefix. Two process-wide switches narrow the output: a
 * list of subsystem prefixes and a minimum {@link LogLevel}.
 */
public class SubsystemLogger {

    private static final String MDC_SUBSYSTEM = "subsystem";
    private static final List<String> prefixes = new CopyOnWriteArrayList<>();
    private static volatile LogLevel minLevel = LogLevel.TRACE;

    private final String subsystem;
    private final Logger logger;

    private SubsystemLogger(String subsystem) {
        this.subsystem = Objects.requireNonNull(subsystem, "subsystem");
        // logback.xml can tune "botprobe.probe" and below per subsystem
        this.logger = LoggerFactory.getLogger("botprobe." + subsystem.replace('/', '.'));
    }

    public static SubsystemLogger create(String subsystem) {
        return new SubsystemLogger(subsystem);
    }

    public SubsystemLogger child(String name) {
        return new SubsystemLogger(subsystem + "/" + name);
    }

    // -----------------------------------------------------------------------
    // Log methods
    // -----------------------------------------------------------------------

    public void debug(String message) {
        log(LogLevel.DEBUG, message, null, null);
    }

    public void debug(String message, Map<String, Object> meta) {
        log(LogLevel.DEBUG, message, meta, null);
    }

    public void info(String message) {
        log(LogLevel.INFO, message, null, null);
    }

    public void info(String message, Map<String, Object> meta) {
        log(LogLevel.INFO, message, meta, null);
    }

    public void warn(String message) {
        log(LogLevel.WARN, message, null, null);
    }

    public void warn(String message, Map<String, Object> meta) {
        log(LogLevel.WARN, message, meta, null);
    }

    public void error(String message) {
        log(LogLevel.ERROR, message, null, null);
    }

    public void error(String message, Map<String, Object> meta) {
        log(LogLevel.ERROR, message, meta, null);
    }

    public void error(String message, Throwable cause) {
        log(LogLevel.ERROR, message, null, cause);
    }

    // -----------------------------------------------------------------------
    // Global switches
    // -----------------------------------------------------------------------

    /**
     * Restrict output to the given subsystem prefixes. A prefix matches itself
     * and anything below it ({@code probe} matches {@code probe/x} but not
     * {@code prober}). No arguments, or only blank ones, lifts the restriction.
     */
    public static void setSubsystemFilter(String... filters) {
        prefixes.clear();
        if (filters == null) {
            return;
        }
        for (String filter : filters) {
            if (filter != null && !filter.isBlank()) {
                prefixes.add(filter.trim());
            }
        }
    }

    /**
     * Threshold applied before SLF4J; {@code null} resets to TRACE.
     */
    public static void setMinLevel(LogLevel level) {
        minLevel = level != null ? level : LogLevel.TRACE;
    }

    public static LogLevel getMinLevel() {
        return minLevel;
    }

    public boolean shouldLog() {
        if (prefixes.isEmpty()) {
            return true;
        }
        for (String prefix : prefixes) {
            if (subsystem.equals(prefix) || subsystem.startsWith(prefix + "/")) {
                return true;
            }
        }
        return false;
    }

    boolean shouldLog(LogLevel level) {
        return level.isEnabledFor(minLevel) && shouldLog();
    }

    public String getSubsystem() {
        return subsystem;
    }

    public Logger getSlf4jLogger() {
        return logger;
    }

    // -----------------------------------------------------------------------
    // Internals
    // -----------------------------------------------------------------------

    private void log(LogLevel level, String message, Map<String, Object> meta, Throwable cause) {
        if (!shouldLog(level)) {
            return;
        }
        try (MDC.MDCCloseable ignored = MDC.putCloseable(MDC_SUBSYSTEM, subsystem)) {
            logger.atLevel(toSlf4j(level))
                    .setMessage(formatMessage(message, meta))
                    .setCause(cause)
                    .log();
        }
    }

    private static Level toSlf4j(LogLevel level) {
        return switch (level) {
            case ERROR -> Level.ERROR;
            case WARN -> Level.WARN;
            case DEBUG -> Level.DEBUG;
            case TRACE -> Level.TRACE;
            default -> Level.INFO;
        };
    }

    String formatMessage(String message, Map<String, Object> meta) {
        String line = "[" + subsystem + "] " + message;
        if (meta == null || meta.isEmpty()) {
            return line;
        }
        return meta.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(", ", line + " {", "}"));
    }
}
