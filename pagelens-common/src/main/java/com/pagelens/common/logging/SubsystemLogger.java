package com.pagelens.common.logging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * SLF4J wrapper that tags every message with a slash-separated subsystem
 * path, e.g. {@code dom/serializer}.
 *
 * <pre>
 * SubsystemLogger log = SubsystemLogger.create("dom/serializer");
 * log.debug("Stage finished", Map.of("stage", "optimize_tree"));
 * SubsystemLogger child = log.child("bbox");
 * </pre>
 *
 * The subsystem is also placed in the MDC under {@code subsystem} for the
 * duration of each call, so logback patterns can print it with {@code %X}.
 */
public class SubsystemLogger {

    private static final String MDC_SUBSYSTEM = "subsystem";
    private static final List<String> subsystemFilters = new CopyOnWriteArrayList<>();
    private static volatile LogLevel minimumLevel = LogLevel.TRACE;

    private final String subsystem;
    private final Logger logger;

    private SubsystemLogger(String subsystem) {
        this.subsystem = subsystem;
        this.logger = LoggerFactory.getLogger("pagelens." + subsystem.replace('/', '.'));
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

    public void trace(String message) {
        emit(LogLevel.TRACE, message, null);
    }

    public void debug(String message) {
        emit(LogLevel.DEBUG, message, null);
    }

    public void debug(String message, Map<String, Object> meta) {
        emit(LogLevel.DEBUG, message, meta);
    }

    public void info(String message) {
        emit(LogLevel.INFO, message, null);
    }

    public void info(String message, Map<String, Object> meta) {
        emit(LogLevel.INFO, message, meta);
    }

    public void warn(String message) {
        emit(LogLevel.WARN, message, null);
    }

    public void warn(String message, Map<String, Object> meta) {
        emit(LogLevel.WARN, message, meta);
    }

    public void error(String message, Throwable t) {
        if (!shouldLog(LogLevel.ERROR))
            return;
        try {
            MDC.put(MDC_SUBSYSTEM, subsystem);
            logger.error(formatMessage(message, null), t);
        } finally {
            MDC.remove(MDC_SUBSYSTEM);
        }
    }

    public boolean isDebugEnabled() {
        return shouldLog(LogLevel.DEBUG) && logger.isDebugEnabled();
    }

    // -----------------------------------------------------------------------
    // Process-wide controls
    // -----------------------------------------------------------------------

    /**
     * Restrict output to subsystems matching one of the given prefixes.
     * Null or empty clears the filter.
     */
    public static void setSubsystemFilter(String... filters) {
        subsystemFilters.clear();
        if (filters != null) {
            Arrays.stream(filters)
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .forEach(subsystemFilters::add);
        }
    }

    /**
     * Set the minimum level from a config value such as "debug" or "warning".
     */
    public static void setMinimumLevel(String level) {
        minimumLevel = LogLevel.normalize(level, LogLevel.TRACE);
    }

    public static LogLevel getMinimumLevel() {
        return minimumLevel;
    }

    boolean shouldLog(LogLevel level) {
        if (!level.isEnabledFor(minimumLevel)) {
            return false;
        }
        if (subsystemFilters.isEmpty()) {
            return true;
        }
        return subsystemFilters.stream().anyMatch(
                prefix -> subsystem.equals(prefix) || subsystem.startsWith(prefix + "/"));
    }

    public String getSubsystem() {
        return subsystem;
    }

    // -----------------------------------------------------------------------
    // Internals
    // -----------------------------------------------------------------------

    private void emit(LogLevel level, String message, Map<String, Object> meta) {
        if (!shouldLog(level))
            return;
        try {
            MDC.put(MDC_SUBSYSTEM, subsystem);
            String formatted = formatMessage(message, meta);
            switch (level) {
                case TRACE -> logger.trace(formatted);
                case DEBUG -> logger.debug(formatted);
                case WARN -> logger.warn(formatted);
                case ERROR -> logger.error(formatted);
                default -> logger.info(formatted);
            }
        } finally {
            MDC.remove(MDC_SUBSYSTEM);
        }
    }

    String formatMessage(String message, Map<String, Object> meta) {
        StringBuilder sb = new StringBuilder();
        sb.append("[").append(subsystem).append("] ").append(message);
        if (meta == null || meta.isEmpty()) {
            return sb.toString();
        }
        sb.append(" {");
        boolean first = true;
        for (var entry : meta.entrySet()) {
            if (!first)
                sb.append(", ");
            sb.append(entry.getKey()).append("=").append(entry.getValue());
            first = false;
        }
        sb.append("}");
        return sb.toString();
    }
}
