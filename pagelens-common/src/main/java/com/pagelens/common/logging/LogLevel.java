package com.pagelens.common.logging;

import java.util.Map;

/**
 * Log levels understood by {@link SubsystemLogger}, with alias normalization
 * for values coming from configuration files.
 */
public enum LogLevel {
    SILENT,
    ERROR,
    WARN,
    INFO,
    DEBUG,
    TRACE;

    private static final Map<String, LogLevel> ALIASES = Map.ofEntries(
            Map.entry("silent", SILENT),
            Map.entry("off", SILENT),
            Map.entry("fatal", ERROR),
            Map.entry("error", ERROR),
            Map.entry("warn", WARN),
            Map.entry("warning", WARN),
            Map.entry("info", INFO),
            Map.entry("debug", DEBUG),
            Map.entry("trace", TRACE));

    /**
     * Normalize an arbitrary string to a LogLevel, falling back to the given
     * default.
     */
    public static LogLevel normalize(String level, LogLevel fallback) {
        if (level == null || level.isBlank()) {
            return fallback;
        }
        LogLevel resolved = ALIASES.get(level.trim().toLowerCase());
        return resolved != null ? resolved : fallback;
    }

    public static LogLevel normalize(String level) {
        return normalize(level, INFO);
    }

    /**
     * Lower = more severe. SILENT sorts after everything so it never passes a
     * threshold check.
     */
    public int priority() {
        return switch (this) {
            case ERROR -> 1;
            case WARN -> 2;
            case INFO -> 3;
            case DEBUG -> 4;
            case TRACE -> 5;
            case SILENT -> Integer.MAX_VALUE;
        };
    }

    /**
     * A message at this level passes when its priority does not exceed the
     * configured minimum.
     */
    public boolean isEnabledFor(LogLevel minLevel) {
        if (minLevel == SILENT || this == SILENT) {
            return false;
        }
        return this.priority() <= minLevel.priority();
    }
}
