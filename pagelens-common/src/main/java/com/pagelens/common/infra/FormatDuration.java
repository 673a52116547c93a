package com.pagelens.common.infra;

/**
 * Duration formatting for diagnostic timing output.
 */
public final class FormatDuration {

    private FormatDuration() {
    }

    /**
     * Format a duration given in (fractional) seconds. Below one second the
     * value is shown in milliseconds with one decimal, e.g. "12.3ms";
     * otherwise as seconds with two decimals and trailing zeros trimmed,
     * e.g. "1.5s".
     */
    public static String formatSeconds(double seconds) {
        if (Double.isNaN(seconds) || seconds < 0)
            seconds = 0;
        if (seconds < 1.0) {
            return String.format(java.util.Locale.ROOT, "%.1fms", seconds * 1000.0);
        }
        String formatted = String.format(java.util.Locale.ROOT, "%.2f", seconds);
        if (formatted.contains(".")) {
            formatted = formatted.replaceAll("0+$", "").replaceAll("\\.$", "");
        }
        return formatted + "s";
    }

    /**
     * Elapsed seconds between two {@link System#nanoTime()} readings.
     */
    public static double secondsBetween(long startNanos, long endNanos) {
        return (endNanos - startNanos) / 1_000_000_000.0;
    }
}
