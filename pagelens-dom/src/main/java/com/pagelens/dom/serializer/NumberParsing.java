package com.pagelens.dom.serializer;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Fail-soft parsing for numeric attribute values such as min/max, and the
 * matching text form used in {@code compound_components}.
 */
public final class NumberParsing {

    /** Plain decimal notation only; no Java suffixes or hex floats. */
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private static final Pattern SPECIAL = Pattern.compile("[+-]?(inf|infinity|nan)", Pattern.CASE_INSENSITIVE);

    /** Doubles whose magnitude falls in [1e-4, 1e16) are written without an exponent. */
    private static final double PLAIN_MIN = 1e-4;
    private static final double PLAIN_MAX = 1e16;

    private NumberParsing() {
    }

    /**
     * Parse {@code value}, returning {@code defaultValue} for null or
     * malformed input.
     */
    public static double parseOrDefault(String value, double defaultValue) {
        Double parsed = parseOptional(value);
        return parsed != null ? parsed : defaultValue;
    }

    /**
     * Parse {@code value}, returning null for null, blank or malformed input
     * so the caller can omit the field.
     */
    public static Double parseOptional(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String text = value.strip();
        if (SPECIAL.matcher(text).matches()) {
            boolean negative = text.startsWith("-");
            String word = text.replaceFirst("^[+-]", "").toLowerCase(Locale.ROOT);
            if ("nan".equals(word)) {
                return Double.NaN;
            }
            return negative ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
        }
        if (!DECIMAL.matcher(text).matches()) {
            return null;
        }
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Text form of a bound: integral types as-is, doubles in shortest form
     * with a trailing ".0" for whole values ("10000000.0", "0.001"), and an
     * exponent only outside [1e-4, 1e16) ("1e+16", "1.5e-05").
     */
    public static String format(Number number) {
        if (!(number instanceof Double) && !(number instanceof Float)) {
            return String.valueOf(number);
        }
        double value = number.doubleValue();
        if (Double.isNaN(value)) {
            return "nan";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "inf" : "-inf";
        }
        if (value == 0) {
            return (1 / value < 0) ? "-0.0" : "0.0";
        }
        BigDecimal decimal = BigDecimal.valueOf(value);
        double magnitude = Math.abs(value);
        if (magnitude >= PLAIN_MIN && magnitude < PLAIN_MAX) {
            String plain = decimal.stripTrailingZeros().toPlainString();
            return plain.contains(".") ? plain : plain + ".0";
        }

        BigDecimal stripped = decimal.stripTrailingZeros();
        String digits = stripped.unscaledValue().abs().toString();
        int exponent = stripped.precision() - stripped.scale() - 1;
        StringBuilder out = new StringBuilder();
        if (value < 0) {
            out.append('-');
        }
        out.append(digits.charAt(0));
        if (digits.length() > 1) {
            out.append('.').append(digits, 1, digits.length());
        }
        out.append('e').append(exponent < 0 ? '-' : '+');
        String exponentDigits = String.valueOf(Math.abs(exponent));
        if (exponentDigits.length() < 2) {
            out.append('0');
        }
        return out.append(exponentDigits).toString();
    }
}
