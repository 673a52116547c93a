package com.pagelens.common.infra;

/**
 * Length capping for text that ends up in LLM-facing output.
 */
public final class TextCaps {

    private TextCaps() {
    }

    /**
     * Cut {@code text} to {@code maxLength} characters and append "..." when
     * anything was removed. Null becomes the empty string.
     */
    public static String capTextLength(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        if (maxLength < 0 || text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength) + "...";
    }
}
