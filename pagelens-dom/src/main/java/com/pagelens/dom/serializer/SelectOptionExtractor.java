package com.pagelens.dom.serializer;

import com.pagelens.dom.model.NodeType;
import com.pagelens.dom.model.RawNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Summarizes the options of a {@code <select>}: how many there are, the first
 * few display strings, and a guess at the value format.
 */
final class SelectOptionExtractor {

    static final int MAX_SHOWN_OPTIONS = 4;
    static final int MAX_OPTION_TEXT_LENGTH = 30;
    static final int FORMAT_SAMPLE_SIZE = 5;

    private SelectOptionExtractor() {
    }

    record SelectOptions(int count, List<String> firstOptions, String formatHint) {
    }

    private record OptionEntry(String text, String value) {
    }

    /**
     * Returns null when the select has no children or no usable options.
     */
    static SelectOptions extract(RawNode select) {
        if (select.getChildren() == null || select.getChildren().isEmpty()) {
            return null;
        }

        List<OptionEntry> options = new ArrayList<>();
        for (RawNode child : select.getChildren()) {
            collectOptions(child, options);
        }
        if (options.isEmpty()) {
            return null;
        }

        List<String> firstOptions = new ArrayList<>();
        for (OptionEntry option : options.subList(0, Math.min(MAX_SHOWN_OPTIONS, options.size()))) {
            String display = !option.text().isEmpty() ? option.text() : option.value();
            if (!display.isEmpty()) {
                firstOptions.add(capCodePoints(display));
            }
        }
        if (options.size() > MAX_SHOWN_OPTIONS) {
            firstOptions.add("... " + (options.size() - MAX_SHOWN_OPTIONS) + " more options...");
        }

        List<String> values = options.stream().map(OptionEntry::value).toList();
        return new SelectOptions(options.size(), firstOptions, inferFormatHint(values));
    }

    // Counted in code points so emoji labels are never split.
    private static String capCodePoints(String display) {
        if (display.codePointCount(0, display.length()) <= MAX_OPTION_TEXT_LENGTH) {
            return display;
        }
        return display.substring(0, display.offsetByCodePoints(0, MAX_OPTION_TEXT_LENGTH)) + "...";
    }

    // Options may sit inside optgroups or arbitrary wrappers.
    private static void collectOptions(RawNode node, List<OptionEntry> out) {
        String tag = node.getTagName();
        if ("option".equals(tag)) {
            String value = node.getAttribute("value") != null ? node.getAttribute("value").strip() : "";
            String text = directText(node);
            if (value.isEmpty() && !text.isEmpty()) {
                value = text;
            }
            if (!text.isEmpty() || !value.isEmpty()) {
                out.add(new OptionEntry(text, value));
            }
            return;
        }
        if (node.getChildren() != null) {
            for (RawNode child : node.getChildren()) {
                collectOptions(child, out);
            }
        }
    }

    private static String directText(RawNode option) {
        StringBuilder text = new StringBuilder();
        if (option.getChildren() != null) {
            for (RawNode child : option.getChildren()) {
                if (child.getNodeType() == NodeType.TEXT_NODE && child.getNodeValue() != null
                        && !child.getNodeValue().isEmpty()) {
                    text.append(child.getNodeValue().strip()).append(' ');
                }
            }
        }
        return text.toString().strip();
    }

    /**
     * First matching rule wins; rules look only at the first few non-empty
     * values and need at least two options overall.
     */
    static String inferFormatHint(List<String> values) {
        if (values.size() < 2) {
            return null;
        }
        List<String> sample = values.subList(0, Math.min(FORMAT_SAMPLE_SIZE, values.size())).stream()
                .filter(v -> !v.isEmpty())
                .toList();
        if (sample.stream().allMatch(SelectOptionExtractor::isDigits)) {
            return "numeric";
        }
        if (sample.stream().allMatch(v -> v.length() == 2 && isUpperCase(v))) {
            return "country/state codes";
        }
        if (sample.stream().allMatch(v -> v.contains("/") || v.contains("-"))) {
            return "date/path format";
        }
        if (sample.stream().anyMatch(v -> v.contains("@"))) {
            return "email addresses";
        }
        return null;
    }

    private static boolean isDigits(String value) {
        return !value.isEmpty() && value.chars().allMatch(Character::isDigit);
    }

    // At least one cased character and no lower-case ones.
    private static boolean isUpperCase(String value) {
        boolean hasCased = false;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (Character.isLowerCase(c)) {
                return false;
            }
            if (Character.isUpperCase(c)) {
                hasCased = true;
            }
        }
        return hasCased && value.equals(value.toUpperCase(Locale.ROOT));
    }
}
