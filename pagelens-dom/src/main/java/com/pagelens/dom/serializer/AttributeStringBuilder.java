package com.pagelens.dom.serializer;

import com.pagelens.common.infra.TextCaps;
import com.pagelens.common.logging.SubsystemLogger;
import com.pagelens.dom.DomConstants;
import com.pagelens.dom.model.AxProperty;
import com.pagelens.dom.model.RawNode;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Builds the {@code key=value} attribute text rendered after an element's
 * tag: allow-listed HTML attributes, accessibility properties, format hints
 * for date-like inputs and the live form value, minus redundant entries.
 */
final class AttributeStringBuilder {

    private static final SubsystemLogger log = SubsystemLogger.create("dom/serializer").child("attributes");

    private static final Set<String> PROTECTED_FROM_DEDUPE =
            Set.of("format", "expected_format", "placeholder", "value", "aria-label", "title");

    private static final Set<String> VALUE_BEARING_TAGS = Set.of("input", "textarea", "select");

    private static final Set<String> BOOLEAN_ATTRIBUTES = Set.of("required");

    private static final Set<String> FALSE_VALUES = Set.of("false", "0", "no");

    private static final List<String> TEXT_DUPLICATE_ATTRIBUTES = List.of("aria-label", "placeholder", "title");

    private static final List<String> DATEPICKER_CLASS_HINTS = List.of("datepicker", "datetimepicker", "daterangepicker");

    private static final String DEFAULT_DATEPICKER_FORMAT = "mm/dd/yyyy";

    private static final String TEL_PLACEHOLDER = "123-456-7890";

    private AttributeStringBuilder() {
    }

    /**
     * @param text already-rendered text content of the element; attributes
     *             that merely repeat it are dropped
     */
    static String build(RawNode node, List<String> includeAttributes, String text) {
        Set<String> allowed = new HashSet<>(includeAttributes);
        Map<String, String> attributes = new LinkedHashMap<>();

        if (node.getAttributes() != null) {
            for (Map.Entry<String, String> entry : node.getAttributes().entrySet()) {
                String value = entry.getValue() != null ? entry.getValue().strip() : "";
                if (allowed.contains(entry.getKey()) && !value.isEmpty()) {
                    attributes.put(entry.getKey(), value);
                }
            }
        }

        if ("input".equals(node.getTagName()) && node.getAttributes() != null) {
            addInputFormatHints(node, allowed, attributes);
        }

        addAccessibilityProperties(node, allowed, attributes);

        if (VALUE_BEARING_TAGS.contains(node.getTagName())) {
            String liveValue = liveValue(node);
            if (liveValue != null) {
                attributes.put("value", liveValue);
            }
        }

        if (attributes.isEmpty()) {
            return "";
        }

        removeDuplicateValues(includeAttributes, attributes);
        removeRedundant(node, attributes, text);

        List<String> formatted = new ArrayList<>();
        for (Map.Entry<String, String> entry : attributes.entrySet()) {
            String capped = TextCaps.capTextLength(entry.getValue(), DomConstants.MAX_ATTRIBUTE_VALUE_LENGTH);
            formatted.add(capped.isEmpty() ? entry.getKey() + "=''" : entry.getKey() + "=" + capped);
        }
        return String.join(" ", formatted);
    }

    /**
     * Renders compound descriptors as
     * {@code compound_components=(name=..,role=..,...),(...)}; empty when
     * there is nothing to show.
     */
    static String buildCompoundComponents(List<CompoundChild> compoundChildren) {
        if (compoundChildren == null || compoundChildren.isEmpty()) {
            return "";
        }
        List<String> groups = new ArrayList<>();
        for (CompoundChild child : compoundChildren) {
            List<String> parts = new ArrayList<>();
            if (child.getName() != null && !child.getName().isEmpty()) {
                parts.add("name=" + child.getName());
            }
            if (child.getRole() != null && !child.getRole().isEmpty()) {
                parts.add("role=" + child.getRole());
            }
            if (child.getValueMin() != null) {
                parts.add("min=" + NumberParsing.format(child.getValueMin()));
            }
            if (child.getValueMax() != null) {
                parts.add("max=" + NumberParsing.format(child.getValueMax()));
            }
            if (child.getValueNow() != null) {
                parts.add("current=" + child.getValueNow());
            }
            if (child.getOptionsCount() != null) {
                parts.add("count=" + child.getOptionsCount());
            }
            if (child.getFirstOptions() != null && !child.getFirstOptions().isEmpty()) {
                List<String> shown = child.getFirstOptions()
                        .subList(0, Math.min(SelectOptionExtractor.MAX_SHOWN_OPTIONS, child.getFirstOptions().size()));
                parts.add("options=" + String.join("|", shown));
            }
            if (child.getFormatHint() != null && !child.getFormatHint().isEmpty()) {
                parts.add("format=" + child.getFormatHint());
            }
            if (!parts.isEmpty()) {
                groups.add("(" + String.join(",", parts) + ")");
            }
        }
        return groups.isEmpty() ? "" : "compound_components=" + String.join(",", groups);
    }

    // ==================== Steps ====================

    // Native date/time inputs always take ISO-8601 values whatever the
    // browser displays, so the format is spelled out.
    private static void addInputFormatHints(RawNode node, Set<String> allowed, Map<String, String> attributes) {
        String inputType = node.getInputType();
        String isoFormat = DomConstants.DATE_TIME_FORMATS.get(inputType);
        if (isoFormat != null) {
            attributes.put("format", isoFormat);
        }

        if (!allowed.contains("placeholder") || attributes.containsKey("placeholder")) {
            return;
        }
        if (isoFormat != null) {
            attributes.put("placeholder", isoFormat);
        } else if ("tel".equals(inputType) && !attributes.containsKey("pattern")) {
            attributes.put("placeholder", TEL_PLACEHOLDER);
        } else if ("text".equals(inputType) || inputType.isEmpty()) {
            addDatepickerHints(node, attributes);
        }
    }

    // Third-party datepickers on plain text inputs: AngularJS UI Bootstrap
    // first, then jQuery/Bootstrap class names, then data-datepicker.
    private static void addDatepickerHints(RawNode node, Map<String, String> attributes) {
        if (node.hasAttribute("uib-datepicker-popup")) {
            String format = node.getAttribute("uib-datepicker-popup");
            if (format != null && !format.isEmpty()) {
                attributes.put("expected_format", format);
                attributes.put("format", format);
            }
            return;
        }
        String classes = node.getAttribute("class") != null
                ? node.getAttribute("class").toLowerCase(Locale.ROOT) : "";
        boolean datepickerClass = DATEPICKER_CLASS_HINTS.stream().anyMatch(classes::contains);
        if (datepickerClass || node.hasAttribute("data-datepicker")) {
            String format = node.getAttribute("data-date-format");
            if (format == null || format.isEmpty()) {
                format = DEFAULT_DATEPICKER_FORMAT;
            }
            attributes.put("placeholder", format);
            attributes.put("format", format);
        }
    }

    private static void addAccessibilityProperties(RawNode node, Set<String> allowed, Map<String, String> attributes) {
        if (node.getAxNode() == null || node.getAxNode().getProperties() == null) {
            return;
        }
        for (AxProperty property : node.getAxNode().getProperties()) {
            try {
                if (property == null || !allowed.contains(property.getName()) || property.getValue() == null) {
                    continue;
                }
                Object value = property.getValue();
                if (value instanceof Boolean flag) {
                    attributes.put(property.getName(), flag.toString());
                } else {
                    String text = value.toString().strip();
                    if (!text.isEmpty()) {
                        attributes.put(property.getName(), text);
                    }
                }
            } catch (RuntimeException e) {
                log.debug("Skipping unreadable accessibility property",
                        Map.of("backendNodeId", node.getBackendNodeId(), "error", String.valueOf(e.getMessage())));
            }
        }
    }

    /**
     * The accessibility tree follows what the user typed; the DOM value
     * attribute does not.
     */
    private static String liveValue(RawNode node) {
        if (node.getAxNode() == null || node.getAxNode().getProperties() == null) {
            return null;
        }
        for (AxProperty property : node.getAxNode().getProperties()) {
            if (property == null || !CompoundComponentSynthesizer.isTruthy(property.getValue())) {
                continue;
            }
            if ("valuetext".equals(property.getName()) || "value".equals(property.getName())) {
                String text = property.getValue().toString().strip();
                if (!text.isEmpty()) {
                    return text;
                }
            }
        }
        return null;
    }

    private static void removeDuplicateValues(List<String> includeAttributes, Map<String, String> attributes) {
        List<String> orderedKeys = includeAttributes.stream()
                .filter(attributes::containsKey)
                .distinct()
                .toList();
        if (orderedKeys.size() <= 1) {
            return;
        }
        Map<String, String> seenValues = new HashMap<>();
        Set<String> toRemove = new HashSet<>();
        for (String key : orderedKeys) {
            String value = attributes.get(key);
            if (value.length() > DomConstants.DEDUPE_MIN_VALUE_LENGTH) {
                if (seenValues.containsKey(value) && !PROTECTED_FROM_DEDUPE.contains(key)) {
                    toRemove.add(key);
                } else {
                    seenValues.put(value, key);
                }
            }
        }
        toRemove.forEach(attributes::remove);
    }

    private static void removeRedundant(RawNode node, Map<String, String> attributes, String text) {
        String tagName = node.getTagName();

        String axRole = node.getAxRole();
        if (axRole != null && axRole.equalsIgnoreCase(tagName)) {
            attributes.remove("role");
        }

        String type = attributes.get("type");
        if (type != null && type.equalsIgnoreCase(tagName)) {
            attributes.remove("type");
        }

        String invalid = attributes.get("invalid");
        if (invalid != null && invalid.equalsIgnoreCase("false")) {
            attributes.remove("invalid");
        }

        for (String name : BOOLEAN_ATTRIBUTES) {
            String value = attributes.get(name);
            if (value != null && FALSE_VALUES.contains(value.toLowerCase(Locale.ROOT))) {
                attributes.remove(name);
            }
        }

        if (attributes.containsKey("expanded") && attributes.containsKey("aria-expanded")) {
            attributes.remove("aria-expanded");
        }

        String normalizedText = text != null ? text.strip().toLowerCase(Locale.ROOT) : "";
        for (String name : TEXT_DUPLICATE_ATTRIBUTES) {
            String value = attributes.get(name);
            if (value != null && !value.isEmpty()
                    && value.strip().toLowerCase(Locale.ROOT).equals(normalizedText)) {
                attributes.remove(name);
            }
        }
    }
}
