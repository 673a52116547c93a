package com.pagelens.dom.serializer;

import com.pagelens.dom.DomConstants;
import com.pagelens.dom.model.AxProperty;
import com.pagelens.dom.model.RawNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Describes the virtual sub-widgets of native compound controls (range
 * sliders, number spinners, file pickers, selects, media players) so the
 * agent knows which parts it can operate.
 */
final class CompoundComponentSynthesizer {

    private static final Set<String> COMPOUND_TAGS = Set.of("input", "select", "details", "audio", "video");

    private static final Set<String> COMPOUND_INPUT_TYPES = Set.of(
            "date", "time", "datetime-local", "month", "week", "range", "number", "color", "file");

    private static final Set<String> EMPTY_FILE_LABELS = Set.of("", "no file chosen", "no file selected");

    private CompoundComponentSynthesizer() {
    }

    /**
     * Attach descriptors to {@code simplified} and flag it as a compound
     * component when the control has any.
     */
    static void apply(SimplifiedNode simplified, RawNode node) {
        List<CompoundChild> descriptors = synthesize(node);
        if (!descriptors.isEmpty()) {
            simplified.getCompoundChildren().addAll(descriptors);
            simplified.setCompoundComponent(true);
        }
    }

    static List<CompoundChild> synthesize(RawNode node) {
        String tag = node.getTagName();
        if (!COMPOUND_TAGS.contains(tag)) {
            return List.of();
        }
        if ("input".equals(tag)) {
            String type = node.getAttribute("type");
            if (type == null || !COMPOUND_INPUT_TYPES.contains(type)) {
                return List.of();
            }
        } else if (node.getAxNode() == null || !node.getAxNode().hasChildIds()) {
            return List.of();
        }

        return switch (tag) {
            case "input" -> inputComponents(node);
            case "select" -> selectComponents(node);
            case "details" -> List.of(
                    CompoundChild.of("button", "Toggle Disclosure"),
                    CompoundChild.of("region", "Content Area"));
            case "audio" -> mediaComponents(false);
            case "video" -> mediaComponents(true);
            default -> List.of();
        };
    }

    private static List<CompoundChild> inputComponents(RawNode node) {
        String type = node.getAttribute("type");
        // Date/time inputs get a format hint in their attributes instead;
        // listing day/month/year parts suggests segmented typing.
        if (DomConstants.DATE_TIME_INPUT_TYPES.contains(type)) {
            return List.of();
        }
        return switch (type) {
            case "range" -> List.of(CompoundChild.ranged("slider", "Value",
                    NumberParsing.parseOrDefault(attributeOr(node, "min", "0"), 0.0),
                    NumberParsing.parseOrDefault(attributeOr(node, "max", "100"), 100.0)));
            case "number" -> List.of(
                    CompoundChild.of("button", "Increment"),
                    CompoundChild.of("button", "Decrement"),
                    CompoundChild.ranged("textbox", "Value",
                            NumberParsing.parseOptional(node.getAttribute("min")),
                            NumberParsing.parseOptional(node.getAttribute("max"))));
            case "color" -> List.of(
                    CompoundChild.of("textbox", "Hex Value"),
                    CompoundChild.of("button", "Color Picker"));
            case "file" -> fileComponents(node);
            default -> List.of();
        };
    }

    private static List<CompoundChild> fileComponents(RawNode node) {
        boolean multiple = node.hasAttribute("multiple");
        return List.of(
                CompoundChild.of("button", "Browse Files"),
                CompoundChild.builder()
                        .role("textbox")
                        .name(multiple ? "Files Selected" : "File Selected")
                        .valueNow(selectedFileName(node))
                        .build());
    }

    /**
     * Current selection from the accessibility record: {@code valuetext} when
     * it names a file, else the file name part of {@code value}, else "None".
     */
    static String selectedFileName(RawNode node) {
        if (node.getAxNode() == null || node.getAxNode().getProperties() == null) {
            return "None";
        }
        for (AxProperty property : node.getAxNode().getProperties()) {
            if (property == null) {
                continue;
            }
            if ("valuetext".equals(property.getName()) && isTruthy(property.getValue())) {
                String text = String.valueOf(property.getValue()).strip();
                return EMPTY_FILE_LABELS.contains(text.toLowerCase()) ? "None" : text;
            }
            if ("value".equals(property.getName()) && isTruthy(property.getValue())) {
                String text = String.valueOf(property.getValue()).strip();
                if (!text.isEmpty()) {
                    return fileNamePart(text);
                }
            }
        }
        return "None";
    }

    private static String fileNamePart(String path) {
        if (path.contains("\\")) {
            return path.substring(path.lastIndexOf('\\') + 1);
        }
        if (path.contains("/")) {
            return path.substring(path.lastIndexOf('/') + 1);
        }
        return path;
    }

    private static List<CompoundChild> selectComponents(RawNode node) {
        List<CompoundChild> components = new ArrayList<>();
        components.add(CompoundChild.of("button", "Dropdown Toggle"));

        SelectOptionExtractor.SelectOptions options = SelectOptionExtractor.extract(node);
        if (options != null) {
            components.add(CompoundChild.builder()
                    .role("listbox")
                    .name("Options")
                    .optionsCount(options.count())
                    .firstOptions(options.firstOptions())
                    .formatHint(options.formatHint())
                    .build());
        } else {
            components.add(CompoundChild.of("listbox", "Options"));
        }
        return components;
    }

    private static List<CompoundChild> mediaComponents(boolean video) {
        List<CompoundChild> components = new ArrayList<>(List.of(
                CompoundChild.of("button", "Play/Pause"),
                CompoundChild.ranged("slider", "Progress", 0, 100),
                CompoundChild.of("button", "Mute"),
                CompoundChild.ranged("slider", "Volume", 0, 100)));
        if (video) {
            components.add(CompoundChild.of("button", "Fullscreen"));
        }
        return components;
    }

    private static String attributeOr(RawNode node, String name, String fallback) {
        String value = node.getAttribute(name);
        return value != null ? value : fallback;
    }

    static boolean isTruthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean flag) {
            return flag;
        }
        if (value instanceof Number number) {
            return number.doubleValue() != 0;
        }
        return !String.valueOf(value).isEmpty();
    }
}
