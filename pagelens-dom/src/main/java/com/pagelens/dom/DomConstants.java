package com.pagelens.dom;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * DOM serializer constants: defaults, tag sets and fixed text tokens.
 */
public final class DomConstants {

    private DomConstants() {}

    // ==================== Defaults ====================

    /** Share of a child's area that must lie inside a propagating container. */
    public static final double DEFAULT_CONTAINMENT_THRESHOLD = 0.99;

    public static final boolean DEFAULT_BBOX_FILTERING_ENABLED = true;

    public static final boolean DEFAULT_PAINT_ORDER_FILTERING_ENABLED = true;

    /** Maximum rendered length of a single attribute value. */
    public static final int MAX_ATTRIBUTE_VALUE_LENGTH = 100;

    /** Attribute values at most this long are never considered duplicates. */
    public static final int DEDUPE_MIN_VALUE_LENGTH = 5;

    /** Attributes rendered next to elements when the caller does not choose. */
    public static final List<String> DEFAULT_INCLUDE_ATTRIBUTES = List.of(
            "title", "type", "checked", "id", "name", "role", "value", "placeholder",
            "data-date-format", "alt", "aria-label", "aria-expanded", "data-state",
            "aria-checked", "aria-valuemin", "aria-valuemax", "aria-valuenow",
            "aria-placeholder", "pattern", "min", "max", "minlength", "maxlength",
            "step", "accept", "multiple", "inputmode", "autocomplete", "data-mask",
            "data-inputmask", "data-datepicker", "format", "expected_format",
            "contenteditable", "pseudo", "selected", "expanded", "pressed", "disabled",
            "invalid", "valuemin", "valuemax", "valuenow", "keyshortcuts", "haspopup",
            "multiselectable", "required", "valuetext", "level", "busy", "live");

    // ==================== Exclusion attributes ====================

    public static final String EXCLUDE_ATTRIBUTE = "data-browser-use-exclude";

    public static String sessionExcludeAttribute(String sessionId) {
        return EXCLUDE_ATTRIBUTE + "-" + sessionId;
    }

    // ==================== Tag sets ====================

    /** Elements that never carry page content. */
    public static final Set<String> DISABLED_ELEMENTS =
            Set.of("style", "script", "head", "meta", "link", "title");

    /** Decorative SVG children, lower-cased (clipPath is matched as clippath). */
    public static final Set<String> SVG_ELEMENTS = Set.of(
            "path", "rect", "g", "circle", "ellipse", "line", "polyline", "polygon",
            "use", "defs", "clippath", "mask", "pattern", "image", "text", "tspan");

    public static final Set<String> DATE_TIME_INPUT_TYPES =
            Set.of("date", "time", "datetime-local", "month", "week");

    /** ISO-8601 value formats required by native date/time inputs. */
    public static final Map<String, String> DATE_TIME_FORMATS = Map.of(
            "date", "YYYY-MM-DD",
            "time", "HH:MM",
            "datetime-local", "YYYY-MM-DDTHH:MM",
            "month", "YYYY-MM",
            "week", "YYYY-W##");

    // ==================== Text protocol ====================

    public static final String SHADOW_OPEN_MARKER = "|SHADOW(open)|";
    public static final String SHADOW_CLOSED_MARKER = "|SHADOW(closed)|";
    public static final String SCROLL_MARKER = "|SCROLL|";
    public static final String SCROLL_INDEX_PREFIX = "|SCROLL[";
    public static final String IFRAME_MARKER = "|IFRAME|";
    public static final String FRAME_MARKER = "|FRAME|";
    public static final String NEW_NODE_MARKER = "*";
    public static final String OPEN_SHADOW_LINE = "Open Shadow";
    public static final String CLOSED_SHADOW_LINE = "Closed Shadow";
    public static final String SHADOW_END_LINE = "Shadow End";
    public static final String SVG_COLLAPSED_SUFFIX = " /> <!-- SVG content collapsed -->";
}
