package com.pagelens.dom.interactive;

import com.pagelens.dom.model.AxProperty;
import com.pagelens.dom.model.DomRect;
import com.pagelens.dom.model.RawNode;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Heuristic interactivity check over tag, attributes, accessibility
 * properties and computed cursor style.
 */
public class DefaultInteractivityOracle implements InteractivityOracle {

    static final Set<String> INTERACTIVE_TAGS = Set.of(
            "button", "input", "select", "textarea", "a",
            "details", "summary", "option", "optgroup");

    static final Set<String> INTERACTIVE_ROLES = Set.of(
            "button", "link", "menuitem", "option", "radio", "checkbox", "tab",
            "textbox", "combobox", "slider", "spinbutton", "search", "searchbox");

    static final Set<String> EVENT_HANDLER_ATTRIBUTES = Set.of(
            "onclick", "onmousedown", "onmouseup", "onkeydown", "onkeyup", "tabindex");

    static final Set<String> INTERACTIVE_AX_PROPERTIES = Set.of(
            "focusable", "editable", "settable", "checked", "expanded",
            "pressed", "selected", "required", "autocomplete", "keyshortcuts");

    static final List<String> SEARCH_HINTS = List.of(
            "search", "magnify", "glass", "lookup", "find", "query",
            "search-icon", "search-btn", "search-button", "searchbox");

    static final Set<String> ICON_HINT_ATTRIBUTES = Set.of(
            "class", "role", "onclick", "data-action", "aria-label");

    private static final double MIN_FRAME_SIZE = 100;
    private static final double MIN_ICON_SIZE = 10;
    private static final double MAX_ICON_SIZE = 50;

    @Override
    public boolean isInteractive(RawNode node) {
        if (node == null || !node.isElement()) {
            return false;
        }
        String tag = node.getTagName();
        if ("html".equals(tag) || "body".equals(tag)) {
            return false;
        }

        if ("iframe".equals(tag) || "frame".equals(tag)) {
            DomRect bounds = node.getBounds();
            return bounds != null && bounds.width() > MIN_FRAME_SIZE && bounds.height() > MIN_FRAME_SIZE;
        }

        if (hasSearchHint(node)) {
            return true;
        }

        if (node.getAxNode() != null && node.getAxNode().getProperties() != null) {
            for (AxProperty property : node.getAxNode().getProperties()) {
                if (property == null || property.getName() == null) {
                    continue;
                }
                String name = property.getName();
                if (("disabled".equals(name) || "hidden".equals(name)) && isTrue(property.getValue())) {
                    return false;
                }
                if (INTERACTIVE_AX_PROPERTIES.contains(name) && isTrue(property.getValue())) {
                    return true;
                }
            }
        }

        if (INTERACTIVE_TAGS.contains(tag)) {
            return true;
        }

        for (String attribute : EVENT_HANDLER_ATTRIBUTES) {
            if (node.hasAttribute(attribute)) {
                return true;
            }
        }

        String roleAttribute = node.getAttribute("role");
        if (roleAttribute != null && INTERACTIVE_ROLES.contains(roleAttribute.toLowerCase(Locale.ROOT))) {
            return true;
        }
        String axRole = node.getAxRole();
        if (axRole != null && INTERACTIVE_ROLES.contains(axRole.toLowerCase(Locale.ROOT))) {
            return true;
        }

        if (isIconSized(node.getBounds())) {
            for (String attribute : ICON_HINT_ATTRIBUTES) {
                if (node.hasAttribute(attribute)) {
                    return true;
                }
            }
        }

        return node.hasLayout() && "pointer".equals(node.getLayout().style("cursor"));
    }

    // ==================== Helpers ====================

    private static boolean hasSearchHint(RawNode node) {
        String haystack = (nullToEmpty(node.getAttribute("class")) + " "
                + nullToEmpty(node.getAttribute("id"))).toLowerCase(Locale.ROOT);
        if (haystack.isBlank()) {
            return false;
        }
        for (String hint : SEARCH_HINTS) {
            if (haystack.contains(hint)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isIconSized(DomRect bounds) {
        if (bounds == null) {
            return false;
        }
        return bounds.width() >= MIN_ICON_SIZE && bounds.width() <= MAX_ICON_SIZE
                && bounds.height() >= MIN_ICON_SIZE && bounds.height() <= MAX_ICON_SIZE;
    }

    private static boolean isTrue(Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof String s) {
            return "true".equalsIgnoreCase(s.strip());
        }
        return false;
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
