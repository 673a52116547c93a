package com.pagelens.dom.serializer;

import com.pagelens.common.logging.SubsystemLogger;
import com.pagelens.dom.model.DomRect;
import com.pagelens.dom.model.NodeType;
import com.pagelens.dom.model.RawNode;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Marks descendants of links, buttons and combo-like widgets that are almost
 * entirely covered by that container, so they are not listed separately.
 * <p>
 * A propagating element hands its bounds to all descendants until another
 * propagating element takes over. Marked nodes keep their subtree.
 */
final class ContainmentFilter {

    private static final SubsystemLogger log = SubsystemLogger.create("dom/serializer").child("bbox");

    /** (tag, role) pairs that start a new bounds scope; a null role matches any. */
    record PropagatingPattern(String tag, String role) {
        boolean matches(String candidateTag, String candidateRole) {
            return tag.equals(candidateTag) && (role == null || role.equals(candidateRole));
        }
    }

    static final List<PropagatingPattern> PROPAGATING_ELEMENTS = List.of(
            new PropagatingPattern("a", null),
            new PropagatingPattern("button", null),
            new PropagatingPattern("div", "button"),
            new PropagatingPattern("div", "combobox"),
            new PropagatingPattern("span", "button"),
            new PropagatingPattern("span", "combobox"),
            new PropagatingPattern("input", "combobox"));

    private static final Set<String> FORM_CONTROL_TAGS = Set.of("input", "select", "textarea", "label");

    private static final Set<String> INTERACTIVE_ROLES =
            Set.of("button", "link", "checkbox", "radio", "tab", "menuitem", "option");

    private final double threshold;

    ContainmentFilter(double threshold) {
        this.threshold = threshold;
    }

    SimplifiedNode apply(SimplifiedNode root) {
        if (root == null) {
            return null;
        }
        filter(root, null, 0);

        int excluded = countExcluded(root);
        if (excluded > 0) {
            log.debug("Bounding-box filtering excluded nodes", Map.of("count", excluded));
        }
        return root;
    }

    private void filter(SimplifiedNode node, PropagatingBounds active, int depth) {
        if (active != null && shouldExcludeChild(node, active)) {
            node.setExcludedByParent(true);
        }

        // An excluded node may still start its own scope.
        RawNode raw = node.getOriginalNode();
        PropagatingBounds scope = active;
        if (isPropagating(raw) && raw.getBounds() != null) {
            scope = new PropagatingBounds(raw.getTagName(), raw.getBounds(), raw.getNodeId(), depth);
        }

        for (SimplifiedNode child : node.getChildren()) {
            filter(child, scope, depth + 1);
        }
    }

    boolean shouldExcludeChild(SimplifiedNode node, PropagatingBounds active) {
        RawNode raw = node.getOriginalNode();
        if (raw.getNodeType() == NodeType.TEXT_NODE) {
            return false;
        }

        DomRect childBounds = raw.getBounds();
        if (childBounds == null) {
            return false;
        }
        if (!isContained(childBounds, active.bounds(), threshold)) {
            return false;
        }

        if (FORM_CONTROL_TAGS.contains(raw.getTagName())) {
            return false;
        }
        // e.g. a button nested in a button, which may stop propagation
        if (isPropagating(raw)) {
            return false;
        }
        if (raw.hasAttribute("onclick")) {
            return false;
        }
        String ariaLabel = raw.getAttribute("aria-label");
        if (ariaLabel != null && !ariaLabel.isBlank()) {
            return false;
        }
        String role = raw.getAttribute("role");
        return role == null || !INTERACTIVE_ROLES.contains(role);
    }

    static boolean isContained(DomRect child, DomRect container, double threshold) {
        if (child.area() == 0) {
            return false;
        }
        return child.containmentRatio(container) >= threshold;
    }

    static boolean isPropagating(RawNode node) {
        String tag = node.getTagName();
        String role = node.getAttribute("role");
        for (PropagatingPattern pattern : PROPAGATING_ELEMENTS) {
            if (pattern.matches(tag, role)) {
                return true;
            }
        }
        return false;
    }

    static int countExcluded(SimplifiedNode node) {
        int count = node.isExcludedByParent() ? 1 : 0;
        for (SimplifiedNode child : node.getChildren()) {
            count += countExcluded(child);
        }
        return count;
    }
}
