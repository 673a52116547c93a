package com.pagelens.dom.serializer;

import com.pagelens.dom.DomConstants;
import com.pagelens.dom.model.NodeType;
import com.pagelens.dom.model.RawNode;

import java.util.Map;

/**
 * First pipeline stage: copies the semantically relevant part of the raw
 * tree into {@link SimplifiedNode}s. Documents are transparent, shadow roots
 * and frame documents are flattened into the main hierarchy.
 */
final class TreeSimplifier {

    private final String sessionId;

    TreeSimplifier(String sessionId) {
        this.sessionId = sessionId;
    }

    /**
     * @return the simplified root, or null when nothing survives
     */
    SimplifiedNode simplify(RawNode node) {
        if (node == null || node.getNodeType() == null) {
            return null;
        }
        return switch (node.getNodeType()) {
            case DOCUMENT_NODE -> simplifyDocument(node);
            case DOCUMENT_FRAGMENT_NODE -> simplifyShadowRoot(node);
            case ELEMENT_NODE -> simplifyElement(node);
            case TEXT_NODE -> simplifyText(node);
            default -> null;
        };
    }

    private SimplifiedNode simplifyDocument(RawNode document) {
        for (RawNode child : document.getChildrenAndShadowRoots()) {
            SimplifiedNode simplified = simplify(child);
            if (simplified != null) {
                return simplified;
            }
        }
        return null;
    }

    // Shadow roots are kept even when empty; SPAs often put all interactive
    // content inside them.
    private SimplifiedNode simplifyShadowRoot(RawNode fragment) {
        SimplifiedNode simplified = new SimplifiedNode(fragment);
        for (RawNode child : fragment.getChildrenAndShadowRoots()) {
            SimplifiedNode simplifiedChild = simplify(child);
            if (simplifiedChild != null) {
                simplified.addChild(simplifiedChild);
            }
        }
        return simplified;
    }

    private SimplifiedNode simplifyElement(RawNode node) {
        String tag = node.getTagName();
        if (DomConstants.DISABLED_ELEMENTS.contains(tag) || DomConstants.SVG_ELEMENTS.contains(tag)) {
            return null;
        }
        if (isExcludedByAttribute(node)) {
            return null;
        }

        if (("iframe".equals(tag) || "frame".equals(tag)) && node.getContentDocument() != null) {
            SimplifiedNode frame = new SimplifiedNode(node);
            RawNode document = node.getContentDocument();
            if (document.getChildren() != null) {
                for (RawNode child : document.getChildren()) {
                    SimplifiedNode simplifiedChild = simplify(child);
                    if (simplifiedChild != null) {
                        frame.addChild(simplifiedChild);
                    }
                }
            }
            return frame;
        }

        boolean visible = node.isVisible();
        boolean scrollable = node.isActuallyScrollable();
        boolean hasAnyChildren = !node.getChildrenAndShadowRoots().isEmpty();
        boolean shadowHost = node.getChildrenAndShadowRoots().stream()
                .anyMatch(child -> child.getNodeType() == NodeType.DOCUMENT_FRAGMENT_NODE);

        if (!visible && hasValidationAttributes(node)) {
            visible = true;
        }
        // Custom file pickers hide the native input with opacity:0.
        if (!visible && node.isFileInput()) {
            visible = true;
        }

        if (!(visible || scrollable || hasAnyChildren || shadowHost)) {
            return null;
        }

        SimplifiedNode simplified = new SimplifiedNode(node);
        simplified.setShadowHost(shadowHost);
        for (RawNode child : node.getChildrenAndShadowRoots()) {
            SimplifiedNode simplifiedChild = simplify(child);
            if (simplifiedChild != null) {
                simplified.addChild(simplifiedChild);
            }
        }

        CompoundComponentSynthesizer.apply(simplified, node);

        if (shadowHost && simplified.hasChildren()) {
            return simplified;
        }
        if (visible || scrollable || simplified.hasChildren()) {
            return simplified;
        }
        return null;
    }

    private SimplifiedNode simplifyText(RawNode node) {
        if (node.hasLayout() && node.isVisible() && hasMeaningfulText(node)) {
            return new SimplifiedNode(node);
        }
        return null;
    }

    /**
     * The session-specific attribute is consulted first; the legacy one only
     * when the former is absent or empty.
     */
    boolean isExcludedByAttribute(RawNode node) {
        String value = null;
        if (sessionId != null && !sessionId.isEmpty()) {
            value = node.getAttribute(DomConstants.sessionExcludeAttribute(sessionId));
        }
        if (value == null || value.isEmpty()) {
            value = node.getAttribute(DomConstants.EXCLUDE_ATTRIBUTE);
        }
        return value != null && value.equalsIgnoreCase("true");
    }

    private static boolean hasValidationAttributes(RawNode node) {
        Map<String, String> attributes = node.getAttributes();
        if (attributes == null) {
            return false;
        }
        return attributes.keySet().stream()
                .anyMatch(name -> name.startsWith("aria-") || name.startsWith("pseudo"));
    }

    static boolean hasMeaningfulText(RawNode node) {
        String value = node.getNodeValue();
        return value != null && value.strip().length() > 1;
    }
}
