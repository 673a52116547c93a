package com.pagelens.dom.serializer;

import com.pagelens.dom.DomConstants;
import com.pagelens.dom.model.NodeType;
import com.pagelens.dom.model.RawNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders a filtered tree as the indented, marker-annotated text an agent
 * reads. One line per emitted node, one tab per nesting level.
 * <p>
 * Output is deterministic for a given tree and attribute allow-list.
 */
public final class TreeTextRenderer {

    private TreeTextRenderer() {
    }

    public static String render(SimplifiedNode node, List<String> includeAttributes) {
        List<String> lines = new ArrayList<>();
        render(node, includeAttributes, 0, lines);
        return String.join("\n", lines);
    }

    private static void render(SimplifiedNode node, List<String> includeAttributes, int depth, List<String> out) {
        if (node == null) {
            return;
        }
        if (node.isExcludedByParent()) {
            renderChildren(node, includeAttributes, depth, out);
            return;
        }

        RawNode raw = node.getOriginalNode();
        String indent = "\t".repeat(depth);
        NodeType type = raw.getNodeType();

        if (type == NodeType.DOCUMENT_FRAGMENT_NODE) {
            out.add(indent + (isClosedShadowRoot(raw) ? DomConstants.CLOSED_SHADOW_LINE : DomConstants.OPEN_SHADOW_LINE));
            renderChildren(node, includeAttributes, depth + 1, out);
            if (node.hasChildren()) {
                out.add(indent + DomConstants.SHADOW_END_LINE);
            }
            return;
        }

        int childDepth = depth;
        if (type == NodeType.ELEMENT_NODE) {
            if (!node.shouldDisplay()) {
                renderChildren(node, includeAttributes, depth, out);
                return;
            }
            if ("svg".equals(raw.getTagName())) {
                out.add(svgLine(node, includeAttributes, indent));
                return;
            }
            if (isBracketed(node)) {
                out.add(elementLine(node, includeAttributes, indent));
                childDepth++;
            }
        } else if (type == NodeType.TEXT_NODE) {
            if (raw.isVisible() && TreeSimplifier.hasMeaningfulText(raw)) {
                out.add(indent + raw.getNodeValue().strip());
            }
        }

        renderChildren(node, includeAttributes, childDepth, out);
    }

    private static void renderChildren(SimplifiedNode node, List<String> includeAttributes, int depth, List<String> out) {
        for (SimplifiedNode child : node.getChildren()) {
            render(child, includeAttributes, depth, out);
        }
    }

    private static boolean isBracketed(SimplifiedNode node) {
        RawNode raw = node.getOriginalNode();
        return node.isInteractive()
                || raw.isActuallyScrollable()
                || raw.isScrollable()
                || isFrame(raw);
    }

    private static String svgLine(SimplifiedNode node, List<String> includeAttributes, String indent) {
        RawNode raw = node.getOriginalNode();
        StringBuilder line = new StringBuilder(indent).append(shadowPrefix(node));
        if (node.isInteractive()) {
            if (node.isNew()) {
                line.append(DomConstants.NEW_NODE_MARKER);
            }
            line.append('[').append(raw.getBackendNodeId()).append(']');
        }
        line.append("<svg");
        String attributes = AttributeStringBuilder.build(raw, includeAttributes, "");
        if (!attributes.isEmpty()) {
            line.append(' ').append(attributes);
        }
        return line.append(DomConstants.SVG_COLLAPSED_SUFFIX).toString();
    }

    private static String elementLine(SimplifiedNode node, List<String> includeAttributes, String indent) {
        RawNode raw = node.getOriginalNode();
        String tag = raw.getTagName();
        boolean showScroll = raw.shouldShowScrollInfo();

        String attributes = AttributeStringBuilder.build(raw, includeAttributes, "");
        String compound = AttributeStringBuilder.buildCompoundComponents(node.getCompoundChildren());
        if (!compound.isEmpty()) {
            attributes = attributes.isEmpty() ? compound : attributes + " " + compound;
        }

        StringBuilder line = new StringBuilder(indent).append(shadowPrefix(node));
        if (showScroll && !node.isInteractive()) {
            line.append(DomConstants.SCROLL_MARKER);
        } else if (node.isInteractive()) {
            if (node.isNew()) {
                line.append(DomConstants.NEW_NODE_MARKER);
            }
            line.append(showScroll ? DomConstants.SCROLL_INDEX_PREFIX : "[")
                    .append(raw.getBackendNodeId())
                    .append(']');
        } else if ("iframe".equals(tag)) {
            line.append(DomConstants.IFRAME_MARKER);
        } else if ("frame".equals(tag)) {
            line.append(DomConstants.FRAME_MARKER);
        }
        line.append('<').append(tag);

        if (!attributes.isEmpty()) {
            line.append(' ').append(attributes);
        }
        line.append(" />");

        if (showScroll) {
            String scrollInfo = raw.getScrollInfoText();
            if (!scrollInfo.isEmpty()) {
                line.append(" (").append(scrollInfo).append(')');
            }
        }
        return line.toString();
    }

    private static String shadowPrefix(SimplifiedNode node) {
        if (!node.isShadowHost()) {
            return "";
        }
        boolean closed = node.getChildren().stream()
                .anyMatch(child -> child.getNodeType() == NodeType.DOCUMENT_FRAGMENT_NODE
                        && isClosedShadowRoot(child.getOriginalNode()));
        return closed ? DomConstants.SHADOW_CLOSED_MARKER : DomConstants.SHADOW_OPEN_MARKER;
    }

    private static boolean isClosedShadowRoot(RawNode fragment) {
        return fragment.getShadowRootType() != null && fragment.getShadowRootType().equalsIgnoreCase("closed");
    }

    private static boolean isFrame(RawNode raw) {
        String tag = raw.getTagName();
        return "iframe".equals(tag) || "frame".equals(tag);
    }
}
