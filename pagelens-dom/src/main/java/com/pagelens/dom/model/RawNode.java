package com.pagelens.dom.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * A node of the captured page tree: DOM data merged with its accessibility
 * record and layout snapshot.
 * <p>
 * The serializer treats these nodes as read-only. {@code backendNodeId} is
 * the browser-assigned id used as the element's address in agent actions.
 * Identity semantics are intentional: equality is reference equality, so the
 * pipeline can key caches by node identity.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RawNode {

    private static final Set<String> OVERFLOW_SCROLL_VALUES = Set.of("auto", "scroll", "overlay");
    private static final Set<String> IMPLICITLY_SCROLLABLE_TAGS =
            Set.of("div", "main", "section", "article", "aside", "body", "html");

    private int nodeId;
    private int backendNodeId;
    private NodeType nodeType;
    private String nodeName;
    private String nodeValue;
    @Builder.Default
    private Map<String, String> attributes = new LinkedHashMap<>();
    @Builder.Default
    private List<RawNode> children = new ArrayList<>();
    @Builder.Default
    private List<RawNode> shadowRoots = new ArrayList<>();
    private RawNode contentDocument;
    /** "open" or "closed" for shadow-root fragments. */
    private String shadowRootType;
    private AxNode axNode;
    private LayoutSnapshot layout;

    @JsonIgnore
    private RawNode parent;

    // ==================== Structure ====================

    /**
     * Wire parent links for this subtree, including shadow roots and embedded
     * frame documents. Call once after building or reading a tree.
     */
    public RawNode linkParents() {
        for (RawNode child : getChildrenAndShadowRoots()) {
            child.parent = this;
            child.linkParents();
        }
        if (contentDocument != null) {
            contentDocument.parent = this;
            contentDocument.linkParents();
        }
        return this;
    }

    /**
     * Light-DOM children followed by shadow roots.
     */
    @JsonIgnore
    public List<RawNode> getChildrenAndShadowRoots() {
        List<RawNode> all = new ArrayList<>();
        if (children != null) {
            all.addAll(children);
        }
        if (shadowRoots != null) {
            all.addAll(shadowRoots);
        }
        return all;
    }

    // ==================== Element facts ====================

    /**
     * Lower-cased node name, e.g. "div" or "#text".
     */
    @JsonIgnore
    public String getTagName() {
        return nodeName != null ? nodeName.toLowerCase(Locale.ROOT) : "";
    }

    public String getAttribute(String name) {
        return attributes != null ? attributes.get(name) : null;
    }

    public boolean hasAttribute(String name) {
        return attributes != null && attributes.containsKey(name);
    }

    /**
     * Input type as written in the markup, lower-cased; empty when absent.
     */
    @JsonIgnore
    public String getInputType() {
        String type = getAttribute("type");
        return type != null ? type.toLowerCase(Locale.ROOT) : "";
    }

    @JsonIgnore
    public boolean isFileInput() {
        return "input".equals(getTagName()) && "file".equals(getAttribute("type"));
    }

    @JsonIgnore
    public boolean isElement() {
        return nodeType == NodeType.ELEMENT_NODE;
    }

    @JsonIgnore
    public String getAxRole() {
        return axNode != null ? axNode.getRole() : null;
    }

    // ==================== Layout ====================

    @JsonIgnore
    public boolean hasLayout() {
        return layout != null;
    }

    @JsonIgnore
    public DomRect getBounds() {
        return layout != null ? layout.getBounds() : null;
    }

    /**
     * Visible per the layout snapshot; a node without layout is not visible.
     */
    @JsonIgnore
    public boolean isVisible() {
        return layout != null && Boolean.TRUE.equals(layout.getVisible());
    }

    /**
     * The browser's own scrollability flag.
     */
    @JsonIgnore
    public boolean isScrollable() {
        return layout != null && Boolean.TRUE.equals(layout.getScrollable());
    }

    /**
     * Scrollable per the browser flag, or because the scroll area exceeds
     * the client area on an axis whose overflow style allows scrolling.
     */
    @JsonIgnore
    public boolean isActuallyScrollable() {
        if (isScrollable()) {
            return true;
        }
        if (layout == null || layout.getScrollRects() == null || layout.getClientRects() == null) {
            return false;
        }
        DomRect scroll = layout.getScrollRects();
        DomRect client = layout.getClientRects();
        boolean overflowsVertically = scroll.height() > client.height() + 1;
        boolean overflowsHorizontally = scroll.width() > client.width() + 1;
        if (!overflowsVertically && !overflowsHorizontally) {
            return false;
        }
        Map<String, String> styles = layout.getComputedStyles();
        if (styles == null || styles.isEmpty()) {
            return IMPLICITLY_SCROLLABLE_TAGS.contains(getTagName());
        }
        String overflow = lower(styles.getOrDefault("overflow", "visible"));
        String overflowX = lower(styles.getOrDefault("overflow-x", overflow));
        String overflowY = lower(styles.getOrDefault("overflow-y", overflow));
        return OVERFLOW_SCROLL_VALUES.contains(overflow)
                || OVERFLOW_SCROLL_VALUES.contains(overflowX)
                || OVERFLOW_SCROLL_VALUES.contains(overflowY);
    }

    /**
     * Scroll info is shown for the outermost scroll container of a nesting
     * chain, and always for the document-level html/body containers.
     */
    @JsonIgnore
    public boolean shouldShowScrollInfo() {
        if (!(isScrollable() || isActuallyScrollable())) {
            return false;
        }
        String tag = getTagName();
        if ("html".equals(tag) || "body".equals(tag)) {
            return true;
        }
        return parent == null || !(parent.isScrollable() || parent.isActuallyScrollable());
    }

    @JsonIgnore
    public ScrollInfo getScrollInfo() {
        if (!isActuallyScrollable() || layout == null
                || layout.getScrollRects() == null || layout.getClientRects() == null) {
            return null;
        }
        return ScrollInfo.of(layout.getScrollRects(), layout.getClientRects());
    }

    /**
     * Human-readable scroll position, e.g. "1.0 pages above, 2.5 pages below";
     * empty when nothing is scrolled out of view.
     */
    @JsonIgnore
    public String getScrollInfoText() {
        ScrollInfo info = getScrollInfo();
        if (info == null) {
            return "";
        }
        List<String> parts = new ArrayList<>();
        if (info.hasVerticalOverflow()) {
            parts.add(String.format(Locale.ROOT, "%.1f pages above, %.1f pages below",
                    info.pagesAbove(), info.pagesBelow()));
        }
        if (info.hasHorizontalOverflow()) {
            parts.add(String.format(Locale.ROOT, "horizontal %.0f%%", info.horizontalScrollPercentage()));
        }
        return String.join(", ", parts);
    }

    private static String lower(String value) {
        return value != null ? value.toLowerCase(Locale.ROOT) : "";
    }

    @Override
    public String toString() {
        return "RawNode{" + nodeType + " " + nodeName + " backendNodeId=" + backendNodeId + "}";
    }
}
