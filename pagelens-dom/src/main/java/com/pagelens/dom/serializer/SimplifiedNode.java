package com.pagelens.dom.serializer;

import com.pagelens.dom.model.NodeType;
import com.pagelens.dom.model.RawNode;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/**
 * Lightweight tree node built by the simplifier. Wraps one {@link RawNode}
 * by reference and owns its children; the flags are filled in by the later
 * pipeline stages.
 */
@Getter
@Setter
public class SimplifiedNode {

    private final RawNode originalNode;
    private List<SimplifiedNode> children;

    private boolean shadowHost;
    private boolean compoundComponent;
    private boolean interactive;
    private boolean isNew;
    private boolean excludedByParent;
    private boolean ignoredByPaintOrder;
    @Getter(AccessLevel.NONE)
    private boolean shouldDisplay = true;

    /** Virtual sub-widgets of a native compound control, rendered inline. */
    private List<CompoundChild> compoundChildren = new ArrayList<>();

    public SimplifiedNode(RawNode originalNode) {
        this(originalNode, new ArrayList<>());
    }

    public SimplifiedNode(RawNode originalNode, List<SimplifiedNode> children) {
        this.originalNode = originalNode;
        this.children = children;
    }

    /**
     * False for structural wrappers that stay in the tree but render only
     * their children.
     */
    public boolean shouldDisplay() {
        return shouldDisplay;
    }

    public void addChild(SimplifiedNode child) {
        children.add(child);
    }

    public boolean hasChildren() {
        return !children.isEmpty();
    }

    public NodeType getNodeType() {
        return originalNode.getNodeType();
    }

    public int getBackendNodeId() {
        return originalNode.getBackendNodeId();
    }

    @Override
    public String toString() {
        return "SimplifiedNode{" + originalNode.getTagName()
                + " backendNodeId=" + originalNode.getBackendNodeId()
                + " children=" + children.size() + "}";
    }
}
