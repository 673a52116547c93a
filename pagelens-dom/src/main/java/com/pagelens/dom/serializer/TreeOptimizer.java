package com.pagelens.dom.serializer;

import com.pagelens.dom.model.NodeType;
import com.pagelens.dom.model.RawNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Bottom-up pruning of wrapper nodes that ended up invisible, childless and
 * not scrollable. Unlike the later stages this one deletes nodes.
 */
final class TreeOptimizer {

    private TreeOptimizer() {
    }

    static SimplifiedNode optimize(SimplifiedNode node) {
        if (node == null) {
            return null;
        }

        List<SimplifiedNode> optimizedChildren = new ArrayList<>();
        for (SimplifiedNode child : node.getChildren()) {
            SimplifiedNode optimized = optimize(child);
            if (optimized != null) {
                optimizedChildren.add(optimized);
            }
        }
        node.setChildren(optimizedChildren);

        RawNode raw = node.getOriginalNode();
        if (raw.isVisible()
                || raw.isActuallyScrollable()
                || raw.getNodeType() == NodeType.TEXT_NODE
                || node.hasChildren()
                || raw.isFileInput()) {
            return node;
        }
        return null;
    }
}
