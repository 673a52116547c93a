package com.pagelens.dom.serializer;

import com.pagelens.dom.model.RawNode;

import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Decides which nodes are addressable, registers them in the selector map
 * under their backend node id, and flags nodes that were not addressable in
 * the previous observation.
 */
final class InteractiveIndexer {

    private final SerializationContext context;
    private final Set<Integer> previousBackendIds;

    /**
     * @param previousSelectorMap selector map of the previous run, or null
     *                            when there is no baseline to diff against
     */
    InteractiveIndexer(SerializationContext context, Map<Integer, RawNode> previousSelectorMap) {
        this.context = context;
        this.previousBackendIds = previousSelectorMap == null ? null
                : previousSelectorMap.values().stream()
                        .map(RawNode::getBackendNodeId)
                        .collect(Collectors.toSet());
    }

    void assign(SimplifiedNode node) {
        if (node == null) {
            return;
        }

        if (!node.isExcludedByParent() && !node.isIgnoredByPaintOrder() && shouldMakeInteractive(node)) {
            RawNode raw = node.getOriginalNode();
            node.setInteractive(true);
            context.register(raw);

            // Synthesized children change between runs, so compound controls
            // are always reported as new.
            if (node.isCompoundComponent()) {
                node.setNew(true);
            } else if (previousBackendIds != null && !previousBackendIds.isEmpty()
                    && !previousBackendIds.contains(raw.getBackendNodeId())) {
                node.setNew(true);
            }
        }

        for (SimplifiedNode child : node.getChildren()) {
            assign(child);
        }
    }

    private boolean shouldMakeInteractive(SimplifiedNode node) {
        RawNode raw = node.getOriginalNode();
        if (raw.isActuallyScrollable()) {
            // A scroll panel that already offers finer targets is not exposed itself.
            return !hasInteractiveDescendants(node);
        }
        return context.isInteractive(raw) && (raw.isVisible() || raw.isFileInput());
    }

    boolean hasInteractiveDescendants(SimplifiedNode node) {
        for (SimplifiedNode child : node.getChildren()) {
            if (context.isInteractive(child.getOriginalNode()) || hasInteractiveDescendants(child)) {
                return true;
            }
        }
        return false;
    }
}
