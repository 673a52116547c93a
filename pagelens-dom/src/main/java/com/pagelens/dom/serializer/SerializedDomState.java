package com.pagelens.dom.serializer;

import com.pagelens.dom.model.RawNode;
import lombok.Getter;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one serialization: the filtered tree plus the selector map
 * from backend node id to the addressable raw node. Keep it around and pass
 * it to the next serializer to get new-element markers.
 */
@Getter
public class SerializedDomState {

    private final SimplifiedNode root;
    private final Map<Integer, RawNode> selectorMap;

    public SerializedDomState(SimplifiedNode root, Map<Integer, RawNode> selectorMap) {
        this.root = root;
        this.selectorMap = Collections.unmodifiableMap(selectorMap);
    }

    /**
     * The text handed to the language model; empty for an empty tree.
     */
    public String llmRepresentation(List<String> includeAttributes) {
        if (root == null) {
            return "";
        }
        return TreeTextRenderer.render(root, includeAttributes);
    }
}
