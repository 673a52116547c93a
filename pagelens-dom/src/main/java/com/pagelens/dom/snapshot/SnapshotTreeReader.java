package com.pagelens.dom.snapshot;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pagelens.dom.model.RawNode;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Reads a captured page tree from JSON and wires parent links.
 * <p>
 * The JSON mirrors {@link RawNode}: {@code children}, {@code shadowRoots}
 * and {@code contentDocument} nest further nodes; {@code axNode} and
 * {@code layout} carry the accessibility and layout records. Unknown
 * properties are ignored.
 */
@Slf4j
public class SnapshotTreeReader {

    private static final String STRING_SOURCE = "<string>";
    private static final String STREAM_SOURCE = "<stream>";

    private final ObjectMapper mapper;

    public SnapshotTreeReader() {
        this(new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false));
    }

    public SnapshotTreeReader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public RawNode read(Path path) {
        String source = path.toString();
        try (InputStream in = Files.newInputStream(path)) {
            return finish(mapper.readValue(in, RawNode.class), source);
        } catch (IOException e) {
            throw new SnapshotFormatException("Failed to read snapshot: " + e.getMessage(), source, e);
        }
    }

    public RawNode read(InputStream in) {
        try {
            return finish(mapper.readValue(in, RawNode.class), STREAM_SOURCE);
        } catch (IOException e) {
            throw new SnapshotFormatException("Failed to read snapshot: " + e.getMessage(), STREAM_SOURCE, e);
        }
    }

    public RawNode read(String json) {
        try {
            return finish(mapper.readValue(json, RawNode.class), STRING_SOURCE);
        } catch (IOException e) {
            throw new SnapshotFormatException("Failed to parse snapshot: " + e.getMessage(), STRING_SOURCE, e);
        }
    }

    private RawNode finish(RawNode root, String source) {
        if (root == null) {
            throw new SnapshotFormatException("Snapshot is empty", source);
        }
        int count = validate(root, source);
        root.linkParents();
        log.debug("Read snapshot from {}: {} nodes", source, count);
        return root;
    }

    private static int validate(RawNode root, String source) {
        Deque<RawNode> pending = new ArrayDeque<>();
        pending.push(root);
        int count = 0;
        while (!pending.isEmpty()) {
            RawNode node = pending.pop();
            count++;
            if (node.getNodeType() == null) {
                throw new SnapshotFormatException(
                        "Node " + node.getNodeName() + " (backendNodeId=" + node.getBackendNodeId()
                                + ") has no nodeType", source);
            }
            for (RawNode child : node.getChildrenAndShadowRoots()) {
                if (child == null) {
                    throw new SnapshotFormatException("Null child under " + node, source);
                }
                pending.push(child);
            }
            if (node.getContentDocument() != null) {
                pending.push(node.getContentDocument());
            }
        }
        return count;
    }
}
