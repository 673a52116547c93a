package com.pagelens.dom.interactive;

import com.pagelens.dom.model.RawNode;

/**
 * Decides whether a captured node is something an agent can act on.
 * Implementations must be pure; the serializer caches one answer per node
 * per run.
 */
@FunctionalInterface
public interface InteractivityOracle {

    boolean isInteractive(RawNode node);
}
