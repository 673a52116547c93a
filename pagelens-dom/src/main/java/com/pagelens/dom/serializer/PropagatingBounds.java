package com.pagelens.dom.serializer;

import com.pagelens.dom.model.DomRect;

/**
 * The enclosing interactive region in force while the containment filter
 * walks a subtree.
 */
record PropagatingBounds(String tag, DomRect bounds, int nodeId, int depth) {
}
