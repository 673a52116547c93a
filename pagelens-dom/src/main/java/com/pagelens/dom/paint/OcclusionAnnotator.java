package com.pagelens.dom.paint;

import com.pagelens.dom.serializer.SimplifiedNode;

/**
 * Marks simplified nodes whose painted area is hidden behind content painted
 * later, by setting {@code ignoredByPaintOrder} in place.
 */
@FunctionalInterface
public interface OcclusionAnnotator {

    void annotate(SimplifiedNode root);
}
