package com.pagelens.dom.paint;

import com.pagelens.common.logging.SubsystemLogger;
import com.pagelens.dom.model.DomRect;
import com.pagelens.dom.model.LayoutSnapshot;
import com.pagelens.dom.model.RawNode;
import com.pagelens.dom.serializer.SimplifiedNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Marks nodes whose bounds are fully covered by opaque content painted
 * above them. Nodes are visited from the highest paint order down; a node
 * only contributes to the covering area once it has itself been checked.
 */
public class PaintOrderOcclusionAnnotator implements OcclusionAnnotator {

    static final String TRANSPARENT_BACKGROUND = "rgba(0, 0, 0, 0)";
    static final double MIN_OPAQUE_OPACITY = 0.8;

    private static final SubsystemLogger log = SubsystemLogger.create("dom/paint");

    @Override
    public void annotate(SimplifiedNode root) {
        if (root == null) {
            return;
        }
        TreeMap<Integer, List<SimplifiedNode>> byPaintOrder = new TreeMap<>();
        collect(root, byPaintOrder);

        RectUnion covered = new RectUnion();
        int occluded = 0;
        for (Map.Entry<Integer, List<SimplifiedNode>> group : byPaintOrder.descendingMap().entrySet()) {
            for (SimplifiedNode node : group.getValue()) {
                DomRect bounds = node.getOriginalNode().getBounds();
                if (covered.contains(bounds)) {
                    node.setIgnoredByPaintOrder(true);
                    occluded++;
                }
                if (!isSeeThrough(node.getOriginalNode().getLayout())) {
                    covered.add(bounds);
                }
            }
        }
        if (occluded > 0) {
            log.debug("Occluded nodes: " + occluded);
        }
    }

    private static void collect(SimplifiedNode node, Map<Integer, List<SimplifiedNode>> byPaintOrder) {
        RawNode raw = node.getOriginalNode();
        LayoutSnapshot layout = raw != null ? raw.getLayout() : null;
        if (layout != null && layout.getPaintOrder() != null && hasArea(layout.getBounds())) {
            byPaintOrder.computeIfAbsent(layout.getPaintOrder(), k -> new ArrayList<>()).add(node);
        }
        for (SimplifiedNode child : node.getChildren()) {
            collect(child, byPaintOrder);
        }
    }

    private static boolean hasArea(DomRect bounds) {
        return bounds != null && bounds.width() > 0 && bounds.height() > 0;
    }

    /**
     * Transparent background or low opacity lets content below show through.
     */
    static boolean isSeeThrough(LayoutSnapshot layout) {
        String background = layout.style("background-color");
        if (background == null || TRANSPARENT_BACKGROUND.equals(background.strip())) {
            return true;
        }
        String opacity = layout.style("opacity");
        if (opacity == null || opacity.isBlank()) {
            return false;
        }
        try {
            return Double.parseDouble(opacity.strip()) < MIN_OPAQUE_OPACITY;
        } catch (NumberFormatException e) {
            log.debug("Unparseable opacity '" + opacity + "', treating as opaque");
            return false;
        }
    }
}
