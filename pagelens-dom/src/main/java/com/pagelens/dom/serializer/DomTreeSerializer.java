package com.pagelens.dom.serializer;

import com.pagelens.common.infra.FormatDuration;
import com.pagelens.common.logging.SubsystemLogger;
import com.pagelens.dom.interactive.DefaultInteractivityOracle;
import com.pagelens.dom.interactive.InteractivityOracle;
import com.pagelens.dom.model.RawNode;
import com.pagelens.dom.paint.OcclusionAnnotator;
import com.pagelens.dom.paint.PaintOrderOcclusionAnnotator;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns a captured page tree into the indexed form an agent acts on.
 * <p>
 * Stages, in order: simplify, mark occluded nodes, prune empty wrappers,
 * collapse content covered by links/buttons, assign interactive indices.
 * Render the result with {@link SerializedDomState#llmRepresentation}.
 * <p>
 * Not thread-safe: use one instance per concurrently processed snapshot.
 */
public class DomTreeSerializer {

    static final String STAGE_SIMPLIFY = "create_simplified_tree";
    static final String STAGE_PAINT_ORDER = "calculate_paint_order";
    static final String STAGE_OPTIMIZE = "optimize_tree";
    static final String STAGE_BBOX = "bbox_filtering";
    static final String STAGE_INDEX = "assign_interactive_indices";
    static final String TOTAL = "serialize_accessible_elements_total";

    private static final SubsystemLogger log = SubsystemLogger.create("dom/serializer");

    private final RawNode root;
    private final Map<Integer, RawNode> previousSelectorMap;
    private final SerializerOptions options;
    private final InteractivityOracle oracle;
    private final OcclusionAnnotator occlusionAnnotator;
    private final double containmentThreshold;

    public DomTreeSerializer(RawNode root) {
        this(root, null, SerializerOptions.defaults());
    }

    public DomTreeSerializer(RawNode root, SerializedDomState previousState, SerializerOptions options) {
        this(root, previousState, options, new DefaultInteractivityOracle(), new PaintOrderOcclusionAnnotator());
    }

    public DomTreeSerializer(RawNode root,
                             SerializedDomState previousState,
                             SerializerOptions options,
                             InteractivityOracle oracle,
                             OcclusionAnnotator occlusionAnnotator) {
        this.root = root;
        this.previousSelectorMap = previousState != null ? previousState.getSelectorMap() : null;
        this.options = options != null ? options : SerializerOptions.defaults();
        this.oracle = oracle != null ? oracle : new DefaultInteractivityOracle();
        this.occlusionAnnotator = occlusionAnnotator;
        this.containmentThreshold = SerializerOptions.normalizeThreshold(this.options.getContainmentThreshold());
    }

    public SerializationResult serialize() {
        long startTotal = System.nanoTime();
        SerializationContext context = new SerializationContext(oracle);

        long start = System.nanoTime();
        SimplifiedNode tree = new TreeSimplifier(options.getSessionId()).simplify(root);
        context.recordTiming(STAGE_SIMPLIFY, elapsedSince(start));

        start = System.nanoTime();
        if (options.isPaintOrderFilteringEnabled() && tree != null && occlusionAnnotator != null) {
            occlusionAnnotator.annotate(tree);
        }
        context.recordTiming(STAGE_PAINT_ORDER, elapsedSince(start));

        start = System.nanoTime();
        tree = TreeOptimizer.optimize(tree);
        context.recordTiming(STAGE_OPTIMIZE, elapsedSince(start));

        if (options.isBboxFilteringEnabled() && tree != null) {
            start = System.nanoTime();
            tree = new ContainmentFilter(containmentThreshold).apply(tree);
            context.recordTiming(STAGE_BBOX, elapsedSince(start));
        }

        start = System.nanoTime();
        new InteractiveIndexer(context, previousSelectorMap).assign(tree);
        context.recordTiming(STAGE_INDEX, elapsedSince(start));

        context.recordTiming(TOTAL, elapsedSince(startTotal));
        logTimings(context);

        return new SerializationResult(new SerializedDomState(tree, context.selectorMap()), context.timings());
    }

    double containmentThreshold() {
        return containmentThreshold;
    }

    private void logTimings(SerializationContext context) {
        if (!log.isDebugEnabled()) {
            return;
        }
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("interactive", context.interactiveCount());
        context.timings().forEach((stage, seconds) -> meta.put(stage, FormatDuration.formatSeconds(seconds)));
        log.debug("Serialized DOM tree", meta);
    }

    private static double elapsedSince(long startNanos) {
        return FormatDuration.secondsBetween(startNanos, System.nanoTime());
    }
}
