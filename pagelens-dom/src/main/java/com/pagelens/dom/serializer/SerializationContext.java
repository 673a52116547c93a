package com.pagelens.dom.serializer;

import com.pagelens.common.infra.FormatDuration;
import com.pagelens.dom.interactive.InteractivityOracle;
import com.pagelens.dom.model.RawNode;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Mutable state of one {@code serialize()} run: the interactivity cache, the
 * selector map being built, the interactive counter and stage timings.
 * Created fresh for every run; never shared between runs.
 */
final class SerializationContext {

    static final String CLICKABLE_DETECTION_TIME = "clickable_detection_time";

    private final InteractivityOracle oracle;
    private final Map<RawNode, Boolean> interactiveCache = new IdentityHashMap<>();
    private final Map<Integer, RawNode> selectorMap = new LinkedHashMap<>();
    private final Map<String, Double> timings = new LinkedHashMap<>();
    private int interactiveCounter = 1;

    SerializationContext(InteractivityOracle oracle) {
        this.oracle = oracle;
    }

    /**
     * Ask the oracle once per node; later calls hit the cache.
     */
    boolean isInteractive(RawNode node) {
        Boolean cached = interactiveCache.get(node);
        if (cached != null) {
            return cached;
        }
        long start = System.nanoTime();
        boolean result = oracle.isInteractive(node);
        addTiming(CLICKABLE_DETECTION_TIME, FormatDuration.secondsBetween(start, System.nanoTime()));
        interactiveCache.put(node, result);
        return result;
    }

    void register(RawNode node) {
        selectorMap.put(node.getBackendNodeId(), node);
        interactiveCounter++;
    }

    Map<Integer, RawNode> selectorMap() {
        return selectorMap;
    }

    int interactiveCount() {
        return interactiveCounter - 1;
    }

    void recordTiming(String stage, double seconds) {
        timings.put(stage, seconds);
    }

    void addTiming(String stage, double seconds) {
        timings.merge(stage, seconds, Double::sum);
    }

    Map<String, Double> timings() {
        return Collections.unmodifiableMap(timings);
    }
}
