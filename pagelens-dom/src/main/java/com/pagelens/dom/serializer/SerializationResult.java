package com.pagelens.dom.serializer;

import java.util.Map;

/**
 * Serialized state plus per-stage timings in seconds (diagnostic only).
 */
public record SerializationResult(SerializedDomState state, Map<String, Double> timings) {
}
