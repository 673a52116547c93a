package com.pagelens.common.config;

import lombok.Data;

import java.util.List;

/**
 * Root configuration type, bound from a JSON file by {@link ConfigService}.
 * Every field is optional; consumers apply their own defaults.
 */
@Data
public class PageLensConfig {

    /** DOM serializer settings. */
    private SerializerConfig serializer;

    /** Logging settings. */
    private LoggingConfig logging;

    @Data
    public static class SerializerConfig {
        /** Collapse children almost fully covered by a link/button ancestor. */
        private Boolean bboxFilteringEnabled;
        /** Fraction of a child's area that must overlap the container, in (0, 1]. */
        private Double containmentThreshold;
        /** Run the occlusion pass before optimizing the tree. */
        private Boolean paintOrderFilteringEnabled;
        /** Per-session suffix of the exclusion attribute. */
        private String sessionId;
        /** Attribute names rendered next to each element. */
        private List<String> includeAttributes;
    }

    @Data
    public static class LoggingConfig {
        private String level;
        private List<String> subsystems;
    }
}
