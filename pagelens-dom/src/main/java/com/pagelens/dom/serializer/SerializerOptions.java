package com.pagelens.dom.serializer;

import com.pagelens.common.config.PageLensConfig;
import com.pagelens.dom.DomConstants;
import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Resolved serializer settings. Build directly, or resolve from the
 * configuration file with {@link #resolve(PageLensConfig)}.
 */
@Slf4j
@Data
@Builder
public class SerializerOptions {

    @Builder.Default
    private boolean bboxFilteringEnabled = DomConstants.DEFAULT_BBOX_FILTERING_ENABLED;
    @Builder.Default
    private double containmentThreshold = DomConstants.DEFAULT_CONTAINMENT_THRESHOLD;
    @Builder.Default
    private boolean paintOrderFilteringEnabled = DomConstants.DEFAULT_PAINT_ORDER_FILTERING_ENABLED;
    private String sessionId;
    @Builder.Default
    private List<String> includeAttributes = DomConstants.DEFAULT_INCLUDE_ATTRIBUTES;

    public static SerializerOptions defaults() {
        return SerializerOptions.builder().build();
    }

    public static SerializerOptions resolve(PageLensConfig config) {
        PageLensConfig.SerializerConfig raw = config != null ? config.getSerializer() : null;
        SerializerOptions options = defaults();
        if (raw == null) {
            return options;
        }
        if (raw.getBboxFilteringEnabled() != null)
            options.setBboxFilteringEnabled(raw.getBboxFilteringEnabled());
        if (raw.getContainmentThreshold() != null)
            options.setContainmentThreshold(normalizeThreshold(raw.getContainmentThreshold()));
        if (raw.getPaintOrderFilteringEnabled() != null)
            options.setPaintOrderFilteringEnabled(raw.getPaintOrderFilteringEnabled());
        if (raw.getSessionId() != null && !raw.getSessionId().isBlank())
            options.setSessionId(raw.getSessionId().trim());
        if (raw.getIncludeAttributes() != null && !raw.getIncludeAttributes().isEmpty())
            options.setIncludeAttributes(List.copyOf(raw.getIncludeAttributes()));
        return options;
    }

    /**
     * Thresholds outside (0, 1] fall back to the default.
     */
    public static double normalizeThreshold(double threshold) {
        if (Double.isNaN(threshold) || threshold <= 0 || threshold > 1) {
            log.warn("Containment threshold {} outside (0, 1], using {}",
                    threshold, DomConstants.DEFAULT_CONTAINMENT_THRESHOLD);
            return DomConstants.DEFAULT_CONTAINMENT_THRESHOLD;
        }
        return threshold;
    }
}
