package com.pagelens.dom.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Paint/layout facts captured for one node (DOMSnapshot layout tree entry).
 * {@code scrollRects} carries the scroll offset in x/y and the full scroll
 * size in width/height; {@code clientRects} carries the visible viewport of
 * the element.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class LayoutSnapshot {
    private DomRect bounds;
    private DomRect clientRects;
    private DomRect scrollRects;
    /** Visibility as decided by the instrumentation layer. */
    private Boolean visible;
    /** Scrollability flag reported by the browser. */
    private Boolean scrollable;
    private Integer paintOrder;
    private Map<String, String> computedStyles;

    public String style(String name) {
        return computedStyles != null ? computedStyles.get(name) : null;
    }
}
