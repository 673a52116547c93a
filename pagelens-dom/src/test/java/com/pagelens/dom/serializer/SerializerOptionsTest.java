package com.pagelens.dom.serializer;

import com.pagelens.common.config.PageLensConfig;
import com.pagelens.dom.DomConstants;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SerializerOptionsTest {

    @Test
    void resolve_defaults_whenNoConfig() {
        SerializerOptions options = SerializerOptions.resolve(null);

        assertTrue(options.isBboxFilteringEnabled());
        assertTrue(options.isPaintOrderFilteringEnabled());
        assertEquals(DomConstants.DEFAULT_CONTAINMENT_THRESHOLD, options.getContainmentThreshold());
        assertNull(options.getSessionId());
        assertEquals(DomConstants.DEFAULT_INCLUDE_ATTRIBUTES, options.getIncludeAttributes());
    }

    @Test
    void resolve_respectsCustomConfig() {
        PageLensConfig config = new PageLensConfig();
        PageLensConfig.SerializerConfig serializer = new PageLensConfig.SerializerConfig();
        serializer.setBboxFilteringEnabled(false);
        serializer.setPaintOrderFilteringEnabled(false);
        serializer.setContainmentThreshold(0.9);
        serializer.setSessionId("  run-7 ");
        serializer.setIncludeAttributes(List.of("id", "title"));
        config.setSerializer(serializer);

        SerializerOptions options = SerializerOptions.resolve(config);

        assertFalse(options.isBboxFilteringEnabled());
        assertFalse(options.isPaintOrderFilteringEnabled());
        assertEquals(0.9, options.getContainmentThreshold());
        assertEquals("run-7", options.getSessionId());
        assertEquals(List.of("id", "title"), options.getIncludeAttributes());
    }

    @Test
    void resolve_invalidThreshold_fallsBackToDefault() {
        PageLensConfig config = new PageLensConfig();
        PageLensConfig.SerializerConfig serializer = new PageLensConfig.SerializerConfig();
        serializer.setContainmentThreshold(1.5);
        config.setSerializer(serializer);

        assertEquals(DomConstants.DEFAULT_CONTAINMENT_THRESHOLD,
                SerializerOptions.resolve(config).getContainmentThreshold());
    }

    @Test
    void normalizeThreshold_bounds() {
        assertEquals(1.0, SerializerOptions.normalizeThreshold(1.0));
        assertEquals(0.01, SerializerOptions.normalizeThreshold(0.01));
        assertEquals(DomConstants.DEFAULT_CONTAINMENT_THRESHOLD, SerializerOptions.normalizeThreshold(0));
        assertEquals(DomConstants.DEFAULT_CONTAINMENT_THRESHOLD, SerializerOptions.normalizeThreshold(-0.2));
        assertEquals(DomConstants.DEFAULT_CONTAINMENT_THRESHOLD, SerializerOptions.normalizeThreshold(Double.NaN));
    }
}
