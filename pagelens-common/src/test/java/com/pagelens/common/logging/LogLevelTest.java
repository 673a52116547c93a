package com.pagelens.common.logging;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LogLevelTest {

    @Test
    void normalize_handlesAliasesAndCase() {
        assertEquals(LogLevel.WARN, LogLevel.normalize("Warning"));
        assertEquals(LogLevel.ERROR, LogLevel.normalize("fatal"));
        assertEquals(LogLevel.SILENT, LogLevel.normalize(" off "));
    }

    @Test
    void normalize_unknownFallsBack() {
        assertEquals(LogLevel.INFO, LogLevel.normalize("verbose"));
        assertEquals(LogLevel.DEBUG, LogLevel.normalize(null, LogLevel.DEBUG));
    }

    @Test
    void isEnabledFor_respectsPriority() {
        assertTrue(LogLevel.ERROR.isEnabledFor(LogLevel.INFO));
        assertTrue(LogLevel.INFO.isEnabledFor(LogLevel.INFO));
        assertFalse(LogLevel.DEBUG.isEnabledFor(LogLevel.INFO));
        assertFalse(LogLevel.ERROR.isEnabledFor(LogLevel.SILENT));
    }
}
