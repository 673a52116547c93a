package com.pagelens.dom.serializer;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NumberParsingTest {

    @Test
    void parseOptional_acceptsDecimalForms() {
        assertEquals(10.0, NumberParsing.parseOptional("10"));
        assertEquals(-2.5, NumberParsing.parseOptional(" -2.5 "));
        assertEquals(0.5, NumberParsing.parseOptional(".5"));
        assertEquals(3.0, NumberParsing.parseOptional("3."));
        assertEquals(1500.0, NumberParsing.parseOptional("1.5e3"));
    }

    @Test
    void parseOptional_rejectsJavaOnlyLiterals() {
        for (String value : List.of("10f", "50d", "0x1p3", "1_000", "abc", "1.2.3", "")) {
            assertNull(NumberParsing.parseOptional(value), value);
        }
        assertNull(NumberParsing.parseOptional(null));
    }

    @Test
    void parseOptional_infinityAndNan() {
        assertEquals(Double.POSITIVE_INFINITY, NumberParsing.parseOptional("inf"));
        assertEquals(Double.NEGATIVE_INFINITY, NumberParsing.parseOptional("-Infinity"));
        assertTrue(NumberParsing.parseOptional("NaN").isNaN());
    }

    @Test
    void parseOrDefault_fallsBackOnMalformed() {
        assertEquals(100.0, NumberParsing.parseOrDefault("50d", 100.0));
        assertEquals(7.0, NumberParsing.parseOrDefault("7", 100.0));
    }

    @Test
    void format_plainRange() {
        assertEquals("10000000.0", NumberParsing.format(1e7));
        assertEquals("0.0", NumberParsing.format(0.0));
        assertEquals("0.25", NumberParsing.format(0.25));
        assertEquals("0.0001", NumberParsing.format(0.0001));
        assertEquals("-2.5", NumberParsing.format(-2.5));
        assertEquals("1234567890123456.0", NumberParsing.format(1234567890123456.0));
    }

    @Test
    void format_exponentOutsidePlainRange() {
        assertEquals("1e-05", NumberParsing.format(0.00001));
        assertEquals("1.5e-05", NumberParsing.format(1.5e-5));
        assertEquals("1e+16", NumberParsing.format(1e16));
        assertEquals("-2.5e+20", NumberParsing.format(-2.5e20));
    }

    @Test
    void format_integersAndSpecials() {
        assertEquals("0", NumberParsing.format(0));
        assertEquals("100", NumberParsing.format(100));
        assertEquals("inf", NumberParsing.format(Double.POSITIVE_INFINITY));
        assertEquals("nan", NumberParsing.format(Double.NaN));
    }
}
