package com.graphbench.telemetry.parse;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class DurationParserTest {

    @Test
    void hoursMinutesSeconds() {
        assertEquals(3723.0, DurationParser.parse("1:02:03"), 1e-9);
        assertEquals(3723.5, DurationParser.parse("1:02:03.5"), 1e-9);
    }

    @Test
    void minutesSeconds() {
        assertEquals(5.5, DurationParser.parse("0:05.50"), 1e-9);
        assertEquals(754.0, DurationParser.parse("12:34"), 1e-9);
    }

    @Test
    void bareDecimal() {
        assertEquals(12.25, DurationParser.parse("12.25"), 1e-9);
        assertEquals(42.0, DurationParser.parse("42"), 1e-9);
    }

    @Test
    void fieldsAreTrimmed() {
        assertEquals(90.0, DurationParser.parse(" 1 : 30 "), 1e-9);
    }

    @Test
    void unparsableIsZero() {
        assertEquals(0.0, DurationParser.parse("n/a"));
        assertEquals(0.0, DurationParser.parse(""));
        assertEquals(0.0, DurationParser.parse("1:2:3:4"));
        assertEquals(0.0, DurationParser.parse("1,5"));
        assertEquals(0.0, DurationParser.parse(null));
    }

    @Test
    void strictReportsAbsenceInsteadOfZero() {
        assertTrue(DurationParser.parseStrict("abc").isEmpty());
        assertTrue(DurationParser.parseStrict("x:10").isEmpty());
        assertEquals(0.0, DurationParser.parseStrict("0:00.00").getAsDouble(), 1e-9);
    }
}
