package com.gridcalc.models;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CellFormatTest {

    private static String format(double number, String code) {
        return CellFormat.format(Value.number(number), code);
    }

    @Test
    void testGeneral() {
        assertEquals("3", format(3, "G"));
        assertEquals("2.5", format(2.5, null));
        assertEquals("7", format(7, "Q9"));
    }

    @Test
    void testFixedAndScientific() {
        assertEquals("3.14", format(3.14159, "F2"));
        assertEquals("3", format(2.5, "F0"));
        assertEquals("1.50", format(1.5, "F"));
        assertEquals("1.23E04", format(12345, "S2"));
    }

    @Test
    void testCurrencyAndComma() {
        assertEquals("$1,234.50", format(1234.5, "C2"));
        assertEquals("($1,234.50)", format(-1234.5, "C2"));
        assertEquals("1,234,567", format(1234567.4, ",0"));
    }

    @Test
    void testPercentAndHidden() {
        assertEquals("12.5%", format(0.125, "P1"));
        assertEquals("50%", format(0.5, "p0"));
        assertEquals("", format(42, "H"));
    }

    @Test
    void testNonNumbersIgnoreNumericFormats() {
        assertEquals("abc", CellFormat.format(Value.text("abc"), "F2"));
        assertEquals("#N/A", CellFormat.format(Value.error(ErrorKind.NA), "C2"));
        assertEquals("TRUE", CellFormat.format(Value.bool(true), "P0"));
    }
}
