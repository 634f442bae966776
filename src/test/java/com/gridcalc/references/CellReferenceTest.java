package com.gridcalc.references;

import com.gridcalc.exceptions.InvalidReferenceException;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class CellReferenceTest {

    @Test
    void testParseAbsoluteMarkers() {
        CellReference ref = CellReference.parse("$b$12");
        assertEquals(11, ref.getRow());
        assertEquals(1, ref.getCol());
        assertTrue(ref.isColAbsolute());
        assertTrue(ref.isRowAbsolute());
        assertEquals("$B$12", ref.toString());

        CellReference mixed = CellReference.parse("C$3");
        assertFalse(mixed.isColAbsolute());
        assertTrue(mixed.isRowAbsolute());
    }

    @Test
    void testColumnLetters() {
        assertEquals(0, CellReference.columnToIndex("A"));
        assertEquals(25, CellReference.columnToIndex("z"));
        assertEquals(26, CellReference.columnToIndex("AA"));
        assertEquals(255, CellReference.columnToIndex("IV"));
        assertEquals("IV", CellReference.indexToColumn(255));
        assertEquals("AB", CellReference.indexToColumn(27));
    }

    @Test
    void testInvalidReferences() {
        assertNull(CellReference.tryParse("A0"));
        assertNull(CellReference.tryParse("1A"));
        assertNull(CellReference.tryParse("SALES"));
        assertThrows(InvalidReferenceException.class, () -> CellReference.parse("A-1"));
        assertThrows(InvalidReferenceException.class, () -> CellReference.parse(null));
    }

    /**
     * Equality and ordering look at the position only, not the "$" flags.
     */
    @Test
    void testEqualityIgnoresAbsoluteFlags() {
        assertEquals(CellReference.parse("A1"), CellReference.parse("$A$1"));
        assertTrue(CellReference.parse("B1").compareTo(CellReference.parse("A2")) < 0);
        assertEquals("A1", CellReference.parse("$A$1").toRelative().toString());
    }

    @Test
    void testAdjustKeepsAbsolutePartsAndClamps() {
        assertEquals("C$1", CellReference.parse("A$1").adjust(5, 2, 99, 99).toString());
        assertEquals("A1", CellReference.parse("B2").adjust(-3, -3, 99, 99).toString());
        assertEquals("$A11", CellReference.parse("$A1").adjust(10, 10, 99, 99).toString());
    }

    @Test
    void testRangeParsingAndShape() {
        RangeReference range = RangeReference.parse("C3..a1");
        assertEquals("C3:A1", range.toString());
        assertEquals("A1:C3", range.normalized().toString());
        assertEquals(3, range.getRowCount());
        assertEquals(3, range.getColCount());
        assertTrue(range.contains(1, 1));
        assertFalse(range.contains(3, 0));
        assertEquals(Arrays.asList(CellReference.of(0, 0), CellReference.of(0, 1), CellReference.of(1, 0),
                CellReference.of(1, 1)), RangeReference.parse("A1:B2").cells());
        assertThrows(InvalidReferenceException.class, () -> RangeReference.parse("A1"));
        assertThrows(InvalidReferenceException.class, () -> RangeReference.parse("A1:B2:C3"));
    }
}
