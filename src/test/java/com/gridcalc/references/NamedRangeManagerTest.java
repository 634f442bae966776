package com.gridcalc.references;

import com.gridcalc.exceptions.InvalidNameException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

class NamedRangeManagerTest {

    private NamedRangeManager names;

    @BeforeEach
    void setUp() {
        names = new NamedRangeManager();
    }

    @Test
    void testNamesAreCaseInsensitive() {
        names.addFromString("Sales", "B2:B10", "monthly");
        assertTrue(names.exists("SALES"));
        assertEquals("B2:B10", names.get("sales").getReferenceText());
        assertEquals("Sales", names.get("SALES").getName());
        assertEquals("monthly", names.get("SALES").getDescription());
        assertFalse(names.get("sales").isSingleCell());
    }

    @Test
    void testSingleCellAndLotusRange() {
        assertTrue(names.addFromString("rate", "$C$1", null).isSingleCell());
        assertEquals("A1:A3", names.addFromString("col", "A1..A3", null).getReferenceText());
    }

    @Test
    void testRejectsInvalidNames() {
        assertThrows(InvalidNameException.class, () -> names.addFromString("A1", "B1", null));
        assertThrows(InvalidNameException.class, () -> names.addFromString("1abc", "B1", null));
        assertThrows(InvalidNameException.class, () -> names.addFromString("my name", "B1", null));
        assertTrue(NamedRangeManager.isValidName("TAX_2024"));
        assertFalse(NamedRangeManager.isValidName("IV65536"));
    }

    @Test
    void testRedefineAndDelete() {
        names.addFromString("x", "A1", null);
        names.addFromString("X", "B2", null);
        assertEquals(1, names.size());
        assertEquals("B2", names.get("x").getReferenceText());
        assertTrue(names.delete("x"));
        assertFalse(names.delete("x"));
        assertNull(names.resolve("x"));
    }

    @Test
    void testFindByCell() {
        names.addFromString("block", "A1:C3", null);
        names.addFromString("corner", "C3", null);
        assertEquals(2, names.findByCell(2, 2).size());
        assertEquals(1, names.findByCell(0, 0).size());
        assertTrue(names.findByCell(5, 5).isEmpty());
    }

    @Test
    void testInsertShiftsNamesAtOrAfterIndex() {
        names.addFromString("above", "A1", null);
        names.addFromString("span", "A1:A5", null);
        names.adjustForInsert(Axis.ROW, 2);
        assertEquals("A1", names.get("above").getReferenceText());
        assertEquals("A1:A6", names.get("span").getReferenceText());

        names.adjustForInsert(Axis.COLUMN, 0);
        assertEquals("B1", names.get("above").getReferenceText());
    }

    /**
     * A single-cell name on a deleted row disappears; a range spanning it shrinks.
     */
    @Test
    void testDeleteDropsSingleCellNames() {
        names.addFromString("gone", "A3", null);
        names.addFromString("span", "A1:A5", null);
        names.addFromString("below", "B9", null);
        assertEquals(Collections.singletonList("gone"), names.adjustForDelete(Axis.ROW, 2));
        assertFalse(names.exists("gone"));
        assertEquals("A1:A4", names.get("span").getReferenceText());
        assertEquals("B8", names.get("below").getReferenceText());
    }
}
