package com.gridcalc.references;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ReferenceAdjusterTest {

    private static final int MAX_ROW = 65535;
    private static final int MAX_COL = 255;

    @Test
    void testCopyShiftsRelativeParts() {
        assertEquals("=B3+$A$1+C$1+$A3",
                ReferenceAdjuster.adjustForCopy("=A2+$A$1+B$1+$A2", 1, 1, MAX_ROW, MAX_COL));
        assertEquals("=SUM(B2:B6)", ReferenceAdjuster.adjustForCopy("=SUM(A1:A5)", 1, 1, MAX_ROW, MAX_COL));
    }

    /**
     * Copying there and back again restores the formula when nothing was clamped.
     */
    @Test
    void testCopyThereAndBack() {
        String formula = "=IF(A1>0, SUM(A1..B4), \"A1\") * $C$2";
        String moved = ReferenceAdjuster.adjustForCopy(formula, 3, 2, MAX_ROW, MAX_COL);
        assertEquals(formula, ReferenceAdjuster.adjustForCopy(moved, -3, -2, MAX_ROW, MAX_COL));
    }

    @Test
    void testCopyLeavesStringsFunctionsAndSpacingAlone() {
        assertEquals("=ROUND( B2 , 2 ) & \"C3\"",
                ReferenceAdjuster.adjustForCopy("=ROUND( A1 , 2 ) & \"C3\"", 1, 1, MAX_ROW, MAX_COL));
        assertEquals("=A1", ReferenceAdjuster.adjustForCopy("=A1", 0, 0, MAX_ROW, MAX_COL));
    }

    @Test
    void testCopyClampsAtTheEdge() {
        assertEquals("=A1", ReferenceAdjuster.adjustForCopy("=B2", -5, -5, MAX_ROW, MAX_COL));
    }

    @Test
    void testInsertRowMovesReferencesAtOrBelow() {
        assertEquals("=SUM(A1:A4)+$B$5",
                ReferenceAdjuster.adjustForStructuralChange("=SUM(A1:A3)+$B$4", Axis.ROW, 1, 1, MAX_ROW, MAX_COL));
    }

    @Test
    void testDeleteColumnTurnsReferenceIntoRefError() {
        assertEquals("=#REF!", ReferenceAdjuster.adjustForStructuralChange("=B1", Axis.COLUMN, 1, -1,
                MAX_ROW, MAX_COL));
        assertEquals("=B1*2", ReferenceAdjuster.adjustForStructuralChange("=C1*2", Axis.COLUMN, 1, -1,
                MAX_ROW, MAX_COL));
        assertEquals("=A1", ReferenceAdjuster.adjustForStructuralChange("=A1", Axis.COLUMN, 1, -1,
                MAX_ROW, MAX_COL));
    }

    @Test
    void testInsertPushingPastTheGridIsRefError() {
        assertEquals("=#REF!", ReferenceAdjuster.adjustForStructuralChange("=A65536", Axis.ROW, 0, 1,
                MAX_ROW, MAX_COL));
    }
}
