package com.gridcalc.formula.functions;

import com.gridcalc.models.ErrorKind;
import com.gridcalc.models.Value;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * A1:C3 is a small table keyed by 10, 20, 30 with a name and a price column.
 * E1:G1 holds the descending row 30, 20, 10.
 */
class LookupFunctionsTest extends AbstractFunctionTest {

    @BeforeEach
    void fillTable() {
        String[][] rows = {{"10", "apple", "1.5"}, {"20", "Banana", "0.25"}, {"30", "cherry", "4"}};
        for (int r = 0; r < rows.length; r++) {
            for (int c = 0; c < rows[r].length; c++) {
                sheet.setCell(r, c, rows[r][c]);
            }
        }
        sheet.setCell("E1", "30");
        sheet.setCell("F1", "20");
        sheet.setCell("G1", "10");
    }

    @Test
    void testVerticalLookup() {
        assertText("Banana", "=VLOOKUP(20, A1:C3, 2)");
        assertText("Banana", "=VLOOKUP(25, A1:C3, 2)");
        assertNumber(4, "=VLOOKUP(99, A1:C3, 3)");
        assertError(ErrorKind.NA, "=VLOOKUP(25, A1:C3, 2, FALSE)");
        assertError(ErrorKind.NA, "=VLOOKUP(5, A1:C3, 2)");
        assertError(ErrorKind.REF, "=VLOOKUP(20, A1:C3, 4)");
    }

    @Test
    void testHorizontalLookupAndTextKeys() {
        assertText("Banana", "=HLOOKUP(\"BANANA\", B2:C2, 1, 0)");
        assertNumber(20, "=HLOOKUP(20, E1:G1, 1, FALSE)");
        assertNumber(0.25, "=LOOKUP(20, A1:A3, C1:C3)");
    }

    @Test
    void testMatch() {
        assertNumber(3, "=MATCH(30, A1:A3, 0)");
        assertNumber(2, "=MATCH(25, A1:A3)");
        assertNumber(2, "=MATCH(\"banana\", B1:B3, 0)");
        assertNumber(1, "=MATCH(25, E1:G1, -1)");
        assertError(ErrorKind.NA, "=MATCH(5, A1:A3, 1)");
    }

    @Test
    void testIndex() {
        assertNumber(0.25, "=INDEX(A1:C3, 2, 3)");
        assertText("apple", "=INDEX(A1:C1, 2)");
        assertNumber(20, "=INDEX(A1:A3, 2)");
        assertError(ErrorKind.REF, "=INDEX(A1:C3, 4, 1)");
    }

    @Test
    void testIndirectReadsTheNamedCell() {
        sheet.setCell("D1", "B3");
        assertText("cherry", "=INDIRECT(D1)");
        assertError(ErrorKind.REF, "=INDIRECT(\"nowhere\")");
    }

    @Test
    void testRowAndColumnOfTheCurrentCell() {
        sheet.setCell("D7", "=ROW()*100+COLUMN()");
        assertEquals(Value.number(704), sheet.getValueByRef("D7"));
        assertError(ErrorKind.REF, "=ROW()");
    }

    @Test
    void testAddressAndShape() {
        assertText("$C$2", "=ADDRESS(2, 3)");
        assertText("C$2", "=ADDRESS(2, 3, 2)");
        assertText("$C2", "=ADDRESS(2, 3, 3)");
        assertText("C2", "=ADDRESS(2, 3, 4)");
        assertNumber(3, "=ROWS(A1:C3)");
        assertNumber(3, "=COLS(A1:C3)");
        assertNumber(1, "=COLUMNS(A1:A3)");
    }
}
