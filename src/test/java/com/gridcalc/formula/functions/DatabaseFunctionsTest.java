package com.gridcalc.formula.functions;

import com.gridcalc.models.ErrorKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Database A1:C5 (Name, Dept, Salary) and criteria blocks in E1:H2.
 */
class DatabaseFunctionsTest extends AbstractFunctionTest {

    @BeforeEach
    void fillDatabase() {
        String[][] rows = {
                {"Name", "Dept", "Salary"},
                {"Ann", "Eng", "100"},
                {"Bob", "Ops", "80"},
                {"Cid", "Eng", "120"},
                {"Dee", "Ops", ""}};
        for (int r = 0; r < rows.length; r++) {
            for (int c = 0; c < rows[r].length; c++) {
                sheet.setCell(r, c, rows[r][c]);
            }
        }
        sheet.setCell("E1", "Dept");
        sheet.setCell("E2", "eng");
        sheet.setCell("F1", "Salary");
        sheet.setCell("F2", "<90");
        sheet.setCell("G1", "Name");
        sheet.setCell("G2", "?o*");
    }

    @Test
    void testAggregatesOverMatchingRows() {
        assertNumber(220, "=DSUM(A1:C5, \"Salary\", E1:E2)");
        assertNumber(220, "=DSUM(A1:C5, 3, E1:E2)");
        assertNumber(2, "=DCOUNT(A1:C5, \"salary\", E1:E2)");
        assertNumber(110, "=DAVG(A1:C5, \"Salary\", E1:E2)");
        assertNumber(120, "=DMAX(A1:C5, \"Salary\", E1:E2)");
        assertNumber(100, "=DMIN(A1:C5, \"Salary\", E1:E2)");
        assertNumber(100, "=DVARP(A1:C5, \"Salary\", E1:E2)", 1e-9);
    }

    /**
     * A one-row criteria range has no conditions, so every record matches.
     */
    @Test
    void testHeaderOnlyCriteriaSelectsEverything() {
        assertNumber(4, "=DCOUNTA(A1:C5, 1, E1)");
        assertNumber(3, "=DCOUNT(A1:C5, 3, E1)");
    }

    @Test
    void testComparisonAndWildcardCriteria() {
        assertText("Bob", "=DGET(A1:C5, \"Name\", F1:F2)");
        assertNumber(80, "=DSUM(A1:C5, \"Salary\", G1:G2)");
        assertError(ErrorKind.NUM, "=DGET(A1:C5, \"Name\", E1:E2)");
    }

    @Test
    void testCriteriaRowsAreAlternatives() {
        sheet.setCell("E3", "Ops");
        assertNumber(4, "=DCOUNTA(A1:C5, \"Name\", E1:E3)");
    }

    @Test
    void testUnknownFieldOrNoMatch() {
        assertError(ErrorKind.VALUE, "=DSUM(A1:C5, \"Bonus\", E1:E2)");
        assertError(ErrorKind.VALUE, "=DSUM(A1:C5, 9, E1:E2)");
        sheet.setCell("E2", "Sales");
        assertError(ErrorKind.DIV_ZERO, "=DAVG(A1:C5, \"Salary\", E1:E2)");
        assertError(ErrorKind.VALUE, "=DGET(A1:C5, \"Name\", E1:E2)");
    }
}
