package com.gridcalc.formula.functions;

import com.gridcalc.models.ErrorKind;
import org.junit.jupiter.api.Test;

class LogicalFunctionsTest extends AbstractFunctionTest {

    /**
     * IF sees error arguments, so only the branch it returns matters.
     */
    @Test
    void testIfReturnsOnlyTheChosenBranch() {
        sheet.setCell("A1", "5");
        assertText("big", "=IF(A1>2, \"big\", \"small\")");
        assertText("small", "=IF(A1>9, \"big\", \"small\")");
        assertBool(false, "=IF(0, 1)");
        assertNumber(2, "=IF(0, 1/0, 2)");
        assertError(ErrorKind.DIV_ZERO, "=IF(1, 1/0, 2)");
        assertError(ErrorKind.DIV_ZERO, "=IF(1/0, 1, 2)");
        assertText("yes", "=IF(\"TRUE\", \"yes\", \"no\")");
    }

    @Test
    void testBooleanOperators() {
        assertBool(false, "=AND(1, TRUE, 0)");
        assertBool(true, "=AND(1, Z9)");
        assertBool(true, "=OR(0, FALSE, 3)");
        assertBool(false, "=NOT(1)");
        assertBool(true, "=XOR(1, 1, 1)");
        assertBool(false, "=XOR(1, 1)");
        assertBool(true, "=TRUE()");
    }

    /**
     * ISERR excludes #N/A; ISERROR does not.
     */
    @Test
    void testPredicates() {
        assertBool(false, "=ISERR(NA())");
        assertBool(true, "=ISERROR(NA())");
        assertBool(true, "=ISNA(NA())");
        assertBool(true, "=ISERR(1/0)");
        assertBool(false, "=ISNUMBER(\"1\")");
        assertBool(true, "=ISNUMBER(1)");
        assertBool(true, "=ISTEXT(\"a\")");
        assertBool(true, "=ISSTRING(\"a\")");
        assertBool(true, "=ISBLANK(Z99)");
        assertBool(false, "=ISTEXT(Z99)");
        assertBool(true, "=ISLOGICAL(FALSE)");
        assertBool(true, "=ISEVEN(-4)");
        assertBool(true, "=ISODD(7)");
    }

    @Test
    void testErrorFallbacks() {
        assertText("x", "=IFERROR(1/0, \"x\")");
        assertNumber(3, "=IFERROR(3, \"x\")");
        assertError(ErrorKind.DIV_ZERO, "=IFNA(1/0, \"x\")");
        assertText("x", "=IFNA(NA(), \"x\")");
        assertError(ErrorKind.ERR, "=ERR()");
    }

    @Test
    void testSwitchAndChoose() {
        assertNumber(2, "=SWITCH(\"b\", \"a\", 1, \"B\", 2)");
        assertError(ErrorKind.NA, "=SWITCH(9, 1, 2)");
        assertText("other", "=SWITCH(9, 1, 2, \"other\")");
        assertText("b", "=CHOOSE(2, \"a\", \"b\", \"c\")");
        assertError(ErrorKind.NA, "=CHOOSE(5, \"a\", \"b\")");
        assertError(ErrorKind.NA, "=CHOOSE(0, \"a\")");
    }
}
