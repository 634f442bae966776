package com.gridcalc.formula.functions;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class InfoFunctionsTest extends AbstractFunctionTest {

    @Test
    void testType() {
        assertNumber(1, "=TYPE(1)");
        assertNumber(2, "=TYPE(\"a\")");
        assertNumber(4, "=TYPE(TRUE)");
        assertNumber(16, "=TYPE(1/0)");
        assertNumber(64, "=TYPE(A1:A2)");
    }

    /**
     * ERROR.TYPE of a value that is not an error is 0.
     */
    @Test
    void testErrorType() {
        assertNumber(2, "=ERROR.TYPE(1/0)");
        assertNumber(7, "=ERROR.TYPE(NA())");
        assertNumber(4, "=ERROR.TYPE(NOWHERE)");
        assertNumber(5, "=ERROR.TYPE(NOSUCH(1))");
        assertNumber(0, "=ERROR.TYPE(1)");
    }

    @Test
    void testN() {
        assertNumber(0, "=N(\"x\")");
        assertNumber(1, "=N(TRUE)");
        assertNumber(0, "=N(1/0)");
        sheet.setCell("A1", "7");
        assertNumber(7, "=N(A1:A3)");
    }

    @Test
    void testRegistry() {
        FunctionRegistry registry = new FunctionRegistry();
        assertTrue(registry.exists("sum"));
        assertTrue(registry.get("IsErr").acceptsErrors());
        assertFalse(registry.get("SUM").acceptsErrors());
        assertNull(registry.get("NOSUCH"));
        assertTrue(registry.size() > 150);
        assertText(InfoFunctions.VERSION, "=VERSION()");
    }
}
