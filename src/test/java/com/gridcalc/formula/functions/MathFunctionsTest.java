package com.gridcalc.formula.functions;

import com.gridcalc.models.ErrorKind;
import com.gridcalc.models.Value;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MathFunctionsTest extends AbstractFunctionTest {

    @Test
    void testSumSkipsTextInRanges() {
        sheet.setCell("A1", "1");
        sheet.setCell("A2", "text");
        sheet.setCell("A3", "2.5");
        assertNumber(3.5, "=SUM(A1:A3)");
        assertNumber(6, "=SUM(1, \"2\", 3)");
        assertNumber(0, "=SUM(Z1:Z5)");
    }

    /**
     * ROUND goes half away from zero, also for negative places.
     */
    @Test
    void testRounding() {
        assertNumber(3, "=ROUND(2.5)");
        assertNumber(-3, "=ROUND(-2.5)");
        assertNumber(1.01, "=ROUND(1.005, 2)");
        assertNumber(1200, "=ROUND(1234.567, -2)");
        assertNumber(-3, "=INT(-3.7)");
        assertNumber(3.78, "=TRUNC(3.789, 2)");
        assertNumber(4.5, "=CEILING(4.3, 0.5)");
        assertNumber(4, "=FLOOR(4.3, 0.5)");
    }

    @Test
    void testModTakesTheDivisorSign() {
        assertNumber(2, "=MOD(-7, 3)");
        assertNumber(-2, "=MOD(7, -3)");
        assertError(ErrorKind.DIV_ZERO, "=MOD(7, 0)");
    }

    @Test
    void testDomainErrors() {
        assertError(ErrorKind.NUM, "=SQRT(-1)");
        assertError(ErrorKind.NUM, "=LN(0)");
        assertError(ErrorKind.NUM, "=ASIN(2)");
        assertError(ErrorKind.NUM, "=FACT(-1)");
        assertError(ErrorKind.DIV_ZERO, "=ATAN2(0, 0)");
        assertError(ErrorKind.ERR, "=ABS(1, 2)");
    }

    @Test
    void testIntegerFunctions() {
        assertNumber(120, "=FACT(5)");
        assertNumber(6, "=GCD(12, 18)");
        assertNumber(12, "=LCM(4, 6)");
        assertNumber(1, "=SIGN(42)");
    }

    @Test
    void testTranscendental() {
        assertNumber(3, "=LOG(1000)", 1e-12);
        assertNumber(3, "=LOG(8, 2)", 1e-12);
        assertNumber(1, "=LN(EXP(1))", 1e-12);
        assertNumber(Math.PI / 4, "=ATAN2(1, 1)", 1e-12);
        assertNumber(180, "=DEGREES(PI())", 1e-9);
        assertNumber(8, "=POWER(2, 3)");
    }

    @Test
    void testRandIsInUnitInterval() {
        for (int i = 0; i < 20; i++) {
            Value value = eval("=RAND()");
            assertTrue(value.getNumber() >= 0 && value.getNumber() < 1);
        }
    }
}
