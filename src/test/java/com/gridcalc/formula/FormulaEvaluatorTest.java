package com.gridcalc.formula;

import com.gridcalc.formula.functions.FunctionRegistry;
import com.gridcalc.models.ErrorKind;
import com.gridcalc.models.Sheet;
import com.gridcalc.models.Value;
import com.gridcalc.recalc.RecalcMode;
import com.gridcalc.recalc.RecalcOrder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Evaluator behaviour against a small sheet:
 * A1=10, A2=20, A3=30, B1="abc", B2 the label '5, C1=1/0.
 */
class FormulaEvaluatorTest {

    private Sheet sheet;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-03-15T12:00:00Z"), ZoneOffset.UTC);
        sheet = new Sheet(new FunctionRegistry(), clock, new Random(3));
        sheet.setCell("A1", "10");
        sheet.setCell("A2", "20");
        sheet.setCell("A3", "30");
        sheet.setCell("B1", "abc");
        sheet.setCell("B2", "'5");
        sheet.setCell("C1", "=1/0");
    }

    private Value eval(String formula) {
        return sheet.evaluate(formula);
    }

    private static Value num(double n) {
        return Value.number(n);
    }

    @Test
    void testPrecedence() {
        assertEquals(num(14), eval("=2+3*4"));
        assertEquals(num(20), eval("=(2+3)*4"));
        assertEquals(num(1), eval("=7%3"));
        assertEquals(num(64), eval("=2^3^2"));
        assertEquals(num(11), eval("=3+2^3"));
    }

    /**
     * A unary sign binds to the atom, so it is applied before "^".
     */
    @Test
    void testUnarySign() {
        assertEquals(num(4), eval("=-2^2"));
        assertEquals(num(-8), eval("=-A1+2"));
        assertEquals(num(10), eval("=+A1"));
        assertEquals(num(10), eval("=--A1"));
    }

    @Test
    void testComparisonIsLowestPrecedence() {
        assertEquals(Value.TRUE, eval("=A1+5>A1*1.2"));
        assertEquals(Value.TRUE, eval("=B1=\"abc\""));
        assertEquals(Value.FALSE, eval("=B1=\"ABC\""));
        assertEquals(Value.FALSE, eval("=A1=B1"));
        assertEquals(Value.TRUE, eval("=A1<>B1"));
        assertEquals(Value.error(ErrorKind.ERR), eval("=A1<B1"));
        assertEquals(Value.TRUE, eval("=Z99=0"));
    }

    @Test
    void testCoercion() {
        assertEquals(num(6), eval("=B2+1"));
        assertEquals(Value.error(ErrorKind.ERR), eval("=B1*2"));
        assertEquals(num(11), eval("=TRUE+A1"));
        assertEquals(num(0), eval("=Z1*5"));
    }

    @Test
    void testErrorsPassThroughUnchanged() {
        assertEquals(Value.error(ErrorKind.DIV_ZERO), eval("=C1+1"));
        assertEquals(Value.error(ErrorKind.DIV_ZERO), eval("=1+C1*B1"));
        assertEquals(Value.error(ErrorKind.DIV_ZERO), eval("=-C1"));
        assertEquals(Value.error(ErrorKind.DIV_ZERO), eval("=C1>1"));
        assertEquals(Value.error(ErrorKind.DIV_ZERO), eval("=SUM(A1, C1)"));
        assertEquals("#DIV/0!", eval("=(C1+A1)*(C1-A1)/C1").asDisplayText());
    }

    @Test
    void testReferencesAndRanges() {
        assertEquals(num(60), eval("=SUM(A1:A3)"));
        assertEquals(num(60), eval("=@SUM(A1..A3)"));
        assertEquals(num(60), eval("=SUM(A3:A1)"));
        assertEquals(Value.error(ErrorKind.VALUE), eval("=A1:A3"));
        assertEquals(Value.error(ErrorKind.VALUE), eval("=A1:A3+1"));
    }

    @Test
    void testUnknownNamesAndFunctions() {
        assertEquals(Value.error(ErrorKind.REF), eval("=SALES*2"));
        assertEquals(Value.error(ErrorKind.REF), eval("=#REF!"));
        assertEquals(Value.error(ErrorKind.NAME), eval("=NOSUCHFN(1)"));
        assertEquals(Value.error(ErrorKind.REF), eval("=IW1"));
    }

    @Test
    void testSyntaxErrors() {
        assertEquals(Value.error(ErrorKind.ERR), eval("=(1+2"));
        assertEquals(Value.error(ErrorKind.ERR), eval("=1 2"));
        assertEquals(Value.error(ErrorKind.ERR), eval("=*3"));
        assertEquals(Value.EMPTY, eval("="));
    }

    @Test
    void testArithmeticOverflowAndDomain() {
        assertEquals(Value.error(ErrorKind.ERR), eval("=10^400"));
        assertEquals(Value.error(ErrorKind.NUM), eval("=(-8)^0.5"));
        assertEquals(Value.error(ErrorKind.DIV_ZERO), eval("=5%0"));
    }

    @Test
    void testStringsAndBooleans() {
        assertEquals(Value.text("a\"b"), eval("=\"a\"\"b\""));
        assertEquals(Value.FALSE, eval("=FALSE"));
        assertEquals(Value.text("abc"), eval("=B1"));
    }

    /**
     * Parenthesis nesting past the limit yields #REF! instead of overflowing the stack.
     */
    @Test
    void testNestingDepthIsBounded() {
        Sheet shallow = new Sheet(100, 26, 16, RecalcMode.AUTOMATIC, RecalcOrder.NATURAL,
                new FunctionRegistry(), Clock.systemUTC(), new Random(1));
        StringBuilder deep = new StringBuilder("=");
        for (int i = 0; i < 40; i++) {
            deep.append('(');
        }
        deep.append('1');
        for (int i = 0; i < 40; i++) {
            deep.append(')');
        }
        assertEquals(Value.error(ErrorKind.REF), shallow.evaluate(deep.toString()));
        assertEquals(num(1), shallow.evaluate("=((((1))))"));
    }
}
