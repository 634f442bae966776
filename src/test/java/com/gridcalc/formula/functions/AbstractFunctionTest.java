package com.gridcalc.formula.functions;

import com.gridcalc.models.ErrorKind;
import com.gridcalc.models.Sheet;
import com.gridcalc.models.Value;
import org.junit.jupiter.api.BeforeEach;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Shared fixture for the built-in function tests: a sheet with a fixed clock
 * (2024-03-15 12:00 UTC) and a seeded random source.
 */
abstract class AbstractFunctionTest {

    static final Instant NOW = Instant.parse("2024-03-15T12:00:00Z");

    protected Sheet sheet;

    @BeforeEach
    void createSheet() {
        sheet = new Sheet(new FunctionRegistry(), Clock.fixed(NOW, ZoneOffset.UTC), new Random(42));
    }

    protected Value eval(String formula) {
        return sheet.evaluate(formula);
    }

    protected void assertNumber(double expected, String formula) {
        Value value = eval(formula);
        assertEquals(Value.number(expected), value, formula);
    }

    protected void assertNumber(double expected, String formula, double delta) {
        Value value = eval(formula);
        assertTrue(value.isNumber(), formula + " gave " + value);
        assertEquals(expected, value.getNumber(), delta, formula);
    }

    protected void assertText(String expected, String formula) {
        assertEquals(Value.text(expected), eval(formula), formula);
    }

    protected void assertBool(boolean expected, String formula) {
        assertEquals(Value.bool(expected), eval(formula), formula);
    }

    protected void assertError(ErrorKind expected, String formula) {
        assertEquals(Value.error(expected), eval(formula), formula);
    }
}
