package com.gridcalc.formula.functions;

import com.gridcalc.formula.EvaluationContext;
import com.gridcalc.formula.SpreadsheetAccess;

import java.time.Clock;
import java.util.Random;

/**
 * Everything a built-in may consult besides its arguments.
 * The clock and random source are injected so NOW, TODAY and RAND
 * are reproducible under test.
 */
public class FunctionContext {
    private final Clock clock;
    private final Random random;
    private final EvaluationContext evaluationContext;
    private final SpreadsheetAccess spreadsheet;

    public FunctionContext(Clock clock, Random random,
                           EvaluationContext evaluationContext, SpreadsheetAccess spreadsheet) {
        this.clock = clock;
        this.random = random;
        this.evaluationContext = evaluationContext;
        this.spreadsheet = spreadsheet;
    }

    public Clock getClock() {
        return clock;
    }
    public Random getRandom() {
        return random;
    }
    public EvaluationContext getEvaluationContext() {
        return evaluationContext;
    }
    public SpreadsheetAccess getSpreadsheet() {
        return spreadsheet;
    }
}
