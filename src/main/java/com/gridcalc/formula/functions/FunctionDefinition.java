package com.gridcalc.formula.functions;

/**
 * A registered function. Unless {@code acceptsErrors} is set, the evaluator
 * returns the first error argument instead of calling the function.
 */
public class FunctionDefinition {
    private final String name;
    private final FormulaFunction function;
    private final boolean acceptsErrors;

    public FunctionDefinition(String name, FormulaFunction function, boolean acceptsErrors) {
        this.name = name;
        this.function = function;
        this.acceptsErrors = acceptsErrors;
    }

    public String getName() {
        return name;
    }
    public FormulaFunction getFunction() {
        return function;
    }
    public boolean acceptsErrors() {
        return acceptsErrors;
    }
}
