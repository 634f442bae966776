package com.gridcalc.formula.functions;

import com.gridcalc.models.Value;

import java.util.List;

/**
 * A built-in spreadsheet function. Arguments arrive already evaluated;
 * a range argument is a single ARRAY value.
 * Implementations may return an error value or throw
 * {@link com.gridcalc.exceptions.FormulaException}.
 */
@FunctionalInterface
public interface FormulaFunction {
    Value apply(List<Value> args, FunctionContext context);
}
