package com.gridcalc.formula.functions;

import com.gridcalc.exceptions.FormulaException;
import com.gridcalc.models.ErrorKind;
import com.gridcalc.models.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.DoubleBinaryOperator;
import java.util.function.DoubleUnaryOperator;

/**
 * Argument checking and coercion shared by the built-in functions.
 */
final class Args {

    private Args() {
    }

    /**
     * Fails with #ERR! unless {@code min <= args.size() <= max}; a negative max means unbounded.
     */
    static void require(List<Value> args, int min, int max) {
        if (args.size() < min || (max >= 0 && args.size() > max)) {
            throw new FormulaException(ErrorKind.ERR, "Wrong number of arguments: " + args.size());
        }
    }

    static boolean present(List<Value> args, int index) {
        return index < args.size() && !args.get(index).isEmpty();
    }

    static double number(List<Value> args, int index) {
        return scalar(args.get(index)).toNumber();
    }

    static double number(List<Value> args, int index, double defaultValue) {
        return present(args, index) ? number(args, index) : defaultValue;
    }

    /**
     * Numeric argument truncated toward zero.
     */
    static int integer(List<Value> args, int index) {
        return (int) number(args, index);
    }

    static int integer(List<Value> args, int index, int defaultValue) {
        return present(args, index) ? integer(args, index) : defaultValue;
    }

    static String text(List<Value> args, int index) {
        return scalar(args.get(index)).toText();
    }

    static String text(List<Value> args, int index, String defaultValue) {
        return present(args, index) ? text(args, index) : defaultValue;
    }

    static boolean bool(List<Value> args, int index) {
        return scalar(args.get(index)).toBoolean();
    }

    static boolean bool(List<Value> args, int index, boolean defaultValue) {
        return present(args, index) ? bool(args, index) : defaultValue;
    }

    /**
     * A one-cell range behaves like its only value; larger ranges are rejected.
     */
    static Value scalar(Value value) {
        if (!value.isArray()) {
            return value;
        }
        List<List<Value>> rows = value.getRows();
        if (rows.size() == 1 && rows.get(0).size() == 1) {
            return rows.get(0).get(0);
        }
        throw new FormulaException(ErrorKind.VALUE, "Range used where a single value was expected");
    }

    /**
     * Arguments with ranges expanded into their cells, row by row.
     */
    static List<Value> flatten(List<Value> args) {
        List<Value> result = new ArrayList<>();
        for (Value arg : args) {
            if (arg.isArray()) {
                for (List<Value> row : arg.getRows()) {
                    result.addAll(row);
                }
            } else {
                result.add(arg);
            }
        }
        return result;
    }

    /**
     * Numbers for aggregate functions. Inside ranges only numeric cells count;
     * a direct argument is coerced (blank and non-numeric text are skipped).
     * Any error encountered aborts with that error.
     */
    static List<Double> numbers(List<Value> args) {
        List<Double> result = new ArrayList<>();
        for (Value arg : args) {
            if (arg.isArray()) {
                for (List<Value> row : arg.getRows()) {
                    for (Value cell : row) {
                        if (cell.isError()) {
                            throw new FormulaException(cell.getError());
                        }
                        if (cell.isNumber()) {
                            result.add(cell.getNumber());
                        }
                    }
                }
            } else if (arg.isError()) {
                throw new FormulaException(arg.getError());
            } else if (arg.isNumber() || arg.isBoolean()) {
                result.add(arg.toNumber());
            } else if (!arg.isEmpty()) {
                Double parsed = Value.parseNumber(arg.getText());
                if (parsed != null) {
                    result.add(parsed);
                }
            }
        }
        return result;
    }

    /**
     * The 2-D shape of an argument; a scalar is a 1x1 table.
     */
    static List<List<Value>> table(Value value) {
        if (value.isArray()) {
            return value.getRows();
        }
        return Collections.singletonList(Collections.singletonList(value));
    }

    static Value unary(List<Value> args, DoubleUnaryOperator op) {
        require(args, 1, 1);
        return Value.number(op.applyAsDouble(number(args, 0)));
    }

    static Value binary(List<Value> args, DoubleBinaryOperator op) {
        require(args, 2, 2);
        return Value.number(op.applyAsDouble(number(args, 0), number(args, 1)));
    }

    static double sum(List<Double> values) {
        double total = 0;
        for (double v : values) {
            total += v;
        }
        return total;
    }
}
