package com.gridcalc.formula.functions;

import com.gridcalc.exceptions.FormulaException;
import com.gridcalc.models.ErrorKind;
import com.gridcalc.models.Value;

import java.util.List;

/**
 * Conditionals, boolean operators and the IS* predicates.
 */
final class LogicalFunctions {

    private LogicalFunctions() {
    }

    static void register(FunctionRegistry registry) {
        registry.registerErrorAware("IF", LogicalFunctions::ifFunction);
        registry.register("TRUE", (args, ctx) -> constant(args, Value.TRUE));
        registry.register("FALSE", (args, ctx) -> constant(args, Value.FALSE));
        registry.register("AND", LogicalFunctions::and);
        registry.register("OR", LogicalFunctions::or);
        registry.register("NOT", (args, ctx) -> {
            Args.require(args, 1, 1);
            return Value.bool(!Args.bool(args, 0));
        });
        registry.register("XOR", LogicalFunctions::xor);
        registry.register("NA", (args, ctx) -> constant(args, Value.error(ErrorKind.NA)));
        registry.register("ERR", (args, ctx) -> constant(args, Value.error(ErrorKind.ERR)));
        registry.registerErrorAware("ISERR", (args, ctx) -> test(args, v -> v.isError() && v.getError() != ErrorKind.NA));
        registry.registerErrorAware("ISERROR", (args, ctx) -> test(args, Value::isError));
        registry.registerErrorAware("ISNA", (args, ctx) -> test(args, v -> v.isError() && v.getError() == ErrorKind.NA));
        registry.registerErrorAware("ISNUMBER", (args, ctx) -> test(args, Value::isNumber));
        registry.registerErrorAware("ISTEXT", (args, ctx) -> test(args, v -> v.isText() && !v.isEmpty()));
        registry.registerErrorAware("ISSTRING", (args, ctx) -> test(args, v -> v.isText() && !v.isEmpty()));
        registry.registerErrorAware("ISBLANK", (args, ctx) -> test(args, Value::isEmpty));
        registry.registerErrorAware("ISLOGICAL", (args, ctx) -> test(args, Value::isBoolean));
        registry.register("ISEVEN", (args, ctx) -> parity(args, 0));
        registry.register("ISODD", (args, ctx) -> parity(args, 1));
        registry.registerErrorAware("IFERROR", (args, ctx) -> fallback(args, false));
        registry.registerErrorAware("IFNA", (args, ctx) -> fallback(args, true));
        registry.registerErrorAware("SWITCH", LogicalFunctions::switchFunction);
        registry.registerErrorAware("CHOOSE", LogicalFunctions::choose);
    }

    private interface Predicate {
        boolean test(Value value);
    }

    private static Value constant(List<Value> args, Value value) {
        Args.require(args, 0, 0);
        return value;
    }

    private static void rejectError(Value value) {
        if (value.isError()) {
            throw new FormulaException(value.getError());
        }
    }

    private static Value ifFunction(List<Value> args, FunctionContext ctx) {
        Args.require(args, 2, 3);
        Value condition = Args.scalar(args.get(0));
        rejectError(condition);
        if (condition.toBoolean()) {
            return args.get(1);
        }
        return args.size() > 2 ? args.get(2) : Value.FALSE;
    }

    private static Value and(List<Value> args, FunctionContext ctx) {
        Args.require(args, 1, -1);
        boolean result = true;
        for (Value v : Args.flatten(args)) {
            if (!v.isEmpty()) {
                result &= v.toBoolean();
            }
        }
        return Value.bool(result);
    }

    private static Value or(List<Value> args, FunctionContext ctx) {
        Args.require(args, 1, -1);
        boolean result = false;
        for (Value v : Args.flatten(args)) {
            if (!v.isEmpty()) {
                result |= v.toBoolean();
            }
        }
        return Value.bool(result);
    }

    private static Value xor(List<Value> args, FunctionContext ctx) {
        Args.require(args, 1, -1);
        int trueCount = 0;
        for (Value v : Args.flatten(args)) {
            if (!v.isEmpty() && v.toBoolean()) {
                trueCount++;
            }
        }
        return Value.bool(trueCount % 2 == 1);
    }

    private static Value test(List<Value> args, Predicate predicate) {
        Args.require(args, 1, 1);
        Value arg = args.get(0);
        if (arg.isArray()) {
            List<List<Value>> rows = arg.getRows();
            arg = rows.isEmpty() || rows.get(0).isEmpty() ? Value.EMPTY : rows.get(0).get(0);
        }
        return Value.bool(predicate.test(arg));
    }

    private static Value parity(List<Value> args, int remainder) {
        Args.require(args, 1, 1);
        long n = (long) Args.number(args, 0);
        return Value.bool(Math.abs(n % 2) == remainder);
    }

    private static Value fallback(List<Value> args, boolean onlyNa) {
        Args.require(args, 2, 2);
        Value value = args.get(0);
        boolean replace = value.isError() && (!onlyNa || value.getError() == ErrorKind.NA);
        return replace ? args.get(1) : value;
    }

    /**
     * SWITCH(expr, match1, result1, ..., [default]); no match and no default is #N/A.
     */
    private static Value switchFunction(List<Value> args, FunctionContext ctx) {
        Args.require(args, 3, -1);
        Value subject = Args.scalar(args.get(0));
        rejectError(subject);
        int pairs = (args.size() - 1) / 2;
        for (int i = 0; i < pairs; i++) {
            Value candidate = Args.scalar(args.get(1 + 2 * i));
            if (sameValue(subject, candidate)) {
                return args.get(2 + 2 * i);
            }
        }
        if ((args.size() - 1) % 2 == 1) {
            return args.get(args.size() - 1);
        }
        return Value.error(ErrorKind.NA);
    }

    private static boolean sameValue(Value a, Value b) {
        if (a.isText() && b.isText()) {
            return a.getText().equalsIgnoreCase(b.getText());
        }
        return a.equals(b);
    }

    /**
     * CHOOSE(index, v1, v2, ...) with a 1-based index; out of range is #N/A.
     */
    private static Value choose(List<Value> args, FunctionContext ctx) {
        Args.require(args, 2, -1);
        Value index = Args.scalar(args.get(0));
        rejectError(index);
        int i = (int) index.toNumber();
        if (i < 1 || i >= args.size()) {
            return Value.error(ErrorKind.NA);
        }
        return args.get(i);
    }
}
