package com.gridcalc.formula.functions;

import com.gridcalc.models.Value;

import java.util.List;

/**
 * Value introspection: TYPE, ERROR.TYPE, N and VERSION.
 */
final class InfoFunctions {

    static final String VERSION = "GridCalc 1.0";

    private InfoFunctions() {
    }

    static void register(FunctionRegistry registry) {
        registry.registerErrorAware("TYPE", InfoFunctions::type);
        registry.registerErrorAware("ERROR.TYPE", InfoFunctions::errorType);
        registry.registerErrorAware("N", InfoFunctions::n);
        registry.register("VERSION", (args, ctx) -> {
            Args.require(args, 0, 0);
            return Value.text(VERSION);
        });
    }

    /**
     * 1 number, 2 text, 4 logical, 16 error, 64 range.
     */
    private static Value type(List<Value> args, FunctionContext ctx) {
        Args.require(args, 1, 1);
        switch (args.get(0).getType()) {
            case NUMBER:
                return Value.number(1);
            case TEXT:
                return Value.number(2);
            case BOOLEAN:
                return Value.number(4);
            case ERROR:
                return Value.number(16);
            default:
                return Value.number(64);
        }
    }

    // 0 when the argument is not an error
    private static Value errorType(List<Value> args, FunctionContext ctx) {
        Args.require(args, 1, 1);
        Value arg = args.get(0);
        return Value.number(arg.isError() ? arg.getError().getTypeCode() : 0);
    }

    private static Value n(List<Value> args, FunctionContext ctx) {
        Args.require(args, 1, 1);
        Value arg = args.get(0);
        if (arg.isArray()) {
            List<List<Value>> rows = arg.getRows();
            arg = rows.isEmpty() || rows.get(0).isEmpty() ? Value.EMPTY : rows.get(0).get(0);
        }
        if (arg.isNumber() || arg.isBoolean()) {
            return Value.number(arg.toNumber());
        }
        return Value.ZERO;
    }
}
