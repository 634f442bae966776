package com.gridcalc.formula.functions;

import com.gridcalc.exceptions.FormulaException;
import com.gridcalc.models.ErrorKind;
import com.gridcalc.models.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Arithmetic and trigonometric built-ins.
 */
final class MathFunctions {

    private MathFunctions() {
    }

    static void register(FunctionRegistry registry) {
        registry.register("SUM", (args, ctx) -> Value.number(Args.sum(Args.numbers(args))));
        registry.register("ABS", (args, ctx) -> Args.unary(args, Math::abs));
        registry.register("INT", (args, ctx) -> Args.unary(args, MathFunctions::truncate));
        registry.register("TRUNC", MathFunctions::trunc);
        registry.register("ROUND", MathFunctions::round);
        registry.register("MOD", MathFunctions::mod);
        registry.register("SQRT", (args, ctx) -> Args.unary(args, MathFunctions::sqrt));
        registry.register("POWER", (args, ctx) -> Args.binary(args, Math::pow));
        registry.register("SIGN", (args, ctx) -> Args.unary(args, Math::signum));
        registry.register("CEILING", (args, ctx) -> multiple(args, true));
        registry.register("FLOOR", (args, ctx) -> multiple(args, false));
        registry.register("FACT", (args, ctx) -> Args.unary(args, MathFunctions::factorial));
        registry.register("GCD", MathFunctions::gcd);
        registry.register("LCM", MathFunctions::lcm);
        registry.register("EXP", (args, ctx) -> Args.unary(args, Math::exp));
        registry.register("LN", (args, ctx) -> Args.unary(args, x -> log(x, Math.E)));
        registry.register("LOG", MathFunctions::log10);
        registry.register("SIN", (args, ctx) -> Args.unary(args, Math::sin));
        registry.register("COS", (args, ctx) -> Args.unary(args, Math::cos));
        registry.register("TAN", (args, ctx) -> Args.unary(args, Math::tan));
        registry.register("ASIN", (args, ctx) -> Args.unary(args, x -> inverseTrig(Math.asin(x))));
        registry.register("ACOS", (args, ctx) -> Args.unary(args, x -> inverseTrig(Math.acos(x))));
        registry.register("ATAN", (args, ctx) -> Args.unary(args, Math::atan));
        registry.register("ATAN2", MathFunctions::atan2);
        registry.register("DEGREES", (args, ctx) -> Args.unary(args, Math::toDegrees));
        registry.register("RADIANS", (args, ctx) -> Args.unary(args, Math::toRadians));
        registry.register("PI", (args, ctx) -> {
            Args.require(args, 0, 0);
            return Value.number(Math.PI);
        });
        registry.register("RAND", (args, ctx) -> {
            Args.require(args, 0, 0);
            return Value.number(ctx.getRandom().nextDouble());
        });
    }

    private static double truncate(double x) {
        return x < 0 ? Math.ceil(x) : Math.floor(x);
    }

    private static Value trunc(List<Value> args, FunctionContext ctx) {
        Args.require(args, 1, 2);
        double x = Args.number(args, 0);
        int digits = Args.integer(args, 1, 0);
        double scale = Math.pow(10, digits);
        return Value.number(truncate(x * scale) / scale);
    }

    /**
     * Rounds half away from zero, to a negative number of places if asked.
     */
    static double round(double x, int places) {
        if (Double.isNaN(x) || Double.isInfinite(x)) {
            return x;
        }
        return new BigDecimal(Double.toString(x)).setScale(places, RoundingMode.HALF_UP).doubleValue();
    }

    private static Value round(List<Value> args, FunctionContext ctx) {
        Args.require(args, 1, 2);
        return Value.number(round(Args.number(args, 0), Args.integer(args, 1, 0)));
    }

    private static Value mod(List<Value> args, FunctionContext ctx) {
        Args.require(args, 2, 2);
        double x = Args.number(args, 0);
        double y = Args.number(args, 1);
        if (y == 0) {
            throw new FormulaException(ErrorKind.DIV_ZERO);
        }
        return Value.number(x - y * Math.floor(x / y));
    }

    private static double sqrt(double x) {
        if (x < 0) {
            throw new FormulaException(ErrorKind.NUM, "Square root of a negative number");
        }
        return Math.sqrt(x);
    }

    private static Value multiple(List<Value> args, boolean up) {
        Args.require(args, 1, 2);
        double x = Args.number(args, 0);
        double significance = Args.number(args, 1, 1);
        if (significance == 0) {
            return Value.ZERO;
        }
        double steps = x / significance;
        return Value.number((up ? Math.ceil(steps) : Math.floor(steps)) * significance);
    }

    private static double factorial(double x) {
        if (x < 0) {
            throw new FormulaException(ErrorKind.NUM, "Factorial of a negative number");
        }
        double result = 1;
        for (int i = 2; i <= (int) x; i++) {
            result *= i;
        }
        return result;
    }

    private static long gcd(long a, long b) {
        while (b != 0) {
            long t = a % b;
            a = b;
            b = t;
        }
        return a;
    }

    private static Value gcd(List<Value> args, FunctionContext ctx) {
        Args.require(args, 1, -1);
        long result = 0;
        for (double n : Args.numbers(args)) {
            result = gcd(result, nonNegative(n));
        }
        return Value.number(result);
    }

    private static Value lcm(List<Value> args, FunctionContext ctx) {
        Args.require(args, 1, -1);
        long result = 1;
        for (double n : Args.numbers(args)) {
            long v = nonNegative(n);
            if (v == 0) {
                return Value.ZERO;
            }
            result = result / gcd(result, v) * v;
        }
        return Value.number(result);
    }

    private static long nonNegative(double n) {
        if (n < 0) {
            throw new FormulaException(ErrorKind.NUM, "Negative argument");
        }
        return (long) n;
    }

    private static double log(double x, double base) {
        if (x <= 0) {
            throw new FormulaException(ErrorKind.NUM, "Logarithm of a non-positive number");
        }
        return base == Math.E ? Math.log(x) : Math.log(x) / Math.log(base);
    }

    private static Value log10(List<Value> args, FunctionContext ctx) {
        Args.require(args, 1, 2);
        double base = Args.number(args, 1, 10);
        if (base <= 0 || base == 1) {
            throw new FormulaException(ErrorKind.NUM, "Invalid logarithm base");
        }
        return Value.number(log(Args.number(args, 0), base));
    }

    private static double inverseTrig(double result) {
        if (Double.isNaN(result)) {
            throw new FormulaException(ErrorKind.NUM, "Argument outside [-1, 1]");
        }
        return result;
    }

    // Lotus order: ATAN2(x, y)
    private static Value atan2(List<Value> args, FunctionContext ctx) {
        Args.require(args, 2, 2);
        double x = Args.number(args, 0);
        double y = Args.number(args, 1);
        if (x == 0 && y == 0) {
            throw new FormulaException(ErrorKind.DIV_ZERO);
        }
        return Value.number(Math.atan2(y, x));
    }
}
