package com.gridcalc.formula.functions;

import com.gridcalc.exceptions.FormulaException;
import com.gridcalc.models.ErrorKind;
import com.gridcalc.models.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregates over numbers and ranges. Blank and text cells inside ranges are ignored.
 */
final class StatisticalFunctions {

    private StatisticalFunctions() {
    }

    static void register(FunctionRegistry registry) {
        registry.register("AVG", StatisticalFunctions::average);
        registry.register("AVERAGE", StatisticalFunctions::average);
        registry.register("COUNT", (args, ctx) -> Value.number(Args.numbers(args).size()));
        registry.register("COUNTA", StatisticalFunctions::countA);
        registry.register("COUNTBLANK", StatisticalFunctions::countBlank);
        registry.register("MIN", (args, ctx) -> extreme(args, false));
        registry.register("MAX", (args, ctx) -> extreme(args, true));
        registry.register("PRODUCT", StatisticalFunctions::product);
        registry.register("STD", (args, ctx) -> Value.number(Math.sqrt(variance(args, false))));
        registry.register("STDP", (args, ctx) -> Value.number(Math.sqrt(variance(args, false))));
        registry.register("STDS", (args, ctx) -> Value.number(Math.sqrt(variance(args, true))));
        registry.register("STDEV", (args, ctx) -> Value.number(Math.sqrt(variance(args, true))));
        registry.register("VAR", (args, ctx) -> Value.number(variance(args, false)));
        registry.register("VARP", (args, ctx) -> Value.number(variance(args, false)));
        registry.register("VARS", (args, ctx) -> Value.number(variance(args, true)));
        registry.register("SUMSQ", StatisticalFunctions::sumSquares);
        registry.register("MEDIAN", StatisticalFunctions::median);
        registry.register("MODE", StatisticalFunctions::mode);
        registry.register("LARGE", (args, ctx) -> kth(args, true));
        registry.register("SMALL", (args, ctx) -> kth(args, false));
        registry.register("RANK", StatisticalFunctions::rank);
        registry.register("PERCENTILE", StatisticalFunctions::percentile);
        registry.register("QUARTILE", StatisticalFunctions::quartile);
        registry.register("RANDBETWEEN", StatisticalFunctions::randBetween);
        registry.register("SUMPRODUCT", StatisticalFunctions::sumProduct);
        registry.register("PERMUT", StatisticalFunctions::permut);
        registry.register("COMBIN", StatisticalFunctions::combin);
        registry.register("GEOMEAN", StatisticalFunctions::geoMean);
        registry.register("HARMEAN", StatisticalFunctions::harMean);
    }

    private static List<Double> nonEmpty(List<Value> args) {
        List<Double> values = Args.numbers(args);
        if (values.isEmpty()) {
            throw new FormulaException(ErrorKind.DIV_ZERO, "No numeric values");
        }
        return values;
    }

    static double mean(List<Double> values) {
        return Args.sum(values) / values.size();
    }

    private static Value average(List<Value> args, FunctionContext ctx) {
        return Value.number(mean(nonEmpty(args)));
    }

    private static Value countA(List<Value> args, FunctionContext ctx) {
        int count = 0;
        for (Value v : Args.flatten(args)) {
            if (!v.isEmpty()) {
                count++;
            }
        }
        return Value.number(count);
    }

    private static Value countBlank(List<Value> args, FunctionContext ctx) {
        int count = 0;
        for (Value v : Args.flatten(args)) {
            if (v.isEmpty()) {
                count++;
            }
        }
        return Value.number(count);
    }

    private static Value extreme(List<Value> args, boolean max) {
        List<Double> values = Args.numbers(args);
        if (values.isEmpty()) {
            return Value.ZERO;
        }
        return Value.number(max ? Collections.max(values) : Collections.min(values));
    }

    private static Value product(List<Value> args, FunctionContext ctx) {
        List<Double> values = Args.numbers(args);
        if (values.isEmpty()) {
            return Value.ZERO;
        }
        double result = 1;
        for (double v : values) {
            result *= v;
        }
        return Value.number(result);
    }

    /**
     * Population variance, or sample variance when {@code sample} is set.
     */
    static double variance(List<Value> args, boolean sample) {
        return varianceOf(Args.numbers(args), sample);
    }

    static double varianceOf(List<Double> values, boolean sample) {
        int n = values.size();
        if (n == 0 || (sample && n < 2)) {
            throw new FormulaException(ErrorKind.DIV_ZERO, "Not enough values");
        }
        double mean = mean(values);
        double squares = 0;
        for (double v : values) {
            squares += (v - mean) * (v - mean);
        }
        return squares / (sample ? n - 1 : n);
    }

    private static Value sumSquares(List<Value> args, FunctionContext ctx) {
        double total = 0;
        for (double v : Args.numbers(args)) {
            total += v * v;
        }
        return Value.number(total);
    }

    private static List<Double> sorted(List<Value> args) {
        List<Double> values = new ArrayList<>(nonEmpty(args));
        Collections.sort(values);
        return values;
    }

    private static Value median(List<Value> args, FunctionContext ctx) {
        List<Double> values = sorted(args);
        int n = values.size();
        if (n % 2 == 1) {
            return Value.number(values.get(n / 2));
        }
        return Value.number((values.get(n / 2 - 1) + values.get(n / 2)) / 2);
    }

    private static Value mode(List<Value> args, FunctionContext ctx) {
        Map<Double, Integer> counts = new LinkedHashMap<>();
        for (double v : nonEmpty(args)) {
            counts.merge(v, 1, Integer::sum);
        }
        Double best = null;
        int bestCount = 1;
        for (Map.Entry<Double, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        if (best == null) {
            throw new FormulaException(ErrorKind.NA, "No repeated value");
        }
        return Value.number(best);
    }

    private static Value kth(List<Value> args, boolean largest) {
        Args.require(args, 2, 2);
        List<Double> values = sorted(args.subList(0, 1));
        int k = Args.integer(args, 1);
        if (k < 1 || k > values.size()) {
            throw new FormulaException(ErrorKind.NUM, "k out of range");
        }
        return Value.number(largest ? values.get(values.size() - k) : values.get(k - 1));
    }

    private static Value rank(List<Value> args, FunctionContext ctx) {
        Args.require(args, 2, 3);
        double x = Args.number(args, 0);
        List<Double> values = Args.numbers(args.subList(1, 2));
        boolean ascending = Args.integer(args, 2, 0) != 0;
        if (!values.contains(x)) {
            throw new FormulaException(ErrorKind.NA, "Value not in list");
        }
        int rank = 1;
        for (double v : values) {
            if (ascending ? v < x : v > x) {
                rank++;
            }
        }
        return Value.number(rank);
    }

    private static double percentile(List<Double> values, double p) {
        if (p < 0 || p > 1) {
            throw new FormulaException(ErrorKind.NUM, "Percentile outside [0, 1]");
        }
        double position = p * (values.size() - 1);
        int lower = (int) Math.floor(position);
        int upper = (int) Math.ceil(position);
        double fraction = position - lower;
        return values.get(lower) + fraction * (values.get(upper) - values.get(lower));
    }

    private static Value percentile(List<Value> args, FunctionContext ctx) {
        Args.require(args, 2, 2);
        return Value.number(percentile(sorted(args.subList(0, 1)), Args.number(args, 1)));
    }

    private static Value quartile(List<Value> args, FunctionContext ctx) {
        Args.require(args, 2, 2);
        int quart = Args.integer(args, 1);
        if (quart < 0 || quart > 4) {
            throw new FormulaException(ErrorKind.NUM, "Quartile outside 0..4");
        }
        return Value.number(percentile(sorted(args.subList(0, 1)), quart / 4.0));
    }

    private static Value randBetween(List<Value> args, FunctionContext ctx) {
        Args.require(args, 2, 2);
        long low = (long) Math.ceil(Args.number(args, 0));
        long high = (long) Math.floor(Args.number(args, 1));
        if (low > high) {
            throw new FormulaException(ErrorKind.NUM, "Bottom is greater than top");
        }
        return Value.number(low + (long) Math.floor(ctx.getRandom().nextDouble() * (high - low + 1)));
    }

    private static Value sumProduct(List<Value> args, FunctionContext ctx) {
        Args.require(args, 1, -1);
        List<List<Value>> arrays = new ArrayList<>();
        for (Value arg : args) {
            arrays.add(Args.flatten(Collections.singletonList(arg)));
        }
        int size = arrays.get(0).size();
        for (List<Value> array : arrays) {
            if (array.size() != size) {
                throw new FormulaException(ErrorKind.VALUE, "Ranges differ in size");
            }
        }
        double total = 0;
        for (int i = 0; i < size; i++) {
            double term = 1;
            for (List<Value> array : arrays) {
                Value cell = array.get(i);
                if (cell.isError()) {
                    throw new FormulaException(cell.getError());
                }
                term *= cell.isNumber() ? cell.getNumber() : 0;
            }
            total += term;
        }
        return Value.number(total);
    }

    private static Value permut(List<Value> args, FunctionContext ctx) {
        Args.require(args, 2, 2);
        int n = Args.integer(args, 0);
        int k = Args.integer(args, 1);
        if (n < 0 || k < 0 || k > n) {
            throw new FormulaException(ErrorKind.NUM, "Invalid PERMUT arguments");
        }
        double result = 1;
        for (int i = n - k + 1; i <= n; i++) {
            result *= i;
        }
        return Value.number(result);
    }

    private static Value combin(List<Value> args, FunctionContext ctx) {
        Args.require(args, 2, 2);
        int n = Args.integer(args, 0);
        int k = Args.integer(args, 1);
        if (n < 0 || k < 0 || k > n) {
            throw new FormulaException(ErrorKind.NUM, "Invalid COMBIN arguments");
        }
        k = Math.min(k, n - k);
        double result = 1;
        for (int i = 1; i <= k; i++) {
            result = result * (n - k + i) / i;
        }
        return Value.number(Math.rint(result));
    }

    private static Value geoMean(List<Value> args, FunctionContext ctx) {
        List<Double> values = nonEmpty(args);
        double logSum = 0;
        for (double v : values) {
            if (v <= 0) {
                throw new FormulaException(ErrorKind.NUM, "GEOMEAN needs positive values");
            }
            logSum += Math.log(v);
        }
        return Value.number(Math.exp(logSum / values.size()));
    }

    private static Value harMean(List<Value> args, FunctionContext ctx) {
        List<Double> values = nonEmpty(args);
        double reciprocals = 0;
        for (double v : values) {
            if (v <= 0) {
                throw new FormulaException(ErrorKind.NUM, "HARMEAN needs positive values");
            }
            reciprocals += 1 / v;
        }
        return Value.number(values.size() / reciprocals);
    }
}
