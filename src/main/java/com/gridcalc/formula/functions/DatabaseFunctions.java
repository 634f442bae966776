package com.gridcalc.formula.functions;

import com.gridcalc.exceptions.FormulaException;
import com.gridcalc.models.ErrorKind;
import com.gridcalc.models.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

/**
 * D* functions: {@code Dxxx(database, field, criteria)} aggregates one field over the
 * database rows selected by a criteria range. Both ranges start with a header row.
 * Criteria rows are alternatives; the conditions within one row must all hold.
 */
final class DatabaseFunctions {

    private DatabaseFunctions() {
    }

    private interface Aggregate {
        Value apply(List<Value> fieldValues);
    }

    static void register(FunctionRegistry registry) {
        registry.register("DSUM", (args, ctx) -> query(args, values -> Value.number(Args.sum(numeric(values)))));
        registry.register("DAVG", (args, ctx) -> query(args, DatabaseFunctions::average));
        registry.register("DAVERAGE", (args, ctx) -> query(args, DatabaseFunctions::average));
        registry.register("DCOUNT", (args, ctx) -> query(args, values -> Value.number(numeric(values).size())));
        registry.register("DCOUNTA", (args, ctx) -> query(args, DatabaseFunctions::countNonEmpty));
        registry.register("DMIN", (args, ctx) -> query(args, values -> extreme(values, false)));
        registry.register("DMAX", (args, ctx) -> query(args, values -> extreme(values, true)));
        registry.register("DSTD", (args, ctx) -> query(args, values ->
                Value.number(Math.sqrt(StatisticalFunctions.varianceOf(numeric(values), false)))));
        registry.register("DSTDP", (args, ctx) -> query(args, values ->
                Value.number(Math.sqrt(StatisticalFunctions.varianceOf(numeric(values), false)))));
        registry.register("DSTDEV", (args, ctx) -> query(args, values ->
                Value.number(Math.sqrt(StatisticalFunctions.varianceOf(numeric(values), true)))));
        registry.register("DVAR", (args, ctx) -> query(args, values ->
                Value.number(StatisticalFunctions.varianceOf(numeric(values), false))));
        registry.register("DVARP", (args, ctx) -> query(args, values ->
                Value.number(StatisticalFunctions.varianceOf(numeric(values), false))));
        registry.register("DGET", (args, ctx) -> query(args, DatabaseFunctions::single));
    }

    private static Value query(List<Value> args, Aggregate aggregate) {
        Args.require(args, 3, 3);
        List<List<Value>> database = Args.table(args.get(0));
        List<List<Value>> criteria = Args.table(args.get(2));
        if (database.isEmpty()) {
            throw new FormulaException(ErrorKind.VALUE, "Empty database");
        }
        List<Value> headers = database.get(0);
        int field = fieldIndex(headers, Args.scalar(args.get(1)));
        List<Value> selected = new ArrayList<>();
        for (List<Value> row : database.subList(1, database.size())) {
            if (matches(row, headers, criteria)) {
                selected.add(field < row.size() ? row.get(field) : Value.EMPTY);
            }
        }
        return aggregate.apply(selected);
    }

    /**
     * Column of {@code field}: a 1-based number or a header name (case-insensitive).
     */
    static int fieldIndex(List<Value> headers, Value field) {
        if (field.isNumber()) {
            int index = (int) field.getNumber() - 1;
            if (index >= 0 && index < headers.size()) {
                return index;
            }
        } else {
            String name = field.toText();
            for (int i = 0; i < headers.size(); i++) {
                if (headers.get(i).asDisplayText().equalsIgnoreCase(name)) {
                    return i;
                }
            }
        }
        throw new FormulaException(ErrorKind.VALUE, "Unknown field " + field);
    }

    static boolean matches(List<Value> row, List<Value> headers, List<List<Value>> criteria) {
        if (criteria.size() < 2) {
            return true;
        }
        List<Value> criteriaHeaders = criteria.get(0);
        for (List<Value> conditions : criteria.subList(1, criteria.size())) {
            if (rowMatches(row, headers, criteriaHeaders, conditions)) {
                return true;
            }
        }
        return false;
    }

    private static boolean rowMatches(List<Value> row, List<Value> headers,
                                      List<Value> criteriaHeaders, List<Value> conditions) {
        for (int i = 0; i < conditions.size() && i < criteriaHeaders.size(); i++) {
            Value condition = conditions.get(i);
            if (condition.isEmpty()) {
                continue;
            }
            int column = -1;
            String header = criteriaHeaders.get(i).asDisplayText();
            for (int j = 0; j < headers.size(); j++) {
                if (headers.get(j).asDisplayText().equalsIgnoreCase(header)) {
                    column = j;
                    break;
                }
            }
            if (column < 0 || column >= row.size() || !conditionHolds(row.get(column), condition)) {
                return false;
            }
        }
        return true;
    }

    /**
     * One criteria cell against one database cell. Text criteria may start with
     * a comparison operator and may contain {@code *} and {@code ?} wildcards.
     */
    static boolean conditionHolds(Value cell, Value condition) {
        if (condition.isNumber()) {
            return cell.isNumber() && cell.getNumber() == condition.getNumber();
        }
        String text = condition.asDisplayText();
        String[] operators = {">=", "<=", "<>", "!=", ">", "<", "="};
        for (String op : operators) {
            if (text.startsWith(op)) {
                return compare(cell, op, text.substring(op.length()).trim());
            }
        }
        return textEquals(cell, text);
    }

    private static boolean compare(Value cell, String op, String operand) {
        if ("=".equals(op)) {
            return textEquals(cell, operand);
        }
        if ("<>".equals(op) || "!=".equals(op)) {
            return !textEquals(cell, operand);
        }
        Double limit = Value.parseNumber(operand);
        if (limit == null || !cell.isNumber()) {
            return false;
        }
        double x = cell.getNumber();
        switch (op) {
            case ">=":
                return x >= limit;
            case "<=":
                return x <= limit;
            case ">":
                return x > limit;
            default:
                return x < limit;
        }
    }

    private static boolean textEquals(Value cell, String pattern) {
        Double number = Value.parseNumber(pattern);
        if (number != null && cell.isNumber()) {
            return cell.getNumber() == number;
        }
        String value = cell.asDisplayText();
        if (pattern.indexOf('*') >= 0 || pattern.indexOf('?') >= 0) {
            return wildcard(pattern).matcher(value).matches();
        }
        return value.equalsIgnoreCase(pattern);
    }

    static Pattern wildcard(String pattern) {
        StringBuilder regex = new StringBuilder();
        for (char c : pattern.toCharArray()) {
            if (c == '*') {
                regex.append(".*");
            } else if (c == '?') {
                regex.append('.');
            } else {
                regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return Pattern.compile(regex.toString(), Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    }

    private static List<Double> numeric(List<Value> values) {
        List<Double> result = new ArrayList<>();
        for (Value v : values) {
            if (v.isError()) {
                throw new FormulaException(v.getError());
            }
            if (v.isNumber()) {
                result.add(v.getNumber());
            }
        }
        return result;
    }

    private static Value average(List<Value> values) {
        List<Double> numbers = numeric(values);
        if (numbers.isEmpty()) {
            throw new FormulaException(ErrorKind.DIV_ZERO, "No matching numeric values");
        }
        return Value.number(StatisticalFunctions.mean(numbers));
    }

    private static Value countNonEmpty(List<Value> values) {
        int count = 0;
        for (Value v : values) {
            if (!v.isEmpty()) {
                count++;
            }
        }
        return Value.number(count);
    }

    private static Value extreme(List<Value> values, boolean max) {
        List<Double> numbers = numeric(values);
        if (numbers.isEmpty()) {
            return Value.ZERO;
        }
        return Value.number(max ? Collections.max(numbers) : Collections.min(numbers));
    }

    // Exactly one matching record
    private static Value single(List<Value> values) {
        if (values.isEmpty()) {
            throw new FormulaException(ErrorKind.VALUE, "No matching record");
        }
        if (values.size() > 1) {
            throw new FormulaException(ErrorKind.NUM, "More than one matching record");
        }
        return values.get(0);
    }
}
