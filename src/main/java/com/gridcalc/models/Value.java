package com.gridcalc.models;

import com.gridcalc.exceptions.FormulaException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Result of evaluating a cell or a sub-expression.
 * Exactly one of number / text / boolean / error is meaningful, chosen by {@link #getType()}.
 * An empty cell is represented as {@link #EMPTY}, i.e. Text("").
 */
public final class Value {

    public static final Value EMPTY = new Value(ValueType.TEXT, 0, "", false, null, null);
    public static final Value TRUE = new Value(ValueType.BOOLEAN, 0, null, true, null, null);
    public static final Value FALSE = new Value(ValueType.BOOLEAN, 0, null, false, null, null);
    public static final Value ZERO = new Value(ValueType.NUMBER, 0, null, false, null, null);

    private final ValueType type;
    private final double number;
    private final String text;
    private final boolean bool;
    private final ErrorKind error;
    // Row-major cells of a range argument
    private final List<List<Value>> rows;

    private Value(ValueType type, double number, String text, boolean bool,
                  ErrorKind error, List<List<Value>> rows) {
        this.type = type;
        this.number = number;
        this.text = text;
        this.bool = bool;
        this.error = error;
        this.rows = rows;
    }

    public static Value number(double number) {
        return new Value(ValueType.NUMBER, number, null, false, null, null);
    }

    public static Value text(String text) {
        if (text == null || text.isEmpty()) {
            return EMPTY;
        }
        return new Value(ValueType.TEXT, 0, text, false, null, null);
    }

    public static Value bool(boolean bool) {
        return bool ? TRUE : FALSE;
    }

    public static Value error(ErrorKind kind) {
        return new Value(ValueType.ERROR, 0, null, false, Objects.requireNonNull(kind), null);
    }

    public static Value array(List<List<Value>> rows) {
        List<List<Value>> copy = new ArrayList<>(rows.size());
        for (List<Value> row : rows) {
            copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }
        return new Value(ValueType.ARRAY, 0, null, false, null, Collections.unmodifiableList(copy));
    }

    // Basic getters
    public ValueType getType() {
        return type;
    }
    public boolean isNumber() {
        return type == ValueType.NUMBER;
    }
    public boolean isText() {
        return type == ValueType.TEXT;
    }
    public boolean isBoolean() {
        return type == ValueType.BOOLEAN;
    }
    public boolean isError() {
        return type == ValueType.ERROR;
    }
    public boolean isArray() {
        return type == ValueType.ARRAY;
    }

    /**
     * True for the empty text value, which is what blank cells evaluate to.
     */
    public boolean isEmpty() {
        return type == ValueType.TEXT && text.isEmpty();
    }

    public double getNumber() {
        return number;
    }
    public String getText() {
        return text;
    }
    public boolean getBoolean() {
        return bool;
    }
    public ErrorKind getError() {
        return error;
    }
    public List<List<Value>> getRows() {
        return rows;
    }

    /**
     * Coerces this value to a number for arithmetic.
     * Blank counts as 0, booleans as 1/0, numeric text is parsed.
     * Errors are rethrown as themselves; anything else is a type failure (#ERR!).
     */
    public double toNumber() {
        switch (type) {
            case NUMBER:
                return number;
            case BOOLEAN:
                return bool ? 1 : 0;
            case TEXT:
                if (text.isEmpty()) {
                    return 0;
                }
                Double parsed = parseNumber(text);
                if (parsed == null) {
                    throw new FormulaException(ErrorKind.ERR, "Not a number: " + text);
                }
                return parsed;
            case ERROR:
                throw new FormulaException(error);
            default:
                throw new FormulaException(ErrorKind.ERR, "Range used where a number was expected");
        }
    }

    /**
     * Coerces this value to text the way string functions see it.
     */
    public String toText() {
        switch (type) {
            case ERROR:
                throw new FormulaException(error);
            case ARRAY:
                throw new FormulaException(ErrorKind.ERR, "Range used where text was expected");
            default:
                return asDisplayText();
        }
    }

    /**
     * Coerces this value to a truth value: non-zero numbers and "TRUE" are true.
     */
    public boolean toBoolean() {
        switch (type) {
            case BOOLEAN:
                return bool;
            case NUMBER:
                return number != 0;
            case TEXT:
                if (text.isEmpty()) {
                    return false;
                }
                if ("TRUE".equalsIgnoreCase(text)) {
                    return true;
                }
                if ("FALSE".equalsIgnoreCase(text)) {
                    return false;
                }
                return toNumber() != 0;
            case ERROR:
                throw new FormulaException(error);
            default:
                throw new FormulaException(ErrorKind.ERR, "Range used where a condition was expected");
        }
    }

    /**
     * Renders the value the way a cell shows it without an explicit format.
     */
    public String asDisplayText() {
        switch (type) {
            case NUMBER:
                return formatNumber(number);
            case BOOLEAN:
                return bool ? "TRUE" : "FALSE";
            case ERROR:
                return error.getText();
            case ARRAY:
                return rows.isEmpty() || rows.get(0).isEmpty() ? "" : rows.get(0).get(0).asDisplayText();
            default:
                return text;
        }
    }

    /**
     * Parses numeric text, allowing thousands separators. Returns null when not numeric.
     */
    public static Double parseNumber(String raw) {
        String trimmed = raw.trim().replace(",", "");
        if (trimmed.isEmpty()) {
            return null;
        }
        char last = Character.toLowerCase(trimmed.charAt(trimmed.length() - 1));
        // Double.parseDouble accepts "1d", "1f", "NaN" and "Infinity"
        if (!Character.isDigit(last) && last != '.') {
            return null;
        }
        try {
            return Double.parseDouble(trimmed);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public static String formatNumber(double number) {
        if (number == Math.rint(number) && Math.abs(number) < 1e15) {
            return Long.toString((long) number);
        }
        return Double.toString(number);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Value)) {
            return false;
        }
        Value other = (Value) o;
        if (type != other.type) {
            return false;
        }
        switch (type) {
            case NUMBER:
                return Double.compare(number, other.number) == 0;
            case TEXT:
                return text.equals(other.text);
            case BOOLEAN:
                return bool == other.bool;
            case ERROR:
                return error == other.error;
            default:
                return rows.equals(other.rows);
        }
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, number, text, bool, error, rows);
    }

    @Override
    public String toString() {
        return type == ValueType.TEXT ? "\"" + text + "\"" : asDisplayText();
    }
}
