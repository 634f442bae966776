package com.gridcalc.models;

/**
 * Represents a single spreadsheet cell.
 * Stores:
 * - rawValue exactly as entered ("42", "'label", "=A1+1", "@SUM(A1..A3)")
 * - formatCode, opaque to the engine ("G" is general)
 * - cachedValue, dropped on every write and recomputed on demand
 */
public class Cell {

    public static final String GENERAL_FORMAT = "G";

    // Lotus label prefixes: left, right, centered, repeating
    private static final String LABEL_PREFIXES = "'\"^\\";

    private String rawValue;
    private String formatCode = GENERAL_FORMAT;
    private Value cachedValue; // null until computed

    public Cell() {
        this("");
    }

    public Cell(String rawValue) {
        this.rawValue = rawValue == null ? "" : rawValue;
    }

    public String getRawValue() {
        return rawValue;
    }

    // Set rawValue if the cell changes
    public void setRawValue(String rawValue) {
        this.rawValue = rawValue == null ? "" : rawValue;
        this.cachedValue = null;
    }

    public String getFormatCode() {
        return formatCode;
    }

    public void setFormatCode(String formatCode) {
        this.formatCode = formatCode == null || formatCode.isEmpty() ? GENERAL_FORMAT : formatCode;
    }

    public Value getCachedValue() {
        return cachedValue;
    }

    public void setCachedValue(Value cachedValue) {
        this.cachedValue = cachedValue;
    }

    public void invalidateCache() {
        cachedValue = null;
    }

    public boolean isEmpty() {
        return rawValue.isEmpty();
    }

    /**
     * "=" and "@" always start a formula; "+" and "-" do unless the rest is a plain number.
     */
    public boolean isFormula() {
        if (rawValue.isEmpty()) {
            return false;
        }
        char first = rawValue.charAt(0);
        if (first == '=' || first == '@') {
            return true;
        }
        if ((first == '+' || first == '-') && rawValue.length() > 1) {
            return Value.parseNumber(rawValue.substring(1)) == null;
        }
        return false;
    }

    /**
     * The formula body: a leading "=" or "@" is dropped, a leading sign is kept.
     * Null when the cell holds no formula.
     */
    public String getFormula() {
        if (!isFormula()) {
            return null;
        }
        char first = rawValue.charAt(0);
        return first == '=' || first == '@' ? rawValue.substring(1) : rawValue;
    }

    /**
     * Raw text without its label prefix.
     */
    public String getDisplayText() {
        if (!rawValue.isEmpty() && LABEL_PREFIXES.indexOf(rawValue.charAt(0)) >= 0) {
            return rawValue.substring(1);
        }
        return rawValue;
    }

    /**
     * Value of a non-formula cell. A label prefix forces text; error strings
     * typed as literals stay text.
     */
    public Value literalValue() {
        if (rawValue.isEmpty()) {
            return Value.EMPTY;
        }
        if (LABEL_PREFIXES.indexOf(rawValue.charAt(0)) >= 0) {
            return Value.text(rawValue.substring(1));
        }
        Double number = Value.parseNumber(rawValue);
        return number != null ? Value.number(number) : Value.text(rawValue);
    }

    /**
     * New cell with the same content and format, no cached value.
     */
    public Cell copy() {
        Cell copy = new Cell(rawValue);
        copy.formatCode = formatCode;
        return copy;
    }
}
