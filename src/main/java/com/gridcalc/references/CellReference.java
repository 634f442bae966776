package com.gridcalc.references;

import com.gridcalc.exceptions.InvalidReferenceException;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A reference to one cell: 0-based row and column plus the "$" flags.
 * Equality and hashing use (row, col) only; the absolute flags are
 * presentation metadata that matter for copy adjustment.
 */
public final class CellReference implements Comparable<CellReference> {

    // Optional "$" before the column letters and/or the row number
    private static final Pattern CELL_PATTERN = Pattern.compile("^(\\$?)([A-Za-z]+)(\\$?)(\\d+)$");

    private final int row;
    private final int col;
    private final boolean colAbsolute;
    private final boolean rowAbsolute;

    public CellReference(int row, int col, boolean colAbsolute, boolean rowAbsolute) {
        if (row < 0 || col < 0) {
            throw new InvalidReferenceException("Negative cell coordinates: row=" + row + ", col=" + col);
        }
        this.row = row;
        this.col = col;
        this.colAbsolute = colAbsolute;
        this.rowAbsolute = rowAbsolute;
    }

    public static CellReference of(int row, int col) {
        return new CellReference(row, col, false, false);
    }

    /**
     * Parses "A1", "$A1", "A$1" or "$A$1" (letters are case-insensitive).
     */
    public static CellReference parse(String ref) {
        if (ref == null) {
            throw new InvalidReferenceException("Missing cell reference");
        }
        CellReference parsed = tryParse(ref);
        if (parsed == null) {
            throw new InvalidReferenceException("Invalid cell reference: " + ref);
        }
        return parsed;
    }

    /**
     * Like {@link #parse} but returns null for anything that is not a valid reference.
     */
    public static CellReference tryParse(String ref) {
        if (ref == null) {
            return null;
        }
        Matcher matcher = CELL_PATTERN.matcher(ref.trim());
        if (!matcher.matches() || matcher.group(2).length() > 6 || matcher.group(4).length() > 9) {
            return null;
        }
        int rowNumber = Integer.parseInt(matcher.group(4));
        if (rowNumber < 1) {
            return null;
        }
        return new CellReference(rowNumber - 1, columnToIndex(matcher.group(2)),
                !matcher.group(1).isEmpty(), !matcher.group(3).isEmpty());
    }

    /**
     * True if {@code text} has the shape of a cell reference (not checking bounds).
     */
    public static boolean looksLikeReference(String text) {
        return text != null && CELL_PATTERN.matcher(text).matches();
    }

    /**
     * Column letters to 0-based index: A=0, Z=25, AA=26, IV=255.
     */
    public static int columnToIndex(String letters) {
        int result = 0;
        for (char ch : letters.toUpperCase(Locale.ROOT).toCharArray()) {
            if (ch < 'A' || ch > 'Z') {
                throw new InvalidReferenceException("Invalid column: " + letters);
            }
            result = result * 26 + (ch - 'A' + 1);
        }
        return result - 1;
    }

    /**
     * 0-based index to column letters: 0=A, 25=Z, 26=AA.
     */
    public static String indexToColumn(int index) {
        StringBuilder sb = new StringBuilder();
        int n = index + 1;
        while (n > 0) {
            int remainder = (n - 1) % 26;
            sb.insert(0, (char) ('A' + remainder));
            n = (n - 1) / 26;
        }
        return sb.toString();
    }

    public int getRow() {
        return row;
    }
    public int getCol() {
        return col;
    }
    public boolean isColAbsolute() {
        return colAbsolute;
    }
    public boolean isRowAbsolute() {
        return rowAbsolute;
    }

    /**
     * Same cell with the "$" flags dropped; used as a map key.
     */
    public CellReference toRelative() {
        return colAbsolute || rowAbsolute ? of(row, col) : this;
    }

    public CellReference withRow(int newRow) {
        return new CellReference(newRow, col, colAbsolute, rowAbsolute);
    }

    public CellReference withCol(int newCol) {
        return new CellReference(row, newCol, colAbsolute, rowAbsolute);
    }

    /**
     * Shifts the relative parts of this reference for a copy, clamping into [0, max].
     */
    public CellReference adjust(int rowDelta, int colDelta, int maxRow, int maxCol) {
        int newRow = rowAbsolute ? row : clamp(row + rowDelta, maxRow);
        int newCol = colAbsolute ? col : clamp(col + colDelta, maxCol);
        return new CellReference(newRow, newCol, colAbsolute, rowAbsolute);
    }

    private static int clamp(int value, int max) {
        return Math.min(Math.max(0, value), max);
    }

    @Override
    public int compareTo(CellReference other) {
        int byRow = Integer.compare(row, other.row);
        return byRow != 0 ? byRow : Integer.compare(col, other.col);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellReference)) {
            return false;
        }
        CellReference other = (CellReference) o;
        return row == other.row && col == other.col;
    }

    @Override
    public int hashCode() {
        return 31 * row + col;
    }

    @Override
    public String toString() {
        return (colAbsolute ? "$" : "") + indexToColumn(col) + (rowAbsolute ? "$" : "") + (row + 1);
    }
}
