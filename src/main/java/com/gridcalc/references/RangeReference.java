package com.gridcalc.references;

import com.gridcalc.exceptions.InvalidReferenceException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A rectangular block of cells between two corner references.
 * The corners are kept as written; {@link #normalized()} gives
 * top-left / bottom-right.
 */
public final class RangeReference {

    private final CellReference start;
    private final CellReference end;

    public RangeReference(CellReference start, CellReference end) {
        this.start = Objects.requireNonNull(start);
        this.end = Objects.requireNonNull(end);
    }

    /**
     * Parses "A1:B10"; the Lotus separator ".." is accepted too.
     */
    public static RangeReference parse(String text) {
        if (text == null) {
            throw new InvalidReferenceException("Missing range reference");
        }
        String normalized = text.trim().replace("..", ":");
        int colon = normalized.indexOf(':');
        if (colon < 0 || colon != normalized.lastIndexOf(':')) {
            throw new InvalidReferenceException("Invalid range reference: " + text);
        }
        return new RangeReference(CellReference.parse(normalized.substring(0, colon)),
                CellReference.parse(normalized.substring(colon + 1)));
    }

    public CellReference getStart() {
        return start;
    }
    public CellReference getEnd() {
        return end;
    }

    public RangeReference normalized() {
        int minRow = Math.min(start.getRow(), end.getRow());
        int maxRow = Math.max(start.getRow(), end.getRow());
        int minCol = Math.min(start.getCol(), end.getCol());
        int maxCol = Math.max(start.getCol(), end.getCol());
        return new RangeReference(
                new CellReference(minRow, minCol, start.isColAbsolute(), start.isRowAbsolute()),
                new CellReference(maxRow, maxCol, end.isColAbsolute(), end.isRowAbsolute()));
    }

    public int getRowCount() {
        return Math.abs(end.getRow() - start.getRow()) + 1;
    }

    public int getColCount() {
        return Math.abs(end.getCol() - start.getCol()) + 1;
    }

    public boolean contains(int row, int col) {
        RangeReference norm = normalized();
        return row >= norm.start.getRow() && row <= norm.end.getRow()
                && col >= norm.start.getCol() && col <= norm.end.getCol();
    }

    /**
     * Every cell of the range, row by row.
     */
    public List<CellReference> cells() {
        RangeReference norm = normalized();
        List<CellReference> result = new ArrayList<>(getRowCount() * getColCount());
        for (int r = norm.start.getRow(); r <= norm.end.getRow(); r++) {
            for (int c = norm.start.getCol(); c <= norm.end.getCol(); c++) {
                result.add(CellReference.of(r, c));
            }
        }
        return result;
    }

    public RangeReference adjust(int rowDelta, int colDelta, int maxRow, int maxCol) {
        return new RangeReference(start.adjust(rowDelta, colDelta, maxRow, maxCol),
                end.adjust(rowDelta, colDelta, maxRow, maxCol));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RangeReference)) {
            return false;
        }
        RangeReference other = (RangeReference) o;
        return start.equals(other.start) && end.equals(other.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override
    public String toString() {
        return start + ":" + end;
    }
}
