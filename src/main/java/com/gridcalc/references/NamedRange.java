package com.gridcalc.references;

import java.util.Locale;

/**
 * A user-defined name for a single cell or a range.
 * Names are stored upper-cased; a single-cell name keeps start == end.
 */
public class NamedRange {
    private final String name;
    private final RangeReference reference;
    private final boolean singleCell;
    private final String description;

    public NamedRange(String name, CellReference cell, String description) {
        this(name, new RangeReference(cell, cell), true, description);
    }

    public NamedRange(String name, RangeReference range, String description) {
        this(name, range, false, description);
    }

    private NamedRange(String name, RangeReference reference, boolean singleCell, String description) {
        this.name = name.toUpperCase(Locale.ROOT);
        this.reference = reference;
        this.singleCell = singleCell;
        this.description = description == null ? "" : description;
    }

    public String getName() {
        return name;
    }
    public RangeReference getReference() {
        return reference;
    }
    public boolean isSingleCell() {
        return singleCell;
    }
    public String getDescription() {
        return description;
    }

    public CellReference getCell() {
        return reference.getStart();
    }

    NamedRange withReference(RangeReference newReference) {
        return new NamedRange(name, newReference, singleCell, description);
    }

    /**
     * The reference text a formula sees in place of the name: "A1" or "A1:B10".
     */
    public String getReferenceText() {
        return singleCell ? reference.getStart().toString() : reference.toString();
    }

    @Override
    public String toString() {
        return name + "=" + getReferenceText();
    }
}
