package com.gridcalc.recalc;

import com.gridcalc.models.Value;
import com.gridcalc.references.CellReference;
import com.gridcalc.references.NamedRangeLookup;

import java.util.Set;

/**
 * The view of the grid the recalculation engine works against.
 */
public interface CellStore {

    /**
     * Positions of every cell whose content is a formula.
     */
    Set<CellReference> getFormulaCells();

    /**
     * Formula body of the cell (a leading "=" or "@" dropped), or null if it holds no formula.
     */
    String getFormula(CellReference cell);

    /**
     * Current value of the cell, computing and caching it if needed.
     */
    Value getValue(CellReference cell);

    void clearCache();

    NamedRangeLookup getNamedRanges();
}
