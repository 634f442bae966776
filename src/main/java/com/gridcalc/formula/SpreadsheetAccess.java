package com.gridcalc.formula;

import com.gridcalc.models.Value;
import com.gridcalc.references.NamedRangeLookup;

import java.util.List;

/**
 * What the evaluator needs from the grid: cell values, rectangular ranges
 * of values, and the named-range table. Implemented by the cell store.
 */
public interface SpreadsheetAccess {

    /**
     * Value of the cell named by {@code ref} ("A1", "$B$2"). An invalid or
     * out-of-bounds reference yields #REF!; re-entering a cell that is being
     * computed yields #CIRC!.
     */
    Value getValueByRef(String ref, EvaluationContext context);

    /**
     * Values of the rectangle between two corners, row-major, shape preserved.
     */
    List<List<Value>> getRange(String startRef, String endRef, EvaluationContext context);

    NamedRangeLookup getNamedRanges();
}
