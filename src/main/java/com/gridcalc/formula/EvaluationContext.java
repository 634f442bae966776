package com.gridcalc.formula;

import com.gridcalc.references.CellReference;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * State threaded through one evaluation: the cell whose formula is being
 * computed and the chain of cells currently on the evaluation stack.
 * Re-entering a cell that is already in {@code computing} is a circular reference.
 */
public class EvaluationContext {
    private CellReference currentCell;
    private final Set<CellReference> computing = new LinkedHashSet<>();
    // Set once the chain of cells outgrew the depth bound; values computed under it are partial
    private boolean truncated;

    public EvaluationContext() {
    }

    public EvaluationContext(CellReference currentCell) {
        this.currentCell = currentCell;
    }

    public CellReference getCurrentCell() {
        return currentCell;
    }

    public void setCurrentCell(CellReference currentCell) {
        this.currentCell = currentCell;
    }

    public boolean isComputing(CellReference cell) {
        return computing.contains(cell.toRelative());
    }

    /**
     * Pushes {@code cell} onto the evaluation stack. Returns false if it was already there.
     */
    public boolean enter(CellReference cell) {
        return computing.add(cell.toRelative());
    }

    public void exit(CellReference cell) {
        computing.remove(cell.toRelative());
    }

    /**
     * Number of cells currently being computed, outermost included.
     */
    public int getDepth() {
        return computing.size();
    }

    public boolean isTruncated() {
        return truncated;
    }

    public void markTruncated() {
        truncated = true;
    }

    public Set<CellReference> getComputing() {
        return computing;
    }
}
