package com.gridcalc.models;

import com.gridcalc.exceptions.FormulaException;
import com.gridcalc.exceptions.InvalidReferenceException;
import com.gridcalc.formula.EvaluationContext;
import com.gridcalc.formula.FormulaEvaluator;
import com.gridcalc.formula.SpreadsheetAccess;
import com.gridcalc.formula.functions.FunctionRegistry;
import com.gridcalc.recalc.CellStore;
import com.gridcalc.recalc.RecalcEngine;
import com.gridcalc.recalc.RecalcMode;
import com.gridcalc.recalc.RecalcOrder;
import com.gridcalc.recalc.RecalcStats;
import com.gridcalc.references.Axis;
import com.gridcalc.references.CellReference;
import com.gridcalc.references.NamedRange;
import com.gridcalc.references.NamedRangeManager;
import com.gridcalc.references.RangeReference;
import com.gridcalc.references.ReferenceAdjuster;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Represents an entire spreadsheet:
 * - Has a unique ID
 * - A sparse map of position -> Cell, with row and column indices kept in step
 * - Its named ranges, formula evaluator and recalculation engine
 * - A read/write lock; callers hold it around every access
 * <p>
 * Rows and columns are 0-based throughout.
 */
public class Sheet implements SpreadsheetAccess, CellStore {

    private static final Logger log = LoggerFactory.getLogger(Sheet.class);

    public static final int DEFAULT_MAX_ROWS = 65536;
    public static final int DEFAULT_MAX_COLS = 256;
    public static final int DEFAULT_MAX_DEPTH = 256;

    // Generates unique IDs for newly created sheets
    private static final AtomicLong ID_GENERATOR = new AtomicLong(1);

    private final long id;
    private final int maxRows;
    private final int maxCols;

    private Map<CellReference, Cell> cells = new HashMap<>();
    // row -> columns holding a cell, col -> rows holding a cell
    private final SortedMap<Integer, SortedSet<Integer>> rowIndex = new TreeMap<>();
    private final SortedMap<Integer, SortedSet<Integer>> colIndex = new TreeMap<>();

    private final NamedRangeManager namedRanges = new NamedRangeManager();
    private final FormulaEvaluator evaluator;
    private final RecalcEngine recalcEngine;

    // Lock to prevent race conditions when multiple threads update the same Sheet
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public Sheet() {
        this(new FunctionRegistry(), Clock.systemDefaultZone(), new Random());
    }

    public Sheet(FunctionRegistry functions, Clock clock, Random random) {
        this(DEFAULT_MAX_ROWS, DEFAULT_MAX_COLS, DEFAULT_MAX_DEPTH, RecalcMode.AUTOMATIC, RecalcOrder.NATURAL,
                functions, clock, random);
    }

    public Sheet(int maxRows, int maxCols, int maxDepth, RecalcMode mode, RecalcOrder order,
                 FunctionRegistry functions, Clock clock, Random random) {
        this.id = ID_GENERATOR.getAndIncrement();
        this.maxRows = maxRows;
        this.maxCols = maxCols;
        this.evaluator = new FormulaEvaluator(this, functions, clock, random, maxDepth);
        this.recalcEngine = new RecalcEngine(this, mode, order);
    }

    public long getId() {
        return id;
    }

    public int getMaxRows() {
        return maxRows;
    }

    public int getMaxCols() {
        return maxCols;
    }

    public ReentrantReadWriteLock getLock() {
        return lock;
    }

    public RecalcEngine getRecalcEngine() {
        return recalcEngine;
    }

    public FormulaEvaluator getEvaluator() {
        return evaluator;
    }

    @Override
    public NamedRangeManager getNamedRanges() {
        return namedRanges;
    }

    // ------------------------
    // Cell access
    // ------------------------

    /**
     * Cell at the position, created empty if absent.
     */
    public Cell getCell(int row, int col) {
        CellReference ref = checkedRef(row, col);
        Cell cell = cells.get(ref);
        if (cell == null) {
            cell = new Cell();
            putCell(ref, cell);
        }
        return cell;
    }

    public Cell getCellIfExists(int row, int col) {
        return cells.get(CellReference.of(row, col));
    }

    public boolean cellExists(int row, int col) {
        Cell cell = getCellIfExists(row, col);
        return cell != null && !cell.isEmpty();
    }

    /**
     * Stores raw text in a cell, refreshes its dependency edges and marks it and
     * its dependents dirty. In automatic mode the dirty cells are recalculated.
     */
    public void setCell(int row, int col, String rawValue) {
        CellReference ref = checkedRef(row, col);
        Cell cell = getCell(row, col);
        cell.setRawValue(rawValue);
        recalcEngine.updateCellDependency(ref, cell.getFormula());
        recalcEngine.markDirty(ref);
    }

    public void setCell(String ref, String rawValue) {
        CellReference cell = CellReference.parse(ref);
        setCell(cell.getRow(), cell.getCol(), rawValue);
    }

    public void deleteCell(int row, int col) {
        CellReference ref = CellReference.of(row, col);
        if (removeCell(ref) == null) {
            return;
        }
        recalcEngine.updateCellDependency(ref, null);
        recalcEngine.markDirty(ref);
    }

    public void deleteCell(String ref) {
        CellReference cell = CellReference.parse(ref);
        deleteCell(cell.getRow(), cell.getCol());
    }

    // ------------------------
    // Values
    // ------------------------

    public Value getValue(int row, int col) {
        return getValue(row, col, null);
    }

    /**
     * Computed value of a cell, served from the cache when present.
     * Re-entering a cell that {@code context} is already computing yields #CIRC!.
     * Results of a read that ran past the depth bound are not cached.
     */
    public Value getValue(int row, int col, EvaluationContext context) {
        if (!inBounds(row, col)) {
            return Value.error(ErrorKind.REF);
        }
        CellReference ref = CellReference.of(row, col);
        Cell cell = cells.get(ref);
        if (cell == null || cell.isEmpty()) {
            return Value.EMPTY;
        }
        if (cell.getCachedValue() != null) {
            return cell.getCachedValue();
        }
        if (!cell.isFormula()) {
            Value literal = cell.literalValue();
            cell.setCachedValue(literal);
            return literal;
        }

        EvaluationContext ctx = context != null ? context : new EvaluationContext();
        if (!ctx.enter(ref)) {
            recalcEngine.recordCircular(ref);
            return Value.error(ErrorKind.CIRC);
        }
        CellReference caller = ctx.getCurrentCell();
        ctx.setCurrentCell(ref);
        Value value;
        try {
            value = evaluator.evaluate(cell.getFormula(), ctx);
        } finally {
            ctx.setCurrentCell(caller);
            ctx.exit(ref);
        }
        // A chain cut off by the depth bound says nothing about this cell on a shallower read
        if (!ctx.isTruncated()) {
            cell.setCachedValue(value);
        }
        return value;
    }

    @Override
    public Value getValue(CellReference cell) {
        return getValue(cell.getRow(), cell.getCol(), null);
    }

    @Override
    public Value getValueByRef(String ref, EvaluationContext context) {
        CellReference cell = CellReference.tryParse(ref);
        if (cell == null) {
            return Value.error(ErrorKind.REF);
        }
        return getValue(cell.getRow(), cell.getCol(), context);
    }

    public Value getValueByRef(String ref) {
        return getValueByRef(ref, null);
    }

    @Override
    public List<List<Value>> getRange(String startRef, String endRef, EvaluationContext context) {
        RangeReference range = rangeOf(startRef, endRef).normalized();
        List<List<Value>> rows = new ArrayList<>(range.getRowCount());
        for (int r = range.getStart().getRow(); r <= range.getEnd().getRow(); r++) {
            List<Value> row = new ArrayList<>(range.getColCount());
            for (int c = range.getStart().getCol(); c <= range.getEnd().getCol(); c++) {
                row.add(getValue(r, c, context));
            }
            rows.add(row);
        }
        return rows;
    }

    /**
     * Values of a range, row by row, in one list.
     */
    public List<Value> getRangeFlat(String startRef, String endRef, EvaluationContext context) {
        List<Value> flat = new ArrayList<>();
        for (List<Value> row : getRange(startRef, endRef, context)) {
            flat.addAll(row);
        }
        return flat;
    }

    /**
     * The cell's value rendered under its format code.
     */
    public String getDisplayValue(int row, int col) {
        Value value = getValue(row, col);
        Cell cell = getCellIfExists(row, col);
        return CellFormat.format(value, cell == null ? Cell.GENERAL_FORMAT : cell.getFormatCode());
    }

    /**
     * Computes a formula that is not stored in any cell.
     */
    public Value evaluate(String formula) {
        return evaluator.evaluate(formula, new EvaluationContext());
    }

    // ------------------------
    // CellStore
    // ------------------------

    @Override
    public Set<CellReference> getFormulaCells() {
        Set<CellReference> result = new TreeSet<>();
        for (Map.Entry<CellReference, Cell> entry : cells.entrySet()) {
            if (entry.getValue().isFormula()) {
                result.add(entry.getKey());
            }
        }
        return result;
    }

    @Override
    public String getFormula(CellReference cell) {
        Cell stored = cells.get(cell.toRelative());
        return stored == null ? null : stored.getFormula();
    }

    @Override
    public void clearCache() {
        for (Cell cell : cells.values()) {
            cell.invalidateCache();
        }
    }

    // ------------------------
    // Recalculation
    // ------------------------

    public RecalcStats recalculate(boolean full) {
        return recalcEngine.recalculate(full);
    }

    public RecalcStats recalculate() {
        return recalculate(true);
    }

    public boolean needsRecalc() {
        return recalcEngine.needsRecalc();
    }

    public RecalcMode getRecalcMode() {
        return recalcEngine.getMode();
    }

    public void setRecalcMode(RecalcMode mode) {
        recalcEngine.setMode(mode);
    }

    public RecalcOrder getRecalcOrder() {
        return recalcEngine.getOrder();
    }

    public void setRecalcOrder(RecalcOrder order) {
        recalcEngine.setOrder(order);
    }

    public Set<CellReference> getCircularReferences() {
        return recalcEngine.getCircularReferences();
    }

    public Set<CellReference> findCircularReferences() {
        return recalcEngine.findCircularReferences();
    }

    // ------------------------
    // Named ranges
    // ------------------------

    /**
     * Defines or redefines a name. Formulas already using it are re-linked.
     */
    public NamedRange defineName(String name, String referenceText, String description) {
        NamedRange named = namedRanges.addFromString(name, referenceText, description);
        refreshAfterNameChange();
        return named;
    }

    public boolean deleteName(String name) {
        boolean removed = namedRanges.delete(name);
        if (removed) {
            refreshAfterNameChange();
        }
        return removed;
    }

    private void refreshAfterNameChange() {
        clearCache();
        recalcEngine.rebuildDependencyGraph();
        if (recalcEngine.getMode() == RecalcMode.AUTOMATIC) {
            recalcEngine.recalculate(true);
        }
    }

    // ------------------------
    // Copy and format
    // ------------------------

    /**
     * Copies content and format; relative references in a formula move with it.
     * Copying from an empty position does nothing.
     */
    public void copyCell(int fromRow, int fromCol, int toRow, int toCol) {
        Cell source = getCellIfExists(fromRow, fromCol);
        if (source == null) {
            return;
        }
        writeCopy(source.copy(), toRow - fromRow, toCol - fromCol, toRow, toCol);
    }

    /**
     * Copies a block so that its top-left corner lands on {@code destination}.
     * Sources are read before anything is written, so overlapping blocks copy cleanly.
     */
    public void copyRange(RangeReference source, CellReference destination) {
        RangeReference range = source.normalized();
        int rowDelta = destination.getRow() - range.getStart().getRow();
        int colDelta = destination.getCol() - range.getStart().getCol();
        Map<CellReference, Cell> snapshot = new LinkedHashMap<>();
        for (CellReference ref : range.cells()) {
            Cell cell = cells.get(ref);
            if (cell != null) {
                snapshot.put(ref, cell.copy());
            }
        }
        for (Map.Entry<CellReference, Cell> entry : snapshot.entrySet()) {
            CellReference from = entry.getKey();
            int toRow = from.getRow() + rowDelta;
            int toCol = from.getCol() + colDelta;
            if (inBounds(toRow, toCol)) {
                writeCopy(entry.getValue(), rowDelta, colDelta, toRow, toCol);
            }
        }
    }

    private void writeCopy(Cell source, int rowDelta, int colDelta, int toRow, int toCol) {
        String raw = source.getRawValue();
        if (source.isFormula()) {
            raw = ReferenceAdjuster.adjustForCopy(raw, rowDelta, colDelta, maxRows - 1, maxCols - 1);
        }
        getCell(toRow, toCol).setFormatCode(source.getFormatCode());
        setCell(toRow, toCol, raw);
    }

    public void setRangeFormat(RangeReference range, String formatCode) {
        for (CellReference ref : range.cells()) {
            getCell(ref.getRow(), ref.getCol()).setFormatCode(formatCode);
        }
    }

    // ------------------------
    // Row/Column operations
    // ------------------------

    public void insertRow(int row) {
        checkedRef(row, 0);
        applyStructuralChange(Axis.ROW, row, 1);
    }

    public void deleteRow(int row) {
        checkedRef(row, 0);
        applyStructuralChange(Axis.ROW, row, -1);
    }

    public void insertCol(int col) {
        checkedRef(0, col);
        applyStructuralChange(Axis.COLUMN, col, 1);
    }

    public void deleteCol(int col) {
        checkedRef(0, col);
        applyStructuralChange(Axis.COLUMN, col, -1);
    }

    /**
     * Rewrites every formula, moves the cells on the far side of {@code index},
     * shifts the named ranges, then rebuilds the dependency graph from scratch.
     */
    private void applyStructuralChange(Axis axis, int index, int shift) {
        Map<CellReference, Cell> moved = new HashMap<>();
        int dropped = 0;
        for (Map.Entry<CellReference, Cell> entry : cells.entrySet()) {
            CellReference ref = entry.getKey();
            Cell cell = entry.getValue();
            int coordinate = axis == Axis.ROW ? ref.getRow() : ref.getCol();
            if (shift < 0 && coordinate == index) {
                continue;
            }
            if (cell.isFormula()) {
                cell.setRawValue(ReferenceAdjuster.adjustForStructuralChange(
                        cell.getRawValue(), axis, index, shift, maxRows - 1, maxCols - 1));
            }
            int target = coordinate < index ? coordinate : coordinate + shift;
            if (target >= (axis == Axis.ROW ? maxRows : maxCols)) {
                dropped++;
                continue;
            }
            moved.put(axis == Axis.ROW ? CellReference.of(target, ref.getCol()) : CellReference.of(ref.getRow(), target),
                    cell);
        }
        cells = moved;
        rebuildIndices();

        if (shift > 0) {
            namedRanges.adjustForInsert(axis, index);
        } else {
            List<String> invalidated = namedRanges.adjustForDelete(axis, index);
            if (!invalidated.isEmpty()) {
                log.info("Sheet {}: names {} removed with their {}", id, invalidated, axis);
            }
        }
        if (dropped > 0) {
            log.warn("Sheet {}: {} cells pushed past the grid edge were dropped", id, dropped);
        }

        clearCache();
        recalcEngine.reset();
        recalcEngine.rebuildDependencyGraph();
        if (recalcEngine.getMode() == RecalcMode.AUTOMATIC) {
            recalcEngine.recalculate(true);
        }
    }

    // ------------------------
    // Iteration
    // ------------------------

    /**
     * Non-empty cells in row-major order.
     */
    public SortedMap<CellReference, Cell> iterCells() {
        SortedMap<CellReference, Cell> result = new TreeMap<>();
        for (Map.Entry<CellReference, Cell> entry : cells.entrySet()) {
            if (!entry.getValue().isEmpty()) {
                result.put(entry.getKey(), entry.getValue());
            }
        }
        return result;
    }

    /**
     * Bounding box of the non-empty cells, or null when there are none.
     */
    public RangeReference getUsedRange() {
        int minRow = Integer.MAX_VALUE;
        int minCol = Integer.MAX_VALUE;
        int maxRow = -1;
        int maxCol = -1;
        for (Map.Entry<Integer, SortedSet<Integer>> entry : rowIndex.entrySet()) {
            for (int col : entry.getValue()) {
                if (cellExists(entry.getKey(), col)) {
                    minRow = Math.min(minRow, entry.getKey());
                    maxRow = Math.max(maxRow, entry.getKey());
                    minCol = Math.min(minCol, col);
                    maxCol = Math.max(maxCol, col);
                }
            }
        }
        if (maxRow < 0) {
            return null;
        }
        return new RangeReference(CellReference.of(minRow, minCol), CellReference.of(maxRow, maxCol));
    }

    /**
     * Columns that hold a cell in {@code row}.
     */
    public SortedSet<Integer> getColumnsInRow(int row) {
        return rowIndex.getOrDefault(row, new TreeSet<>());
    }

    /**
     * Rows that hold a cell in {@code col}.
     */
    public SortedSet<Integer> getRowsInColumn(int col) {
        return colIndex.getOrDefault(col, new TreeSet<>());
    }

    public void clear() {
        cells.clear();
        rowIndex.clear();
        colIndex.clear();
        namedRanges.clear();
        recalcEngine.reset();
    }

    // ------------------------
    // Internals
    // ------------------------

    private void putCell(CellReference ref, Cell cell) {
        cells.put(ref, cell);
        rowIndex.computeIfAbsent(ref.getRow(), k -> new TreeSet<>()).add(ref.getCol());
        colIndex.computeIfAbsent(ref.getCol(), k -> new TreeSet<>()).add(ref.getRow());
    }

    private Cell removeCell(CellReference ref) {
        Cell removed = cells.remove(ref);
        if (removed != null) {
            unindex(rowIndex, ref.getRow(), ref.getCol());
            unindex(colIndex, ref.getCol(), ref.getRow());
        }
        return removed;
    }

    private static void unindex(SortedMap<Integer, SortedSet<Integer>> index, int key, int member) {
        SortedSet<Integer> members = index.get(key);
        if (members != null) {
            members.remove(member);
            if (members.isEmpty()) {
                index.remove(key);
            }
        }
    }

    private void rebuildIndices() {
        rowIndex.clear();
        colIndex.clear();
        for (CellReference ref : cells.keySet()) {
            rowIndex.computeIfAbsent(ref.getRow(), k -> new TreeSet<>()).add(ref.getCol());
            colIndex.computeIfAbsent(ref.getCol(), k -> new TreeSet<>()).add(ref.getRow());
        }
    }

    private boolean inBounds(int row, int col) {
        return row >= 0 && col >= 0 && row < maxRows && col < maxCols;
    }

    private CellReference checkedRef(int row, int col) {
        if (!inBounds(row, col)) {
            throw new InvalidReferenceException("Cell (" + row + ", " + col + ") is outside the "
                    + maxRows + "x" + maxCols + " grid");
        }
        return CellReference.of(row, col);
    }

    private RangeReference rangeOf(String startRef, String endRef) {
        CellReference start = CellReference.tryParse(startRef);
        CellReference end = CellReference.tryParse(endRef);
        if (start == null || end == null || !inBounds(start.getRow(), start.getCol())
                || !inBounds(end.getRow(), end.getCol())) {
            throw new FormulaException(ErrorKind.REF, "Invalid range " + startRef + ":" + endRef);
        }
        return new RangeReference(start, end);
    }

    @Override
    public String toString() {
        return "Sheet(" + id + ", " + iterCells().size() + " cells)";
    }
}
