package com.gridcalc.services;

import com.gridcalc.config.EngineProperties;
import com.gridcalc.exceptions.SheetNotFoundException;
import com.gridcalc.formula.functions.FunctionRegistry;
import com.gridcalc.models.Cell;
import com.gridcalc.models.CellDetails;
import com.gridcalc.models.Sheet;
import com.gridcalc.models.Value;
import com.gridcalc.recalc.RecalcMode;
import com.gridcalc.recalc.RecalcOrder;
import com.gridcalc.recalc.RecalcStats;
import com.gridcalc.references.CellReference;
import com.gridcalc.references.NamedRange;
import com.gridcalc.references.RangeReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Lock;
import java.util.function.Supplier;

/**
 * Main business logic for creating sheets, editing cells, running
 * recalculation and reporting dependencies and cycles.
 * <p>
 * Each sheet is a single-writer session. Anything that may compute a value
 * takes the sheet's write lock, since computing fills the value cache and the
 * live circular set; listings of stored text and graph edges take the read lock.
 */
@Service
public class SheetService {

    private static final Logger log = LoggerFactory.getLogger(SheetService.class);

    // All sheets live here in memory; no persistent store
    private final Map<Long, Sheet> sheets = new ConcurrentHashMap<>();

    private final EngineProperties properties;
    private final FunctionRegistry functions;
    private final Clock clock;
    private final Supplier<Random> randomSupplier;

    public SheetService(EngineProperties properties, FunctionRegistry functions, Clock clock,
                        Supplier<Random> randomSupplier) {
        this.properties = properties;
        this.functions = functions;
        this.clock = clock;
        this.randomSupplier = randomSupplier;
    }

    /**
     * Creates an empty sheet with the configured limits and recalc settings; returns its ID.
     */
    public long createSheet() {
        Sheet sheet = new Sheet(properties.getMaxRows(), properties.getMaxCols(),
                properties.getMaxEvaluationDepth(), properties.getDefaultRecalcMode(),
                properties.getDefaultRecalcOrder(), functions, clock, randomSupplier.get());
        sheets.put(sheet.getId(), sheet);
        log.info("Created sheet {} ({}x{}, {} recalc, {} order)", sheet.getId(), sheet.getMaxRows(),
                sheet.getMaxCols(), sheet.getRecalcMode(), sheet.getRecalcOrder());
        return sheet.getId();
    }

    /**
     * Retrieves a Sheet by ID. Throws if not found.
     */
    public Sheet getSheet(long sheetId) {
        Sheet sheet = sheets.get(sheetId);
        if (sheet == null) {
            throw new SheetNotFoundException(sheetId);
        }
        return sheet;
    }

    public void deleteSheet(long sheetId) {
        if (sheets.remove(sheetId) == null) {
            throw new SheetNotFoundException(sheetId);
        }
        log.info("Deleted sheet {}", sheetId);
    }

    // ----------------------------------------------------------------
    // Cells
    // ----------------------------------------------------------------

    public void setCell(long sheetId, String ref, String rawValue) {
        CellReference cell = CellReference.parse(ref);
        withWriteLock(sheetId, sheet -> {
            sheet.setCell(cell.getRow(), cell.getCol(), rawValue);
            return null;
        });
    }

    public void deleteCell(long sheetId, String ref) {
        CellReference cell = CellReference.parse(ref);
        withWriteLock(sheetId, sheet -> {
            sheet.deleteCell(cell.getRow(), cell.getCol());
            return null;
        });
    }

    /**
     * Returns a map of A1-style reference -> display value for every non-empty
     * cell, row by row. In manual mode values may be stale until the next recalculation.
     */
    public Map<String, String> getSheetData(long sheetId) {
        return withWriteLock(sheetId, sheet -> {
            Map<String, String> data = new LinkedHashMap<>();
            for (CellReference ref : sheet.iterCells().keySet()) {
                data.put(ref.toString(), sheet.getDisplayValue(ref.getRow(), ref.getCol()));
            }
            return data;
        });
    }

    public CellDetails getCellDetails(long sheetId, String ref) {
        CellReference cell = CellReference.parse(ref);
        return withWriteLock(sheetId, sheet -> {
            Cell stored = sheet.getCellIfExists(cell.getRow(), cell.getCol());
            Value value = sheet.getValue(cell.getRow(), cell.getCol());
            return new CellDetails(
                    cell.toRelative().toString(),
                    stored == null ? "" : stored.getRawValue(),
                    stored == null ? null : stored.getFormula(),
                    value,
                    sheet.getDisplayValue(cell.getRow(), cell.getCol()),
                    stored == null ? Cell.GENERAL_FORMAT : stored.getFormatCode(),
                    names(sheet.getRecalcEngine().getDependencies(cell)),
                    names(sheet.getRecalcEngine().getDependents(cell)));
        });
    }

    public void setRangeFormat(long sheetId, String range, String formatCode) {
        RangeReference parsed = parseRange(range);
        withWriteLock(sheetId, sheet -> {
            sheet.setRangeFormat(parsed, formatCode);
            return null;
        });
    }

    /**
     * Computes a formula against the sheet without storing it.
     */
    public Value evaluate(long sheetId, String formula) {
        return withWriteLock(sheetId, sheet -> sheet.evaluate(formula));
    }

    // ----------------------------------------------------------------
    // Recalculation
    // ----------------------------------------------------------------

    public RecalcStats recalculate(long sheetId, boolean full) {
        return withWriteLock(sheetId, sheet -> {
            RecalcStats stats = sheet.recalculate(full);
            log.info("Sheet {} recalculated: {}", sheetId, stats);
            return stats;
        });
    }

    public void setRecalcMode(long sheetId, RecalcMode mode) {
        withWriteLock(sheetId, sheet -> {
            sheet.setRecalcMode(mode);
            return null;
        });
    }

    public void setRecalcOrder(long sheetId, RecalcOrder order) {
        withWriteLock(sheetId, sheet -> {
            sheet.setRecalcOrder(order);
            return null;
        });
    }

    /**
     * Live circular set (cells seen as #CIRC!) and the cells on cycles of the graph.
     */
    public Map<String, List<String>> getCircularReferences(long sheetId) {
        return withWriteLock(sheetId, sheet -> {
            Map<String, List<String>> result = new LinkedHashMap<>();
            result.put("live", names(sheet.getCircularReferences()));
            result.put("cycles", names(sheet.findCircularReferences()));
            return result;
        });
    }

    // ----------------------------------------------------------------
    // Structure
    // ----------------------------------------------------------------

    public void insertRow(long sheetId, int row) {
        structural(sheetId, "Inserted row", row + 1, sheet -> sheet.insertRow(row));
    }

    public void deleteRow(long sheetId, int row) {
        structural(sheetId, "Deleted row", row + 1, sheet -> sheet.deleteRow(row));
    }

    public void insertCol(long sheetId, int col) {
        structural(sheetId, "Inserted column", CellReference.indexToColumn(col), sheet -> sheet.insertCol(col));
    }

    public void deleteCol(long sheetId, int col) {
        structural(sheetId, "Deleted column", CellReference.indexToColumn(col), sheet -> sheet.deleteCol(col));
    }

    private interface SheetEdit {
        void apply(Sheet sheet);
    }

    private void structural(long sheetId, String what, Object where, SheetEdit edit) {
        withWriteLock(sheetId, sheet -> {
            edit.apply(sheet);
            return null;
        });
        log.info("Sheet {}: {} {}", sheetId, what, where);
    }

    /**
     * Copies {@code source} (e.g. "A1:B3") so that its top-left lands on {@code destination}.
     */
    public void copyRange(long sheetId, String source, String destination) {
        RangeReference from = parseRange(source);
        CellReference to = CellReference.parse(destination);
        withWriteLock(sheetId, sheet -> {
            sheet.copyRange(from, to);
            return null;
        });
    }

    // ----------------------------------------------------------------
    // Names
    // ----------------------------------------------------------------

    public NamedRange defineName(long sheetId, String name, String reference, String description) {
        return withWriteLock(sheetId, sheet -> sheet.defineName(name, reference, description));
    }

    public boolean deleteName(long sheetId, String name) {
        return withWriteLock(sheetId, sheet -> sheet.deleteName(name));
    }

    public Map<String, String> listNames(long sheetId) {
        return withReadLock(sheetId, sheet -> {
            Map<String, String> result = new LinkedHashMap<>();
            for (NamedRange named : sheet.getNamedRanges().listAll()) {
                result.put(named.getName(), named.getReferenceText());
            }
            return result;
        });
    }

    // ----------------------------------------------------------------
    // Dependency graph
    // ----------------------------------------------------------------

    /**
     * For each formula cell, the cells it reads.
     */
    public Map<String, List<String>> getForwardDependencies(long sheetId) {
        return withReadLock(sheetId, sheet -> render(sheet.getRecalcEngine().getGraph().forwardSnapshot()));
    }

    /**
     * For each referenced cell, the formula cells that read it.
     */
    public Map<String, List<String>> getReverseDependencies(long sheetId) {
        return withReadLock(sheetId, sheet -> render(sheet.getRecalcEngine().getGraph().reverseSnapshot()));
    }

    // ----------------------------------------------------------------
    // Internal Helpers (used within this service only)
    // ----------------------------------------------------------------

    private interface SheetAction<T> {
        T apply(Sheet sheet);
    }

    private <T> T withWriteLock(long sheetId, SheetAction<T> action) {
        Sheet sheet = getSheet(sheetId);
        Lock lock = sheet.getLock().writeLock();
        // Prevent race conditions among multiple writers
        lock.lock();
        try {
            return action.apply(sheet);
        } finally {
            lock.unlock();
        }
    }

    private <T> T withReadLock(long sheetId, SheetAction<T> action) {
        Sheet sheet = getSheet(sheetId);
        Lock lock = sheet.getLock().readLock();
        lock.lock();
        try {
            return action.apply(sheet);
        } finally {
            lock.unlock();
        }
    }

    private static RangeReference parseRange(String range) {
        if (range.contains(":") || range.contains("..")) {
            return RangeReference.parse(range);
        }
        CellReference cell = CellReference.parse(range);
        return new RangeReference(cell, cell);
    }

    private static List<String> names(Collection<CellReference> refs) {
        List<String> result = new ArrayList<>(refs.size());
        for (CellReference ref : refs) {
            result.add(ref.toString());
        }
        return result;
    }

    private static Map<String, List<String>> render(Map<CellReference, Set<CellReference>> graph) {
        // Keyed by position so that A2 sorts before A10
        Map<CellReference, List<String>> ordered = new TreeMap<>();
        for (Map.Entry<CellReference, Set<CellReference>> entry : graph.entrySet()) {
            ordered.put(entry.getKey(), names(new TreeSet<>(entry.getValue())));
        }
        Map<String, List<String>> result = new LinkedHashMap<>();
        for (Map.Entry<CellReference, List<String>> entry : ordered.entrySet()) {
            result.put(entry.getKey().toString(), entry.getValue());
        }
        return result;
    }
}
