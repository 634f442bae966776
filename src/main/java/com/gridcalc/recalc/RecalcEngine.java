package com.gridcalc.recalc;

import com.gridcalc.models.ErrorKind;
import com.gridcalc.models.Value;
import com.gridcalc.references.CellReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Keeps the dependency graph in step with edits, tracks dirty cells and runs
 * recalculation passes over a {@link CellStore}.
 * <p>
 * Not thread-safe; callers hold the owning sheet's write lock.
 */
public class RecalcEngine {

    private static final Logger log = LoggerFactory.getLogger(RecalcEngine.class);

    private static final Comparator<CellReference> COLUMN_MAJOR =
            Comparator.comparingInt(CellReference::getCol).thenComparingInt(CellReference::getRow);

    private final CellStore store;
    private final DependencyGraph graph = new DependencyGraph();
    private final Set<CellReference> dirty = new LinkedHashSet<>();
    // Cells seen resolving to #CIRC! since the last pass started
    private final Set<CellReference> circular = new TreeSet<>();
    private RecalcMode mode;
    private RecalcOrder order;

    public RecalcEngine(CellStore store, RecalcMode mode, RecalcOrder order) {
        this.store = store;
        this.mode = mode;
        this.order = order;
    }

    public RecalcMode getMode() {
        return mode;
    }

    public void setMode(RecalcMode mode) {
        this.mode = mode;
    }

    public RecalcOrder getOrder() {
        return order;
    }

    /**
     * Changes the pass order. The dependency graph is unaffected.
     */
    public void setOrder(RecalcOrder order) {
        this.order = order;
    }

    public DependencyGraph getGraph() {
        return graph;
    }

    /**
     * Re-derives the out-edges of {@code cell} from its formula; null removes them.
     */
    public void updateCellDependency(CellReference cell, String formula) {
        if (formula == null) {
            graph.remove(cell);
        } else {
            graph.update(cell, DependencyScanner.scan(formula, store.getNamedRanges()));
        }
    }

    /**
     * Marks {@code cell} and everything that transitively reads it as dirty,
     * then recalculates the dirty set when in automatic mode.
     */
    public void markDirty(CellReference cell) {
        Deque<CellReference> queue = new ArrayDeque<>();
        CellReference start = cell.toRelative();
        if (dirty.add(start)) {
            queue.add(start);
        }
        while (!queue.isEmpty()) {
            CellReference current = queue.poll();
            for (CellReference reader : graph.getDependents(current)) {
                if (dirty.add(reader)) {
                    queue.add(reader);
                }
            }
        }
        if (mode == RecalcMode.AUTOMATIC) {
            recalculate(false);
        }
    }

    public boolean needsRecalc() {
        return !dirty.isEmpty();
    }

    public Set<CellReference> getDirtyCells() {
        return Collections.unmodifiableSet(dirty);
    }

    /**
     * Runs one pass: every formula cell when {@code full}, otherwise the dirty set.
     */
    public RecalcStats recalculate(boolean full) {
        long started = System.nanoTime();
        RecalcStats stats = new RecalcStats();

        Set<CellReference> candidates;
        if (full) {
            if (graph.isEmpty()) {
                rebuildDependencyGraph();
            }
            candidates = store.getFormulaCells();
        } else {
            candidates = new LinkedHashSet<>(dirty);
        }

        List<CellReference> ordered = calculationOrder(candidates);
        store.clearCache();
        circular.clear();

        // Formulas the pass reads but does not recalculate lost their cached values
        // too; refill them bottom-up so no single read walks a whole chain.
        for (CellReference cell : topologicalOrder(formulaPrecedents(candidates))) {
            store.getValue(cell);
        }

        for (CellReference cell : ordered) {
            if (store.getFormula(cell) == null) {
                continue;
            }
            Value value = store.getValue(cell);
            stats.countEvaluated();
            if (value.isError()) {
                if (value.getError() == ErrorKind.CIRC) {
                    circular.add(cell);
                    stats.countCircular();
                } else {
                    stats.countError();
                }
            }
        }

        dirty.clear();
        stats.setElapsedMs((System.nanoTime() - started) / 1_000_000.0);
        log.debug("Recalculated {} ({} order, full={}): {}", ordered.size(), order, full, stats);
        return stats;
    }

    /**
     * Orders {@code cells} for evaluation under the current order setting.
     */
    public List<CellReference> calculationOrder(Set<CellReference> cells) {
        List<CellReference> result = new ArrayList<>(cells);
        switch (order) {
            case COLUMN_WISE:
                result.sort(COLUMN_MAJOR);
                return result;
            case ROW_WISE:
                Collections.sort(result);
                return result;
            default:
                return topologicalOrder(cells);
        }
    }

    /**
     * Kahn's algorithm restricted to {@code cells}: a cell comes after every
     * candidate it reads. Cells left over on a cycle are appended at the end.
     */
    List<CellReference> topologicalOrder(Set<CellReference> cells) {
        if (graph.isEmpty()) {
            rebuildDependencyGraph();
        }
        Map<CellReference, Integer> inDegree = new HashMap<>();
        for (CellReference cell : cells) {
            int degree = 0;
            for (CellReference dependency : graph.getDependencies(cell)) {
                if (cells.contains(dependency)) {
                    degree++;
                }
            }
            inDegree.put(cell, degree);
        }

        Deque<CellReference> ready = new ArrayDeque<>();
        for (CellReference cell : new TreeSet<>(cells)) {
            if (inDegree.get(cell) == 0) {
                ready.add(cell);
            }
        }

        List<CellReference> result = new ArrayList<>(cells.size());
        while (!ready.isEmpty()) {
            CellReference cell = ready.poll();
            result.add(cell);
            for (CellReference reader : new TreeSet<>(graph.getDependents(cell))) {
                Integer degree = inDegree.get(reader);
                if (degree == null) {
                    continue;
                }
                inDegree.put(reader, degree - 1);
                if (degree - 1 == 0) {
                    ready.add(reader);
                }
            }
        }

        if (result.size() < cells.size()) {
            Set<CellReference> remaining = new TreeSet<>(cells);
            remaining.removeAll(result);
            result.addAll(remaining);
        }
        return result;
    }

    /**
     * Formula cells outside {@code cells} that {@code cells} read, directly or
     * through other cells.
     */
    Set<CellReference> formulaPrecedents(Set<CellReference> cells) {
        Set<CellReference> seen = new LinkedHashSet<>(cells);
        Set<CellReference> result = new LinkedHashSet<>();
        Deque<CellReference> queue = new ArrayDeque<>(cells);
        while (!queue.isEmpty()) {
            for (CellReference dependency : graph.getDependencies(queue.poll())) {
                if (seen.add(dependency) && store.getFormula(dependency) != null) {
                    result.add(dependency);
                    queue.add(dependency);
                }
            }
        }
        return result;
    }

    /**
     * Rebuilds the whole graph from the store's formulas. Needed once after a bulk
     * load or a structural edit.
     */
    public void rebuildDependencyGraph() {
        graph.clear();
        for (CellReference cell : store.getFormulaCells()) {
            updateCellDependency(cell, store.getFormula(cell));
        }
    }

    /**
     * Cells that resolved to #CIRC! during the latest pass or since, as seen by
     * the evaluation guard. May lag behind {@link #findCircularReferences()}
     * until the next pass.
     */
    public Set<CellReference> getCircularReferences() {
        return Collections.unmodifiableSet(circular);
    }

    /**
     * Called by the store when its evaluation guard catches a re-entered cell.
     */
    public void recordCircular(CellReference cell) {
        circular.add(cell.toRelative());
    }

    /**
     * Every cell on a cycle of the current graph, found by a full SCC sweep.
     */
    public Set<CellReference> findCircularReferences() {
        return CycleFinder.findCycles(graph);
    }

    public Set<CellReference> getDependencies(CellReference cell) {
        return graph.getDependencies(cell);
    }

    public Set<CellReference> getDependents(CellReference cell) {
        return graph.getDependents(cell);
    }

    /**
     * Forgets all graph, dirty and circular state.
     */
    public void reset() {
        graph.clear();
        dirty.clear();
        circular.clear();
    }
}
