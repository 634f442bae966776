package com.gridcalc.recalc;

import com.gridcalc.models.ErrorKind;
import com.gridcalc.models.Value;
import com.gridcalc.references.CellReference;
import com.gridcalc.references.NamedRangeLookup;
import com.gridcalc.references.NamedRangeManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.*;

class RecalcEngineTest {

    /**
     * In-memory store that records the order in which cells are evaluated.
     * A formula of "CIRC" or "ERR" makes the cell evaluate to that error.
     */
    private static final class RecordingStore implements CellStore {
        final Map<CellReference, String> formulas = new HashMap<>();
        final List<CellReference> evaluated = new ArrayList<>();
        final NamedRangeManager names = new NamedRangeManager();
        int cacheClears;

        @Override
        public Set<CellReference> getFormulaCells() {
            return new TreeSet<>(formulas.keySet());
        }

        @Override
        public String getFormula(CellReference cell) {
            return formulas.get(cell.toRelative());
        }

        @Override
        public Value getValue(CellReference cell) {
            evaluated.add(cell);
            String formula = formulas.get(cell);
            if ("CIRC".equals(formula)) {
                return Value.error(ErrorKind.CIRC);
            }
            if ("ERR".equals(formula)) {
                return Value.error(ErrorKind.ERR);
            }
            return Value.number(evaluated.size());
        }

        @Override
        public void clearCache() {
            cacheClears++;
        }

        @Override
        public NamedRangeLookup getNamedRanges() {
            return names;
        }
    }

    private RecordingStore store;
    private RecalcEngine engine;

    @BeforeEach
    void setUp() {
        store = new RecordingStore();
        engine = new RecalcEngine(store, RecalcMode.MANUAL, RecalcOrder.NATURAL);
    }

    private static CellReference ref(String text) {
        return CellReference.parse(text);
    }

    private static List<CellReference> refs(String... texts) {
        List<CellReference> result = new ArrayList<>();
        for (String text : texts) {
            result.add(ref(text));
        }
        return result;
    }

    private void formula(String cell, String formula) {
        store.formulas.put(ref(cell), formula);
        engine.updateCellDependency(ref(cell), formula);
    }

    /**
     * Natural order puts every cell after the cells it reads, whatever their positions.
     */
    @Test
    void testNaturalOrderIsTopological() {
        formula("A1", "B5+C1");
        formula("B5", "C1*2");
        formula("C1", "D9");
        formula("A2", "1");

        List<CellReference> order = engine.calculationOrder(new LinkedHashSet<>(refs("A1", "A2", "B5", "C1")));
        assertEquals(4, order.size());
        assertTrue(order.indexOf(ref("C1")) < order.indexOf(ref("B5")));
        assertTrue(order.indexOf(ref("B5")) < order.indexOf(ref("A1")));
    }

    @Test
    void testCycleMembersGoLastInPositionOrder() {
        formula("A1", "B1");
        formula("B1", "A1");
        formula("C1", "A1");
        formula("D1", "7");
        assertEquals(refs("D1", "A1", "B1", "C1"),
                engine.calculationOrder(new LinkedHashSet<>(refs("A1", "B1", "C1", "D1"))));
    }

    @Test
    void testPositionalOrders() {
        formula("B1", "A2");
        formula("A2", "1");
        formula("A1", "B1");
        Set<CellReference> cells = new LinkedHashSet<>(refs("B1", "A2", "A1"));

        engine.setOrder(RecalcOrder.COLUMN_WISE);
        assertEquals(refs("A1", "A2", "B1"), engine.calculationOrder(cells));
        engine.setOrder(RecalcOrder.ROW_WISE);
        assertEquals(refs("A1", "B1", "A2"), engine.calculationOrder(cells));
    }

    @Test
    void testMarkDirtyReachesTransitiveReaders() {
        formula("B1", "A1");
        formula("C1", "B1");
        formula("D1", "Z9");
        engine.markDirty(ref("A1"));
        assertEquals(new TreeSet<>(refs("A1", "B1", "C1")), new TreeSet<>(engine.getDirtyCells()));
        assertTrue(engine.needsRecalc());
        assertTrue(store.evaluated.isEmpty());
    }

    @Test
    void testIncrementalPassEvaluatesOnlyDirtyFormulas() {
        formula("B1", "A1");
        formula("C1", "B1");
        formula("D1", "Z9");
        engine.markDirty(ref("A1"));

        RecalcStats stats = engine.recalculate(false);
        assertEquals(2, stats.getCellsEvaluated());
        assertEquals(refs("B1", "C1"), store.evaluated);
        assertFalse(engine.needsRecalc());
        assertEquals(1, store.cacheClears);
    }

    /**
     * Formulas read by the pass but not dirty themselves are recomputed first,
     * deepest first, and are not counted.
     */
    @Test
    void testPrecedentsOutsideThePassAreRefilledBottomUp() {
        formula("C1", "B1");
        formula("B1", "A1");
        formula("A1", "Z9");
        formula("D1", "C1+E5");
        engine.markDirty(ref("D1"));

        assertEquals(new TreeSet<>(refs("A1", "B1", "C1")),
                new TreeSet<>(engine.formulaPrecedents(Collections.singleton(ref("D1")))));
        RecalcStats stats = engine.recalculate(false);
        assertEquals(refs("A1", "B1", "C1", "D1"), store.evaluated);
        assertEquals(1, stats.getCellsEvaluated());
    }

    @Test
    void testFullPassCountsErrorsAndCycles() {
        formula("A1", "CIRC");
        formula("A2", "ERR");
        formula("A3", "1");

        RecalcStats stats = engine.recalculate(true);
        assertEquals(3, stats.getCellsEvaluated());
        assertEquals(1, stats.getCircularRefsFound());
        assertEquals(1, stats.getErrorsFound());
        assertEquals(Collections.singleton(ref("A1")), engine.getCircularReferences());
        assertTrue(stats.getElapsedMs() >= 0);
    }

    @Test
    void testAutomaticModeRecalculatesOnMarkDirty() {
        engine.setMode(RecalcMode.AUTOMATIC);
        formula("B1", "A1");
        engine.markDirty(ref("A1"));
        assertEquals(refs("B1"), store.evaluated);
        assertFalse(engine.needsRecalc());
    }

    @Test
    void testLiveCircularSetClearsOnNextPass() {
        engine.recordCircular(ref("$A$1"));
        assertEquals(Collections.singleton(ref("A1")), engine.getCircularReferences());
        engine.recalculate(true);
        assertTrue(engine.getCircularReferences().isEmpty());
    }

    @Test
    void testGraphQueriesAndReset() {
        formula("C1", "A1+B1");
        formula("A1", "C1");
        assertEquals(new TreeSet<>(refs("A1", "B1")), new TreeSet<>(engine.getDependencies(ref("C1"))));
        assertEquals(Collections.singleton(ref("A1")), engine.getDependents(ref("C1")));
        assertEquals(new TreeSet<>(refs("A1", "C1")), engine.findCircularReferences());

        engine.reset();
        assertTrue(engine.getGraph().isEmpty());
        engine.rebuildDependencyGraph();
        assertEquals(Collections.singleton(ref("C1")), engine.getDependents(ref("A1")));
    }

    @Test
    void testRemovingAFormulaDropsItsEdges() {
        formula("B1", "A1");
        store.formulas.remove(ref("B1"));
        engine.updateCellDependency(ref("B1"), null);
        assertTrue(engine.getDependents(ref("A1")).isEmpty());
    }

    @Test
    void testModeAndOrderParsing() {
        assertEquals(RecalcMode.MANUAL, RecalcMode.fromValue(" manual "));
        assertEquals(RecalcOrder.COLUMN_WISE, RecalcOrder.fromValue("Column-Wise"));
        assertEquals(RecalcOrder.ROW_WISE, RecalcOrder.fromValue("rowwise"));
        assertEquals(RecalcOrder.NATURAL, RecalcOrder.fromValue("natural"));
        assertThrows(IllegalArgumentException.class, () -> RecalcMode.fromValue("sometimes"));
    }
}
