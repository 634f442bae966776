package com.gridcalc.recalc;

import com.gridcalc.references.CellReference;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Who-reads-whom between cells.
 * An edge a -> b means the formula in a reads cell b. Both directions are kept
 * so dirty propagation can walk from a changed cell to its readers.
 */
public class DependencyGraph {

    // Forward adjacency: cell -> cells its formula reads
    private final Map<CellReference, Set<CellReference>> dependencies = new HashMap<>();
    // Reverse adjacency: cell -> formula cells that read it
    private final Map<CellReference, Set<CellReference>> dependents = new HashMap<>();

    /**
     * Replaces the out-edges of {@code cell} with {@code newDependencies}
     * (an empty set removes the cell's edges entirely).
     */
    public void update(CellReference cell, Set<CellReference> newDependencies) {
        CellReference key = cell.toRelative();
        Set<CellReference> old = dependencies.remove(key);
        if (old != null) {
            for (CellReference target : old) {
                Set<CellReference> readers = dependents.get(target);
                if (readers != null) {
                    readers.remove(key);
                    if (readers.isEmpty()) {
                        dependents.remove(target);
                    }
                }
            }
        }
        if (newDependencies.isEmpty()) {
            return;
        }
        Set<CellReference> targets = new HashSet<>();
        for (CellReference dependency : newDependencies) {
            CellReference target = dependency.toRelative();
            targets.add(target);
            dependents.computeIfAbsent(target, k -> new HashSet<>()).add(key);
        }
        dependencies.put(key, targets);
    }

    public void remove(CellReference cell) {
        update(cell, Collections.<CellReference>emptySet());
    }

    public Set<CellReference> getDependencies(CellReference cell) {
        Set<CellReference> result = dependencies.get(cell.toRelative());
        return result == null ? Collections.<CellReference>emptySet() : Collections.unmodifiableSet(result);
    }

    public Set<CellReference> getDependents(CellReference cell) {
        Set<CellReference> result = dependents.get(cell.toRelative());
        return result == null ? Collections.<CellReference>emptySet() : Collections.unmodifiableSet(result);
    }

    /**
     * Cells that have at least one out-edge.
     */
    public Set<CellReference> getFormulaNodes() {
        return Collections.unmodifiableSet(dependencies.keySet());
    }

    public boolean isEmpty() {
        return dependencies.isEmpty();
    }

    public void clear() {
        dependencies.clear();
        dependents.clear();
    }

    /**
     * Forward adjacency as a sorted copy, for reporting.
     */
    public Map<CellReference, Set<CellReference>> forwardSnapshot() {
        return snapshot(dependencies);
    }

    /**
     * Reverse adjacency as a sorted copy, for reporting.
     */
    public Map<CellReference, Set<CellReference>> reverseSnapshot() {
        return snapshot(dependents);
    }

    private static Map<CellReference, Set<CellReference>> snapshot(Map<CellReference, Set<CellReference>> graph) {
        Map<CellReference, Set<CellReference>> copy = new TreeMap<>();
        for (Map.Entry<CellReference, Set<CellReference>> entry : graph.entrySet()) {
            copy.put(entry.getKey(), new TreeSet<>(entry.getValue()));
        }
        return copy;
    }
}
