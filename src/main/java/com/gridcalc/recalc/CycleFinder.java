package com.gridcalc.recalc;

import com.gridcalc.references.CellReference;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Finds every cell that sits on a dependency cycle, using Tarjan's
 * strongly-connected-components algorithm with explicit stacks.
 * A cell is reported when its component has more than one member or
 * when it reads itself.
 */
public final class CycleFinder {

    private final DependencyGraph graph;
    private final Map<CellReference, Integer> index = new HashMap<>();
    private final Map<CellReference, Integer> lowLink = new HashMap<>();
    private final Deque<CellReference> componentStack = new ArrayDeque<>();
    private final Set<CellReference> onStack = new HashSet<>();
    private final Set<CellReference> cyclic = new TreeSet<>();
    private int counter;

    private CycleFinder(DependencyGraph graph) {
        this.graph = graph;
    }

    public static Set<CellReference> findCycles(DependencyGraph graph) {
        CycleFinder finder = new CycleFinder(graph);
        for (CellReference node : new TreeSet<>(graph.getFormulaNodes())) {
            if (!finder.index.containsKey(node)) {
                finder.strongConnect(node);
            }
        }
        return finder.cyclic;
    }

    // One call-stack frame of the recursive formulation
    private static final class Frame {
        final CellReference node;
        final Iterator<CellReference> successors;

        Frame(CellReference node, Iterator<CellReference> successors) {
            this.node = node;
            this.successors = successors;
        }
    }

    private void visit(CellReference node, Deque<Frame> callStack) {
        index.put(node, counter);
        lowLink.put(node, counter);
        counter++;
        componentStack.push(node);
        onStack.add(node);
        callStack.push(new Frame(node, graph.getDependencies(node).iterator()));
    }

    private void strongConnect(CellReference root) {
        Deque<Frame> callStack = new ArrayDeque<>();
        visit(root, callStack);
        while (!callStack.isEmpty()) {
            Frame frame = callStack.peek();
            if (frame.successors.hasNext()) {
                CellReference next = frame.successors.next();
                if (!index.containsKey(next)) {
                    visit(next, callStack);
                } else if (onStack.contains(next)) {
                    lowLink.put(frame.node, Math.min(lowLink.get(frame.node), index.get(next)));
                }
                continue;
            }
            callStack.pop();
            if (!callStack.isEmpty()) {
                CellReference parent = callStack.peek().node;
                lowLink.put(parent, Math.min(lowLink.get(parent), lowLink.get(frame.node)));
            }
            if (lowLink.get(frame.node).equals(index.get(frame.node))) {
                popComponent(frame.node);
            }
        }
    }

    private void popComponent(CellReference root) {
        Set<CellReference> component = new HashSet<>();
        CellReference member;
        do {
            member = componentStack.pop();
            onStack.remove(member);
            component.add(member);
        } while (!member.equals(root));
        if (component.size() > 1 || graph.getDependencies(root).contains(root)) {
            cyclic.addAll(component);
        }
    }
}
