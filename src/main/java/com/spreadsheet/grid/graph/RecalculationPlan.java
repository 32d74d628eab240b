package com.spreadsheet.grid.graph;

import com.spreadsheet.grid.models.CellRef;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Output of {@link DependencyGraph#plan}: the cells to refresh in
 * dependency order, the chain depth of each, and the cells that could not be
 * ordered because of a cycle.
 */
public final class RecalculationPlan {
    private final List<CellRef> order;
    private final Map<CellRef, Integer> depth;
    private final Set<CellRef> cyclic;

    RecalculationPlan(List<CellRef> order, Map<CellRef, Integer> depth, Set<CellRef> cyclic) {
        this.order = Collections.unmodifiableList(order);
        this.depth = Collections.unmodifiableMap(depth);
        this.cyclic = Collections.unmodifiableSet(cyclic);
    }

    public List<CellRef> getOrder() {
        return order;
    }

    /**
     * Length of the longest dependency chain from a root to 'cell' within the plan.
     */
    public int depthOf(CellRef cell) {
        return depth.getOrDefault(cell, 0);
    }

    public Set<CellRef> getCyclic() {
        return cyclic;
    }

    public boolean hasCycle() {
        return !cyclic.isEmpty();
    }
}
