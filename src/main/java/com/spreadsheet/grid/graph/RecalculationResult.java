package com.spreadsheet.grid.graph;

import com.spreadsheet.grid.models.CellRef;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * What a mutation or recalculation pass did: the cells whose cached value
 * changed (the UI repaints only these), the cells found in a cycle, and how
 * many formulas were evaluated.
 */
public final class RecalculationResult {

    private static final RecalculationResult NONE = new RecalculationResult(Collections.emptySet(), Collections.emptySet(), 0);

    private final Set<CellRef> changed;
    private final Set<CellRef> cyclic;
    private final int evaluated;

    public RecalculationResult(Set<CellRef> changed, Set<CellRef> cyclic, int evaluated) {
        this.changed = Collections.unmodifiableSet(new TreeSet<>(changed));
        this.cyclic = Collections.unmodifiableSet(new TreeSet<>(cyclic));
        this.evaluated = evaluated;
    }

    public static RecalculationResult none() {
        return NONE;
    }

    public Set<CellRef> getChanged() {
        return changed;
    }

    public Set<CellRef> getCyclic() {
        return cyclic;
    }

    public int getEvaluated() {
        return evaluated;
    }

    public boolean hasChanges() {
        return !changed.isEmpty();
    }

    @Override
    public String toString() {
        return "RecalculationResult{changed=" + changed + ", cyclic=" + cyclic + ", evaluated=" + evaluated + "}";
    }
}
