package com.spreadsheet.grid.graph;

import com.spreadsheet.grid.models.CellRange;
import com.spreadsheet.grid.models.CellRef;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Directed graph between formula cells and the cells/ranges they read.
 * <ul>
 *   <li>forward: formula cell -> referenced cells / ranges</li>
 *   <li>reverse: referenced cell -> formula cells reading it directly</li>
 *   <li>range reverse: referenced range -> formula cells reading it; a range
 *       edge matches every cell inside the range, stored or not</li>
 * </ul>
 * Ranges are indexed by each column they span, so a lookup only tests the
 * ranges in the cell's column. Ranges wider than {@link #MAX_INDEXED_COLUMNS}
 * are kept in one list and tested on every lookup.
 * Cycles are allowed in the stored graph; {@link #plan(Collection)} reports
 * them instead of failing.
 */
public class DependencyGraph {

    static final int MAX_INDEXED_COLUMNS = 64;

    private final Map<CellRef, Set<CellRef>> precedentCells = new HashMap<>();
    private final Map<CellRef, Set<CellRange>> precedentRanges = new HashMap<>();

    private final Map<CellRef, Set<CellRef>> dependents = new HashMap<>();
    private final Map<CellRange, Set<CellRef>> rangeDependents = new LinkedHashMap<>();

    private final Map<Integer, Set<CellRange>> rangesByColumn = new HashMap<>();
    private final Set<CellRange> wideRanges = new LinkedHashSet<>();

    /**
     * Replaces all outgoing edges of 'cell' with the given references.
     */
    public void setDependencies(CellRef cell, Set<CellRef> cells, Set<CellRange> ranges) {
        clearDependencies(cell);
        if (!cells.isEmpty()) {
            precedentCells.put(cell, new LinkedHashSet<>(cells));
            for (CellRef target : cells) {
                dependents.computeIfAbsent(target, k -> new LinkedHashSet<>()).add(cell);
            }
        }
        if (!ranges.isEmpty()) {
            precedentRanges.put(cell, new LinkedHashSet<>(ranges));
            for (CellRange range : ranges) {
                rangeDependents.computeIfAbsent(range, k -> {
                    indexRange(k);
                    return new LinkedHashSet<>();
                }).add(cell);
            }
        }
    }

    /**
     * Removes every outgoing edge of 'cell' and its entry on the reverse side.
     * Edges pointing at 'cell' from other formulas stay.
     */
    public void clearDependencies(CellRef cell) {
        Set<CellRef> oldCells = precedentCells.remove(cell);
        if (oldCells != null) {
            for (CellRef target : oldCells) {
                Set<CellRef> set = dependents.get(target);
                if (set != null) {
                    set.remove(cell);
                    if (set.isEmpty()) {
                        dependents.remove(target);
                    }
                }
            }
        }
        Set<CellRange> oldRanges = precedentRanges.remove(cell);
        if (oldRanges != null) {
            for (CellRange range : oldRanges) {
                Set<CellRef> set = rangeDependents.get(range);
                if (set != null) {
                    set.remove(cell);
                    if (set.isEmpty()) {
                        rangeDependents.remove(range);
                        unindexRange(range);
                    }
                }
            }
        }
    }

    public Set<CellRef> getPrecedentCells(CellRef cell) {
        return Collections.unmodifiableSet(precedentCells.getOrDefault(cell, Collections.emptySet()));
    }

    public Set<CellRange> getPrecedentRanges(CellRef cell) {
        return Collections.unmodifiableSet(precedentRanges.getOrDefault(cell, Collections.emptySet()));
    }

    /**
     * Formula cells that read 'cell' directly or through a range.
     */
    public Set<CellRef> getDependents(CellRef cell) {
        Set<CellRef> result = new LinkedHashSet<>(dependents.getOrDefault(cell, Collections.emptySet()));
        addRangeHits(cell, rangesByColumn.getOrDefault(cell.getCol(), Collections.emptySet()), result);
        addRangeHits(cell, wideRanges, result);
        return result;
    }

    private void addRangeHits(CellRef cell, Set<CellRange> candidates, Set<CellRef> result) {
        for (CellRange range : candidates) {
            if (range.contains(cell)) {
                result.addAll(rangeDependents.get(range));
            }
        }
    }

    private void indexRange(CellRange range) {
        if (range.colCount() > MAX_INDEXED_COLUMNS) {
            wideRanges.add(range);
            return;
        }
        for (int col = range.getStart().getCol(); col <= range.getEnd().getCol(); col++) {
            rangesByColumn.computeIfAbsent(col, k -> new LinkedHashSet<>()).add(range);
        }
    }

    private void unindexRange(CellRange range) {
        if (range.colCount() > MAX_INDEXED_COLUMNS) {
            wideRanges.remove(range);
            return;
        }
        for (int col = range.getStart().getCol(); col <= range.getEnd().getCol(); col++) {
            Set<CellRange> set = rangesByColumn.get(col);
            if (set != null) {
                set.remove(range);
                if (set.isEmpty()) {
                    rangesByColumn.remove(col);
                }
            }
        }
    }

    /**
     * Every formula cell with at least one registered reference.
     */
    public Set<CellRef> getFormulaCells() {
        Set<CellRef> result = new TreeSet<>(precedentCells.keySet());
        result.addAll(precedentRanges.keySet());
        return result;
    }

    /**
     * Breadth-first closure of the roots and everything that transitively depends on them.
     */
    public Set<CellRef> transitiveDependents(Collection<CellRef> roots) {
        return transitiveDependents(roots, new HashMap<>());
    }

    /**
     * Same closure, filling 'children' with each visited cell's dependents so
     * a planning pass looks them up once.
     */
    private Set<CellRef> transitiveDependents(Collection<CellRef> roots, Map<CellRef, Set<CellRef>> children) {
        Set<CellRef> visited = new LinkedHashSet<>(roots);
        Deque<CellRef> queue = new ArrayDeque<>(roots);
        while (!queue.isEmpty()) {
            CellRef current = queue.poll();
            for (CellRef child : children.computeIfAbsent(current, this::getDependents)) {
                if (visited.add(child)) {
                    queue.add(child);
                }
            }
        }
        return visited;
    }

    /**
     * Orders the roots and their transitive dependents with Kahn's algorithm.
     * Each cell appears after all of its precedents inside the affected set.
     * Cells that can never reach in-degree zero (members of a cycle, or
     * downstream of one) end up in {@link RecalculationPlan#getCyclic()}.
     */
    public RecalculationPlan plan(Collection<CellRef> roots) {
        Map<CellRef, Set<CellRef>> dependentsOf = new HashMap<>();
        Set<CellRef> affected = transitiveDependents(roots, dependentsOf);

        // 1. Edges inside the affected set and in-degrees
        Map<CellRef, List<CellRef>> edges = new HashMap<>();
        Map<CellRef, Integer> inDegree = new HashMap<>();
        for (CellRef node : affected) {
            inDegree.putIfAbsent(node, 0);
        }
        for (CellRef node : affected) {
            List<CellRef> children = new ArrayList<>();
            for (CellRef child : dependentsOf.get(node)) {
                if (affected.contains(child)) {
                    children.add(child);
                    inDegree.merge(child, 1, Integer::sum);
                }
            }
            edges.put(node, children);
        }

        // 2. Seed with in-degree 0
        Deque<CellRef> queue = new ArrayDeque<>();
        for (CellRef node : affected) {
            if (inDegree.get(node) == 0) {
                queue.add(node);
            }
        }

        // 3. Kahn, tracking the longest chain that reaches each cell
        List<CellRef> order = new ArrayList<>(affected.size());
        Map<CellRef, Integer> depth = new HashMap<>();
        while (!queue.isEmpty()) {
            CellRef current = queue.poll();
            order.add(current);
            int currentDepth = depth.getOrDefault(current, 0);
            for (CellRef child : edges.get(current)) {
                depth.merge(child, currentDepth + 1, Math::max);
                if (inDegree.merge(child, -1, Integer::sum) == 0) {
                    queue.add(child);
                }
            }
        }

        Set<CellRef> cyclic = new TreeSet<>();
        if (order.size() != affected.size()) {
            cyclic.addAll(affected);
            cyclic.removeAll(order);
        }
        Map<CellRef, Integer> orderedDepth = new LinkedHashMap<>();
        for (CellRef cell : order) {
            orderedDepth.put(cell, depth.getOrDefault(cell, 0));
        }
        return new RecalculationPlan(order, orderedDepth, cyclic);
    }

    /**
     * Cells currently caught in a cycle anywhere in the graph. Empty for a valid (acyclic) graph.
     */
    public Set<CellRef> findCycles() {
        return plan(getFormulaCells()).getCyclic();
    }

    public boolean isAcyclic() {
        return findCycles().isEmpty();
    }

    /**
     * Forward edges as A1 strings, e.g. {"C1": ["A1", "B1:B3"]}, sorted by cell.
     */
    public Map<String, List<String>> describePrecedents() {
        Map<String, List<String>> result = new LinkedHashMap<>();
        for (CellRef cell : getFormulaCells()) {
            List<String> refs = new ArrayList<>();
            for (CellRef ref : getPrecedentCells(cell)) {
                refs.add(ref.toA1());
            }
            for (CellRange range : getPrecedentRanges(cell)) {
                refs.add(range.toRangeString());
            }
            result.put(cell.toA1(), refs);
        }
        return result;
    }

    /**
     * Reverse edges as A1 strings, e.g. {"A1": ["C1"], "B1:B3": ["C1"]}.
     */
    public Map<String, List<String>> describeDependents() {
        Map<String, List<String>> result = new LinkedHashMap<>();
        for (Map.Entry<CellRef, Set<CellRef>> entry : new TreeMap<>(dependents).entrySet()) {
            result.put(entry.getKey().toA1(), toA1List(entry.getValue()));
        }
        for (Map.Entry<CellRange, Set<CellRef>> entry : rangeDependents.entrySet()) {
            result.put(entry.getKey().toRangeString(), toA1List(entry.getValue()));
        }
        return result;
    }

    private static List<String> toA1List(Set<CellRef> cells) {
        List<String> list = new ArrayList<>();
        for (CellRef cell : new TreeSet<>(cells)) {
            list.add(cell.toA1());
        }
        return list;
    }
}
