package com.spreadsheet.grid.models;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * One or more selected ranges plus the primary cell, i.e. the last endpoint
 * the user set. The primary cell is what the format bar shows.
 * The range list is never empty.
 */
public class Selection {

    private CellRef primary;
    private final List<CellRange> ranges = new ArrayList<>();

    public Selection(CellRef cell) {
        this.primary = cell;
        this.ranges.add(CellRange.of(cell));
    }

    public static Selection fromRange(CellRange range) {
        Selection selection = new Selection(range.getEnd());
        selection.ranges.set(0, range);
        return selection;
    }

    public CellRef getPrimary() {
        return primary;
    }

    /**
     * Replaces all ranges with a single range from the primary cell to 'end'.
     * Repeated calls do not stack; the primary cell stays put.
     */
    public void extendTo(CellRef end) {
        ranges.clear();
        ranges.add(new CellRange(primary, end));
    }

    /**
     * Appends a range (ctrl-click) and makes its end the primary cell.
     */
    public void addRange(CellRange range) {
        ranges.add(range);
        primary = range.getEnd();
    }

    /**
     * Resets to a single-cell selection.
     */
    public void set(CellRef cell) {
        primary = cell;
        ranges.clear();
        ranges.add(CellRange.of(cell));
    }

    /**
     * Arrow-key movement: moves the primary cell, clamped at row/column zero,
     * and collapses the selection onto it.
     */
    public void move(int dRow, int dCol) {
        set(primary.clampedOffset(dRow, dCol));
    }

    public boolean isSelected(CellRef cell) {
        for (CellRange range : ranges) {
            if (range.contains(cell)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Union of all selected cells; overlapping ranges count once.
     */
    public Set<CellRef> cells() {
        Set<CellRef> result = new LinkedHashSet<>();
        for (CellRange range : ranges) {
            for (CellRef cell : range.cells()) {
                result.add(cell);
            }
        }
        return result;
    }

    public int cellCount() {
        return cells().size();
    }

    public CellRange range() {
        return ranges.get(0);
    }

    public List<CellRange> ranges() {
        return Collections.unmodifiableList(ranges);
    }
}
