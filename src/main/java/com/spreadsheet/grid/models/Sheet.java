package com.spreadsheet.grid.models;

import com.spreadsheet.grid.graph.DependencyGraph;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A single sheet of a workbook:
 * - a name
 * - sparse cell storage keyed by CellRef (only non-empty cells are kept)
 * - column width / row height overrides on top of sheet-wide defaults
 * - frozen row/column counts
 * - the dependency graph of its formula cells
 */
public class Sheet {

    public static final double DEFAULT_COLUMN_WIDTH = 100.0;
    public static final double DEFAULT_ROW_HEIGHT = 24.0;

    private String name;
    // Insertion-ordered so iteration (and therefore usedRange ties) is deterministic
    private final Map<CellRef, Cell> cells = new LinkedHashMap<>();

    private final Map<Integer, Double> colWidths = new HashMap<>();
    private final Map<Integer, Double> rowHeights = new HashMap<>();
    private final double defaultColWidth;
    private final double defaultRowHeight;

    private int frozenRows;
    private int frozenCols;

    private final DependencyGraph dependencyGraph = new DependencyGraph();

    public Sheet(String name) {
        this(name, DEFAULT_COLUMN_WIDTH, DEFAULT_ROW_HEIGHT);
    }

    public Sheet(String name, double defaultColWidth, double defaultRowHeight) {
        requirePositive(defaultColWidth, "default column width");
        requirePositive(defaultRowHeight, "default row height");
        this.name = name;
        this.defaultColWidth = defaultColWidth;
        this.defaultRowHeight = defaultRowHeight;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    // ------------------------
    // Cell storage
    // ------------------------

    /**
     * Empty when the cell was never written or has been cleared.
     */
    public Optional<Cell> get(CellRef ref) {
        return Optional.ofNullable(cells.get(ref));
    }

    /**
     * Inserts or overwrites a cell. An Empty value without a formula is
     * the same as {@link #clear(CellRef)}.
     */
    public void set(CellRef ref, Cell cell) {
        if (cell.getValue().isEmpty() && !cell.hasFormula()) {
            cells.remove(ref);
        } else {
            cells.put(ref, cell);
        }
    }

    public void clear(CellRef ref) {
        cells.remove(ref);
    }

    /**
     * Read-only view of the stored cells in insertion order.
     */
    public Map<CellRef, Cell> cells() {
        return Collections.unmodifiableMap(cells);
    }

    public int cellCount() {
        return cells.size();
    }

    /**
     * Bounding box of all stored cells, empty for a sheet with no cells.
     */
    public Optional<CellRange> usedRange() {
        if (cells.isEmpty()) {
            return Optional.empty();
        }
        int minRow = Integer.MAX_VALUE;
        int minCol = Integer.MAX_VALUE;
        int maxRow = 0;
        int maxCol = 0;
        for (CellRef ref : cells.keySet()) {
            minRow = Math.min(minRow, ref.getRow());
            minCol = Math.min(minCol, ref.getCol());
            maxRow = Math.max(maxRow, ref.getRow());
            maxCol = Math.max(maxCol, ref.getCol());
        }
        return Optional.of(new CellRange(new CellRef(minRow, minCol), new CellRef(maxRow, maxCol)));
    }

    // ------------------------
    // Sizing
    // ------------------------

    public double getColWidth(int col) {
        return colWidths.getOrDefault(col, defaultColWidth);
    }

    /**
     * Sets a width override; a width equal to the default removes the override.
     */
    public void setColWidth(int col, double width) {
        requireIndex(col, "column");
        requirePositive(width, "column width");
        if (width == defaultColWidth) {
            colWidths.remove(col);
        } else {
            colWidths.put(col, width);
        }
    }

    public void resetColWidth(int col) {
        colWidths.remove(col);
    }

    public double getRowHeight(int row) {
        return rowHeights.getOrDefault(row, defaultRowHeight);
    }

    public void setRowHeight(int row, double height) {
        requireIndex(row, "row");
        requirePositive(height, "row height");
        if (height == defaultRowHeight) {
            rowHeights.remove(row);
        } else {
            rowHeights.put(row, height);
        }
    }

    public void resetRowHeight(int row) {
        rowHeights.remove(row);
    }

    public Map<Integer, Double> getColWidthOverrides() {
        return Collections.unmodifiableMap(colWidths);
    }

    public Map<Integer, Double> getRowHeightOverrides() {
        return Collections.unmodifiableMap(rowHeights);
    }

    public double getDefaultColWidth() {
        return defaultColWidth;
    }

    public double getDefaultRowHeight() {
        return defaultRowHeight;
    }

    public int getFrozenRows() {
        return frozenRows;
    }

    public void setFrozenRows(int frozenRows) {
        requireIndex(frozenRows, "frozen row count");
        this.frozenRows = frozenRows;
    }

    public int getFrozenCols() {
        return frozenCols;
    }

    public void setFrozenCols(int frozenCols) {
        requireIndex(frozenCols, "frozen column count");
        this.frozenCols = frozenCols;
    }

    public DependencyGraph getDependencyGraph() {
        return dependencyGraph;
    }

    private static void requirePositive(double size, String what) {
        if (!(size > 0) || Double.isInfinite(size)) {
            throw new IllegalArgumentException("Invalid " + what + ": " + size);
        }
    }

    private static void requireIndex(int index, String what) {
        if (index < 0) {
            throw new IllegalArgumentException("Invalid " + what + ": " + index);
        }
    }
}
