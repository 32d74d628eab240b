package com.spreadsheet.grid.models;

/**
 * Recalculation state of a formula cell.
 * CLEAN -> DIRTY -> EVALUATING -> CLEAN or ERROR.
 * Meeting a cell that is already EVALUATING means a cycle.
 */
public enum CellState {
    CLEAN,
    DIRTY,
    EVALUATING,
    ERROR
}
