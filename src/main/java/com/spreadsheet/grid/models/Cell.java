package com.spreadsheet.grid.models;

import com.spreadsheet.grid.formula.Formula;

/**
 * Storage unit of a sheet.
 * Stores:
 * - value: the literal, or the last computed result when a formula is present
 * - formula: parsed formula (null for literal cells)
 * - style: presentation hints
 * - state: whether the cached value of a formula cell is fresh
 */
public class Cell {
    private CellValue value;
    private Formula formula;
    private CellStyle style;
    private CellState state = CellState.CLEAN;

    public Cell(CellValue value, Formula formula, CellStyle style) {
        this.value = value == null ? CellValue.empty() : value;
        this.formula = formula;
        this.style = style == null ? new CellStyle() : style;
        if (formula != null) {
            this.state = CellState.DIRTY;
        }
    }

    public static Cell withValue(CellValue value) {
        return new Cell(value, null, null);
    }

    public CellValue getValue() {
        return value;
    }

    public void setValue(CellValue value) {
        this.value = value == null ? CellValue.empty() : value;
    }

    public boolean hasFormula() {
        return formula != null;
    }

    public Formula getFormula() {
        return formula;
    }

    /**
     * Original formula text, e.g. "=SUM(A1:A3)", or null for literals.
     */
    public String getFormulaText() {
        return formula == null ? null : formula.getText();
    }

    public CellStyle getStyle() {
        return style;
    }

    public void setStyle(CellStyle style) {
        this.style = style == null ? new CellStyle() : style;
    }

    public CellState getState() {
        return state;
    }

    public void setState(CellState state) {
        this.state = state;
    }

    public boolean isDirty() {
        return state == CellState.DIRTY;
    }
}
