package com.spreadsheet.grid.exceptions;

/**
 * Thrown by the formula parser (the write is rejected and the cell keeps its
 * previous content) and by the evaluator (the recalculator turns it into an
 * error value in the cell).
 */
public class FormulaException extends RuntimeException {

    private final FormulaErrorKind kind;

    public FormulaException(FormulaErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public FormulaErrorKind getKind() {
        return kind;
    }
}
