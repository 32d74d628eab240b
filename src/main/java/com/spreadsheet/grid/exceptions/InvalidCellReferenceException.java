package com.spreadsheet.grid.exceptions;

/**
 * Thrown at the service boundary when a caller passes a malformed
 * A1 reference or range string, e.g. "A0" or "B2:".
 */
public class InvalidCellReferenceException extends RuntimeException {
    public InvalidCellReferenceException(String message) {
        super(message);
    }
}
