package com.spreadsheet.grid.exceptions;

/**
 * Thrown when a sheet index does not exist in the workbook.
 */
public class SheetNotFoundException extends RuntimeException {
    public SheetNotFoundException(String message) {
        super(message);
    }
}
