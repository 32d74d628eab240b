package com.spreadsheet.grid.exceptions;

/**
 * Error body returned by the REST layer.
 * For example:
 * {
 *   "code": "INVALID_SYNTAX",
 *   "message": "Unexpected token ')' at position 4"
 * }
 */
public class ErrorResponse {
    private String code;
    private String message;

    public ErrorResponse(String code, String message) {
        this.code = code;
        this.message = message;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
