package com.spreadsheet.grid.exceptions;

/**
 * Kinds of formula failure. Parse-time kinds reject the write; evaluation-time
 * kinds are stored in the cell as an error value whose kind is {@link #code()}.
 */
public enum FormulaErrorKind {
    INVALID_SYNTAX("invalid-syntax", true),
    INVALID_REF("invalid-ref", true),
    DIV_BY_ZERO("div-by-zero", false),
    UNKNOWN_FUNCTION("unknown-function", false),
    INVALID_ARGUMENT("invalid-argument", false),
    TYPE_ERROR("type-error", false),
    CIRCULAR_REFERENCE("circular-reference", false);

    private final String code;
    private final boolean parseTime;

    FormulaErrorKind(String code, boolean parseTime) {
        this.code = code;
        this.parseTime = parseTime;
    }

    public String code() {
        return code;
    }

    public boolean isParseTime() {
        return parseTime;
    }
}
