package com.spreadsheet.grid.models;

import com.fasterxml.jackson.annotation.JsonCreator;

/**
 * Tag of a {@link CellValue}.
 */
public enum ValueType {
    EMPTY,
    TEXT,
    NUMBER,
    BOOLEAN,
    ERROR,
    DATE;

    /**
     * Allows case-insensitive JSON input, e.g. "number" -> NUMBER.
     */
    @JsonCreator
    public static ValueType fromValue(String value) {
        return ValueType.valueOf(value.trim().toUpperCase());
    }
}
