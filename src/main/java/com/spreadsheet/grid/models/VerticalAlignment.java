package com.spreadsheet.grid.models;

public enum VerticalAlignment {
    TOP,
    MIDDLE,
    BOTTOM
}
