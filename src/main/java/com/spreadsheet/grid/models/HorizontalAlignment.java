package com.spreadsheet.grid.models;

public enum HorizontalAlignment {
    LEFT,
    CENTER,
    RIGHT
}
