package com.spreadsheet.grid.formula;

public enum UnaryOperator {
    NEGATE("-"),
    // Postfix: 50% is 0.5
    PERCENT("%");

    private final String symbol;

    UnaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
