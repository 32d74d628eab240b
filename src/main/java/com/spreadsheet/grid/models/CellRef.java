package com.spreadsheet.grid.models;

import java.util.Optional;

/**
 * Immutable (row, col) coordinate of a cell, both 0-based.
 * A1 notation: column letters form a bijective base-26 numeral
 * (A=1 ... Z=26, AA=27 ...) and the row is 1-based.
 */
public final class CellRef implements Comparable<CellRef> {

    private final int row;
    private final int col;

    public CellRef(int row, int col) {
        if (row < 0 || col < 0) {
            throw new IllegalArgumentException("Cell coordinates must be non-negative: (" + row + ", " + col + ")");
        }
        this.row = row;
        this.col = col;
    }

    public int getRow() {
        return row;
    }

    public int getCol() {
        return col;
    }

    /**
     * Parses A1 notation such as "B3" or "aa10".
     * Returns empty for anything malformed instead of throwing.
     */
    public static Optional<CellRef> parse(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String s = text.trim();
        int i = 0;
        while (i < s.length() && isAsciiLetter(s.charAt(i))) {
            i++;
        }
        if (i == 0 || i == s.length()) {
            return Optional.empty();
        }
        int col = lettersToColumn(s.substring(0, i));
        if (col < 0) {
            return Optional.empty();
        }
        String digits = s.substring(i);
        for (int j = 0; j < digits.length(); j++) {
            char c = digits.charAt(j);
            if (c < '0' || c > '9') {
                return Optional.empty();
            }
        }
        int row;
        try {
            row = Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
        if (row < 1) {
            return Optional.empty();
        }
        return Optional.of(new CellRef(row - 1, col));
    }

    /**
     * Canonical uppercase A1 form, e.g. (2, 1) -> "B3".
     */
    public String toA1() {
        return columnToLetters(col) + (row + 1);
    }

    /**
     * Converts a 0-based column index to its letters: 0=A, 25=Z, 26=AA.
     */
    public static String columnToLetters(int col) {
        if (col < 0) {
            throw new IllegalArgumentException("Column index must be non-negative: " + col);
        }
        StringBuilder sb = new StringBuilder();
        long n = (long) col + 1;
        while (n > 0) {
            long remainder = (n - 1) % 26;
            sb.insert(0, (char) ('A' + remainder));
            n = (n - 1) / 26;
        }
        return sb.toString();
    }

    /**
     * Converts column letters (case-insensitive) to a 0-based index.
     * Returns -1 for empty input, non-letters or an index past Integer.MAX_VALUE.
     */
    public static int lettersToColumn(String letters) {
        if (letters == null || letters.isEmpty()) {
            return -1;
        }
        long index = 0;
        for (int i = 0; i < letters.length(); i++) {
            char c = Character.toUpperCase(letters.charAt(i));
            if (c < 'A' || c > 'Z') {
                return -1;
            }
            index = index * 26 + (c - 'A' + 1);
            if (index - 1 > Integer.MAX_VALUE) {
                return -1;
            }
        }
        return (int) (index - 1);
    }

    /**
     * Moves by the given deltas. Moving past row or column zero is a caller error.
     */
    public CellRef offset(int dRow, int dCol) {
        return new CellRef(row + dRow, col + dCol);
    }

    /**
     * Moves by the given deltas, stopping at row/column zero (arrow-key movement).
     */
    public CellRef clampedOffset(int dRow, int dCol) {
        return new CellRef(Math.max(0, row + dRow), Math.max(0, col + dCol));
    }

    private static boolean isAsciiLetter(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z');
    }

    @Override
    public int compareTo(CellRef other) {
        if (row != other.row) {
            return Integer.compare(row, other.row);
        }
        return Integer.compare(col, other.col);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellRef)) {
            return false;
        }
        CellRef other = (CellRef) o;
        return row == other.row && col == other.col;
    }

    @Override
    public int hashCode() {
        return 31 * row + col;
    }

    @Override
    public String toString() {
        return toA1();
    }
}
