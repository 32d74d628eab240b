package com.spreadsheet.grid.models;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * Rectangular span of cells. The constructor normalizes its corners,
 * so start is always top-left and end bottom-right.
 */
public final class CellRange {

    private final CellRef start;
    private final CellRef end;

    public CellRange(CellRef a, CellRef b) {
        this.start = new CellRef(Math.min(a.getRow(), b.getRow()), Math.min(a.getCol(), b.getCol()));
        this.end = new CellRef(Math.max(a.getRow(), b.getRow()), Math.max(a.getCol(), b.getCol()));
    }

    public static CellRange of(CellRef cell) {
        return new CellRange(cell, cell);
    }

    public CellRef getStart() {
        return start;
    }

    public CellRef getEnd() {
        return end;
    }

    public boolean contains(CellRef cell) {
        return cell.getRow() >= start.getRow()
                && cell.getRow() <= end.getRow()
                && cell.getCol() >= start.getCol()
                && cell.getCol() <= end.getCol();
    }

    public long rowCount() {
        return (long) end.getRow() - start.getRow() + 1;
    }

    public long colCount() {
        return (long) end.getCol() - start.getCol() + 1;
    }

    public long cellCount() {
        return rowCount() * colCount();
    }

    /**
     * Lazy row-major enumeration. Each call to iterator() starts over.
     */
    public Iterable<CellRef> cells() {
        return RangeIterator::new;
    }

    /**
     * Parses "A1:C5". A single reference without ':' is not a range.
     */
    public static Optional<CellRange> parse(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String[] parts = text.split(":", -1);
        if (parts.length != 2) {
            return Optional.empty();
        }
        Optional<CellRef> a = CellRef.parse(parts[0]);
        Optional<CellRef> b = CellRef.parse(parts[1]);
        if (a.isEmpty() || b.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new CellRange(a.get(), b.get()));
    }

    public String toRangeString() {
        return start.toA1() + ":" + end.toA1();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellRange)) {
            return false;
        }
        CellRange other = (CellRange) o;
        return start.equals(other.start) && end.equals(other.end);
    }

    @Override
    public int hashCode() {
        return 31 * start.hashCode() + end.hashCode();
    }

    @Override
    public String toString() {
        return toRangeString();
    }

    private final class RangeIterator implements Iterator<CellRef> {
        private int row = start.getRow();
        private int col = start.getCol();

        @Override
        public boolean hasNext() {
            return row <= end.getRow();
        }

        @Override
        public CellRef next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            CellRef current = new CellRef(row, col);
            if (col < end.getCol()) {
                col++;
            } else {
                col = start.getCol();
                row++;
            }
            return current;
        }
    }
}
