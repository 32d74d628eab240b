package com.spreadsheet.grid.models;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CellRefTest {

    /**
     * Column letters are bijective BASE26.
     */
    @ParameterizedTest
    @CsvSource({
            "0, A",
            "25, Z",
            "26, AA",
            "51, AZ",
            "52, BA",
            "701, ZZ",
            "702, AAA",
            "16383, XFD"
    })
    void testColumnLettersAreBijectiveBase26(int col, String letters) {
        assertEquals(letters, CellRef.columnToLetters(col));
        assertEquals(col, CellRef.lettersToColumn(letters));
    }

    /**
     * Parse reads letters and one based row.
     */
    @Test
    void testParseReadsLettersAndOneBasedRow() {
        CellRef ref = CellRef.parse("B3").orElseThrow();
        assertEquals(2, ref.getRow());
        assertEquals(1, ref.getCol());
    }

    /**
     * Parse is case insensitive and trims.
     */
    @Test
    void testParseIsCaseInsensitiveAndTrims() {
        assertEquals(Optional.of(new CellRef(9, 26)), CellRef.parse("  aa10 "));
    }

    /**
     * Parse rejects malformed input.
     */
    @ParameterizedTest
    @ValueSource(strings = {"", "A", "1", "A0", "1A", "A1B", "A-1", "A 1", "A99999999999", "Ä1", "A١"})
    void testParseRejectsMalformedInput(String text) {
        assertTrue(CellRef.parse(text).isEmpty(), text);
    }

    /**
     * Parse rejects null.
     */
    @Test
    void testParseRejectsNull() {
        assertTrue(CellRef.parse(null).isEmpty());
    }

    /**
     * A1 text round-trips for assorted cells.
     */
    @Test
    void testA1RoundTripsForAssortedCells() {
        int[] rows = {0, 1, 9, 99, 1048575};
        int[] cols = {0, 1, 25, 26, 701, 702, 16383};
        for (int row : rows) {
            for (int col : cols) {
                CellRef ref = new CellRef(row, col);
                assertEquals(Optional.of(ref), CellRef.parse(ref.toA1()), ref.toA1());
            }
        }
    }

    /**
     * Negative coordinates are rejected.
     */
    @Test
    void testNegativeCoordinatesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> new CellRef(-1, 0));
        assertThrows(IllegalArgumentException.class, () -> new CellRef(0, -1));
    }

    /**
     * Clamped offset stops at zero.
     */
    @Test
    void testClampedOffsetStopsAtZero() {
        CellRef a1 = new CellRef(0, 0);
        assertEquals(a1, a1.clampedOffset(-1, -5));
        assertEquals(new CellRef(2, 0), new CellRef(1, 1).clampedOffset(1, -3));
    }

    /**
     * Offset past zero throws.
     */
    @Test
    void testOffsetPastZeroThrows() {
        assertThrows(IllegalArgumentException.class, () -> new CellRef(0, 0).offset(-1, 0));
        assertEquals(new CellRef(3, 4), new CellRef(1, 1).offset(2, 3));
    }

    /**
     * Orders row major.
     */
    @Test
    void testOrdersRowMajor() {
        assertTrue(new CellRef(0, 5).compareTo(new CellRef(1, 0)) < 0);
        assertTrue(new CellRef(1, 2).compareTo(new CellRef(1, 1)) > 0);
        assertEquals(0, new CellRef(3, 3).compareTo(new CellRef(3, 3)));
    }
}
