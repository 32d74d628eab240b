package com.spreadsheet.grid.models;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class SheetTest {

    private Sheet sheet;

    @BeforeEach
    void setUp() {
        sheet = new Sheet("Data");
    }

    private static CellRef ref(String a1) {
        return CellRef.parse(a1).orElseThrow();
    }

    /**
     * Setting empty removes the cell.
     */
    @Test
    void testSettingEmptyRemovesTheCell() {
        sheet.set(ref("B2"), Cell.withValue(CellValue.number(5)));
        assertEquals(1, sheet.cellCount());

        sheet.set(ref("B2"), Cell.withValue(CellValue.empty()));
        assertEquals(0, sheet.cellCount());
        assertTrue(sheet.get(ref("B2")).isEmpty());
    }

    /**
     * Unwritten cell is absent.
     */
    @Test
    void testUnwrittenCellIsAbsent() {
        assertTrue(sheet.get(ref("Z99")).isEmpty());
    }

    /**
     * Used range is the bounding box.
     */
    @Test
    void testUsedRangeIsTheBoundingBox() {
        assertEquals(Optional.empty(), sheet.usedRange());

        sheet.set(ref("C2"), Cell.withValue(CellValue.text("x")));
        sheet.set(ref("A5"), Cell.withValue(CellValue.number(1)));
        sheet.set(ref("B3"), Cell.withValue(CellValue.bool(true)));

        assertEquals(new CellRange(ref("A2"), ref("C5")), sheet.usedRange().orElseThrow());

        sheet.clear(ref("A5"));
        assertEquals(new CellRange(ref("B2"), ref("C3")), sheet.usedRange().orElseThrow());
    }

    /**
     * Column width overrides.
     */
    @Test
    void testColumnWidthOverrides() {
        assertEquals(Sheet.DEFAULT_COLUMN_WIDTH, sheet.getColWidth(3));

        sheet.setColWidth(3, 150.0);
        assertEquals(150.0, sheet.getColWidth(3));
        assertEquals(1, sheet.getColWidthOverrides().size());

        sheet.setColWidth(3, Sheet.DEFAULT_COLUMN_WIDTH);
        assertTrue(sheet.getColWidthOverrides().isEmpty());

        sheet.setColWidth(4, 80.0);
        sheet.resetColWidth(4);
        assertEquals(Sheet.DEFAULT_COLUMN_WIDTH, sheet.getColWidth(4));
    }

    /**
     * Row height overrides.
     */
    @Test
    void testRowHeightOverrides() {
        sheet.setRowHeight(0, 40.0);
        assertEquals(40.0, sheet.getRowHeight(0));
        assertEquals(Sheet.DEFAULT_ROW_HEIGHT, sheet.getRowHeight(1));
        assertThrows(IllegalArgumentException.class, () -> sheet.setRowHeight(1, 0.0));
        assertThrows(IllegalArgumentException.class, () -> sheet.setColWidth(-1, 10.0));

        sheet.resetRowHeight(0);
        assertTrue(sheet.getRowHeightOverrides().isEmpty());
    }

    /**
     * Custom defaults.
     */
    @Test
    void testCustomDefaults() {
        Sheet custom = new Sheet("Wide", 120.0, 30.0);
        assertEquals(120.0, custom.getDefaultColWidth());
        assertEquals(120.0, custom.getColWidth(0));
        assertEquals(30.0, custom.getRowHeight(0));
    }

    /**
     * Frozen panes.
     */
    @Test
    void testFrozenPanes() {
        sheet.setFrozenRows(1);
        sheet.setFrozenCols(2);
        assertEquals(1, sheet.getFrozenRows());
        assertEquals(2, sheet.getFrozenCols());
        assertThrows(IllegalArgumentException.class, () -> sheet.setFrozenRows(-1));
    }

    /**
     * Style survives on a non empty cell.
     */
    @Test
    void testStyleSurvivesOnANonEmptyCell() {
        CellStyle style = new CellStyle();
        style.setBold(true);
        style.setHorizontalAlignment(HorizontalAlignment.RIGHT);
        sheet.set(ref("A1"), new Cell(CellValue.number(1), null, style));

        CellStyle stored = sheet.get(ref("A1")).orElseThrow().getStyle();
        assertEquals(style, stored);
        assertFalse(stored.isDefault());
        assertTrue(new CellStyle().isDefault());
    }
}
