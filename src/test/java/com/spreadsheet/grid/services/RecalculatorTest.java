package com.spreadsheet.grid.services;

import com.spreadsheet.grid.exceptions.FormulaErrorKind;
import com.spreadsheet.grid.exceptions.FormulaException;
import com.spreadsheet.grid.formula.Evaluator;
import com.spreadsheet.grid.formula.Formula;
import com.spreadsheet.grid.formula.FormulaContext;
import com.spreadsheet.grid.graph.RecalculationResult;
import com.spreadsheet.grid.models.Cell;
import com.spreadsheet.grid.models.CellRef;
import com.spreadsheet.grid.models.CellState;
import com.spreadsheet.grid.models.CellStyle;
import com.spreadsheet.grid.models.CellValue;
import com.spreadsheet.grid.models.Sheet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Engine-level tests: writes, propagation and cycle handling on a bare Sheet.
 */
class RecalculatorTest {

    private static final CellValue CIRCULAR = CellValue.error(Recalculator.CIRCULAR_REFERENCE);

    private Recalculator recalculator;
    private Sheet sheet;

    @BeforeEach
    void setUp() {
        recalculator = new Recalculator();
        sheet = new Sheet("Sheet1");
    }

    private static CellRef ref(String a1) {
        return CellRef.parse(a1).orElseThrow();
    }

    private static Set<CellRef> refs(String... a1) {
        Set<CellRef> result = new HashSet<>();
        for (String s : a1) {
            result.add(ref(s));
        }
        return result;
    }

    private RecalculationResult number(String a1, double value) {
        return recalculator.setCellValue(sheet, ref(a1), CellValue.number(value));
    }

    private RecalculationResult formula(String a1, String text) {
        return recalculator.setCellFormula(sheet, ref(a1), text);
    }

    private CellValue value(String a1) {
        return recalculator.getCellValue(sheet, ref(a1)).orElse(CellValue.empty());
    }

    /**
     * SUM over a row.
     */
    @Test
    void testSumOverARow() {
        number("A1", 1);
        number("B1", 2);
        number("C1", 3);
        formula("D1", "=SUM(A1:C1)");

        assertEquals(CellValue.number(6), value("D1"));
    }

    /**
     * AVERAGE over a column.
     */
    @Test
    void testAverageOverAColumn() {
        number("A1", 10);
        number("A2", 20);
        number("A3", 30);
        formula("A4", "=AVERAGE(A1:A3)");

        assertEquals(CellValue.number(20), value("A4"));
    }

    /**
     * Changes propagate through chains.
     */
    @Test
    void testChangesPropagateThroughChains() {
        number("A1", 2);
        formula("B1", "=A1*10");
        formula("C1", "=B1+1");

        RecalculationResult result = number("A1", 3);

        assertEquals(CellValue.number(31), value("C1"));
        assertEquals(refs("A1", "B1", "C1"), result.getChanged());
        assertEquals(2, result.getEvaluated());
    }

    /**
     * Diamond is evaluated once per cell.
     */
    @Test
    void testDiamondIsEvaluatedOncePerCell() {
        number("A1", 1);
        formula("B1", "=A1+1");
        formula("C1", "=A1*2");
        formula("D1", "=B1+C1");

        RecalculationResult result = number("A1", 5);

        assertEquals(CellValue.number(16), value("D1"));
        assertEquals(3, result.getEvaluated());
    }

    /**
     * Range formulas see new cells inside the range.
     */
    @Test
    void testRangeFormulasSeeNewCellsInsideTheRange() {
        formula("B1", "=SUM(A1:A5)");
        assertEquals(CellValue.number(0), value("B1"));

        RecalculationResult result = number("A3", 7);

        assertEquals(CellValue.number(7), value("B1"));
        assertTrue(result.getChanged().contains(ref("B1")));
    }

    /**
     * Unchanged result is not reported.
     */
    @Test
    void testUnchangedResultIsNotReported() {
        number("A1", 1);
        number("A2", 2);
        formula("B1", "=MAX(A1:A2)");

        RecalculationResult result = number("A1", 0);

        assertEquals(refs("A1"), result.getChanged());
    }

    /**
     * Two cell cycle becomes circular reference.
     */
    @Test
    void testTwoCellCycleBecomesCircularReference() {
        formula("B1", "=A1+1");
        RecalculationResult result = formula("A1", "=B1+1");

        assertEquals(CIRCULAR, value("A1"));
        assertEquals(CIRCULAR, value("B1"));
        assertEquals(refs("A1", "B1"), result.getCyclic());
        assertEquals(CellState.ERROR, sheet.get(ref("A1")).orElseThrow().getState());
    }

    /**
     * Breaking a cycle restores values.
     */
    @Test
    void testBreakingACycleRestoresValues() {
        formula("B1", "=A1+1");
        formula("A1", "=B1+1");

        number("A1", 5);

        assertEquals(CellValue.number(5), value("A1"));
        assertEquals(CellValue.number(6), value("B1"));
    }

    /**
     * A formula that reads its own cell.
     */
    @Test
    void testSelfReference() {
        formula("A1", "=A1+1");
        assertEquals(CIRCULAR, value("A1"));
    }

    /**
     * A range that contains the formula cell.
     */
    @Test
    void testRangeContainingItself() {
        number("A1", 1);
        formula("A3", "=SUM(A1:A5)");
        assertEquals(CIRCULAR, value("A3"));
    }

    /**
     * Cells fed by a cycle are flagged too.
     */
    @Test
    void testCellsFedByACycleAreFlaggedToo() {
        formula("A1", "=B1");
        formula("B1", "=A1");
        formula("C1", "=A1*2");

        assertEquals(CIRCULAR, value("C1"));
    }

    /**
     * Evaluation errors are stored as values.
     */
    @Test
    void testEvaluationErrorsAreStoredAsValues() {
        number("A1", 0);
        formula("B1", "=10/A1");

        assertEquals(CellValue.error(FormulaErrorKind.DIV_BY_ZERO.code()), value("B1"));
        assertEquals(CellState.ERROR, sheet.get(ref("B1")).orElseThrow().getState());

        number("A1", 4);
        assertEquals(CellValue.number(2.5), value("B1"));
        assertEquals(CellState.CLEAN, sheet.get(ref("B1")).orElseThrow().getState());
    }

    /**
     * Errors flow into dependents.
     */
    @Test
    void testErrorsFlowIntoDependents() {
        formula("A1", "=NOPE()");
        formula("B1", "=A1+1");

        assertEquals(CellValue.error(FormulaErrorKind.UNKNOWN_FUNCTION.code()), value("B1"));
    }

    /**
     * Syntax error keeps the previous formula.
     */
    @Test
    void testSyntaxErrorKeepsThePreviousFormula() {
        number("A1", 4);
        formula("B1", "=A1*2");

        FormulaException ex = assertThrows(FormulaException.class, () -> formula("B1", "=A1*"));
        assertEquals(FormulaErrorKind.INVALID_SYNTAX, ex.getKind());

        Cell cell = sheet.get(ref("B1")).orElseThrow();
        assertEquals("=A1*2", cell.getFormulaText());
        assertEquals(CellValue.number(8), cell.getValue());

        number("A1", 5);
        assertEquals(CellValue.number(10), value("B1"));
    }

    /**
     * Bad reference is rejected.
     */
    @Test
    void testBadReferenceIsRejected() {
        FormulaException ex = assertThrows(FormulaException.class, () -> formula("A1", "=B0+1"));
        assertEquals(FormulaErrorKind.INVALID_REF, ex.getKind());
        assertTrue(sheet.get(ref("A1")).isEmpty());
    }

    /**
     * Replacing a formula with a value drops its edges.
     */
    @Test
    void testReplacingAFormulaWithAValueDropsItsEdges() {
        number("A1", 1);
        formula("B1", "=A1");
        number("B1", 9);

        assertTrue(sheet.getDependencyGraph().getDependents(ref("A1")).isEmpty());
        number("A1", 2);
        assertEquals(CellValue.number(9), value("B1"));
    }

    /**
     * Clearing a precedent recalculates dependents.
     */
    @Test
    void testClearingAPrecedentRecalculatesDependents() {
        number("A1", 3);
        formula("B1", "=A1*2");

        RecalculationResult result = recalculator.clearCell(sheet, ref("A1"));

        assertEquals(CellValue.number(0), value("B1"));
        assertEquals(refs("A1", "B1"), result.getChanged());
        assertTrue(sheet.get(ref("A1")).isEmpty());
    }

    /**
     * Clearing an empty cell does nothing.
     */
    @Test
    void testClearingAnEmptyCellDoesNothing() {
        assertFalse(recalculator.clearCell(sheet, ref("Q7")).hasChanges());
    }

    /**
     * Writing empty removes the cell.
     */
    @Test
    void testWritingEmptyRemovesTheCell() {
        number("A1", 3);
        recalculator.setCellValue(sheet, ref("A1"), CellValue.empty());
        assertEquals(0, sheet.cellCount());
    }

    /**
     * Formula keeps the cell style.
     */
    @Test
    void testFormulaKeepsTheCellStyle() {
        CellStyle style = new CellStyle();
        style.setItalic(true);
        sheet.set(ref("A1"), new Cell(CellValue.number(1), null, style));

        formula("A1", "=1+1");

        assertEquals(style, sheet.get(ref("A1")).orElseThrow().getStyle());
    }

    /**
     * Depth limit stops long chains.
     */
    @Test
    void testDepthLimitStopsLongChains() {
        Recalculator shallow = new Recalculator(new Evaluator(), 3, true);
        shallow.setCellValue(sheet, ref("A1"), CellValue.number(1));
        for (int row = 2; row <= 6; row++) {
            shallow.setCellFormula(sheet, ref("A" + row), "=A" + (row - 1) + "+1");
        }
        shallow.setCellValue(sheet, ref("A1"), CellValue.number(10));

        assertEquals(CellValue.number(13), sheet.get(ref("A4")).orElseThrow().getValue());
        assertEquals(CellValue.error(Recalculator.DEPTH_LIMIT), sheet.get(ref("A5")).orElseThrow().getValue());
        assertEquals(CellValue.error(Recalculator.DEPTH_LIMIT), sheet.get(ref("A6")).orElseThrow().getValue());
    }

    /**
     * Deferred mode recalculates on read.
     */
    @Test
    void testDeferredModeRecalculatesOnRead() {
        Recalculator deferred = new Recalculator(new Evaluator(), Recalculator.DEFAULT_MAX_DEPTH, false);
        deferred.setCellValue(sheet, ref("A1"), CellValue.number(2));
        deferred.setCellFormula(sheet, ref("B1"), "=A1*3");

        assertTrue(sheet.get(ref("B1")).orElseThrow().isDirty());
        assertEquals(CellValue.number(6), deferred.getCellValue(sheet, ref("B1")).orElseThrow());

        deferred.setCellValue(sheet, ref("A1"), CellValue.number(5));
        assertTrue(sheet.get(ref("B1")).orElseThrow().isDirty());
        assertEquals(CellValue.number(6), sheet.get(ref("B1")).orElseThrow().getValue());

        RecalculationResult result = deferred.recalculate(sheet);
        assertEquals(refs("B1"), result.getChanged());
        assertEquals(CellValue.number(15), sheet.get(ref("B1")).orElseThrow().getValue());
        assertFalse(deferred.recalculate(sheet).hasChanges());
    }

    /**
     * A full recalculation refreshes TODAY and NOW.
     */
    @Test
    void testRecalculateAllRefreshesTheClock() {
        number("A1", 1);
        formula("B1", "=A1+1");
        formula("C1", "=B1*2");

        RecalculationResult result = recalculator.recalculateAll(sheet);

        assertEquals(2, result.getEvaluated());
        assertTrue(result.getChanged().isEmpty());
        assertEquals(Arrays.asList(CellValue.number(2), CellValue.number(4)),
                Arrays.asList(value("B1"), value("C1")));
    }

    /**
     * ROUND with an enormous digit count is still a value, and the cell is
     * left readable for the formulas after it.
     */
    @Test
    void testRoundWithHugeDigitCount() {
        formula("A1", "=ROUND(1.5, 2000000000)");
        formula("B1", "=A1+1");

        assertEquals(CellValue.number(1.5), value("A1"));
        assertEquals(CellState.CLEAN, sheet.get(ref("A1")).orElseThrow().getState());
        assertEquals(CellValue.number(2.5), value("B1"));
    }

    /**
     * An unexpected failure inside evaluation becomes an error value and never
     * leaves the cell marked as being evaluated.
     */
    @Test
    void testUnexpectedEvaluationFailureIsStored() {
        Evaluator failing = new Evaluator() {
            @Override
            public CellValue evaluate(Formula formula, FormulaContext context) {
                if (formula.getText().contains("A9")) {
                    throw new IllegalStateException("boom");
                }
                return super.evaluate(formula, context);
            }
        };
        recalculator = new Recalculator(failing, Recalculator.DEFAULT_MAX_DEPTH, true);

        formula("A1", "=A9*2");
        formula("C1", "=A1");

        CellValue expected = CellValue.error(FormulaErrorKind.INVALID_ARGUMENT.code());
        assertEquals(expected, value("A1"));
        assertEquals(CellState.ERROR, sheet.get(ref("A1")).orElseThrow().getState());
        assertEquals(expected, value("C1"));
    }

    /**
     * A range reaching the last column is read through the stored cells.
     */
    @Test
    void testRangeToTheLastColumn() {
        number("A1", 4);
        number("C1", 5);
        formula("B2", "=COUNTA(A1:FXSHRXX1)");
        formula("B3", "=SUM(A1:FXSHRXX1)");

        assertEquals(CellValue.number(2), value("B2"));
        assertEquals(CellValue.number(9), value("B3"));
    }

    /**
     * A long string literal is accepted.
     */
    @Test
    void testLongStringLiteral() {
        String text = repeat("x", 20000);
        formula("A1", "=\"" + text + "\"");

        assertEquals(CellValue.text(text), value("A1"));
    }

    private static String repeat(String s, int times) {
        StringBuilder sb = new StringBuilder(s.length() * times);
        for (int i = 0; i < times; i++) {
            sb.append(s);
        }
        return sb.toString();
    }
}
