package com.spreadsheet.grid.formula;

import com.spreadsheet.grid.exceptions.FormulaErrorKind;
import com.spreadsheet.grid.exceptions.FormulaException;
import com.spreadsheet.grid.models.CellRef;
import com.spreadsheet.grid.models.CellValue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class EvaluatorTest {

    private static final Instant NOON_2024_03_01 = Instant.parse("2024-03-01T12:00:00Z");

    private final Map<CellRef, CellValue> cells = new HashMap<>();
    private final FormulaContext context = ref -> Optional.ofNullable(cells.get(ref));
    private Evaluator evaluator;

    @BeforeEach
    void setUp() {
        evaluator = new Evaluator(Clock.fixed(NOON_2024_03_01, ZoneOffset.UTC));
        put("A1", CellValue.number(1));
        put("A2", CellValue.number(2));
        put("A3", CellValue.number(3));
        put("B1", CellValue.text("hello"));
        put("B2", CellValue.text("10"));
        put("C1", CellValue.bool(true));
        put("D1", CellValue.error("div-by-zero"));
    }

    private void put(String a1, CellValue value) {
        cells.put(CellRef.parse(a1).orElseThrow(), value);
    }

    private CellValue eval(String formula) {
        return evaluator.evaluate(Formula.parse(formula), context);
    }

    private FormulaErrorKind failure(String formula) {
        return assertThrows(FormulaException.class, () -> eval(formula)).getKind();
    }

    /**
     * Numeric results.
     */
    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "=1+2*3          | 7",
            "=(1+2)*3        | 9",
            "=2^10           | 1024",
            "=-2^2           | 4",
            "=7/2            | 3.5",
            "=50%            | 0.5",
            "=A1+A2+A3       | 6",
            "=B2*2           | 20",
            "=C1+1           | 2",
            "=Z99+5          | 5",
            "=SUM(A1:A3)     | 6",
            "=AVERAGE(A1:A3) | 2",
            "=SUM(A1:A3, 10) | 16",
            "=MAX(A1:B2)     | 10",
            "=MIN(A1:A3)     | 1",
            "=COUNT(A1:B2)   | 2",
            "=COUNTA(A1:D1)  | 4"
    })
    void testNumericResults(String formula, double expected) {
        assertEquals(CellValue.number(expected), eval(formula));
    }

    /**
     * Division by zero is an error.
     */
    @Test
    void testDivisionByZeroIsAnError() {
        assertEquals(FormulaErrorKind.DIV_BY_ZERO, failure("=1/0"));
        assertEquals(FormulaErrorKind.DIV_BY_ZERO, failure("=A1/Z1"));
    }

    /**
     * Text in arithmetic is a type error.
     */
    @Test
    void testTextInArithmeticIsATypeError() {
        assertEquals(FormulaErrorKind.TYPE_ERROR, failure("=B1+1"));
        assertEquals(FormulaErrorKind.TYPE_ERROR, failure("=-B1"));
    }

    /**
     * Error operands propagate.
     */
    @Test
    void testErrorOperandsPropagate() {
        assertEquals(CellValue.error("div-by-zero"), eval("=D1+1"));
        assertEquals(CellValue.error("div-by-zero"), eval("=D1=1"));
    }

    /**
     * Range outside a function is a type error.
     */
    @Test
    void testRangeOutsideAFunctionIsATypeError() {
        assertEquals(FormulaErrorKind.TYPE_ERROR, failure("=A1:A3+1"));
    }

    /**
     * Unknown function and wrong arity.
     */
    @Test
    void testUnknownFunctionAndWrongArity() {
        assertEquals(FormulaErrorKind.UNKNOWN_FUNCTION, failure("=NOPE(1)"));
        assertEquals(FormulaErrorKind.INVALID_ARGUMENT, failure("=ABS(1, 2)"));
        assertEquals(FormulaErrorKind.INVALID_ARGUMENT, failure("=SUM()"));
        assertFalse(FormulaErrorKind.INVALID_ARGUMENT.isParseTime());
    }

    /**
     * Concatenation uses display strings.
     */
    @Test
    void testConcatenationUsesDisplayStrings() {
        assertEquals(CellValue.text("hello1"), eval("=B1&A1"));
        assertEquals(CellValue.text("x TRUE"), eval("=\"x \"&C1"));
        assertEquals(CellValue.text("hello"), eval("=B1&Z9"));
    }

    /**
     * Comparison operators.
     */
    @Test
    void testComparisons() {
        assertEquals(CellValue.bool(true), eval("=A1<A2"));
        assertEquals(CellValue.bool(true), eval("=\"abc\"<\"abd\""));
        assertEquals(CellValue.bool(true), eval("=Z1=0"));
        assertEquals(CellValue.bool(true), eval("=Z1=\"\""));
        assertEquals(CellValue.bool(false), eval("=A1=\"1\""));
        assertEquals(CellValue.bool(true), eval("=A1<>\"1\""));
        assertEquals(CellValue.error(Evaluator.UNEQUAL_TYPES), eval("=A1<\"1\""));
    }

    /**
     * IF only evaluates the taken branch.
     */
    @Test
    void testIfOnlyEvaluatesTheTakenBranch() {
        assertEquals(CellValue.text("yes"), eval("=IF(A1>0, \"yes\", 1/0)"));
        assertEquals(CellValue.number(2), eval("=IF(A1>5, 1/0, 2)"));
        assertEquals(CellValue.bool(false), eval("=IF(FALSE, 1)"));
        assertEquals(CellValue.error("div-by-zero"), eval("=IF(D1, 1, 2)"));
    }

    /**
     * Logical functions.
     */
    @Test
    void testLogicalFunctions() {
        assertEquals(CellValue.bool(true), eval("=AND(A1, C1, \"TRUE\")"));
        assertEquals(CellValue.bool(false), eval("=AND(A1, 0)"));
        assertEquals(CellValue.bool(true), eval("=OR(0, A1:A3)"));
        assertEquals(CellValue.bool(false), eval("=NOT(C1)"));
        assertEquals(CellValue.bool(true), eval("=TRUE()"));
    }

    /**
     * Text functions.
     */
    @Test
    void testTextFunctions() {
        assertEquals(CellValue.text("HELLO"), eval("=UPPER(B1)"));
        assertEquals(CellValue.number(5), eval("=LEN(B1)"));
        assertEquals(CellValue.text("he"), eval("=LEFT(B1, 2)"));
        assertEquals(CellValue.text("o"), eval("=RIGHT(B1)"));
        assertEquals(CellValue.text("ell"), eval("=MID(B1, 2, 3)"));
        assertEquals(CellValue.number(3), eval("=FIND(\"l\", B1)"));
        assertEquals(CellValue.text("heLLo"), eval("=SUBSTITUTE(B1, \"l\", \"L\")"));
        assertEquals(CellValue.text("hello 1"), eval("=CONCAT(B1, \" \", A1)"));
        assertEquals(FormulaErrorKind.INVALID_ARGUMENT, failure("=FIND(\"z\", B1)"));
    }

    /**
     * Math functions.
     */
    @Test
    void testMathFunctions() {
        assertEquals(CellValue.number(2.5), eval("=ROUND(2.45, 1)"));
        assertEquals(CellValue.number(3), eval("=ROUND(2.5)"));
        assertEquals(CellValue.number(3), eval("=SQRT(9)"));
        assertEquals(CellValue.error(FunctionLibrary.NEGATIVE_SQRT), eval("=SQRT(-1)"));
        assertEquals(CellValue.number(8), eval("=POW(2, 3)"));
        assertEquals(CellValue.number(-2), eval("=FLOOR(-1.5)"));
        assertEquals(CellValue.number(2), eval("=CEILING(1.1)"));
        assertEquals(CellValue.number(4), eval("=ABS(-4)"));
    }

    /**
     * Function names are case insensitive.
     */
    @Test
    void testFunctionNamesAreCaseInsensitive() {
        assertEquals(CellValue.number(6), eval("=sum(a1:a3)"));
        assertEquals(CellValue.number(2), eval("=Avg(A1:A3)"));
    }

    /**
     * Date functions read the clock.
     */
    @Test
    void testDateFunctionsReadTheClock() {
        assertEquals(CellValue.date(LocalDate.of(2024, 3, 1).toEpochDay()), eval("=TODAY()"));
        double expectedNow = NOON_2024_03_01.toEpochMilli() / 86_400_000.0;
        assertEquals(expectedNow, eval("=NOW()").getNumber(), 1e-9);
        assertEquals(CellValue.number(LocalDate.of(2024, 3, 1).toEpochDay() + 1), eval("=TODAY()+1"));
    }

    /**
     * Empty range aggregates.
     */
    @Test
    void testEmptyRangeAggregates() {
        assertEquals(CellValue.number(0), eval("=SUM(X1:X10)"));
        assertEquals(CellValue.number(0), eval("=AVERAGE(X1:X10)"));
        assertEquals(CellValue.error(FunctionLibrary.NO_NUMERIC_VALUES), eval("=MAX(X1:X10)"));
    }
}
