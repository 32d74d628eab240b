package com.spreadsheet.grid.formula;

import com.spreadsheet.grid.models.CellRange;
import com.spreadsheet.grid.models.CellRef;
import com.spreadsheet.grid.models.CellValue;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Value lookup the evaluator runs against.
 */
@FunctionalInterface
public interface FormulaContext {

    /**
     * Current value of a cell; empty when nothing is stored there.
     */
    Optional<CellValue> getCell(CellRef ref);

    /**
     * Non-empty values inside a range in row-major order. Blank cells are left
     * out since no range-consuming function counts them.
     */
    default List<CellValue> getRange(CellRange range) {
        List<CellValue> values = new ArrayList<>();
        for (CellRef ref : range.cells()) {
            getCell(ref).filter(v -> !v.isEmpty()).ifPresent(values::add);
        }
        return values;
    }
}
