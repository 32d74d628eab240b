package com.spreadsheet.grid.services;

import com.spreadsheet.grid.exceptions.FormulaErrorKind;
import com.spreadsheet.grid.exceptions.FormulaException;
import com.spreadsheet.grid.formula.Evaluator;
import com.spreadsheet.grid.formula.Formula;
import com.spreadsheet.grid.formula.FormulaContext;
import com.spreadsheet.grid.graph.DependencyGraph;
import com.spreadsheet.grid.graph.RecalculationPlan;
import com.spreadsheet.grid.graph.RecalculationResult;
import com.spreadsheet.grid.models.Cell;
import com.spreadsheet.grid.models.CellRange;
import com.spreadsheet.grid.models.CellRef;
import com.spreadsheet.grid.models.CellState;
import com.spreadsheet.grid.models.CellStyle;
import com.spreadsheet.grid.models.CellValue;
import com.spreadsheet.grid.models.Sheet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Cell mutations and recalculation for one sheet at a time.
 * <p>
 * Every write updates storage and the sheet's dependency graph, then either
 * recalculates the written cell and its transitive dependents right away
 * (auto mode) or only marks them DIRTY until {@link #recalculate(Sheet)} or a
 * read of a dirty cell (deferred mode).
 * <p>
 * Not thread-safe; callers hold the workbook's write lock.
 */
public class Recalculator {

    public static final String CIRCULAR_REFERENCE = FormulaErrorKind.CIRCULAR_REFERENCE.code();
    public static final String DEPTH_LIMIT = "depth-limit";
    public static final int DEFAULT_MAX_DEPTH = 10_000;

    private static final Logger log = LoggerFactory.getLogger(Recalculator.class);

    private final Evaluator evaluator;
    private final int maxDepth;
    private final boolean autoRecalculate;

    public Recalculator() {
        this(new Evaluator(), DEFAULT_MAX_DEPTH, true);
    }

    public Recalculator(Evaluator evaluator, int maxDepth, boolean autoRecalculate) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
        this.evaluator = evaluator;
        this.maxDepth = maxDepth;
        this.autoRecalculate = autoRecalculate;
    }

    /**
     * Value of a cell, recalculating pending cells first if this one is stale.
     * Empty when nothing is stored at 'ref'.
     */
    public Optional<CellValue> getCellValue(Sheet sheet, CellRef ref) {
        Optional<Cell> cell = sheet.get(ref);
        if (cell.isPresent() && cell.get().isDirty()) {
            recalculate(sheet);
        }
        return sheet.get(ref).map(Cell::getValue);
    }

    /**
     * Stores a literal value (Empty clears the cell) and refreshes its dependents.
     */
    public RecalculationResult setCellValue(Sheet sheet, CellRef ref, CellValue value) {
        Optional<Cell> existing = sheet.get(ref);
        CellValue old = existing.map(Cell::getValue).orElse(CellValue.empty());
        CellStyle style = existing.map(Cell::getStyle).orElse(null);

        sheet.getDependencyGraph().clearDependencies(ref);
        sheet.set(ref, new Cell(value, null, style));

        return afterWrite(sheet, ref, !old.equals(value));
    }

    /**
     * Parses and stores a formula, registers its references and evaluates it.
     *
     * @throws FormulaException with a parse-time kind; the cell is left untouched
     */
    public RecalculationResult setCellFormula(Sheet sheet, CellRef ref, String text) {
        Formula formula = Formula.parse(text);

        Optional<Cell> existing = sheet.get(ref);
        CellValue cached = existing.map(Cell::getValue).orElse(CellValue.empty());
        CellStyle style = existing.map(Cell::getStyle).orElse(null);

        Cell cell = new Cell(cached, formula, style);
        sheet.getDependencyGraph().setDependencies(ref, formula.getReferencedCells(), formula.getReferencedRanges());
        sheet.set(ref, cell);
        log.debug("Formula {} stored at {} in sheet '{}'", formula.getText(), ref.toA1(), sheet.getName());

        return afterWrite(sheet, ref, false);
    }

    /**
     * Removes a cell and refreshes whatever read it.
     */
    public RecalculationResult clearCell(Sheet sheet, CellRef ref) {
        Optional<Cell> existing = sheet.get(ref);
        if (existing.isEmpty()) {
            return RecalculationResult.none();
        }
        sheet.clear(ref);
        sheet.getDependencyGraph().clearDependencies(ref);
        return afterWrite(sheet, ref, !existing.get().getValue().isEmpty());
    }

    /**
     * Recalculates every DIRTY formula cell of the sheet.
     */
    public RecalculationResult recalculate(Sheet sheet) {
        List<CellRef> dirty = new ArrayList<>();
        for (Map.Entry<CellRef, Cell> entry : sheet.cells().entrySet()) {
            if (entry.getValue().isDirty()) {
                dirty.add(entry.getKey());
            }
        }
        if (dirty.isEmpty()) {
            return RecalculationResult.none();
        }
        return recalculateFrom(sheet, dirty, Collections.emptySet());
    }

    /**
     * Marks every formula cell DIRTY and recalculates the whole sheet.
     */
    public RecalculationResult recalculateAll(Sheet sheet) {
        List<CellRef> formulas = new ArrayList<>();
        for (Map.Entry<CellRef, Cell> entry : sheet.cells().entrySet()) {
            if (entry.getValue().hasFormula()) {
                entry.getValue().setState(CellState.DIRTY);
                formulas.add(entry.getKey());
            }
        }
        if (formulas.isEmpty()) {
            return RecalculationResult.none();
        }
        return recalculateFrom(sheet, formulas, Collections.emptySet());
    }

    // ----------------------------------------------------------------
    // Internal helpers
    // ----------------------------------------------------------------

    private RecalculationResult afterWrite(Sheet sheet, CellRef ref, boolean selfChanged) {
        Set<CellRef> changed = selfChanged ? Collections.singleton(ref) : Collections.emptySet();
        if (autoRecalculate) {
            return recalculateFrom(sheet, Collections.singleton(ref), changed);
        }
        DependencyGraph graph = sheet.getDependencyGraph();
        for (CellRef dependent : graph.transitiveDependents(Collections.singleton(ref))) {
            sheet.get(dependent)
                    .filter(Cell::hasFormula)
                    .ifPresent(c -> c.setState(CellState.DIRTY));
        }
        return new RecalculationResult(changed, Collections.emptySet(), 0);
    }

    /**
     * One recalculation pass: plan with Kahn's algorithm, evaluate each formula
     * once in dependency order, then flag whatever the plan could not order as
     * a circular reference.
     */
    private RecalculationResult recalculateFrom(Sheet sheet, Collection<CellRef> roots, Set<CellRef> alreadyChanged) {
        RecalculationPlan plan = sheet.getDependencyGraph().plan(roots);
        Set<CellRef> changed = new HashSet<>(alreadyChanged);

        for (CellRef ref : plan.getOrder()) {
            sheet.get(ref).filter(Cell::hasFormula).ifPresent(c -> c.setState(CellState.DIRTY));
        }
        for (CellRef ref : plan.getCyclic()) {
            sheet.get(ref).filter(Cell::hasFormula).ifPresent(c -> c.setState(CellState.DIRTY));
        }

        FormulaContext context = new SheetContext(sheet);
        int evaluated = 0;
        for (CellRef ref : plan.getOrder()) {
            Optional<Cell> found = sheet.get(ref);
            if (found.isEmpty() || !found.get().hasFormula()) {
                continue;
            }
            Cell cell = found.get();
            CellValue value;
            if (plan.depthOf(ref) > maxDepth) {
                value = CellValue.error(DEPTH_LIMIT);
                cell.setState(CellState.ERROR);
            } else {
                cell.setState(CellState.EVALUATING);
                try {
                    value = evaluator.evaluate(cell.getFormula(), context);
                    cell.setState(CellState.CLEAN);
                } catch (FormulaException e) {
                    log.debug("Formula at {} failed: {}", ref.toA1(), e.getMessage());
                    value = CellValue.error(e.getKind().code());
                    cell.setState(CellState.ERROR);
                } catch (RuntimeException e) {
                    log.warn("Formula at {} failed unexpectedly", ref.toA1(), e);
                    value = CellValue.error(FormulaErrorKind.INVALID_ARGUMENT.code());
                    cell.setState(CellState.ERROR);
                }
                evaluated++;
            }
            store(cell, ref, value, changed);
        }

        for (CellRef ref : plan.getCyclic()) {
            Optional<Cell> found = sheet.get(ref);
            if (found.isPresent() && found.get().hasFormula()) {
                found.get().setState(CellState.ERROR);
                store(found.get(), ref, CellValue.error(CIRCULAR_REFERENCE), changed);
            }
        }
        if (plan.hasCycle()) {
            log.warn("Circular reference in sheet '{}': {}", sheet.getName(), plan.getCyclic());
        }

        RecalculationResult result = new RecalculationResult(changed, plan.getCyclic(), evaluated);
        log.debug("Recalculated sheet '{}': {}", sheet.getName(), result);
        return result;
    }

    private static void store(Cell cell, CellRef ref, CellValue value, Set<CellRef> changed) {
        if (!cell.getValue().equals(value)) {
            changed.add(ref);
        }
        cell.setValue(value);
    }

    /**
     * Reads cached values straight from the sheet. Plan order guarantees that
     * precedents are fresh; reading a cell that is still EVALUATING means the
     * formula reached itself.
     */
    private static final class SheetContext implements FormulaContext {
        private final Sheet sheet;

        SheetContext(Sheet sheet) {
            this.sheet = sheet;
        }

        @Override
        public Optional<CellValue> getCell(CellRef ref) {
            Optional<Cell> cell = sheet.get(ref);
            if (cell.isEmpty()) {
                return Optional.empty();
            }
            if (cell.get().getState() == CellState.EVALUATING) {
                throw new FormulaException(FormulaErrorKind.CIRCULAR_REFERENCE,
                        "Cell " + ref.toA1() + " is already being evaluated");
            }
            return Optional.of(cell.get().getValue());
        }

        /**
         * Walks whichever is smaller: the range or the stored cells.
         */
        @Override
        public List<CellValue> getRange(CellRange range) {
            if (range.cellCount() <= sheet.cellCount()) {
                return FormulaContext.super.getRange(range);
            }
            Map<CellRef, CellValue> inside = new TreeMap<>();
            for (CellRef ref : sheet.cells().keySet()) {
                if (range.contains(ref)) {
                    getCell(ref).filter(v -> !v.isEmpty()).ifPresent(v -> inside.put(ref, v));
                }
            }
            return new ArrayList<>(inside.values());
        }
    }
}
