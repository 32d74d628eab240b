package com.spreadsheet.grid.services;

import com.spreadsheet.grid.config.GridEngineProperties;
import com.spreadsheet.grid.exceptions.FormulaException;
import com.spreadsheet.grid.exceptions.InvalidCellReferenceException;
import com.spreadsheet.grid.exceptions.SheetNotFoundException;
import com.spreadsheet.grid.exceptions.WorkbookNotFoundException;
import com.spreadsheet.grid.formula.Evaluator;
import com.spreadsheet.grid.graph.RecalculationResult;
import com.spreadsheet.grid.models.Cell;
import com.spreadsheet.grid.models.CellRange;
import com.spreadsheet.grid.models.CellRef;
import com.spreadsheet.grid.models.CellSnapshot;
import com.spreadsheet.grid.models.CellValue;
import com.spreadsheet.grid.models.Sheet;
import com.spreadsheet.grid.models.Spreadsheet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

/**
 * Workbook registry and the entry point for every cell edit and read.
 * Each workbook is guarded by its own read/write lock: writes and
 * recalculation passes take the write lock, reads of clean values the read lock.
 */
@Service
public class SpreadsheetService {

    /** Upper bound on the cells returned by one range read. */
    public static final long MAX_RANGE_CELLS = 100_000;

    private static final Logger log = LoggerFactory.getLogger(SpreadsheetService.class);

    // All workbooks live here in memory
    private final Map<Long, Spreadsheet> workbooks = new ConcurrentHashMap<>();
    private final AtomicLong nextId = new AtomicLong(1);

    private final GridEngineProperties properties;
    private final Recalculator recalculator;

    public SpreadsheetService() {
        this(new GridEngineProperties(), Clock.systemDefaultZone());
    }

    @Autowired
    public SpreadsheetService(GridEngineProperties properties, Clock clock) {
        this.properties = properties;
        this.recalculator = new Recalculator(new Evaluator(clock),
                properties.getMaxDependencyDepth(), properties.isAutoRecalculate());
    }

    // ----------------------------------------------------------------
    // Workbooks and sheets
    // ----------------------------------------------------------------

    /**
     * Creates a workbook with one empty sheet and returns its id.
     */
    public long createWorkbook() {
        long id = nextId.getAndIncrement();
        workbooks.put(id, new Spreadsheet(newSheet(properties.getDefaultSheetName())));
        log.info("Created workbook {}", id);
        return id;
    }

    public Spreadsheet getWorkbook(long workbookId) {
        Spreadsheet workbook = workbooks.get(workbookId);
        if (workbook == null) {
            throw new WorkbookNotFoundException("Workbook not found: " + workbookId);
        }
        return workbook;
    }

    public void deleteWorkbook(long workbookId) {
        if (workbooks.remove(workbookId) == null) {
            throw new WorkbookNotFoundException("Workbook not found: " + workbookId);
        }
        log.info("Deleted workbook {}", workbookId);
    }

    public List<String> getSheetNames(long workbookId) {
        Spreadsheet workbook = getWorkbook(workbookId);
        workbook.getLock().readLock().lock();
        try {
            return workbook.sheetNames();
        } finally {
            workbook.getLock().readLock().unlock();
        }
    }

    public int getActiveSheet(long workbookId) {
        Spreadsheet workbook = getWorkbook(workbookId);
        workbook.getLock().readLock().lock();
        try {
            return workbook.getActiveSheet();
        } finally {
            workbook.getLock().readLock().unlock();
        }
    }

    /**
     * Appends a sheet and returns its index.
     */
    public int addSheet(long workbookId, String name) {
        requireName(name);
        Spreadsheet workbook = getWorkbook(workbookId);
        workbook.getLock().writeLock().lock();
        try {
            int index = workbook.addSheet(newSheet(name.trim()));
            log.info("Added sheet '{}' at index {} to workbook {}", name.trim(), index, workbookId);
            return index;
        } finally {
            workbook.getLock().writeLock().unlock();
        }
    }

    /**
     * @throws IllegalStateException when the sheet is the last one left
     */
    public void removeSheet(long workbookId, int sheetIndex) {
        Spreadsheet workbook = getWorkbook(workbookId);
        workbook.getLock().writeLock().lock();
        try {
            requireSheet(workbook, sheetIndex);
            Optional<Sheet> removed = workbook.removeSheet(sheetIndex);
            if (removed.isEmpty()) {
                throw new IllegalStateException("Cannot remove the last sheet of workbook " + workbookId);
            }
            log.info("Removed sheet '{}' from workbook {}", removed.get().getName(), workbookId);
        } finally {
            workbook.getLock().writeLock().unlock();
        }
    }

    public void renameSheet(long workbookId, int sheetIndex, String name) {
        requireName(name);
        Spreadsheet workbook = getWorkbook(workbookId);
        workbook.getLock().writeLock().lock();
        try {
            requireSheet(workbook, sheetIndex);
            workbook.renameSheet(sheetIndex, name.trim());
        } finally {
            workbook.getLock().writeLock().unlock();
        }
    }

    public void setActiveSheet(long workbookId, int sheetIndex) {
        Spreadsheet workbook = getWorkbook(workbookId);
        workbook.getLock().writeLock().lock();
        try {
            if (!workbook.setActiveSheet(sheetIndex)) {
                throw new SheetNotFoundException("Sheet not found: " + sheetIndex);
            }
        } finally {
            workbook.getLock().writeLock().unlock();
        }
    }

    // ----------------------------------------------------------------
    // Cell edits
    // ----------------------------------------------------------------

    /**
     * Sets a cell from what the user typed:
     * "=..." is a formula, a number or TRUE/FALSE becomes that value,
     * blank input clears the cell, anything else is text.
     */
    public RecalculationResult setCellInput(long workbookId, int sheetIndex, String cellRef, String rawInput) {
        String raw = rawInput == null ? "" : rawInput;
        String trimmed = raw.trim();
        if (trimmed.startsWith("=")) {
            return setCellFormula(workbookId, sheetIndex, cellRef, trimmed);
        }
        if (trimmed.isEmpty()) {
            return clearCell(workbookId, sheetIndex, cellRef);
        }
        return setCellValue(workbookId, sheetIndex, cellRef, parseLiteral(raw));
    }

    /**
     * @throws FormulaException when the formula does not parse; the cell keeps its old content
     */
    public RecalculationResult setCellFormula(long workbookId, int sheetIndex, String cellRef, String formula) {
        CellRef ref = parseRef(cellRef);
        Spreadsheet workbook = getWorkbook(workbookId);
        workbook.getLock().writeLock().lock();
        try {
            Sheet sheet = requireSheet(workbook, sheetIndex);
            return recalculator.setCellFormula(sheet, ref, formula);
        } catch (FormulaException ex) {
            log.warn("Rejected formula '{}' at {}: {}", formula, ref.toA1(), ex.getMessage());
            throw ex;
        } finally {
            workbook.getLock().writeLock().unlock();
        }
    }

    public RecalculationResult setCellValue(long workbookId, int sheetIndex, String cellRef, CellValue value) {
        CellRef ref = parseRef(cellRef);
        Spreadsheet workbook = getWorkbook(workbookId);
        workbook.getLock().writeLock().lock();
        try {
            return recalculator.setCellValue(requireSheet(workbook, sheetIndex), ref, value);
        } finally {
            workbook.getLock().writeLock().unlock();
        }
    }

    public RecalculationResult clearCell(long workbookId, int sheetIndex, String cellRef) {
        CellRef ref = parseRef(cellRef);
        Spreadsheet workbook = getWorkbook(workbookId);
        workbook.getLock().writeLock().lock();
        try {
            return recalculator.clearCell(requireSheet(workbook, sheetIndex), ref);
        } finally {
            workbook.getLock().writeLock().unlock();
        }
    }

    /**
     * Re-evaluates every formula of the sheet.
     */
    public RecalculationResult recalculate(long workbookId, int sheetIndex) {
        Spreadsheet workbook = getWorkbook(workbookId);
        workbook.getLock().writeLock().lock();
        try {
            return recalculator.recalculateAll(requireSheet(workbook, sheetIndex));
        } finally {
            workbook.getLock().writeLock().unlock();
        }
    }

    // ----------------------------------------------------------------
    // Reads
    // ----------------------------------------------------------------

    /**
     * Value of one cell, Empty when nothing is stored there.
     */
    public CellValue getCellValue(long workbookId, int sheetIndex, String cellRef) {
        CellRef ref = parseRef(cellRef);
        Spreadsheet workbook = getWorkbook(workbookId);

        workbook.getLock().readLock().lock();
        try {
            Optional<Cell> cell = requireSheet(workbook, sheetIndex).get(ref);
            if (cell.isEmpty()) {
                return CellValue.empty();
            }
            if (!cell.get().isDirty()) {
                return cell.get().getValue();
            }
        } finally {
            workbook.getLock().readLock().unlock();
        }

        // Stale value: recompute under the write lock
        workbook.getLock().writeLock().lock();
        try {
            return recalculator.getCellValue(requireSheet(workbook, sheetIndex), ref).orElse(CellValue.empty());
        } finally {
            workbook.getLock().writeLock().unlock();
        }
    }

    /**
     * Values of a rectangular range, one list per row, Empty where nothing is stored.
     */
    public List<List<CellValue>> getRangeValues(long workbookId, int sheetIndex, String rangeText) {
        CellRange range = CellRange.parse(rangeText)
                .orElseThrow(() -> new InvalidCellReferenceException("Invalid range: " + rangeText));
        if (range.cellCount() > MAX_RANGE_CELLS) {
            throw new IllegalArgumentException("Range " + range.toRangeString() + " has more than "
                    + MAX_RANGE_CELLS + " cells");
        }
        Spreadsheet workbook = getWorkbook(workbookId);
        return withFreshSheet(workbook, sheetIndex, sheet -> {
            int cols = (int) range.colCount();
            List<List<CellValue>> rows = new ArrayList<>((int) range.rowCount());
            List<CellValue> row = new ArrayList<>(cols);
            for (CellRef ref : range.cells()) {
                row.add(sheet.get(ref).map(Cell::getValue).orElse(CellValue.empty()));
                if (row.size() == cols) {
                    rows.add(row);
                    row = new ArrayList<>(cols);
                }
            }
            return rows;
        });
    }

    /**
     * Bounding range of the stored cells as "A1:C5", or empty for a blank sheet.
     */
    public Optional<String> getUsedRange(long workbookId, int sheetIndex) {
        Spreadsheet workbook = getWorkbook(workbookId);
        workbook.getLock().readLock().lock();
        try {
            return requireSheet(workbook, sheetIndex).usedRange().map(CellRange::toRangeString);
        } finally {
            workbook.getLock().readLock().unlock();
        }
    }

    /**
     * Every stored cell of the sheet keyed by A1 reference, in row-major order.
     */
    public Map<String, CellSnapshot> getSheetData(long workbookId, int sheetIndex) {
        Spreadsheet workbook = getWorkbook(workbookId);
        return withFreshSheet(workbook, sheetIndex, sheet -> {
            Map<String, CellSnapshot> data = new LinkedHashMap<>();
            for (Map.Entry<CellRef, Cell> entry : new TreeMap<>(sheet.cells()).entrySet()) {
                data.put(entry.getKey().toA1(), CellSnapshot.of(entry.getKey(), entry.getValue()));
            }
            return data;
        });
    }

    /**
     * Cells and ranges read by the formula at 'cellRef'.
     */
    public List<String> getPrecedents(long workbookId, int sheetIndex, String cellRef) {
        CellRef ref = parseRef(cellRef);
        Spreadsheet workbook = getWorkbook(workbookId);
        workbook.getLock().readLock().lock();
        try {
            Sheet sheet = requireSheet(workbook, sheetIndex);
            List<String> result = new ArrayList<>();
            for (CellRef precedent : sheet.getDependencyGraph().getPrecedentCells(ref)) {
                result.add(precedent.toA1());
            }
            for (CellRange range : sheet.getDependencyGraph().getPrecedentRanges(ref)) {
                result.add(range.toRangeString());
            }
            return result;
        } finally {
            workbook.getLock().readLock().unlock();
        }
    }

    /**
     * Formula cells that read 'cellRef' directly or through a range, sorted.
     */
    public List<String> getDependents(long workbookId, int sheetIndex, String cellRef) {
        CellRef ref = parseRef(cellRef);
        Spreadsheet workbook = getWorkbook(workbookId);
        workbook.getLock().readLock().lock();
        try {
            Sheet sheet = requireSheet(workbook, sheetIndex);
            List<String> result = new ArrayList<>();
            for (CellRef dependent : new TreeSet<>(sheet.getDependencyGraph().getDependents(ref))) {
                result.add(dependent.toA1());
            }
            return result;
        } finally {
            workbook.getLock().readLock().unlock();
        }
    }

    /**
     * The whole forward graph: formula cell -> what it reads.
     */
    public Map<String, List<String>> getPrecedentGraph(long workbookId, int sheetIndex) {
        Spreadsheet workbook = getWorkbook(workbookId);
        workbook.getLock().readLock().lock();
        try {
            return requireSheet(workbook, sheetIndex).getDependencyGraph().describePrecedents();
        } finally {
            workbook.getLock().readLock().unlock();
        }
    }

    /**
     * The whole reverse graph: referenced cell or range -> formulas reading it.
     */
    public Map<String, List<String>> getDependentGraph(long workbookId, int sheetIndex) {
        Spreadsheet workbook = getWorkbook(workbookId);
        workbook.getLock().readLock().lock();
        try {
            return requireSheet(workbook, sheetIndex).getDependencyGraph().describeDependents();
        } finally {
            workbook.getLock().readLock().unlock();
        }
    }

    // ----------------------------------------------------------------
    // Internal helpers
    // ----------------------------------------------------------------

    private Sheet newSheet(String name) {
        return new Sheet(name, properties.getDefaultColumnWidth(), properties.getDefaultRowHeight());
    }

    private static Sheet requireSheet(Spreadsheet workbook, int sheetIndex) {
        return workbook.sheet(sheetIndex)
                .orElseThrow(() -> new SheetNotFoundException("Sheet not found: " + sheetIndex));
    }

    private static CellRef parseRef(String cellRef) {
        return CellRef.parse(cellRef)
                .orElseThrow(() -> new InvalidCellReferenceException("Invalid cell reference: " + cellRef));
    }

    private static void requireName(String name) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Sheet name must not be blank");
        }
    }

    /**
     * Numbers and TRUE/FALSE (any case) become typed values; everything else stays text.
     */
    static CellValue parseLiteral(String raw) {
        String trimmed = raw.trim();
        if ("TRUE".equalsIgnoreCase(trimmed)) {
            return CellValue.bool(true);
        }
        if ("FALSE".equalsIgnoreCase(trimmed)) {
            return CellValue.bool(false);
        }
        OptionalDouble number = CellValue.text(trimmed).asNumber();
        if (number.isPresent()) {
            return CellValue.number(number.getAsDouble());
        }
        return CellValue.text(raw);
    }

    /**
     * Runs 'reader' under the read lock, or under the write lock after a
     * pending recalculation when the sheet holds dirty cells.
     */
    private <T> T withFreshSheet(Spreadsheet workbook, int sheetIndex, Function<Sheet, T> reader) {
        ReentrantReadWriteLock lock = workbook.getLock();
        lock.readLock().lock();
        try {
            Sheet sheet = requireSheet(workbook, sheetIndex);
            if (!hasDirtyCells(sheet)) {
                return reader.apply(sheet);
            }
        } finally {
            lock.readLock().unlock();
        }

        lock.writeLock().lock();
        try {
            Sheet sheet = requireSheet(workbook, sheetIndex);
            recalculator.recalculate(sheet);
            return reader.apply(sheet);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private static boolean hasDirtyCells(Sheet sheet) {
        for (Cell cell : sheet.cells().values()) {
            if (cell.isDirty()) {
                return true;
            }
        }
        return false;
    }
}
