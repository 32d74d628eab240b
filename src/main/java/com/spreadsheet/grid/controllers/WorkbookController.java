package com.spreadsheet.grid.controllers;

import com.spreadsheet.grid.graph.RecalculationResult;
import com.spreadsheet.grid.models.CellRef;
import com.spreadsheet.grid.models.CellSnapshot;
import com.spreadsheet.grid.models.CellValue;
import com.spreadsheet.grid.services.SpreadsheetService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST endpoints for workbooks, their sheets and cells.
 * "/workbooks" is the base path; sheets are addressed by index and cells by
 * A1 reference, e.g. PUT /workbooks/1/sheets/0/cells/C1 with body "=A1+B1".
 */
@RestController
@RequestMapping("/workbooks")
public class WorkbookController {

    @Autowired
    private SpreadsheetService spreadsheetService;

    /**
     * POST /workbooks
     * Creates a workbook with one empty sheet, returns its id.
     */
    @PostMapping
    public ResponseEntity<Long> createWorkbook() {
        return ResponseEntity.ok(spreadsheetService.createWorkbook());
    }

    @DeleteMapping("/{workbookId}")
    public ResponseEntity<Void> deleteWorkbook(@PathVariable long workbookId) {
        spreadsheetService.deleteWorkbook(workbookId);
        return ResponseEntity.ok().build();
    }

    // ----------------------------------------------------------------
    // Sheets
    // ----------------------------------------------------------------

    @GetMapping("/{workbookId}/sheets")
    public ResponseEntity<List<String>> getSheetNames(@PathVariable long workbookId) {
        return ResponseEntity.ok(spreadsheetService.getSheetNames(workbookId));
    }

    /**
     * POST /workbooks/{workbookId}/sheets
     * Body: sheet name. Returns the new sheet's index.
     */
    @PostMapping("/{workbookId}/sheets")
    public ResponseEntity<Integer> addSheet(@PathVariable long workbookId, @RequestBody String name) {
        return ResponseEntity.ok(spreadsheetService.addSheet(workbookId, name));
    }

    @PutMapping("/{workbookId}/sheets/{sheetIndex}/name")
    public ResponseEntity<Void> renameSheet(@PathVariable long workbookId,
                                            @PathVariable int sheetIndex,
                                            @RequestBody String name) {
        spreadsheetService.renameSheet(workbookId, sheetIndex, name);
        return ResponseEntity.ok().build();
    }

    /**
     * DELETE /workbooks/{workbookId}/sheets/{sheetIndex}
     * Removing the last sheet is rejected with a 400.
     */
    @DeleteMapping("/{workbookId}/sheets/{sheetIndex}")
    public ResponseEntity<Void> removeSheet(@PathVariable long workbookId, @PathVariable int sheetIndex) {
        spreadsheetService.removeSheet(workbookId, sheetIndex);
        return ResponseEntity.ok().build();
    }

    @GetMapping("/{workbookId}/activeSheet")
    public ResponseEntity<Integer> getActiveSheet(@PathVariable long workbookId) {
        return ResponseEntity.ok(spreadsheetService.getActiveSheet(workbookId));
    }

    @PutMapping("/{workbookId}/activeSheet/{sheetIndex}")
    public ResponseEntity<Void> setActiveSheet(@PathVariable long workbookId, @PathVariable int sheetIndex) {
        spreadsheetService.setActiveSheet(workbookId, sheetIndex);
        return ResponseEntity.ok().build();
    }

    /**
     * GET /workbooks/{workbookId}/sheets/{sheetIndex}
     * Every stored cell keyed by A1 reference: { "A1": {...}, "C1": {...} }.
     */
    @GetMapping("/{workbookId}/sheets/{sheetIndex}")
    public ResponseEntity<Map<String, CellSnapshot>> getSheet(@PathVariable long workbookId,
                                                              @PathVariable int sheetIndex) {
        return ResponseEntity.ok(spreadsheetService.getSheetData(workbookId, sheetIndex));
    }

    @GetMapping("/{workbookId}/sheets/{sheetIndex}/usedRange")
    public ResponseEntity<Map<String, String>> getUsedRange(@PathVariable long workbookId,
                                                            @PathVariable int sheetIndex) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("usedRange", spreadsheetService.getUsedRange(workbookId, sheetIndex).orElse(null));
        return ResponseEntity.ok(body);
    }

    /**
     * GET /workbooks/{workbookId}/sheets/{sheetIndex}/range/{range}
     * Values of e.g. "A1:C3", one array per row, null for empty cells.
     */
    @GetMapping("/{workbookId}/sheets/{sheetIndex}/range/{range}")
    public ResponseEntity<List<List<Object>>> getRange(@PathVariable long workbookId,
                                                       @PathVariable int sheetIndex,
                                                       @PathVariable String range) {
        List<List<Object>> rows = new ArrayList<>();
        for (List<CellValue> row : spreadsheetService.getRangeValues(workbookId, sheetIndex, range)) {
            List<Object> values = new ArrayList<>(row.size());
            for (CellValue value : row) {
                values.add(CellSnapshot.jsonValue(value));
            }
            rows.add(values);
        }
        return ResponseEntity.ok(rows);
    }

    @PostMapping("/{workbookId}/sheets/{sheetIndex}/recalculate")
    public ResponseEntity<Map<String, Object>> recalculate(@PathVariable long workbookId,
                                                           @PathVariable int sheetIndex) {
        return ResponseEntity.ok(toBody(spreadsheetService.recalculate(workbookId, sheetIndex)));
    }

    // ----------------------------------------------------------------
    // Cells
    // ----------------------------------------------------------------

    /**
     * PUT /workbooks/{workbookId}/sheets/{sheetIndex}/cells/{cellRef}
     * Body: raw input ("=..." formula, number, TRUE/FALSE or text; empty clears).
     * Returns the cells whose value changed. A formula that does not parse is
     * rejected with a 400 and the cell keeps its previous content.
     */
    @PutMapping("/{workbookId}/sheets/{sheetIndex}/cells/{cellRef}")
    public ResponseEntity<Map<String, Object>> setCell(@PathVariable long workbookId,
                                                       @PathVariable int sheetIndex,
                                                       @PathVariable String cellRef,
                                                       @RequestBody(required = false) String rawInput) {
        RecalculationResult result = spreadsheetService.setCellInput(workbookId, sheetIndex, cellRef, rawInput);
        return ResponseEntity.ok(toBody(result));
    }

    @DeleteMapping("/{workbookId}/sheets/{sheetIndex}/cells/{cellRef}")
    public ResponseEntity<Map<String, Object>> clearCell(@PathVariable long workbookId,
                                                         @PathVariable int sheetIndex,
                                                         @PathVariable String cellRef) {
        return ResponseEntity.ok(toBody(spreadsheetService.clearCell(workbookId, sheetIndex, cellRef)));
    }

    @GetMapping("/{workbookId}/sheets/{sheetIndex}/cells/{cellRef}")
    public ResponseEntity<Map<String, Object>> getCell(@PathVariable long workbookId,
                                                       @PathVariable int sheetIndex,
                                                       @PathVariable String cellRef) {
        CellValue value = spreadsheetService.getCellValue(workbookId, sheetIndex, cellRef);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("type", value.getType());
        body.put("value", CellSnapshot.jsonValue(value));
        body.put("display", value.toDisplayString());
        return ResponseEntity.ok(body);
    }

    @GetMapping("/{workbookId}/sheets/{sheetIndex}/cells/{cellRef}/precedents")
    public ResponseEntity<List<String>> getPrecedents(@PathVariable long workbookId,
                                                      @PathVariable int sheetIndex,
                                                      @PathVariable String cellRef) {
        return ResponseEntity.ok(spreadsheetService.getPrecedents(workbookId, sheetIndex, cellRef));
    }

    @GetMapping("/{workbookId}/sheets/{sheetIndex}/cells/{cellRef}/dependents")
    public ResponseEntity<List<String>> getDependents(@PathVariable long workbookId,
                                                      @PathVariable int sheetIndex,
                                                      @PathVariable String cellRef) {
        return ResponseEntity.ok(spreadsheetService.getDependents(workbookId, sheetIndex, cellRef));
    }

    /**
     * GET /workbooks/{workbookId}/sheets/{sheetIndex}/forwardDependencies
     * For each formula cell, the cells and ranges it reads.
     */
    @GetMapping("/{workbookId}/sheets/{sheetIndex}/forwardDependencies")
    public ResponseEntity<Map<String, List<String>>> getForwardDependencies(@PathVariable long workbookId,
                                                                           @PathVariable int sheetIndex) {
        return ResponseEntity.ok(spreadsheetService.getPrecedentGraph(workbookId, sheetIndex));
    }

    /**
     * GET /workbooks/{workbookId}/sheets/{sheetIndex}/reverseDependencies
     * For each referenced cell or range, the formula cells reading it.
     */
    @GetMapping("/{workbookId}/sheets/{sheetIndex}/reverseDependencies")
    public ResponseEntity<Map<String, List<String>>> getReverseDependencies(@PathVariable long workbookId,
                                                                           @PathVariable int sheetIndex) {
        return ResponseEntity.ok(spreadsheetService.getDependentGraph(workbookId, sheetIndex));
    }

    private static Map<String, Object> toBody(RecalculationResult result) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("changed", toA1List(result.getChanged()));
        body.put("cyclic", toA1List(result.getCyclic()));
        body.put("evaluated", result.getEvaluated());
        return body;
    }

    private static List<String> toA1List(Iterable<CellRef> cells) {
        List<String> list = new ArrayList<>();
        for (CellRef cell : cells) {
            list.add(cell.toA1());
        }
        return list;
    }
}
