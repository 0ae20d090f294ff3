package com.spreadsheet.reactive.controllers;

import com.spreadsheet.reactive.engine.CellSnapshot;
import com.spreadsheet.reactive.engine.RecalculationResult;
import com.spreadsheet.reactive.models.CellAddress;
import com.spreadsheet.reactive.models.CreateSheetRequest;
import com.spreadsheet.reactive.services.SheetService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * REST endpoints for managing spreadsheet Sheets.
 * "/sheet" is the base path.
 */
@RestController
@RequestMapping("/sheet")
public class SheetController {

    @Autowired
    private SheetService sheetService;

    /**
     * POST /sheet
     * Body: { "rows": 3, "columns": 3 }, both optional.
     * Returns the new sheetId.
     */
    @PostMapping
    public ResponseEntity<Long> createSheet(@RequestBody(required = false) CreateSheetRequest request) {
        Integer rows = request != null ? request.getRows() : null;
        Integer columns = request != null ? request.getColumns() : null;
        long sheetId = sheetService.createSheet(rows, columns);
        return ResponseEntity.ok(sheetId);
    }

    /**
     * PUT /sheet/{sheetId}/cell/{cellId}
     * Body: raw value, an integer like "10" or a formula like "=A1+B2-3+A2:B3".
     * An empty body sets the cell to 0.
     * Returns the ids of the dependents that were recomputed, in order.
     * Parse errors, bad ids and cycles become a 400 through GlobalExceptionHandler.
     */
    @PutMapping("/{sheetId}/cell/{cellId}")
    public ResponseEntity<List<String>> setCellValue(
            @PathVariable long sheetId,
            @PathVariable String cellId,
            @RequestBody(required = false) String rawValue
    ) {
        RecalculationResult result = sheetService.setCellValue(sheetId, cellId, rawValue);
        List<String> recomputed = result.getRecomputed().stream()
                .map(CellAddress::toString)
                .collect(Collectors.toList());
        return ResponseEntity.ok(recomputed);
    }

    /**
     * GET /sheet/{sheetId}/cell/{cellId}
     * Returns the cell's current integer value.
     */
    @GetMapping("/{sheetId}/cell/{cellId}")
    public ResponseEntity<Integer> getCellValue(@PathVariable long sheetId, @PathVariable String cellId) {
        return ResponseEntity.ok(sheetService.getCellValue(sheetId, cellId));
    }

    /**
     * GET /sheet/{sheetId}/cell/{cellId}/details
     * Returns value, formula (null for literals) and direct dependents of one cell.
     */
    @GetMapping("/{sheetId}/cell/{cellId}/details")
    public ResponseEntity<CellSnapshot> describeCell(@PathVariable long sheetId, @PathVariable String cellId) {
        return ResponseEntity.ok(sheetService.describeCell(sheetId, cellId));
    }

    /**
     * GET /sheet/{sheetId}
     * Returns every cell's value: { "A1": 10, "B1": 0, ... }.
     */
    @GetMapping("/{sheetId}")
    public ResponseEntity<Map<String, Integer>> getSheet(@PathVariable long sheetId) {
        return ResponseEntity.ok(sheetService.getSheetData(sheetId));
    }

    /**
     * GET /sheet/{sheetId}/dependents
     * Returns, for each referenced cell, the cells whose formula references it.
     */
    @GetMapping("/{sheetId}/dependents")
    public ResponseEntity<Map<String, List<String>>> getDependents(@PathVariable long sheetId) {
        return ResponseEntity.ok(sheetService.getDependents(sheetId));
    }
}
