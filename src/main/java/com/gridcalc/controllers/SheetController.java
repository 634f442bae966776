package com.gridcalc.controllers;

import com.gridcalc.exceptions.InvalidReferenceException;
import com.gridcalc.models.CellDetails;
import com.gridcalc.models.Value;
import com.gridcalc.recalc.RecalcMode;
import com.gridcalc.recalc.RecalcOrder;
import com.gridcalc.recalc.RecalcStats;
import com.gridcalc.references.CellReference;
import com.gridcalc.references.NamedRange;
import com.gridcalc.services.SheetService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST endpoints for managing spreadsheet Sheets.
 * "/sheet" is the base path. Cells are addressed A1-style; rows in row
 * paths are 1-based numbers and columns are letters.
 */
@RestController
@RequestMapping("/sheet")
public class SheetController {

    @Autowired
    private SheetService sheetService;

    /**
     * POST /sheet
     * Creates an empty sheet, returns the sheetId.
     */
    @PostMapping
    public ResponseEntity<Long> createSheet() {
        return ResponseEntity.ok(sheetService.createSheet());
    }

    /**
     * GET /sheet/{sheetId}
     * Returns the display value of every non-empty cell,
     * in the format: { "A1": "10", "B1": "hello", ... }.
     */
    @GetMapping("/{sheetId}")
    public ResponseEntity<Map<String, String>> getSheet(@PathVariable long sheetId) {
        return ResponseEntity.ok(sheetService.getSheetData(sheetId));
    }

    @DeleteMapping("/{sheetId}")
    public ResponseEntity<Void> deleteSheet(@PathVariable long sheetId) {
        sheetService.deleteSheet(sheetId);
        return ResponseEntity.ok().build();
    }

    /**
     * PUT /sheet/{sheetId}/cell/{ref}
     * Body: raw cell text ("42", "'label", "=A1*2", "@SUM(A1..A3)").
     */
    @PutMapping("/{sheetId}/cell/{ref}")
    public ResponseEntity<Void> setCell(@PathVariable long sheetId, @PathVariable String ref,
                                        @RequestBody(required = false) String rawValue) {
        sheetService.setCell(sheetId, ref, rawValue == null ? "" : rawValue);
        return ResponseEntity.ok().build();
    }

    @GetMapping("/{sheetId}/cell/{ref}")
    public ResponseEntity<CellDetails> getCell(@PathVariable long sheetId, @PathVariable String ref) {
        return ResponseEntity.ok(sheetService.getCellDetails(sheetId, ref));
    }

    @DeleteMapping("/{sheetId}/cell/{ref}")
    public ResponseEntity<Void> deleteCell(@PathVariable long sheetId, @PathVariable String ref) {
        sheetService.deleteCell(sheetId, ref);
        return ResponseEntity.ok().build();
    }

    /**
     * PUT /sheet/{sheetId}/format/{range}
     * Body: a format code such as "F2", "C0" or "P1".
     */
    @PutMapping("/{sheetId}/format/{range}")
    public ResponseEntity<Void> setFormat(@PathVariable long sheetId, @PathVariable String range,
                                          @RequestBody String formatCode) {
        sheetService.setRangeFormat(sheetId, range, formatCode.trim());
        return ResponseEntity.ok().build();
    }

    /**
     * POST /sheet/{sheetId}/evaluate
     * Body: a formula. Returns { "formula", "type", "value" } without storing anything.
     */
    @PostMapping("/{sheetId}/evaluate")
    public ResponseEntity<Map<String, Object>> evaluate(@PathVariable long sheetId, @RequestBody String formula) {
        Value value = sheetService.evaluate(sheetId, formula);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("formula", formula);
        body.put("type", value.getType());
        body.put("value", value.isNumber() ? (Object) value.getNumber() : value.asDisplayText());
        return ResponseEntity.ok(body);
    }

    @PostMapping("/{sheetId}/recalculate")
    public ResponseEntity<RecalcStats> recalculate(@PathVariable long sheetId,
                                                   @RequestParam(defaultValue = "true") boolean full) {
        return ResponseEntity.ok(sheetService.recalculate(sheetId, full));
    }

    @PutMapping("/{sheetId}/recalc-mode/{mode}")
    public ResponseEntity<Void> setRecalcMode(@PathVariable long sheetId, @PathVariable String mode) {
        sheetService.setRecalcMode(sheetId, RecalcMode.fromValue(mode));
        return ResponseEntity.ok().build();
    }

    @PutMapping("/{sheetId}/recalc-order/{order}")
    public ResponseEntity<Void> setRecalcOrder(@PathVariable long sheetId, @PathVariable String order) {
        sheetService.setRecalcOrder(sheetId, RecalcOrder.fromValue(order));
        return ResponseEntity.ok().build();
    }

    // Rows and columns

    @PostMapping("/{sheetId}/rows/{row}")
    public ResponseEntity<Void> insertRow(@PathVariable long sheetId, @PathVariable int row) {
        sheetService.insertRow(sheetId, rowIndex(row));
        return ResponseEntity.ok().build();
    }

    @DeleteMapping("/{sheetId}/rows/{row}")
    public ResponseEntity<Void> deleteRow(@PathVariable long sheetId, @PathVariable int row) {
        sheetService.deleteRow(sheetId, rowIndex(row));
        return ResponseEntity.ok().build();
    }

    @PostMapping("/{sheetId}/cols/{col}")
    public ResponseEntity<Void> insertCol(@PathVariable long sheetId, @PathVariable String col) {
        sheetService.insertCol(sheetId, colIndex(col));
        return ResponseEntity.ok().build();
    }

    @DeleteMapping("/{sheetId}/cols/{col}")
    public ResponseEntity<Void> deleteCol(@PathVariable long sheetId, @PathVariable String col) {
        sheetService.deleteCol(sheetId, colIndex(col));
        return ResponseEntity.ok().build();
    }

    /**
     * POST /sheet/{sheetId}/copy
     * Body: { "source": "A1:B3", "destination": "D1" }.
     */
    @PostMapping("/{sheetId}/copy")
    public ResponseEntity<Void> copy(@PathVariable long sheetId, @RequestBody Map<String, String> request) {
        sheetService.copyRange(sheetId, required(request, "source"), required(request, "destination"));
        return ResponseEntity.ok().build();
    }

    // Named ranges

    @GetMapping("/{sheetId}/names")
    public ResponseEntity<Map<String, String>> listNames(@PathVariable long sheetId) {
        return ResponseEntity.ok(sheetService.listNames(sheetId));
    }

    /**
     * PUT /sheet/{sheetId}/names/{name}
     * Body: { "reference": "A1:A10", "description": "optional" }.
     */
    @PutMapping("/{sheetId}/names/{name}")
    public ResponseEntity<Map<String, String>> defineName(@PathVariable long sheetId, @PathVariable String name,
                                                          @RequestBody Map<String, String> request) {
        NamedRange named = sheetService.defineName(sheetId, name, required(request, "reference"),
                request.get("description"));
        Map<String, String> body = new LinkedHashMap<>();
        body.put("name", named.getName());
        body.put("reference", named.getReferenceText());
        body.put("description", named.getDescription());
        return ResponseEntity.ok(body);
    }

    @DeleteMapping("/{sheetId}/names/{name}")
    public ResponseEntity<Void> deleteName(@PathVariable long sheetId, @PathVariable String name) {
        if (!sheetService.deleteName(sheetId, name)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok().build();
    }

    // Cycles and dependencies

    /**
     * GET /sheet/{sheetId}/circular
     * Returns { "live": [...], "cycles": [...] }.
     */
    @GetMapping("/{sheetId}/circular")
    public ResponseEntity<Map<String, List<String>>> getCircularReferences(@PathVariable long sheetId) {
        return ResponseEntity.ok(sheetService.getCircularReferences(sheetId));
    }

    /**
     * GET /sheet/{sheetId}/forwardDependencies
     * For each formula cell => the cells it references.
     */
    @GetMapping("/{sheetId}/forwardDependencies")
    public ResponseEntity<Map<String, List<String>>> getForwardDependencyGraph(@PathVariable long sheetId) {
        return ResponseEntity.ok(sheetService.getForwardDependencies(sheetId));
    }

    /**
     * GET /sheet/{sheetId}/reverseDependencies
     * For each referenced cell => the formula cells that reference it.
     */
    @GetMapping("/{sheetId}/reverseDependencies")
    public ResponseEntity<Map<String, List<String>>> getReverseDependencyGraph(@PathVariable long sheetId) {
        return ResponseEntity.ok(sheetService.getReverseDependencies(sheetId));
    }

    private static int rowIndex(int rowNumber) {
        if (rowNumber < 1) {
            throw new InvalidReferenceException("Row numbers start at 1: " + rowNumber);
        }
        return rowNumber - 1;
    }

    private static int colIndex(String letters) {
        if (letters == null || !letters.matches("[A-Za-z]{1,3}")) {
            throw new InvalidReferenceException("Invalid column: " + letters);
        }
        return CellReference.columnToIndex(letters);
    }

    private static String required(Map<String, String> request, String key) {
        String value = request.get(key);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Missing \"" + key + "\"");
        }
        return value;
    }
}
