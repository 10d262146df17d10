package com.formulagrid.app.controllers;

import com.formulagrid.app.models.CellId;
import com.formulagrid.app.models.CellView;
import com.formulagrid.app.services.RecalculationEngine;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * REST endpoints for the cell grid.
 * "/grid" is the base path.
 */
@RestController
@RequestMapping("/grid")
public class GridController {

    @Autowired
    private RecalculationEngine engine;

    /**
     * PUT /grid/cells/{cellId}
     * Body: raw text (literal, or a formula starting with "=").
     * An empty body clears the cell.
     * Always 200 for a valid cell id, even if the formula is broken:
     * the returned cell carries the error state.
     */
    @PutMapping("/cells/{cellId}")
    public ResponseEntity<CellView> setCell(
            @PathVariable String cellId,
            @RequestBody(required = false) String rawInput
    ) {
        CellId id = CellId.parse(cellId);
        engine.applyEdit(id, rawInput);
        return ResponseEntity.ok(engine.getCell(id));
    }

    @GetMapping("/cells/{cellId}")
    public ResponseEntity<CellView> getCell(@PathVariable String cellId) {
        return ResponseEntity.ok(engine.getCell(CellId.parse(cellId)));
    }

    /**
     * GET /grid/cells
     * All 100 cells in row-major order, for a full redraw.
     */
    @GetMapping("/cells")
    public ResponseEntity<List<CellView>> getAllCells() {
        return ResponseEntity.ok(new ArrayList<>(engine.getAllCells().values()));
    }

    /**
     * GET /grid
     * Display values of the non-empty cells, e.g. { "A1": "5", "B1": "8" }.
     */
    @GetMapping
    public ResponseEntity<Map<String, String>> getGrid() {
        return ResponseEntity.ok(engine.getAllCellValues());
    }

    @GetMapping("/cells/{cellId}/precedents")
    public ResponseEntity<Set<CellId>> getPrecedents(@PathVariable String cellId) {
        return ResponseEntity.ok(engine.getPrecedents(CellId.parse(cellId)));
    }

    @GetMapping("/cells/{cellId}/dependents")
    public ResponseEntity<Set<CellId>> getDependents(@PathVariable String cellId) {
        return ResponseEntity.ok(engine.getDependents(CellId.parse(cellId)));
    }

    /**
     * GET /grid/forwardDependencies
     * For each referenced cell => the cells whose formulas read it.
     */
    @GetMapping("/forwardDependencies")
    public ResponseEntity<Map<CellId, Set<CellId>>> getForwardDependencies() {
        return ResponseEntity.ok(engine.getForwardDependencies());
    }

    /**
     * GET /grid/reverseDependencies
     * For each formula cell => the cells it references.
     */
    @GetMapping("/reverseDependencies")
    public ResponseEntity<Map<CellId, Set<CellId>>> getReverseDependencies() {
        return ResponseEntity.ok(engine.getReverseDependencies());
    }

    /**
     * DELETE /grid
     * Clears every cell.
     */
    @DeleteMapping
    public ResponseEntity<Void> reset() {
        engine.reset();
        return ResponseEntity.noContent().build();
    }
}
