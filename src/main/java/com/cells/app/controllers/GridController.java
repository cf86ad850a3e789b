package com.cells.app.controllers;

import com.cells.app.models.CellSnapshot;
import com.cells.app.models.GridView;
import com.cells.app.services.GridService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST endpoints for the grid display side.
 * "/grid" is the base path.
 */
@RestController
@RequestMapping("/grid")
public class GridController {

    @Autowired
    private GridService gridService;

    /**
     * GET /grid
     * Returns the grid bounds, the current revision and every non-blank cell,
     * in the format: { "revision": 3, "columns": ["A", ...], "rows": 99,
     * "cells": { "B2": { "input": "=A2+A3", "display": "7", "error": false } } }.
     * Clients compare the revision to know when to refresh.
     */
    @GetMapping
    public ResponseEntity<GridView> getGrid() {
        return ResponseEntity.ok(gridService.getGridView());
    }

    /**
     * GET /grid/cell/{cellKey}
     * Snapshot of one cell; cells never set come back blank.
     */
    @GetMapping("/cell/{cellKey}")
    public ResponseEntity<CellSnapshot> getCell(@PathVariable String cellKey) {
        return ResponseEntity.ok(gridService.getSnapshot(cellKey));
    }

    /**
     * PUT /grid/cell/{cellKey}
     * Body: the raw cell text (literal or "=formula"); an empty body clears the cell.
     * The whole grid is recalculated before this returns.
     */
    @PutMapping("/cell/{cellKey}")
    public ResponseEntity<Void> setCell(
            @PathVariable String cellKey,
            @RequestBody(required = false) String rawText
    ) {
        gridService.applyEdit(cellKey, rawText == null ? "" : rawText);
        return ResponseEntity.ok().build();
    }
}
