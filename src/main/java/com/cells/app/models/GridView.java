package com.cells.app.models;

import java.util.List;
import java.util.Map;

/**
 * Whole-grid snapshot: bounds, the pass revision, and the
 * non-blank cells keyed by address ("A1", "B2", ...).
 */
public class GridView {
    private final long revision;
    private final List<String> columns;
    private final int rows;
    private final Map<String, CellSnapshot> cells;

    public GridView(long revision, List<String> columns, int rows, Map<String, CellSnapshot> cells) {
        this.revision = revision;
        this.columns = columns;
        this.rows = rows;
        this.cells = cells;
    }

    public long getRevision() {
        return revision;
    }

    public List<String> getColumns() {
        return columns;
    }

    public int getRows() {
        return rows;
    }

    public Map<String, CellSnapshot> getCells() {
        return cells;
    }
}
