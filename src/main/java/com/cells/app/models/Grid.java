package com.cells.app.models;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Represents the whole grid:
 * - A sparse map of CellKey -> Cell (missing keys read as blank cells)
 * - The value cache of the last recalculation pass
 * - A revision counter, bumped after each completed pass
 * - A read/write lock; edits and passes run under the write lock
 */
public class Grid {

    // Insertion ordered, so the first sweep visits cells in the order they were created
    private final Map<CellKey, Cell> cells = new LinkedHashMap<>();
    private final Map<CellKey, Double> values = new HashMap<>();
    private long revision;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * Returns the cell at the key, or null if it was never set.
     */
    public Cell getCell(CellKey key) {
        return cells.get(key);
    }

    public Cell getOrCreateCell(CellKey key) {
        return cells.computeIfAbsent(key, k -> new Cell());
    }

    public CellSnapshot snapshot(CellKey key) {
        Cell cell = cells.get(key);
        return cell == null ? CellSnapshot.blank() : cell.toSnapshot();
    }

    public Map<CellKey, Cell> getCells() {
        return cells;
    }

    public Map<CellKey, Double> getValues() {
        return values;
    }

    public Map<CellKey, Double> getValuesView() {
        return Collections.unmodifiableMap(values);
    }

    public long getRevision() {
        return revision;
    }

    public void nextRevision() {
        revision++;
    }

    public ReentrantReadWriteLock getLock() {
        return lock;
    }
}
