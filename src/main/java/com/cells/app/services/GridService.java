package com.cells.app.services;

import com.cells.app.models.CellKey;
import com.cells.app.models.CellSnapshot;
import com.cells.app.models.ColumnKey;
import com.cells.app.models.Grid;
import com.cells.app.models.GridView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Main entry point for the grid: applies edits, runs the recalculation
 * pass and hands out read-only snapshots to the display side.
 */
@Service
public class GridService {

    private static final Logger logger = LoggerFactory.getLogger(GridService.class);

    private final Grid grid = new Grid();
    private final RecalculationEngine engine;
    private final ApplicationEventPublisher eventPublisher;

    public GridService(RecalculationEngine engine, ApplicationEventPublisher eventPublisher) {
        this.engine = engine;
        this.eventPublisher = eventPublisher;
    }

    /**
     * Sets a cell's raw text with these steps:
     * 1) Re-parse the one cell (creating it on first use).
     * 2) Recalculate the whole grid.
     * 3) Tell listeners that any cell may have changed.
     */
    public RecalculationResult applyEdit(CellKey key, String newText) {
        RecalculationResult result;
        long revision;
        grid.getLock().writeLock().lock();
        try {
            grid.getOrCreateCell(key).update(newText);
            result = engine.recalculate(grid);
            revision = grid.getRevision();
        } finally {
            grid.getLock().writeLock().unlock();
        }
        logger.info("Cell {} edited, {} unresolved reference(s)", key, result.getUnresolved().size());
        eventPublisher.publishEvent(new GridRecalculatedEvent(this, key, revision, result));
        return result;
    }

    public RecalculationResult applyEdit(String key, String newText) {
        return applyEdit(CellKey.parse(key), newText);
    }

    /**
     * Sets many cells at once and recalculates a single time.
     */
    public RecalculationResult seed(Map<CellKey, String> inputs) {
        RecalculationResult result;
        long revision;
        grid.getLock().writeLock().lock();
        try {
            for (Map.Entry<CellKey, String> entry : inputs.entrySet()) {
                grid.getOrCreateCell(entry.getKey()).update(entry.getValue());
            }
            result = engine.recalculate(grid);
            revision = grid.getRevision();
        } finally {
            grid.getLock().writeLock().unlock();
        }
        logger.info("Seeded {} cell(s)", inputs.size());
        eventPublisher.publishEvent(new GridRecalculatedEvent(this, null, revision, result));
        return result;
    }

    /**
     * Runs a full pass without changing any input.
     */
    public RecalculationResult recalculate() {
        RecalculationResult result;
        long revision;
        grid.getLock().writeLock().lock();
        try {
            result = engine.recalculate(grid);
            revision = grid.getRevision();
        } finally {
            grid.getLock().writeLock().unlock();
        }
        eventPublisher.publishEvent(new GridRecalculatedEvent(this, null, revision, result));
        return result;
    }

    /**
     * Snapshot of any position, including ones never set (returned blank).
     */
    public CellSnapshot getSnapshot(CellKey key) {
        grid.getLock().readLock().lock();
        try {
            return grid.snapshot(key);
        } finally {
            grid.getLock().readLock().unlock();
        }
    }

    public CellSnapshot getSnapshot(String key) {
        return getSnapshot(CellKey.parse(key));
    }

    /**
     * Returns the grid bounds plus every non-blank cell, in key order.
     */
    public GridView getGridView() {
        List<String> columns = ColumnKey.all().stream()
                .map(ColumnKey::toString)
                .collect(Collectors.toList());

        grid.getLock().readLock().lock();
        try {
            Map<String, CellSnapshot> cells = new LinkedHashMap<>();
            grid.getCells().entrySet().stream()
                    .sorted(Map.Entry.comparingByKey())
                    .forEach(entry -> {
                        CellSnapshot snapshot = entry.getValue().toSnapshot();
                        if (!snapshot.isBlank()) {
                            cells.put(entry.getKey().toString(), snapshot);
                        }
                    });
            return new GridView(grid.getRevision(), columns, CellKey.MAX_ROW, cells);
        } finally {
            grid.getLock().readLock().unlock();
        }
    }
}
