package com.cells.app.services;

import com.cells.app.exceptions.MissingDependencyException;
import com.cells.app.models.Cell;
import com.cells.app.models.CellKey;
import com.cells.app.models.Grid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Recomputes every cell of a grid in dependency order.
 *
 * A fixpoint iteration rather than a topological sort: the first sweep
 * evaluates every cell, cells waiting on an unknown value are retried on
 * following sweeps, and once a sweep resolves nothing new the remaining
 * cells are marked as reference errors. That covers both references to
 * cells without a numeric value and reference cycles.
 *
 * The caller must hold the grid's write lock.
 */
@Component
public class RecalculationEngine {

    private static final Logger logger = LoggerFactory.getLogger(RecalculationEngine.class);

    public RecalculationResult recalculate(Grid grid) {
        Map<CellKey, Double> values = grid.getValues();
        values.clear();

        List<CellKey> waiting = new ArrayList<>();
        for (Map.Entry<CellKey, Cell> entry : grid.getCells().entrySet()) {
            Cell cell = entry.getValue();
            cell.clearReferenceError();
            if (!tryResolve(entry.getKey(), cell, values)) {
                waiting.add(entry.getKey());
            }
        }

        int sweeps = 1;
        while (!waiting.isEmpty()) {
            int remaining = waiting.size();
            List<CellKey> stillWaiting = new ArrayList<>();
            for (CellKey key : waiting) {
                if (!tryResolve(key, grid.getCell(key), values)) {
                    stillWaiting.add(key);
                }
            }
            sweeps++;
            waiting = stillWaiting;

            if (waiting.size() >= remaining) {
                // no progress: nothing left in the queue can ever resolve
                for (CellKey key : waiting) {
                    grid.getCell(key).markReferenceError();
                }
                break;
            }
        }

        Collections.sort(waiting);
        grid.nextRevision();
        RecalculationResult result = new RecalculationResult(values.size(), sweeps, waiting);
        logger.debug("Recalculated grid revision {}: {}", grid.getRevision(), result);
        return result;
    }

    /**
     * @return false if the cell has to wait for another cell's value
     */
    private boolean tryResolve(CellKey key, Cell cell, Map<CellKey, Double> values) {
        try {
            OptionalDouble value = cell.tryEvaluate(values);
            if (value.isPresent()) {
                values.put(key, value.getAsDouble());
            }
            return true;
        } catch (MissingDependencyException ex) {
            logger.trace("{} is waiting for {}", key, ex.getKey());
            return false;
        }
    }
}
