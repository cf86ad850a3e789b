package com.cells.app.exceptions;

import com.cells.app.models.CellKey;

/**
 * Raised while evaluating a formula whose referenced cell has no known
 * value yet in the current recalculation pass. The recalculation engine
 * uses it to retry the cell on a later sweep.
 */
public class MissingDependencyException extends Exception {

    private final CellKey key;

    public MissingDependencyException(CellKey key) {
        // thrown once per blocked cell per sweep, so skip the stack trace
        super("No value yet for " + key, null, false, false);
        this.key = key;
    }

    public CellKey getKey() {
        return key;
    }
}
