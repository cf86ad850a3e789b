package com.cells.app.services;

import com.cells.app.models.CellKey;

import java.util.List;

/**
 * Outcome of one full recalculation pass.
 */
public class RecalculationResult {
    private final int numericCells;
    private final int sweeps;
    private final List<CellKey> unresolved;

    public RecalculationResult(int numericCells, int sweeps, List<CellKey> unresolved) {
        this.numericCells = numericCells;
        this.sweeps = sweeps;
        this.unresolved = List.copyOf(unresolved);
    }

    /** Cells that ended the pass with a numeric value. */
    public int getNumericCells() {
        return numericCells;
    }

    /** Sweeps over the grid, counting the initial one. */
    public int getSweeps() {
        return sweeps;
    }

    /** Cells marked as reference errors, in key order. */
    public List<CellKey> getUnresolved() {
        return unresolved;
    }

    @Override
    public String toString() {
        return "RecalculationResult{numericCells=" + numericCells
                + ", sweeps=" + sweeps + ", unresolved=" + unresolved + '}';
    }
}
