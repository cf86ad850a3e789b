package com.cells.app.services;

import com.cells.app.models.CellKey;
import org.springframework.context.ApplicationEvent;

/**
 * Published after every completed recalculation pass. Listeners should
 * treat every cell as possibly changed; no diff is computed.
 */
public class GridRecalculatedEvent extends ApplicationEvent {

    private final CellKey editedKey;
    private final long revision;
    private final RecalculationResult result;

    public GridRecalculatedEvent(Object source, CellKey editedKey, long revision, RecalculationResult result) {
        super(source);
        this.editedKey = editedKey;
        this.revision = revision;
        this.result = result;
    }

    /**
     * The edited cell, or null when the pass followed a bulk seed or an
     * explicit recalculation.
     */
    public CellKey getEditedKey() {
        return editedKey;
    }

    public long getRevision() {
        return revision;
    }

    public RecalculationResult getResult() {
        return result;
    }
}
