package com.cells.app.models;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Read-only view of one cell as handed to the display side:
 * the raw input (shown while editing), the display text, and
 * whether the cell is in an error state.
 */
public class CellSnapshot {

    private static final CellSnapshot BLANK = new CellSnapshot("", "", false);

    private final String input;
    private final String display;
    private final boolean error;

    public CellSnapshot(String input, String display, boolean error) {
        this.input = input;
        this.display = display;
        this.error = error;
    }

    public static CellSnapshot blank() {
        return BLANK;
    }

    public String getInput() {
        return input;
    }

    public String getDisplay() {
        return display;
    }

    public boolean isError() {
        return error;
    }

    @JsonIgnore
    public boolean isBlank() {
        return input.isEmpty() && display.isEmpty() && !error;
    }
}
