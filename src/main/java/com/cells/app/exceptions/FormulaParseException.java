package com.cells.app.exceptions;

/**
 * Thrown when cell text starts with the formula marker but the rest
 * doesn't follow the formula grammar. Carries the 0-based position
 * in the raw cell text where parsing stopped.
 */
public class FormulaParseException extends RuntimeException {

    private final int position;

    public FormulaParseException(String message, int position) {
        super(message + " at position " + position);
        this.position = position;
    }

    public int getPosition() {
        return position;
    }
}
