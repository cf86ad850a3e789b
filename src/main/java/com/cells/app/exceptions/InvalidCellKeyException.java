package com.cells.app.exceptions;

/**
 * Thrown when a cell address can't be mapped onto the grid,
 * e.g. "A0", "AA1" or "B100".
 */
public class InvalidCellKeyException extends RuntimeException {
    public InvalidCellKeyException(String message) {
        super(message);
    }
}
