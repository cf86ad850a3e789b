package com.cells.app.exceptions;

/**
 * Simple DTO to structure error responses with a code and message.
 * For example:
 * {
 *   "code": "INVALID_CELL_KEY",
 *   "message": "Invalid cell key: AA1"
 * }
 */
public class ErrorResponse {
    private final String code;
    private final String message;

    public ErrorResponse(String code, String message) {
        this.code = code;
        this.message = message;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
