package com.spreadsheet.reactive.exceptions;

/**
 * Thrown when a cell id is malformed,
 * for example "a1", "AA1", "A0" or "A-3".
 */
public class InvalidCellIdException extends RuntimeException {
    public InvalidCellIdException(String message) {
        super(message);
    }
}
