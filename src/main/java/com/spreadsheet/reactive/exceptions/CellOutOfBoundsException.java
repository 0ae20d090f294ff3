package com.spreadsheet.reactive.exceptions;

/**
 * Thrown when a well-formed cell id lies outside the sheet's dimensions.
 */
public class CellOutOfBoundsException extends RuntimeException {
    public CellOutOfBoundsException(String message) {
        super(message);
    }
}
