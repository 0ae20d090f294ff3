package com.spreadsheet.reactive.exceptions;

/**
 * Thrown when installing a formula would create a circular dependency
 * (e.g., a cell referencing itself, or a multi-cell loop).
 */
public class CircularReferenceException extends RuntimeException {
    public CircularReferenceException(String message) {
        super(message);
    }
}
