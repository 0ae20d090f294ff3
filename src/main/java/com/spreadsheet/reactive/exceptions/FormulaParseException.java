package com.spreadsheet.reactive.exceptions;

/**
 * Thrown when a formula token is neither an integer nor a cell or range reference,
 * or when a range is not written top-left to bottom-right.
 */
public class FormulaParseException extends RuntimeException {
    public FormulaParseException(String message) {
        super(message);
    }

    public FormulaParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
