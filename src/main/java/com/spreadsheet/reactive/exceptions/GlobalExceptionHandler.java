package com.spreadsheet.reactive.exceptions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

/**
 * Catches spreadsheet exceptions from the controllers or services,
 * returning error JSON with an HTTP 4xx code instead of 500.
 */
@ControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(CircularReferenceException.class)
    public ResponseEntity<ErrorResponse> handleCircularRef(CircularReferenceException ex) {
        return respond("CIRCULAR_REFERENCE", ex, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(FormulaParseException.class)
    public ResponseEntity<ErrorResponse> handleParseError(FormulaParseException ex) {
        return respond("PARSE_ERROR", ex, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(InvalidCellIdException.class)
    public ResponseEntity<ErrorResponse> handleInvalidCellId(InvalidCellIdException ex) {
        return respond("INVALID_CELL_ID", ex, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(CellOutOfBoundsException.class)
    public ResponseEntity<ErrorResponse> handleOutOfBounds(CellOutOfBoundsException ex) {
        return respond("OUT_OF_BOUNDS", ex, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
        return respond("INVALID_ARGUMENT", ex, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(SheetNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleSheetNotFound(SheetNotFoundException ex) {
        return respond("SHEET_NOT_FOUND", ex, HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<ErrorResponse> handleGeneric(RuntimeException ex) {
        logger.error("Unhandled error", ex);
        ErrorResponse error = new ErrorResponse("SERVER_ERROR", ex.getMessage());
        return new ResponseEntity<>(error, HttpStatus.INTERNAL_SERVER_ERROR);
    }

    private ResponseEntity<ErrorResponse> respond(String code, RuntimeException ex, HttpStatus status) {
        logger.warn("{}: {}", code, ex.getMessage());
        return new ResponseEntity<>(new ErrorResponse(code, ex.getMessage()), status);
    }
}
