package com.gridcalc.exceptions;

import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

/**
 * Maps request failures to an {@link ErrorResponse}. Formula failures never
 * arrive here; they are cell values.
 */
@ControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(InvalidReferenceException.class)
    public ResponseEntity<ErrorResponse> handleInvalidReference(InvalidReferenceException ex,
                                                                HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, "INVALID_REFERENCE", ex, request);
    }

    @ExceptionHandler(InvalidNameException.class)
    public ResponseEntity<ErrorResponse> handleInvalidName(InvalidNameException ex, HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, "INVALID_NAME", ex, request);
    }

    // Unknown recalc mode/order, missing request fields
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleBadArgument(IllegalArgumentException ex, HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", ex, request);
    }

    @ExceptionHandler(SheetNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleSheetNotFound(SheetNotFoundException ex, HttpServletRequest request) {
        return respond(HttpStatus.NOT_FOUND, "SHEET_NOT_FOUND", ex, request);
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<ErrorResponse> handleGeneric(RuntimeException ex, HttpServletRequest request) {
        log.error("Unhandled failure on {} {}", request.getMethod(), request.getRequestURI(), ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "SERVER_ERROR", ex.getMessage(), request);
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String code, RuntimeException ex,
                                                         HttpServletRequest request) {
        log.warn("{} on {} {}: {}", code, request.getMethod(), request.getRequestURI(), ex.getMessage());
        return body(status, code, ex.getMessage(), request);
    }

    private static ResponseEntity<ErrorResponse> body(HttpStatus status, String code, String message,
                                                      HttpServletRequest request) {
        ErrorResponse error = new ErrorResponse(status.value(), code, message, request.getRequestURI());
        return new ResponseEntity<>(error, status);
    }
}
