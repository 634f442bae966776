package com.gridcalc.exceptions;

/**
 * Thrown when a cell or range reference string cannot be parsed
 * outside formula evaluation (e.g. "A0", "1A" or "A1:").
 * Inside a formula the same problem evaluates to #REF! instead.
 */
public class InvalidReferenceException extends RuntimeException {
    public InvalidReferenceException(String message) {
        super(message);
    }
}
