package com.gridcalc.exceptions;

/**
 * Thrown when a named range is given an illegal name,
 * e.g. one that looks like a cell reference ("AB12") or starts with a digit.
 */
public class InvalidNameException extends RuntimeException {
    public InvalidNameException(String message) {
        super(message);
    }
}
