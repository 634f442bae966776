package com.gridcalc.models;

/**
 * Enumerates the kinds of value a formula can produce:
 * NUMBER, TEXT, BOOLEAN, ERROR.
 * ARRAY only appears while a range is being handed to a function.
 */
public enum ValueType {
    NUMBER,
    TEXT,
    BOOLEAN,
    ERROR,
    ARRAY
}
