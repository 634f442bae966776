package com.gridcalc.references;

/**
 * Which coordinate a structural edit (insert/delete) shifts.
 */
public enum Axis {
    ROW,
    COLUMN
}
