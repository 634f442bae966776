package com.gridcalc.recalc;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * When recalculation happens:
 * AUTOMATIC recalculates inside every edit, MANUAL only collects dirty cells
 * until an explicit recalculate.
 */
public enum RecalcMode {
    AUTOMATIC,
    MANUAL;

    /**
     * Allows case-insensitive input, e.g. "manual" -> MANUAL.
     */
    @JsonCreator
    public static RecalcMode fromValue(String value) {
        return RecalcMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
