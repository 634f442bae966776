package com.gridcalc.recalc;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * Evaluation order of a recalculation pass.
 * NATURAL follows the dependency graph; COLUMN_WISE and ROW_WISE are plain
 * position sorts that ignore it, as Lotus does.
 */
public enum RecalcOrder {
    NATURAL,
    COLUMN_WISE,
    ROW_WISE;

    /**
     * Allows case-insensitive input with or without separators:
     * "columnwise", "Column-Wise" and "COLUMN_WISE" all map to COLUMN_WISE.
     */
    @JsonCreator
    public static RecalcOrder fromValue(String value) {
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace("-", "_");
        if ("COLUMNWISE".equals(normalized)) {
            return COLUMN_WISE;
        }
        if ("ROWWISE".equals(normalized)) {
            return ROW_WISE;
        }
        return RecalcOrder.valueOf(normalized);
    }
}
