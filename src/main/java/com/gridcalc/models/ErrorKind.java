package com.gridcalc.models;

import java.util.HashMap;
import java.util.Map;

/**
 * Enumerates the formula error values a cell can evaluate to.
 * The literal text of each (e.g. "#DIV/0!") is what users see and
 * what the ERROR.TYPE function recognizes.
 */
public enum ErrorKind {
    DIV_ZERO("#DIV/0!", 2),
    ERR("#ERR!", 3),
    CIRC("#CIRC!", 8),
    REF("#REF!", 4),
    NAME("#NAME?", 5),
    NA("#N/A", 7),
    NUM("#NUM!", 6),
    NULL("#NULL!", 1),
    VALUE("#VALUE!", 3);

    private static final Map<String, ErrorKind> BY_TEXT = new HashMap<>();

    static {
        for (ErrorKind kind : values()) {
            BY_TEXT.put(kind.text, kind);
        }
    }

    private final String text;
    private final int typeCode;

    ErrorKind(String text, int typeCode) {
        this.text = text;
        this.typeCode = typeCode;
    }

    public String getText() {
        return text;
    }

    /**
     * Stable number reported by ERROR.TYPE (NULL=1 ... CIRC=8; ERR shares 3 with VALUE).
     */
    public int getTypeCode() {
        return typeCode;
    }

    /**
     * Returns the kind whose literal text is exactly {@code text}, or null.
     */
    public static ErrorKind fromText(String text) {
        return text == null ? null : BY_TEXT.get(text);
    }

    public static boolean isErrorText(String text) {
        return fromText(text) != null;
    }

    @Override
    public String toString() {
        return text;
    }
}
