package com.gridcalc.exceptions;

import com.gridcalc.models.ErrorKind;

/**
 * Thrown inside the formula engine (coercions, built-in functions, the parser)
 * to abort the current evaluation with a specific error value.
 * It never escapes the evaluator: the caller receives the matching
 * error value instead.
 */
public class FormulaException extends RuntimeException {
    private final ErrorKind kind;

    public FormulaException(ErrorKind kind) {
        super(kind.getText());
        this.kind = kind;
    }

    public FormulaException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
