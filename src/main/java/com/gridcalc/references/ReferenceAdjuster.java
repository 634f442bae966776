package com.gridcalc.references;

import com.gridcalc.formula.Token;
import com.gridcalc.formula.TokenType;
import com.gridcalc.formula.Tokenizer;

import java.util.List;

/**
 * Rewrites the cell references inside formula text when cells are copied or
 * when rows and columns are inserted or deleted. Only CELL tokens are touched;
 * a range is adjusted as its two corner cells. Everything else, whitespace and
 * named ranges included, is copied through unchanged.
 */
public final class ReferenceAdjuster {

    public static final String REF_ERROR = "#REF!";

    private ReferenceAdjuster() {
    }

    private interface CellRewrite {
        /**
         * Returns the replacement text for {@code ref}.
         */
        String rewrite(CellReference ref);
    }

    /**
     * Shifts the relative parts of every reference by the copy offset.
     * Shifted coordinates are clamped into {@code [0, maxRow]} and {@code [0, maxCol]}.
     */
    public static String adjustForCopy(String formula, int rowDelta, int colDelta, int maxRow, int maxCol) {
        if (rowDelta == 0 && colDelta == 0) {
            return formula;
        }
        return rewrite(formula, ref -> ref.adjust(rowDelta, colDelta, maxRow, maxCol).toString());
    }

    /**
     * Moves references after a row or column insert ({@code shift = 1}) or delete
     * ({@code shift = -1}) at {@code boundary}. A reference to a deleted line, or one
     * pushed outside the grid, becomes {@code #REF!}. Absolute references move too.
     */
    public static String adjustForStructuralChange(String formula, Axis axis, int boundary, int shift,
                                                   int maxRow, int maxCol) {
        return rewrite(formula, ref -> {
            int coordinate = axis == Axis.ROW ? ref.getRow() : ref.getCol();
            int max = axis == Axis.ROW ? maxRow : maxCol;
            if (shift < 0 && coordinate == boundary) {
                return REF_ERROR;
            }
            if (coordinate < boundary) {
                return ref.toString();
            }
            int moved = coordinate + shift;
            if (moved < 0 || moved > max) {
                return REF_ERROR;
            }
            return (axis == Axis.ROW ? ref.withRow(moved) : ref.withCol(moved)).toString();
        });
    }

    private static String rewrite(String formula, CellRewrite rewrite) {
        if (formula == null || formula.isEmpty()) {
            return formula;
        }
        List<Token> tokens = Tokenizer.tokenize(formula);
        StringBuilder out = new StringBuilder(formula.length());
        int copied = 0;
        for (Token token : tokens) {
            CellReference ref = token.is(TokenType.CELL) ? CellReference.tryParse(token.getRawText()) : null;
            if (ref == null) {
                continue;
            }
            out.append(formula, copied, token.getPosition());
            out.append(rewrite.rewrite(ref));
            copied = token.getEnd();
        }
        out.append(formula, copied, formula.length());
        return out.toString();
    }
}
