package com.gridcalc.recalc;

import com.gridcalc.formula.Token;
import com.gridcalc.formula.TokenType;
import com.gridcalc.formula.Tokenizer;
import com.gridcalc.references.CellReference;
import com.gridcalc.references.NamedRangeLookup;
import com.gridcalc.references.RangeReference;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Extracts the cells a formula reads. Ranges (written "A1:B3", "A1..B3", or
 * through a named range) expand to every cell they cover; remaining single
 * references are added as they are. Text that is not a valid reference is ignored.
 */
public final class DependencyScanner {

    private DependencyScanner() {
    }

    public static Set<CellReference> scan(String formula, NamedRangeLookup names) {
        Set<CellReference> result = new LinkedHashSet<>();
        if (formula == null || formula.isEmpty()) {
            return result;
        }
        List<Token> tokens = Tokenizer.tokenize(formula, names);
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.is(TokenType.RANGE)) {
                addRange(result, token.getValue());
            } else if (token.is(TokenType.CELL)) {
                CellReference start = CellReference.tryParse(token.getValue());
                if (i + 2 < tokens.size() && tokens.get(i + 1).is(TokenType.COLON)
                        && tokens.get(i + 2).is(TokenType.CELL)) {
                    CellReference end = CellReference.tryParse(tokens.get(i + 2).getValue());
                    if (start != null && end != null) {
                        result.addAll(new RangeReference(start, end).cells());
                    }
                    i += 2;
                } else if (start != null) {
                    result.add(start.toRelative());
                }
            }
        }
        return result;
    }

    private static void addRange(Set<CellReference> result, String text) {
        int colon = text.indexOf(':');
        if (colon < 0) {
            CellReference cell = CellReference.tryParse(text);
            if (cell != null) {
                result.add(cell.toRelative());
            }
            return;
        }
        CellReference start = CellReference.tryParse(text.substring(0, colon));
        CellReference end = CellReference.tryParse(text.substring(colon + 1));
        if (start != null && end != null) {
            result.addAll(new RangeReference(start, end).cells());
        }
    }
}
