package com.gridcalc.formula;

import com.gridcalc.references.NamedRange;
import com.gridcalc.references.NamedRangeLookup;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits formula text into tokens.
 * <p>
 * Whitespace is skipped; each token records its source span so callers
 * (the reference adjuster in particular) can rebuild the text around it.
 * "@" is the Lotus function prefix and is dropped, ".." is read as ":",
 * and an identifier followed by "(" is a function name. Any other
 * identifier becomes a CELL token, unless the supplied named-range lookup
 * knows it, in which case it becomes a CELL or RANGE token carrying the
 * resolved reference text. Unrecognized characters are ignored.
 */
public final class Tokenizer {

    private static final Pattern NUMBER_PATTERN = Pattern.compile("(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private Tokenizer() {
    }

    public static List<Token> tokenize(String formula) {
        return tokenize(formula, null);
    }

    /**
     * Tokenizes {@code formula}; {@code names} may be null to leave names unresolved.
     * The returned list always ends with an EOF token positioned at the end of the text.
     */
    public static List<Token> tokenize(String formula, NamedRangeLookup names) {
        List<Token> tokens = new ArrayList<>();
        int length = formula.length();
        int i = 0;

        while (i < length) {
            char ch = formula.charAt(i);

            if (Character.isWhitespace(ch)) {
                i++;
                continue;
            }

            if (ch == '"') {
                i = readString(formula, i, tokens);
                continue;
            }

            if (i + 1 < length) {
                String two = formula.substring(i, i + 2);
                if (two.equals("<>") || two.equals("<=") || two.equals(">=")
                        || two.equals("==") || two.equals("!=")) {
                    tokens.add(new Token(TokenType.COMPARISON, two, i, two));
                    i += 2;
                    continue;
                }
                if (two.equals("..")) {
                    tokens.add(new Token(TokenType.COLON, ":", i, two));
                    i += 2;
                    continue;
                }
            }

            switch (ch) {
                case '<':
                case '>':
                case '=':
                    tokens.add(single(TokenType.COMPARISON, ch, i));
                    i++;
                    continue;
                case '+':
                case '-':
                case '*':
                case '/':
                case '^':
                case '%':
                    tokens.add(single(TokenType.OPERATOR, ch, i));
                    i++;
                    continue;
                case '(':
                    tokens.add(single(TokenType.LPAREN, ch, i));
                    i++;
                    continue;
                case ')':
                    tokens.add(single(TokenType.RPAREN, ch, i));
                    i++;
                    continue;
                case ',':
                    tokens.add(single(TokenType.COMMA, ch, i));
                    i++;
                    continue;
                case ':':
                    tokens.add(single(TokenType.COLON, ch, i));
                    i++;
                    continue;
                case '@':
                    i++;
                    continue;
                default:
                    break;
            }

            if (Character.isDigit(ch) || (ch == '.' && i + 1 < length && Character.isDigit(formula.charAt(i + 1)))) {
                Matcher matcher = NUMBER_PATTERN.matcher(formula);
                matcher.region(i, length);
                if (matcher.lookingAt()) {
                    String number = matcher.group();
                    tokens.add(new Token(TokenType.NUMBER, number, i, number));
                    i = matcher.end();
                    continue;
                }
            }

            if (Character.isLetter(ch) || ch == '_' || ch == '$') {
                i = readIdentifier(formula, i, names, tokens);
                continue;
            }

            // Unknown character
            i++;
        }

        tokens.add(new Token(TokenType.EOF, "", length, ""));
        return tokens;
    }

    private static Token single(TokenType type, char ch, int position) {
        String text = String.valueOf(ch);
        return new Token(type, text, position, text);
    }

    /**
     * Reads a "..." literal starting at {@code start}; "" inside it is an escaped quote.
     * An unterminated literal runs to the end of the formula.
     */
    private static int readString(String formula, int start, List<Token> tokens) {
        StringBuilder value = new StringBuilder();
        int j = start + 1;
        while (j < formula.length()) {
            char c = formula.charAt(j);
            if (c == '"') {
                if (j + 1 < formula.length() && formula.charAt(j + 1) == '"') {
                    value.append('"');
                    j += 2;
                    continue;
                }
                break;
            }
            value.append(c);
            j++;
        }
        int end = Math.min(j + 1, formula.length());
        tokens.add(new Token(TokenType.STRING, value.toString(), start, formula.substring(start, end)));
        return end;
    }

    private static int readIdentifier(String formula, int start, NamedRangeLookup names, List<Token> tokens) {
        int length = formula.length();
        int j = start;
        while (j < length && isIdentifierPart(formula, j)) {
            j++;
        }
        String name = formula.substring(start, j);

        int k = j;
        while (k < length && Character.isWhitespace(formula.charAt(k))) {
            k++;
        }

        if (k < length && formula.charAt(k) == '(') {
            tokens.add(new Token(TokenType.FUNCTION, name.toUpperCase(Locale.ROOT), start, name));
        } else if (names != null && names.exists(name)) {
            NamedRange named = names.resolve(name);
            TokenType type = named.isSingleCell() ? TokenType.CELL : TokenType.RANGE;
            tokens.add(new Token(type, named.getReferenceText(), start, name));
        } else {
            tokens.add(new Token(TokenType.CELL, name.toUpperCase(Locale.ROOT), start, name));
        }
        return j;
    }

    // A dot continues a name only inside dotted function names such as ERROR.TYPE
    private static boolean isIdentifierPart(String formula, int index) {
        char c = formula.charAt(index);
        if (Character.isLetterOrDigit(c) || c == '_' || c == '$') {
            return true;
        }
        return c == '.' && index + 1 < formula.length() && Character.isLetter(formula.charAt(index + 1));
    }
}
