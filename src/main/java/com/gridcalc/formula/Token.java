package com.gridcalc.formula;

/**
 * One lexical unit of a formula.
 * {@code value} is the normalized text (upper-cased names, unescaped strings,
 * resolved named ranges); {@code rawText} is exactly what the formula contained
 * between {@code position} and {@link #getEnd()}.
 */
public class Token {
    private final TokenType type;
    private final String value;
    private final int position;
    private final String rawText;

    public Token(TokenType type, String value, int position, String rawText) {
        this.type = type;
        this.value = value;
        this.position = position;
        this.rawText = rawText;
    }

    public TokenType getType() {
        return type;
    }
    public String getValue() {
        return value;
    }
    public int getPosition() {
        return position;
    }
    public String getRawText() {
        return rawText;
    }

    /**
     * Offset just past this token in the source formula.
     */
    public int getEnd() {
        return position + rawText.length();
    }

    public boolean is(TokenType expected) {
        return type == expected;
    }

    @Override
    public String toString() {
        return type + "(" + value + ")@" + position;
    }
}
