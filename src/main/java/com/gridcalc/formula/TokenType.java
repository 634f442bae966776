package com.gridcalc.formula;

/**
 * Lexical categories produced by the {@link Tokenizer}.
 */
public enum TokenType {
    NUMBER,
    STRING,
    CELL,
    RANGE,
    FUNCTION,
    OPERATOR,
    COMPARISON,
    LPAREN,
    RPAREN,
    COMMA,
    COLON,
    EOF
}
