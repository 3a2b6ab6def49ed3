package com.plang.core.grammar;

public enum TokenType {
    // keywords
    IMPORT, POLICY, RULE, PRIORITY, USE, WHEN, THEN, TO,
    AND, OR, NOT, IN, TRUE, FALSE, NULL,
    // literals and names
    IDENT, STRING, INT, FLOAT,
    // punctuation
    LBRACE, RBRACE, LPAREN, RPAREN, LBRACKET, RBRACKET, COMMA, COLON, DOT,
    // operators
    EQ, NEQ, LT, LTE, GT, GTE, PLUS, MINUS, STAR, SLASH, PERCENT,
    EOF
}
