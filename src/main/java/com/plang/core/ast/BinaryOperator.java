package com.plang.core.ast;

/**
 * Binary operators, with the symbol used in source and binding precedence
 * (higher binds tighter).
 */
public enum BinaryOperator {
    OR("or", 1),
    AND("and", 2),
    EQ("==", 3),
    NEQ("!=", 3),
    LT("<", 3),
    LTE("<=", 3),
    GT(">", 3),
    GTE(">=", 3),
    IN("in", 3),
    ADD("+", 4),
    SUB("-", 4),
    MUL("*", 5),
    DIV("/", 5),
    MOD("%", 5);

    private final String symbol;
    private final int precedence;

    BinaryOperator(String symbol, int precedence) {
        this.symbol = symbol;
        this.precedence = precedence;
    }

    public String symbol() {
        return symbol;
    }

    public int precedence() {
        return precedence;
    }

    public boolean isComparison() {
        return precedence == 3;
    }

    public boolean isLogical() {
        return this == AND || this == OR;
    }
}
