package com.plang.core.ast;

import java.util.List;

/**
 * Call of one of the fixed built-in functions. There are no user-defined functions.
 */
public record FuncCall(String function, List<Expr> arguments, Position position) implements Expr {

    public FuncCall {
        arguments = arguments == null ? List.of() : List.copyOf(arguments);
        position = position == null ? Position.UNKNOWN : position;
    }

    public FuncCall(String function, List<Expr> arguments) {
        this(function, arguments, Position.UNKNOWN);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitFuncCall(this);
    }
}
