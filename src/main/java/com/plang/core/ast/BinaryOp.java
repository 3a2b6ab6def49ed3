package com.plang.core.ast;

public record BinaryOp(BinaryOperator operator, Expr left, Expr right, Position position) implements Expr {

    public BinaryOp {
        position = position == null ? Position.UNKNOWN : position;
    }

    public BinaryOp(BinaryOperator operator, Expr left, Expr right) {
        this(operator, left, right, Position.UNKNOWN);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitBinaryOp(this);
    }
}
