package com.plang.core.ast;

public record UnaryOp(UnaryOperator operator, Expr operand, Position position) implements Expr {

    public UnaryOp {
        position = position == null ? Position.UNKNOWN : position;
    }

    public UnaryOp(UnaryOperator operator, Expr operand) {
        this(operator, operand, Position.UNKNOWN);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitUnaryOp(this);
    }
}
