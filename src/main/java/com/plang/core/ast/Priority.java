package com.plang.core.ast;

public record Priority(int value, Position position) implements Node {

    public Priority {
        position = position == null ? Position.UNKNOWN : position;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitPriority(this);
    }
}
