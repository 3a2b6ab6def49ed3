package com.plang.core.ast;

public record Import(String path, Position position) implements Node {

    public Import {
        position = position == null ? Position.UNKNOWN : position;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitImport(this);
    }
}
