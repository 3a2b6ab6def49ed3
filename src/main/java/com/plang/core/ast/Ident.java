package com.plang.core.ast;

public record Ident(String name, Position position) implements Expr {

    public Ident {
        position = position == null ? Position.UNKNOWN : position;
    }

    public Ident(String name) {
        this(name, Position.UNKNOWN);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitIdent(this);
    }
}
