package com.plang.core.ast;

/**
 * {@code when <condition> then <action>}. Either child may be null in a hand-built
 * (malformed) tree; visitors skip missing children.
 */
public record ConditionBlock(Expr condition, ActionBlock action, Position position) implements Node {

    public ConditionBlock {
        position = position == null ? Position.UNKNOWN : position;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitConditionBlock(this);
    }
}
