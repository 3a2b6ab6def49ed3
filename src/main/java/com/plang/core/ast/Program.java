package com.plang.core.ast;

import java.util.List;

/**
 * Root of a parsed PLang source: imports, policies and top-level rules in source order.
 */
public record Program(List<Node> statements, Position position) implements Node {

    public Program {
        statements = statements == null ? List.of() : List.copyOf(statements);
        position = position == null ? Position.UNKNOWN : position;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitProgram(this);
    }
}
