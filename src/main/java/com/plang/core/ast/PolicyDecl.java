package com.plang.core.ast;

import com.plang.core.grammar.GovernanceCategory;

import java.util.List;

/**
 * {@code policy Name : CATEGORY { ... }}. The category is null when the source omits it.
 */
public record PolicyDecl(String name, GovernanceCategory category, List<Node> body,
                         Position position) implements Node {

    public PolicyDecl {
        body = body == null ? List.of() : List.copyOf(body);
        position = position == null ? Position.UNKNOWN : position;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitPolicyDecl(this);
    }
}
