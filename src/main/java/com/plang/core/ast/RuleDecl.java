package com.plang.core.ast;

import com.plang.core.grammar.GovernanceCategory;

import java.util.List;

/**
 * {@code rule Name : CATEGORY { ... }}, either nested in a policy (parentPolicy set)
 * or declared at top level (parentPolicy null).
 */
public record RuleDecl(String name, GovernanceCategory category, String parentPolicy,
                       List<Node> body, Position position) implements Node {

    public RuleDecl {
        body = body == null ? List.of() : List.copyOf(body);
        position = position == null ? Position.UNKNOWN : position;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitRuleDecl(this);
    }
}
