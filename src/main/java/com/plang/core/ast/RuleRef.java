package com.plang.core.ast;

/**
 * {@code use RuleName} inside a policy body: attaches a top-level rule to the policy.
 */
public record RuleRef(String ruleName, Position position) implements Node {

    public RuleRef {
        position = position == null ? Position.UNKNOWN : position;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitRuleRef(this);
    }
}
