package com.plang.core.visitor;

import com.plang.core.ast.BaseVisitor;
import com.plang.core.ast.Node;
import com.plang.core.ast.PolicyDecl;
import com.plang.core.ast.RuleDecl;
import com.plang.core.grammar.GovernanceCategory;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Collects the effective governance category of every policy and rule. Nested rules
 * without their own category inherit the enclosing policy's; anything else undeclared
 * is {@link GovernanceCategory#DEFAULT}.
 */
public class CategoryCollector extends BaseVisitor<Void> {

    private final Map<String, GovernanceCategory> byDeclaration = new LinkedHashMap<>();
    private final Set<GovernanceCategory> categories = EnumSet.noneOf(GovernanceCategory.class);
    private final Deque<GovernanceCategory> enclosing = new ArrayDeque<>();

    public static CategoryCollector collect(Node root) {
        var collector = new CategoryCollector();
        collector.visitNullable(root);
        return collector;
    }

    @Override
    public Void visitPolicyDecl(PolicyDecl node) {
        GovernanceCategory effective = GovernanceCategory.orDefault(node.category());
        record(node.name(), effective);
        enclosing.push(effective);
        try {
            return super.visitPolicyDecl(node);
        } finally {
            enclosing.pop();
        }
    }

    @Override
    public Void visitRuleDecl(RuleDecl node) {
        GovernanceCategory effective = node.category() != null
                ? node.category()
                : GovernanceCategory.orDefault(enclosing.peek());
        record(node.name(), effective);
        return super.visitRuleDecl(node);
    }

    private void record(String name, GovernanceCategory category) {
        byDeclaration.putIfAbsent(name, category);
        categories.add(category);
    }

    public Map<String, GovernanceCategory> byDeclaration() {
        return Collections.unmodifiableMap(byDeclaration);
    }

    public Set<GovernanceCategory> categories() {
        return Collections.unmodifiableSet(categories);
    }
}
