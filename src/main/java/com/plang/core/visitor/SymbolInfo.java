package com.plang.core.visitor;

import com.plang.core.grammar.GovernanceCategory;

import java.util.List;

/**
 * Symbol-table entry for a policy or rule declaration.
 */
public record SymbolInfo(
    String name,
    SymbolType type,
    GovernanceCategory category,
    int priority,
    String parentPolicy,
    List<String> childRules,
    List<ConditionSummary> conditions
) {
    public SymbolInfo {
        childRules = List.copyOf(childRules);
        conditions = List.copyOf(conditions);
    }
}
