package com.plang.core.ir;

import com.plang.core.grammar.GovernanceCategory;

/**
 * Governance metadata carried by every IR function: the category fixes the execution
 * phase, the priority orders functions within a phase (lower value runs first).
 */
public record GovernanceDescriptor(GovernanceCategory category, int priority) {

    public static final int DEFAULT_PRIORITY = 50;

    public GovernanceDescriptor {
        category = GovernanceCategory.orDefault(category);
    }

    public static GovernanceDescriptor of(GovernanceCategory category, Integer priority) {
        return new GovernanceDescriptor(category, priority != null ? priority : DEFAULT_PRIORITY);
    }

    public static GovernanceDescriptor defaults() {
        return new GovernanceDescriptor(GovernanceCategory.DEFAULT, DEFAULT_PRIORITY);
    }
}
