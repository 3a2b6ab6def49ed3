package com.plang.core.grammar;

import java.util.Locale;
import java.util.Optional;

/**
 * Governance category of a policy or rule. The declaration order is the
 * execution phase order: every SAFETY policy is scheduled before any PRIVACY
 * policy, and so on down to CUSTOM.
 */
public enum GovernanceCategory {
    SAFETY,
    PRIVACY,
    OPERATIONAL,
    ROUTING,
    CUSTOM;

    /** Category applied when a declaration names none. */
    public static final GovernanceCategory DEFAULT = CUSTOM;

    /**
     * Execution phase index; lower runs first.
     */
    public int phase() {
        return ordinal();
    }

    public boolean precedes(GovernanceCategory other) {
        return phase() < other.phase();
    }

    public static Optional<GovernanceCategory> fromKeyword(String keyword) {
        if (keyword == null || keyword.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(keyword.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    public static GovernanceCategory orDefault(GovernanceCategory category) {
        return category != null ? category : DEFAULT;
    }
}
