package com.plang.core.grammar;

import java.util.Locale;
import java.util.Optional;

/**
 * Actions a condition block can emit, ranked by severity.
 * <p>
 * DENY(100) &gt; ESCALATE(80) &gt; ROUTE(50) &gt; ALLOW(10). The ranking is what the
 * executor reduces over when several policies fire in the same stage.
 */
public enum ActionKind {
    ALLOW(10),
    ROUTE(50),
    ESCALATE(80),
    DENY(100);

    private final int severity;

    ActionKind(int severity) {
        this.severity = severity;
    }

    public int severity() {
        return severity;
    }

    public boolean isTerminal() {
        return this == DENY;
    }

    /**
     * Returns the more restrictive of two actions. Either argument may be null,
     * meaning "nothing fired".
     */
    public static ActionKind mostRestrictive(ActionKind a, ActionKind b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.severity >= b.severity ? a : b;
    }

    public static Optional<ActionKind> fromKeyword(String keyword) {
        if (keyword == null || keyword.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(keyword.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
