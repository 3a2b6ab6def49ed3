package com.plang.core.arbitration;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * What happens when a limit is breached, ordered by severity: pause &lt; stop &lt; kill.
 */
public enum BreachAction {
    PAUSE(1),
    STOP(2),
    KILL(3);

    /** Applied when no contributing policy names an action. */
    public static final BreachAction DEFAULT = STOP;

    private final int severity;

    BreachAction(int severity) {
        this.severity = severity;
    }

    public int severity() {
        return severity;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static BreachAction fromValue(String value) {
        if (value == null) {
            return null;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    public static BreachAction mostSevere(BreachAction a, BreachAction b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.severity >= b.severity ? a : b;
    }
}
