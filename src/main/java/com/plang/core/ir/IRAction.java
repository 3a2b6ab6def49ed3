package com.plang.core.ir;

import com.plang.core.grammar.ActionKind;

/**
 * Block terminator: emit {@code kind}. ROUTE actions carry the target function name,
 * which may not exist in the module (the router then simply gets no dependency edge).
 */
public record IRAction(ActionKind kind, String target, String reason) implements IRInstruction {

    public IRAction(ActionKind kind) {
        this(kind, null, null);
    }

    public boolean isRoute() {
        return kind == ActionKind.ROUTE && target != null;
    }
}
