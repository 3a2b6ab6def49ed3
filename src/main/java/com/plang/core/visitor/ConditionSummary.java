package com.plang.core.visitor;

import com.plang.core.ast.Expr;
import com.plang.core.grammar.ActionKind;

/**
 * One {@code when ... then ...} pair of a declaration, as recorded in the symbol table.
 * Condition or action may be null when the source tree was incomplete.
 *
 * @param label         stable block label, {@code <declaration>#<index>}
 * @param condition     condition expression
 * @param conditionText canonical source rendering of the condition
 * @param action        emitted action kind
 * @param routeTarget   target name for ROUTE actions
 * @param reason        optional reason string
 */
public record ConditionSummary(String label, Expr condition, String conditionText,
                               ActionKind action, String routeTarget, String reason) {

    public boolean isComplete() {
        return condition != null && action != null;
    }
}
