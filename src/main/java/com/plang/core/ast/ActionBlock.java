package com.plang.core.ast;

import com.plang.core.grammar.ActionKind;

/**
 * The {@code then} part of a condition block: an action kind, a route target for
 * ROUTE actions and an optional human-readable reason.
 */
public record ActionBlock(ActionKind kind, RouteTarget routeTarget, String reason,
                          Position position) implements Node {

    public ActionBlock {
        position = position == null ? Position.UNKNOWN : position;
    }

    public ActionBlock(ActionKind kind) {
        this(kind, null, null, Position.UNKNOWN);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitActionBlock(this);
    }
}
