package com.plang.core.ast;

/**
 * AST node of the PLang grammar. Closed hierarchy of immutable records; each node
 * dispatches to exactly one {@link AstVisitor} handler.
 */
public sealed interface Node
        permits Program, PolicyDecl, RuleDecl, Import, RuleRef, Priority,
                ConditionBlock, ActionBlock, RouteTarget, Expr {

    <R> R accept(AstVisitor<R> visitor);

    Position position();
}
