package com.plang.core.ast;

import java.util.List;

/**
 * Visits every child of every node and does nothing else. Missing (null) children
 * are skipped, so malformed trees are traversed without failing.
 *
 * @param <R> result type; the default handlers return {@link #defaultResult()}
 */
public abstract class BaseVisitor<R> implements AstVisitor<R> {

    protected R defaultResult() {
        return null;
    }

    protected void visitAll(List<? extends Node> nodes) {
        if (nodes == null) {
            return;
        }
        for (Node node : nodes) {
            visitNullable(node);
        }
    }

    protected R visitNullable(Node node) {
        return node == null ? defaultResult() : node.accept(this);
    }

    @Override
    public R visitProgram(Program node) {
        visitAll(node.statements());
        return defaultResult();
    }

    @Override
    public R visitPolicyDecl(PolicyDecl node) {
        visitAll(node.body());
        return defaultResult();
    }

    @Override
    public R visitRuleDecl(RuleDecl node) {
        visitAll(node.body());
        return defaultResult();
    }

    @Override
    public R visitImport(Import node) {
        return defaultResult();
    }

    @Override
    public R visitRuleRef(RuleRef node) {
        return defaultResult();
    }

    @Override
    public R visitPriority(Priority node) {
        return defaultResult();
    }

    @Override
    public R visitConditionBlock(ConditionBlock node) {
        visitNullable(node.condition());
        visitNullable(node.action());
        return defaultResult();
    }

    @Override
    public R visitActionBlock(ActionBlock node) {
        visitNullable(node.routeTarget());
        return defaultResult();
    }

    @Override
    public R visitRouteTarget(RouteTarget node) {
        return defaultResult();
    }

    @Override
    public R visitBinaryOp(BinaryOp node) {
        visitNullable(node.left());
        visitNullable(node.right());
        return defaultResult();
    }

    @Override
    public R visitUnaryOp(UnaryOp node) {
        visitNullable(node.operand());
        return defaultResult();
    }

    @Override
    public R visitIdent(Ident node) {
        return defaultResult();
    }

    @Override
    public R visitLiteral(Literal node) {
        return defaultResult();
    }

    @Override
    public R visitFuncCall(FuncCall node) {
        visitAll(node.arguments());
        return defaultResult();
    }

    @Override
    public R visitAttrAccess(AttrAccess node) {
        visitNullable(node.target());
        return defaultResult();
    }
}
