package com.plang.core.ast;

/**
 * One handler per node type. {@link BaseVisitor} supplies a recursive default so
 * specialised visitors only override the nodes they care about.
 *
 * @param <R> result type of each visit
 */
public interface AstVisitor<R> {

    R visitProgram(Program node);

    R visitPolicyDecl(PolicyDecl node);

    R visitRuleDecl(RuleDecl node);

    R visitImport(Import node);

    R visitRuleRef(RuleRef node);

    R visitPriority(Priority node);

    R visitConditionBlock(ConditionBlock node);

    R visitActionBlock(ActionBlock node);

    R visitRouteTarget(RouteTarget node);

    R visitBinaryOp(BinaryOp node);

    R visitUnaryOp(UnaryOp node);

    R visitIdent(Ident node);

    R visitLiteral(Literal node);

    R visitFuncCall(FuncCall node);

    R visitAttrAccess(AttrAccess node);
}
