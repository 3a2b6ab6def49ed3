package com.plang.core.ast;

/**
 * Expression nodes used inside {@code when} conditions.
 */
public sealed interface Expr extends Node
        permits BinaryOp, UnaryOp, Ident, Literal, FuncCall, AttrAccess {
}
