package com.plang.core.ir;

public enum FunctionKind {
    POLICY,
    RULE
}
