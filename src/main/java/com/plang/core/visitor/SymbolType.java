package com.plang.core.visitor;

public enum SymbolType {
    POLICY,
    RULE
}
