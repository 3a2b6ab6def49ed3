package com.plang.core.engine;

import com.plang.core.ast.Program;
import com.plang.core.dag.ExecutionPlan;
import com.plang.core.ir.IRModule;
import com.plang.core.visitor.SymbolTable;

/**
 * Everything produced by compiling one PLang unit, imports merged.
 */
public record CompiledPolicySet(
    String name,
    Program program,
    SymbolTable symbols,
    IRModule module,
    ExecutionPlan plan
) {}
