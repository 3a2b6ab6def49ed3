package com.plang.core.ir;

import com.plang.core.ast.Expr;

/**
 * Evaluates {@code expression}; if it is not truthy the rest of the block is skipped.
 */
public record IRCondition(Expr expression) implements IRInstruction {
}
