package com.plang.core.ir;

/**
 * Instruction of an IR basic block. The set is closed: a block evaluates a condition
 * and terminates with an action.
 */
public sealed interface IRInstruction permits IRCondition, IRAction {
}
