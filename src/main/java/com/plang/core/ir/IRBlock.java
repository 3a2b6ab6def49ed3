package com.plang.core.ir;

import java.util.List;
import java.util.Optional;

/**
 * Basic block: one condition followed by its terminating action.
 */
public record IRBlock(String label, List<IRInstruction> instructions) {

    public IRBlock {
        instructions = List.copyOf(instructions);
    }

    public static IRBlock of(String label, IRCondition condition, IRAction action) {
        return new IRBlock(label, List.of(condition, action));
    }

    public Optional<IRCondition> condition() {
        for (IRInstruction instruction : instructions) {
            if (instruction instanceof IRCondition c) {
                return Optional.of(c);
            }
        }
        return Optional.empty();
    }

    public Optional<IRAction> terminator() {
        if (!instructions.isEmpty() && instructions.get(instructions.size() - 1) instanceof IRAction a) {
            return Optional.of(a);
        }
        return Optional.empty();
    }
}
