package com.plang.core.ir;

import java.util.List;

/**
 * Lowered policy or rule.
 *
 * @param name         unique name within the module
 * @param kind         whether it came from a policy or a rule declaration
 * @param parentPolicy owning policy for nested rules, otherwise null
 * @param governance   category and priority
 * @param blocks       condition/action blocks in source order
 */
public record IRFunction(
    String name,
    FunctionKind kind,
    String parentPolicy,
    GovernanceDescriptor governance,
    List<IRBlock> blocks
) {
    public IRFunction {
        governance = governance != null ? governance : GovernanceDescriptor.defaults();
        blocks = blocks == null ? List.of() : List.copyOf(blocks);
    }

    /**
     * Targets of every ROUTE action in this function, in block order.
     */
    public List<String> routeTargets() {
        return blocks.stream()
                .flatMap(b -> b.terminator().stream())
                .filter(IRAction::isRoute)
                .map(IRAction::target)
                .toList();
    }
}
