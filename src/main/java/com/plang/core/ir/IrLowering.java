package com.plang.core.ir;

import com.plang.core.visitor.ConditionSummary;
import com.plang.core.visitor.SymbolInfo;
import com.plang.core.visitor.SymbolTable;
import com.plang.core.visitor.SymbolType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;

/**
 * Lowers a {@link SymbolTable} into an {@link IRModule}: one function per declaration,
 * one basic block per complete condition/action pair.
 */
@Component
public class IrLowering {

    private static final Logger log = LoggerFactory.getLogger(IrLowering.class);

    public IRModule lower(SymbolTable symbols, String moduleName) {
        var module = new IRModule(moduleName);
        for (SymbolInfo symbol : symbols.symbols()) {
            module.addFunction(lowerSymbol(symbol, symbols));
        }
        log.debug("Lowered {} declarations into module {}", module.size(), moduleName);
        return module;
    }

    private IRFunction lowerSymbol(SymbolInfo symbol, SymbolTable symbols) {
        var blocks = new ArrayList<IRBlock>();
        for (ConditionSummary summary : symbol.conditions()) {
            if (!summary.isComplete()) {
                log.warn("Skipping incomplete condition block {} (condition={}, action={})",
                        summary.label(), summary.condition() != null, summary.action() != null);
                continue;
            }
            String target = summary.routeTarget();
            if (target != null && !symbols.contains(target)) {
                log.debug("Route target '{}' in {} is not declared in this module", target, summary.label());
            }
            blocks.add(IRBlock.of(summary.label(),
                    new IRCondition(summary.condition()),
                    new IRAction(summary.action(), target, summary.reason())));
        }
        FunctionKind kind = symbol.type() == SymbolType.POLICY ? FunctionKind.POLICY : FunctionKind.RULE;
        return new IRFunction(symbol.name(), kind, symbol.parentPolicy(),
                new GovernanceDescriptor(symbol.category(), symbol.priority()), blocks);
    }
}
