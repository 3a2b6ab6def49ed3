package com.plang.core.runtime;

import com.plang.core.grammar.ActionKind;
import com.plang.core.grammar.GovernanceCategory;
import com.plang.core.ir.IRAction;
import com.plang.core.ir.IRBlock;
import com.plang.core.ir.IRCondition;
import com.plang.core.ir.IRFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Optional;

/**
 * Evaluates one IR function against a context.
 *
 * <p>Blocks run in order; every block whose condition is truthy emits an intent. The
 * function's action is the most restrictive action among fired blocks. Exceptions
 * are turned into a failed {@link PolicyResult}; only cancellation propagates.
 */
@Component
public class PolicyEvaluator {

    private static final Logger log = LoggerFactory.getLogger(PolicyEvaluator.class);

    private final FactResolver resolver;

    public PolicyEvaluator(FactResolver resolver) {
        this.resolver = resolver;
    }

    /**
     * @param budget steps this evaluation may consume
     * @throws EvaluationCancelledException if the run is cancelled mid-evaluation
     */
    public PolicyResult evaluate(IRFunction function, EvaluationContext context, long budget) {
        GovernanceCategory category = function.governance().category();
        var meter = new StepMeter(budget, context.token());
        var evaluator = new ExpressionEvaluator(context, resolver, meter);
        var intents = new ArrayList<Intent>();
        ActionKind action = null;
        long start = System.currentTimeMillis();

        try {
            for (IRBlock block : function.blocks()) {
                Optional<IRCondition> condition = block.condition();
                Optional<IRAction> terminator = block.terminator();
                if (condition.isEmpty() || terminator.isEmpty()) {
                    log.debug("Skipping incomplete block {}", block.label());
                    continue;
                }
                if (evaluator.test(condition.get().expression())) {
                    IRAction fired = terminator.get();
                    intents.add(new Intent(function.name(), block.label(), fired.kind(),
                            fired.target(), fired.reason(), category));
                    action = ActionKind.mostRestrictive(action, fired.kind());
                    log.debug("Block {} fired {}", block.label(), fired.kind());
                }
            }
            return new PolicyResult(function.name(), category, true, action, intents, meter.used(),
                    null, false, context.resolvedFacts(), System.currentTimeMillis() - start);
        } catch (StepBudgetExceededException e) {
            log.warn("Policy {} exhausted its step budget ({} steps)", function.name(), e.getBudget());
            return new PolicyResult(function.name(), category, false, action, intents, meter.used(),
                    e.getMessage(), true, context.resolvedFacts(), System.currentTimeMillis() - start);
        } catch (EvaluationCancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Policy {} failed: {}", function.name(), e.getMessage());
            return new PolicyResult(function.name(), category, false, null, intents, meter.used(),
                    e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(), false,
                    context.resolvedFacts(), System.currentTimeMillis() - start);
        }
    }
}
