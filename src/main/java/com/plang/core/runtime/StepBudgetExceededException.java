package com.plang.core.runtime;

/**
 * Raised by {@link StepMeter} when an evaluation uses more steps than its budget allows.
 */
public class StepBudgetExceededException extends RuntimeException {

    private final long budget;

    public StepBudgetExceededException(long budget) {
        super("Step budget of " + budget + " exhausted");
        this.budget = budget;
    }

    public long getBudget() {
        return budget;
    }
}
