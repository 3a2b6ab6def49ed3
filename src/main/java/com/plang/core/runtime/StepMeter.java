package com.plang.core.runtime;

/**
 * Counts evaluation steps against a budget. Every tick also checks for cancellation,
 * so long evaluations stop promptly once the run is cancelled.
 */
public final class StepMeter {

    private final long budget;
    private final CancellationToken token;
    private long used;

    public StepMeter(long budget, CancellationToken token) {
        this.budget = Math.max(0, budget);
        this.token = token;
    }

    /**
     * @throws EvaluationCancelledException if the run was cancelled or the thread interrupted
     * @throws StepBudgetExceededException  if this tick goes over budget
     */
    public void tick() {
        if ((token != null && token.isCancelled()) || Thread.currentThread().isInterrupted()) {
            throw new EvaluationCancelledException("Evaluation cancelled after " + used + " steps");
        }
        if (used >= budget) {
            throw new StepBudgetExceededException(budget);
        }
        used++;
    }

    public long used() {
        return used;
    }

    public long budget() {
        return budget;
    }
}
