package com.plang.core.runtime;

/**
 * Raised from inside an evaluation when its run was cancelled or its thread interrupted.
 */
public class EvaluationCancelledException extends RuntimeException {

    public EvaluationCancelledException(String message) {
        super(message);
    }
}
