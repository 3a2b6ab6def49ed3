package com.plang.core.runtime;

/**
 * Raised when an expression cannot be evaluated: type errors, division by zero,
 * unknown built-in functions or bad arity.
 */
public class EvaluationException extends RuntimeException {

    public EvaluationException(String message) {
        super(message);
    }

    public EvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
