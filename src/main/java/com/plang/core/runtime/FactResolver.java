package com.plang.core.runtime;

import java.util.Optional;

/**
 * Source of facts not present in the evaluation context, such as tenant settings or
 * usage counters held by an external service. Lookups may block; each concurrent
 * policy evaluation calls its resolver on its own worker thread.
 */
@FunctionalInterface
public interface FactResolver {

    /** Resolver that knows no facts. */
    FactResolver NONE = (key, context) -> Optional.empty();

    /**
     * @param key     identifier or dotted path, e.g. {@code "usage.tokens"}
     * @param context the context of the evaluation asking
     * @return the fact's value, or empty if unknown
     */
    Optional<Object> resolve(String key, EvaluationContext context);
}
