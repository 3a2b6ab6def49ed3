package com.plang.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while running or arbitrating policies, consumed by audit sinks.
 *
 * @param eventType   e.g. "run.started", "stage.completed", "trace.recorded"
 * @param executionId the execution this event belongs to
 * @param policy      the policy this event relates to (nullable for run-level events)
 * @param payload     arbitrary key-value data associated with the event
 * @param timestamp   when the event occurred
 */
public record PlangEvent(
    String eventType,
    String executionId,
    String policy,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {}
