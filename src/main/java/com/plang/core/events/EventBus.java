package com.plang.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Fans out audit events from policy runs and arbitrations to registered sinks.
 *
 * <p>A run publishes {@code run.started}, one {@code stage.completed} per stage, a
 * {@code policy.failed} for each failed member, {@code run.completed} and finally
 * {@code trace.recorded}. Sinks registered for an execution id see only that run.
 * Arbitration events carry no execution id and reach global sinks only.
 *
 * <p>A sink that throws is logged and skipped; it never aborts the run that published.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final Map<String, List<Consumer<PlangEvent>>> runSinks = new ConcurrentHashMap<>();

    private final List<Consumer<PlangEvent>> globalSinks = new CopyOnWriteArrayList<>();

    /**
     * Delivers the event to the sinks of its execution, then to global sinks.
     *
     * @return the number of sinks that accepted the event without throwing
     */
    public int publish(PlangEvent event) {
        int delivered = 0;
        if (event.executionId() != null) {
            List<Consumer<PlangEvent>> sinks = runSinks.get(event.executionId());
            if (sinks != null) {
                for (Consumer<PlangEvent> sink : sinks) {
                    delivered += deliver(sink, event);
                }
            }
        }
        for (Consumer<PlangEvent> sink : globalSinks) {
            delivered += deliver(sink, event);
        }
        log.debug("Event {} [{}] delivered to {} sink(s)", event.eventType(), event.executionId(), delivered);
        return delivered;
    }

    public Subscription subscribe(String executionId, Consumer<PlangEvent> sink) {
        runSinks.compute(executionId, (id, sinks) -> {
            List<Consumer<PlangEvent>> target = sinks != null ? sinks : new CopyOnWriteArrayList<>();
            target.add(sink);
            return target;
        });
        log.debug("Audit sink attached to execution {}", executionId);
        return () -> runSinks.computeIfPresent(executionId, (id, sinks) -> {
            sinks.remove(sink);
            return sinks.isEmpty() ? null : sinks;
        });
    }

    public Subscription subscribeAll(Consumer<PlangEvent> sink) {
        globalSinks.add(sink);
        log.debug("Global audit sink attached");
        return () -> globalSinks.remove(sink);
    }

    /** Number of sinks currently attached to one execution. */
    public int sinkCount(String executionId) {
        List<Consumer<PlangEvent>> sinks = runSinks.get(executionId);
        return sinks == null ? 0 : sinks.size();
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private static int deliver(Consumer<PlangEvent> sink, PlangEvent event) {
        try {
            sink.accept(event);
            return 1;
        } catch (RuntimeException e) {
            log.warn("Audit sink failed on {} for execution {}: {}",
                    event.eventType(), event.executionId(), e.getMessage(), e);
            return 0;
        }
    }
}
