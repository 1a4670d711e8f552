package com.provenant.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Hands audit entries, and the few progress events that are not audited, to the
 * listeners following a build job.
 * <p>
 * Listeners run on the publishing thread. A listener that throws is logged and skipped;
 * it never fails the audit append that published the event.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final Map<String, Set<Consumer<ProvenantEvent>>> listenersByJob = new ConcurrentHashMap<>();
    private final Set<Consumer<ProvenantEvent>> everyJob = ConcurrentHashMap.newKeySet();

    public void publish(ProvenantEvent event) {
        log.debug("Event {} #{} for {} {}", event.eventType(), event.sequence(), event.entityType(), event.entityId());
        if (event.jobId() != null) {
            Set<Consumer<ProvenantEvent>> listeners = listenersByJob.get(event.jobId());
            if (listeners != null) {
                listeners.forEach(listener -> deliver(listener, event));
            }
        }
        everyJob.forEach(listener -> deliver(listener, event));
    }

    /** Follows one build job. Events without a job id are not delivered here. */
    public Subscription subscribe(String jobId, Consumer<ProvenantEvent> listener) {
        listenersByJob.compute(jobId, (id, listeners) -> {
            Set<Consumer<ProvenantEvent>> set = listeners != null ? listeners : ConcurrentHashMap.newKeySet();
            set.add(listener);
            return set;
        });
        return () -> listenersByJob.computeIfPresent(jobId, (id, listeners) -> {
            listeners.remove(listener);
            return listeners.isEmpty() ? null : listeners;
        });
    }

    /** Follows every event, including key and suspension events. */
    public Subscription subscribeAll(Consumer<ProvenantEvent> listener) {
        everyJob.add(listener);
        return () -> everyJob.remove(listener);
    }

    public int listenerCount(String jobId) {
        Set<Consumer<ProvenantEvent>> listeners = listenersByJob.get(jobId);
        return listeners != null ? listeners.size() : 0;
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliver(Consumer<ProvenantEvent> listener, ProvenantEvent event) {
        try {
            listener.accept(event);
        } catch (RuntimeException e) {
            log.warn("Listener failed on {} #{}: {}", event.eventType(), event.sequence(), e.getMessage(), e);
        }
    }
}
