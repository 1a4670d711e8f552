package com.provenant.core.events;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EventBusTest {

    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
    }

    private static ProvenantEvent audited(long sequence, String type, String jobId) {
        return new ProvenantEvent(type, "build-job", jobId, jobId, sequence, "h" + sequence,
                Map.of("job_id", jobId), Instant.now());
    }

    @Test
    @DisplayName("job listeners only see their own job's events")
    void jobScoped() {
        List<ProvenantEvent> received = new ArrayList<>();
        eventBus.subscribe("job-1", received::add);

        eventBus.publish(audited(0, "job.submitted", "job-1"));
        eventBus.publish(audited(1, "job.submitted", "job-2"));

        assertEquals(1, received.size());
        assertEquals(0L, received.get(0).sequence());
    }

    @Test
    @DisplayName("subscribeAll also sees events that belong to no job")
    void everyJobListener() {
        List<ProvenantEvent> received = new ArrayList<>();
        eventBus.subscribeAll(received::add);

        eventBus.publish(audited(0, "job.submitted", "job-1"));
        eventBus.publish(new ProvenantEvent("key.created", "key", "key-1", null, 1L, "h1", Map.of(), Instant.now()));

        assertEquals(2, received.size());
    }

    @Test
    @DisplayName("unsubscribing the last listener of a job forgets the job")
    void unsubscribe() {
        List<ProvenantEvent> received = new ArrayList<>();
        EventBus.Subscription subscription = eventBus.subscribe("job-1", received::add);
        assertEquals(1, eventBus.listenerCount("job-1"));

        subscription.unsubscribe();
        eventBus.publish(audited(0, "job.submitted", "job-1"));

        assertTrue(received.isEmpty());
        assertEquals(0, eventBus.listenerCount("job-1"));
    }

    @Test
    @DisplayName("a failing listener does not stop delivery to others")
    void failingListenerIsolated() {
        List<ProvenantEvent> received = new ArrayList<>();
        eventBus.subscribe("job-1", e -> { throw new IllegalStateException("boom"); });
        eventBus.subscribe("job-1", received::add);

        eventBus.publish(audited(0, "job.submitted", "job-1"));

        assertEquals(1, received.size());
    }

    @Test
    @DisplayName("progress events carry no sequence")
    void progressEvents() {
        ProvenantEvent started = ProvenantEvent.progress("builder.started", "build-job", "job-1", "job-1",
                Map.of("builder_id", "builder-a"), Instant.now());

        assertFalse(started.isAudited());
        assertNull(started.hash());
        assertTrue(audited(3, "job.submitted", "job-1").isAudited());
    }
}
