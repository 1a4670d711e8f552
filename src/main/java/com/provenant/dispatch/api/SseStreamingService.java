package com.provenant.dispatch.api;

import com.provenant.core.audit.AuditLog;
import com.provenant.core.events.EventBus;
import com.provenant.core.events.ProvenantEvent;
import com.provenant.core.model.AuditEntry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Streams a build job's audit trail over SSE.
 * <p>
 * A new stream first replays the entries already recorded for the job, or only those
 * after the client's {@code Last-Event-ID}, and then follows new entries as they are
 * appended. The SSE event id is the entry's audit sequence, so a reconnecting client
 * resumes without gaps or repeats. Progress events that are not audited are sent live
 * without an id.
 */
@Service
public class SseStreamingService {

    private static final Logger log = LoggerFactory.getLogger(SseStreamingService.class);

    /** 2 hours, the default job deadline. */
    private static final long DEFAULT_TIMEOUT_MS = 2 * 60 * 60 * 1000L;

    private static final long KEEPALIVE_SECONDS = 30;

    private final EventBus eventBus;
    private final AuditLog auditLog;
    private final long timeoutMs;
    private final Set<JobStream> streams = ConcurrentHashMap.newKeySet();

    private final ScheduledExecutorService keepalive = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "sse-keepalive");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public SseStreamingService(EventBus eventBus, AuditLog auditLog) {
        this(eventBus, auditLog, DEFAULT_TIMEOUT_MS);
    }

    SseStreamingService(EventBus eventBus, AuditLog auditLog, long timeoutMs) {
        this.eventBus = eventBus;
        this.auditLog = auditLog;
        this.timeoutMs = timeoutMs;
    }

    @PostConstruct
    void startKeepalive() {
        keepalive.scheduleAtFixedRate(this::sendKeepalives, KEEPALIVE_SECONDS, KEEPALIVE_SECONDS, TimeUnit.SECONDS);
    }

    @PreDestroy
    void stopKeepalive() {
        keepalive.shutdownNow();
    }

    public SseEmitter createEmitter(String jobId) {
        return createEmitter(jobId, null);
    }

    /**
     * Opens a stream for {@code jobId}.
     *
     * @param lastEventId the last audit sequence the client has seen, or null for the full trail
     */
    public SseEmitter createEmitter(String jobId, Long lastEventId) {
        SseEmitter emitter = newEmitter(timeoutMs);
        long resumeAfter = lastEventId != null ? lastEventId : -1L;
        JobStream stream = new JobStream(jobId, emitter, resumeAfter);

        // Subscribe before reading history so nothing appended in between is missed.
        stream.subscription = eventBus.subscribe(jobId, stream::live);
        streams.add(stream);
        emitter.onCompletion(() -> close(stream));
        emitter.onTimeout(() -> close(stream));
        emitter.onError(ex -> {
            log.debug("SSE stream for job {} failed: {}", jobId, ex.getMessage());
            close(stream);
        });

        List<AuditEntry> history = auditLog.entriesForJob(jobId).stream()
                .filter(entry -> entry.sequence() > resumeAfter)
                .toList();
        stream.replay(history);
        log.info("SSE stream opened for job {}: replayed {} audit entries after #{}",
                jobId, history.size(), resumeAfter);
        return emitter;
    }

    public int activeStreamCount() {
        return streams.size();
    }

    SseEmitter newEmitter(long timeout) {
        return new SseEmitter(timeout);
    }

    private void sendKeepalives() {
        for (JobStream stream : streams) {
            try {
                stream.emitter.send(SseEmitter.event().comment("keepalive"));
            } catch (IOException | IllegalStateException e) {
                log.debug("Keepalive failed for job {}: {}", stream.jobId, e.getMessage());
            }
        }
    }

    private void close(JobStream stream) {
        stream.subscription.unsubscribe();
        streams.remove(stream);
    }

    static Map<String, Object> data(ProvenantEvent event) {
        Map<String, Object> data = new LinkedHashMap<>();
        if (event.isAudited()) {
            data.put("sequence", event.sequence());
            data.put("hash", event.hash());
        }
        data.put("event_type", event.eventType());
        data.put("entity_type", event.entityType());
        data.put("entity_id", event.entityId());
        data.put("job_id", event.jobId());
        data.put("recorded_at", event.timestamp().toString());
        data.put("payload", event.payload());
        return data;
    }

    private static final class JobStream {

        private final String jobId;
        private final SseEmitter emitter;
        private final long resumeAfter;
        private final Set<Long> sent = new HashSet<>();
        /** Live events that arrive before the replay has run; null once it has. */
        private List<ProvenantEvent> held = new ArrayList<>();
        private EventBus.Subscription subscription;

        JobStream(String jobId, SseEmitter emitter, long resumeAfter) {
            this.jobId = jobId;
            this.emitter = emitter;
            this.resumeAfter = resumeAfter;
        }

        synchronized void live(ProvenantEvent event) {
            if (held != null) {
                held.add(event);
                return;
            }
            send(event);
        }

        synchronized void replay(List<AuditEntry> history) {
            for (AuditEntry entry : history) {
                send(ProvenantEvent.audited(entry, jobId));
            }
            List<ProvenantEvent> arrived = held;
            held = null;
            arrived.forEach(this::send);
        }

        private void send(ProvenantEvent event) {
            if (event.isAudited() && (event.sequence() <= resumeAfter || !sent.add(event.sequence()))) {
                return;
            }
            SseEmitter.SseEventBuilder builder = SseEmitter.event();
            if (event.isAudited()) {
                builder.id(Long.toString(event.sequence()));
            }
            builder.name(event.eventType()).data(data(event));
            try {
                emitter.send(builder);
            } catch (IOException | IllegalStateException e) {
                log.debug("Failed to stream {} for job {}: {}", event.eventType(), jobId, e.getMessage());
            }
        }
    }
}
