package com.linlay.sessionrelay.relay;

import com.linlay.sessionrelay.transcript.LiveTimeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Registry entry for one in-flight request: the subprocess it owns, its cancellation flag and the records relayed
 * so far.
 */
public class ActiveSession {

    private static final Logger log = LoggerFactory.getLogger(ActiveSession.class);

    private final AgentProcess process;
    private final LiveTimeline timeline;
    private final Instant startedAt;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public ActiveSession(AgentProcess process, LiveTimeline timeline, Instant startedAt) {
        this.process = Objects.requireNonNull(process, "process cannot be null");
        this.timeline = Objects.requireNonNull(timeline, "timeline cannot be null");
        this.startedAt = startedAt == null ? Instant.now() : startedAt;
    }

    public AgentProcess process() {
        return process;
    }

    public LiveTimeline timeline() {
        return timeline;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Marks the session cancelled and signals the process. Returns false when it was already cancelled.
     */
    public boolean cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return false;
        }
        try {
            process.destroy();
        } catch (RuntimeException ex) {
            // the process may already be gone
            log.warn("Failed to terminate agent process pid={}", process.pid(), ex);
        }
        return true;
    }
}
