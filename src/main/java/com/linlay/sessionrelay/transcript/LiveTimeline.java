package com.linlay.sessionrelay.transcript;

import com.linlay.sessionrelay.stream.model.LogEntry;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Records relayed while a request is in flight, viewed through the same correlator as a closed transcript.
 * Tool calls without a result yet are reported as running.
 */
public class LiveTimeline {

    private final TranscriptCorrelator correlator;
    private final List<LogEntry> entries = new ArrayList<>();

    public LiveTimeline(TranscriptCorrelator correlator) {
        this.correlator = Objects.requireNonNull(correlator, "correlator cannot be null");
    }

    public void append(LogEntry entry) {
        if (entry == null) {
            return;
        }
        synchronized (entries) {
            entries.add(entry);
        }
    }

    public int size() {
        synchronized (entries) {
            return entries.size();
        }
    }

    public TranscriptTimeline snapshot() {
        List<LogEntry> copy;
        synchronized (entries) {
            copy = List.copyOf(entries);
        }
        return correlator.reconstruct(copy, ToolStatus.RUNNING);
    }
}
