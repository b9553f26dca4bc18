package com.linlay.sessionrelay.transcript;

import java.util.List;

public record TranscriptTimeline(
        List<TimelineMessage> messages,
        boolean compacted,
        String firstPrompt
) {

    public TranscriptTimeline {
        messages = messages == null ? List.of() : List.copyOf(messages);
    }

    public static TranscriptTimeline empty() {
        return new TranscriptTimeline(List.of(), false, null);
    }

    public boolean isEmpty() {
        return messages.isEmpty();
    }
}
