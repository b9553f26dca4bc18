package com.linlay.sessionrelay.model.api;

import com.linlay.sessionrelay.transcript.TimelineMessage;

import java.util.List;

public record SessionHistoryResponse(
        List<TimelineMessage> messages,
        String cwd,
        String sessionId,
        boolean compacted,
        String firstPrompt
) {
}
