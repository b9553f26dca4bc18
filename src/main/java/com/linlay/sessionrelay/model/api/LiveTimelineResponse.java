package com.linlay.sessionrelay.model.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.linlay.sessionrelay.transcript.TimelineMessage;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record LiveTimelineResponse(
        String sessionId,
        boolean busy,
        List<TimelineMessage> messages,
        String firstPrompt
) {
}
