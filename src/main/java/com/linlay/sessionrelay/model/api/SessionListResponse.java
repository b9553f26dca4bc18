package com.linlay.sessionrelay.model.api;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

public record SessionListResponse(
        List<SessionItem> sessions,
        String cwd,
        String latestSessionId
) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record SessionItem(
            String sessionId,
            String firstPrompt,
            String created,
            String modified,
            String gitBranch
    ) {
    }
}
