package com.linlay.sessionrelay.transcript;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SessionSummary(
        String sessionId,
        String firstPrompt,
        String created,
        String modified,
        String gitBranch,
        boolean sidechain,
        String fullPath
) {
}
