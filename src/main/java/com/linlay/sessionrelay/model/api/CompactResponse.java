package com.linlay.sessionrelay.model.api;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CompactResponse(
        String sessionId,
        boolean success,
        String error
) {
}
