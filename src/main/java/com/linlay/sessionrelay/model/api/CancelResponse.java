package com.linlay.sessionrelay.model.api;

public record CancelResponse(
        String sessionId,
        boolean cancelled
) {
}
