package com.linlay.sessionrelay.model.api;

public record DeleteSessionResponse(
        String sessionId,
        boolean deleted
) {
}
