package com.linlay.sessionrelay.relay;

import java.nio.file.Path;
import java.util.List;

public record RelayRequest(
        String sessionId,
        String message,
        List<String> images,
        Path workingDirectory
) {

    public RelayRequest {
        images = images == null ? List.of() : List.copyOf(images);
    }

    public boolean isNewSession() {
        return sessionId == null || sessionId.isBlank();
    }
}
