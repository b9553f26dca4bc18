package com.linlay.sessionrelay.model.api;

import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * {@code images} are base64 data URLs, sent to the agent ahead of the text.
 */
public record SendMessageRequest(
        @NotNull
        String message,
        List<String> images
) {
}
