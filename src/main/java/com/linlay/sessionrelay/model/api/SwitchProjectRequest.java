package com.linlay.sessionrelay.model.api;

import jakarta.validation.constraints.NotBlank;

public record SwitchProjectRequest(
        @NotBlank
        String project
) {
}
