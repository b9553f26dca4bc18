package com.linlay.sessionrelay.model.api;

public record SwitchProjectResponse(
        String cwd
) {
}
