package com.linlay.sessionrelay.relay;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * One agent invocation. {@code resumeSessionId} is null for a fresh session; {@code command} marks a slash-command
 * run, which skips partial messages and the appended system prompt.
 */
public record AgentLaunchSpec(
        String resumeSessionId,
        String prompt,
        List<String> images,
        Path workingDirectory,
        boolean command
) {

    public AgentLaunchSpec {
        Objects.requireNonNull(workingDirectory, "workingDirectory cannot be null");
        prompt = prompt == null ? "" : prompt;
        images = images == null ? List.of() : List.copyOf(images);
    }

    public static AgentLaunchSpec message(String resumeSessionId, String prompt, List<String> images, Path workingDirectory) {
        return new AgentLaunchSpec(resumeSessionId, prompt, images, workingDirectory, false);
    }

    public static AgentLaunchSpec slashCommand(String sessionId, String command, Path workingDirectory) {
        return new AgentLaunchSpec(sessionId, command, List.of(), workingDirectory, true);
    }

    public boolean hasImages() {
        return !images.isEmpty();
    }

    public boolean resumes() {
        return resumeSessionId != null && !resumeSessionId.isBlank();
    }
}
