package com.linlay.sessionrelay.relay;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.sessionrelay.config.AgentCliProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LocalAgentProcessLauncherTest {

    @TempDir
    Path tempDir;

    @Test
    void launchShouldFailForMissingWorkingDirectory() {
        AgentCliProperties properties = new AgentCliProperties();
        LocalAgentProcessLauncher launcher = new LocalAgentProcessLauncher(
                new AgentCommandBuilder(properties),
                new MessageContentBuilder(new ObjectMapper()),
                properties
        );

        assertThatThrownBy(() -> launcher.launch(AgentLaunchSpec.message(null, "hi", null, tempDir.resolve("gone"))))
                .isInstanceOf(SubprocessSpawnException.class)
                .hasMessageContaining("does not exist");
    }

    @Test
    void launchShouldFailForUnknownExecutable() {
        AgentCliProperties properties = new AgentCliProperties();
        properties.setCommand(List.of(tempDir.resolve("no-such-agent-binary").toString()));
        LocalAgentProcessLauncher launcher = new LocalAgentProcessLauncher(
                new AgentCommandBuilder(properties),
                new MessageContentBuilder(new ObjectMapper()),
                properties
        );

        assertThatThrownBy(() -> launcher.launch(AgentLaunchSpec.message(null, "hi", null, tempDir)))
                .isInstanceOf(SubprocessSpawnException.class)
                .hasMessageContaining("Failed to start agent process");
    }
}
