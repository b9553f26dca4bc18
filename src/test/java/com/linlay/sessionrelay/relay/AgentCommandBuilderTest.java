package com.linlay.sessionrelay.relay;

import com.linlay.sessionrelay.config.AgentCliProperties;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AgentCommandBuilderTest {

    @Test
    void buildShouldPassPromptAsLastArgumentForNewSession() {
        AgentCommandBuilder builder = new AgentCommandBuilder(new AgentCliProperties());

        List<String> command = builder.build(AgentLaunchSpec.message(null, "hello", null, Path.of("/tmp")));

        assertThat(command.get(0)).isEqualTo("claude");
        assertThat(command).containsSequence("-p", "--output-format", "stream-json", "--verbose");
        assertThat(command).containsSequence("--permission-mode", "bypassPermissions");
        assertThat(command).contains("--dangerously-skip-permissions", "--include-partial-messages", "--append-system-prompt");
        assertThat(command).doesNotContain("--resume", "--input-format");
        assertThat(command.get(command.size() - 1)).isEqualTo("hello");
    }

    @Test
    void buildShouldResumeAndSwitchToStdinWhenImagesArePresent() {
        AgentCommandBuilder builder = new AgentCommandBuilder(new AgentCliProperties());

        List<String> command = builder.build(AgentLaunchSpec.message(
                "s1",
                "what is this",
                List.of("data:image/png;base64,AAAA"),
                Path.of("/tmp")
        ));

        assertThat(command).containsSequence("--resume", "s1");
        assertThat(command).endsWith("--input-format", "stream-json");
        assertThat(command).doesNotContain("what is this");
    }

    @Test
    void buildShouldKeepSlashCommandsLean() {
        AgentCliProperties properties = new AgentCliProperties();
        properties.setCommand(List.of("nix", "develop", "--command", "claude"));
        AgentCommandBuilder builder = new AgentCommandBuilder(properties);

        List<String> command = builder.build(AgentLaunchSpec.slashCommand("s1", "/compact", Path.of("/tmp")));

        assertThat(command).startsWith("nix", "develop", "--command", "claude");
        assertThat(command).doesNotContain("--include-partial-messages", "--append-system-prompt");
        assertThat(command).endsWith("--resume", "s1", "/compact");
    }

    @Test
    void buildShouldRejectEmptyCommand() {
        AgentCliProperties properties = new AgentCliProperties();
        properties.setCommand(List.of(" "));
        AgentCommandBuilder builder = new AgentCommandBuilder(properties);

        assertThatThrownBy(() -> builder.build(AgentLaunchSpec.message(null, "hi", null, Path.of("/tmp"))))
                .isInstanceOf(IllegalStateException.class);
    }
}
