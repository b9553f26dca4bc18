package com.linlay.sessionrelay.relay;

import com.linlay.sessionrelay.config.AgentCliProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;

@Component
public class AgentCommandBuilder {

    private final AgentCliProperties properties;

    public AgentCommandBuilder(AgentCliProperties properties) {
        this.properties = properties;
    }

    public List<String> build(AgentLaunchSpec spec) {
        List<String> command = new ArrayList<>();
        for (String part : properties.getCommand()) {
            if (StringUtils.hasText(part)) {
                command.add(part.trim());
            }
        }
        if (command.isEmpty()) {
            throw new IllegalStateException("agent.cli.command is empty");
        }

        command.add("-p");
        command.add("--output-format");
        command.add("stream-json");
        command.add("--verbose");
        if (StringUtils.hasText(properties.getPermissionMode())) {
            command.add("--permission-mode");
            command.add(properties.getPermissionMode().trim());
        }
        if (properties.isSkipPermissions()) {
            command.add("--dangerously-skip-permissions");
        }
        if (!spec.command()) {
            if (properties.isIncludePartialMessages()) {
                command.add("--include-partial-messages");
            }
            if (StringUtils.hasText(properties.getAppendSystemPrompt())) {
                command.add("--append-system-prompt");
                command.add(properties.getAppendSystemPrompt());
            }
        }
        for (String extra : properties.getExtraArgs()) {
            if (StringUtils.hasText(extra)) {
                command.add(extra.trim());
            }
        }
        if (spec.resumes()) {
            command.add("--resume");
            command.add(spec.resumeSessionId().trim());
        }

        // images only travel as structured stdin input
        if (spec.hasImages()) {
            command.add("--input-format");
            command.add("stream-json");
        } else {
            command.add(spec.prompt());
        }
        return command;
    }
}
