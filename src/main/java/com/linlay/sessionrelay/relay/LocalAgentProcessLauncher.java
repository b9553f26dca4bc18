package com.linlay.sessionrelay.relay;

import com.linlay.sessionrelay.config.AgentCliProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;

@Component
public class LocalAgentProcessLauncher implements AgentProcessLauncher {

    private static final Logger log = LoggerFactory.getLogger(LocalAgentProcessLauncher.class);

    private final AgentCommandBuilder commandBuilder;
    private final MessageContentBuilder messageContentBuilder;
    private final AgentCliProperties properties;

    public LocalAgentProcessLauncher(
            AgentCommandBuilder commandBuilder,
            MessageContentBuilder messageContentBuilder,
            AgentCliProperties properties
    ) {
        this.commandBuilder = commandBuilder;
        this.messageContentBuilder = messageContentBuilder;
        this.properties = properties;
    }

    @Override
    public AgentProcess launch(AgentLaunchSpec spec) {
        if (!Files.isDirectory(spec.workingDirectory())) {
            throw new SubprocessSpawnException(
                    "Working directory does not exist: " + spec.workingDirectory(),
                    null
            );
        }
        List<String> command = commandBuilder.build(spec);
        Process process;
        try {
            process = new ProcessBuilder(command)
                    .directory(spec.workingDirectory().toFile())
                    .start();
        } catch (IOException ex) {
            throw new SubprocessSpawnException("Failed to start agent process: " + ex.getMessage(), ex);
        }
        LocalAgentProcess agentProcess = new LocalAgentProcess(process, properties.getStderrLimitChars());
        log.info(
                "Agent process started pid={}, resume={}, images={}, cwd={}",
                agentProcess.pid(),
                spec.resumes() ? spec.resumeSessionId() : "new",
                spec.images().size(),
                spec.workingDirectory()
        );

        try (OutputStream stdin = process.getOutputStream()) {
            if (spec.hasImages()) {
                stdin.write(messageContentBuilder.stdinRecord(spec).getBytes(StandardCharsets.UTF_8));
                stdin.flush();
            }
        } catch (IOException ex) {
            agentProcess.destroy();
            throw new SubprocessSpawnException("Failed to write agent input: " + ex.getMessage(), ex);
        }
        return agentProcess;
    }
}
