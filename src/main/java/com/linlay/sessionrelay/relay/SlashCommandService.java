package com.linlay.sessionrelay.relay;

import com.linlay.sessionrelay.config.AgentCliProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

/**
 * Runs a slash command against an existing session and waits for the agent to finish. Output records are
 * discarded; only the exit status matters.
 */
@Service
public class SlashCommandService {

    public static final String COMPACT = "/compact";

    private static final Logger log = LoggerFactory.getLogger(SlashCommandService.class);

    private final AgentProcessLauncher launcher;
    private final AgentCliProperties properties;

    public SlashCommandService(AgentProcessLauncher launcher, AgentCliProperties properties) {
        this.launcher = launcher;
        this.properties = properties;
    }

    public CommandOutcome compact(String sessionId, Path workingDirectory) {
        return run(COMPACT, sessionId, workingDirectory);
    }

    public CommandOutcome run(String command, String sessionId, Path workingDirectory) {
        log.debug("Sending {} to session={}", command, sessionId);
        AgentProcess process;
        try {
            process = launcher.launch(AgentLaunchSpec.slashCommand(sessionId, command, workingDirectory));
        } catch (SubprocessSpawnException ex) {
            log.error("{} failed to start for session={}: {}", command, sessionId, ex.getMessage());
            return CommandOutcome.failure(ex.getMessage());
        }

        // stdout is drained off-thread so a process that never closes it still hits the timeout
        Thread stdoutDrainer = new Thread(() -> drain(process.stdout(), sessionId), "agent-stdout-" + process.pid());
        stdoutDrainer.setDaemon(true);
        stdoutDrainer.start();

        try {
            Optional<Integer> exitCode = process.awaitExit(Duration.ofMillis(Math.max(1L, properties.getCommandTimeoutMs())));
            if (exitCode.isEmpty()) {
                process.destroy();
                log.warn("{} timed out for session={}, pid={}", command, sessionId, process.pid());
                return CommandOutcome.failure(command + " timed out");
            }
            if (exitCode.get() != 0) {
                SubprocessExitException failure = new SubprocessExitException(exitCode.get(), process.stderrText());
                log.warn("{} failed with exit code={} for session={}: {}", command, exitCode.get(), sessionId, failure.stderr());
                return CommandOutcome.failure(failure.getMessage());
            }
            log.info("{} complete for session={}", command, sessionId);
            return CommandOutcome.ok();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            process.destroy();
            return CommandOutcome.failure(command + " interrupted");
        }
    }

    private void drain(InputStream stdout, String sessionId) {
        try (InputStream input = stdout) {
            byte[] buffer = new byte[8192];
            while (input.read(buffer) != -1) {
                // discard
            }
        } catch (IOException ex) {
            log.debug("stdout drain stopped for session={}: {}", sessionId, ex.getMessage());
        }
    }

    public record CommandOutcome(boolean success, String error) {

        public static CommandOutcome ok() {
            return new CommandOutcome(true, null);
        }

        public static CommandOutcome failure(String error) {
            return new CommandOutcome(false, error == null || error.isBlank() ? "Command failed" : error);
        }
    }
}
