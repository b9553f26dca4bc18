package com.linlay.sessionrelay.relay;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * {@link AgentProcess} over a local {@link Process}. Stderr is drained on a daemon thread so a chatty process
 * never blocks on a full pipe; only the first {@code stderrLimitChars} characters are kept.
 */
class LocalAgentProcess implements AgentProcess {

    private static final Logger log = LoggerFactory.getLogger(LocalAgentProcess.class);
    private static final long STDERR_JOIN_MS = 1_000;

    private final Process process;
    private final int stderrLimitChars;
    private final StringBuilder stderr = new StringBuilder();
    private final Thread stderrDrainer;

    LocalAgentProcess(Process process, int stderrLimitChars) {
        this.process = process;
        this.stderrLimitChars = Math.max(0, stderrLimitChars);
        this.stderrDrainer = new Thread(this::drainStderr, "agent-stderr-" + process.pid());
        this.stderrDrainer.setDaemon(true);
        this.stderrDrainer.start();
    }

    @Override
    public long pid() {
        return process.pid();
    }

    @Override
    public InputStream stdout() {
        return process.getInputStream();
    }

    @Override
    public boolean isAlive() {
        return process.isAlive();
    }

    @Override
    public void destroy() {
        if (!process.isAlive()) {
            return;
        }
        process.descendants().forEach(ProcessHandle::destroy);
        process.destroy();
    }

    @Override
    public Optional<Integer> awaitExit(Duration timeout) throws InterruptedException {
        if (!process.waitFor(Math.max(0L, timeout.toMillis()), TimeUnit.MILLISECONDS)) {
            return Optional.empty();
        }
        stderrDrainer.join(STDERR_JOIN_MS);
        return Optional.of(process.exitValue());
    }

    @Override
    public String stderrText() {
        synchronized (stderr) {
            return stderr.toString();
        }
    }

    private void drainStderr() {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getErrorStream(), StandardCharsets.UTF_8))) {
            char[] buffer = new char[1024];
            int read;
            while ((read = reader.read(buffer)) != -1) {
                synchronized (stderr) {
                    int room = stderrLimitChars - stderr.length();
                    if (room > 0) {
                        stderr.append(buffer, 0, Math.min(room, read));
                    }
                }
            }
        } catch (IOException ex) {
            log.debug("Agent stderr closed pid={}, reason={}", process.pid(), ex.getMessage());
        }
    }
}
