package com.linlay.sessionrelay.relay;

import java.io.InputStream;
import java.time.Duration;
import java.util.Optional;

/**
 * Handle on a running agent subprocess.
 */
public interface AgentProcess {

    long pid();

    InputStream stdout();

    boolean isAlive();

    /**
     * Asks the process to terminate. Safe to call repeatedly and after exit.
     */
    void destroy();

    /**
     * Waits up to {@code timeout} for exit; empty when the process is still running.
     */
    Optional<Integer> awaitExit(Duration timeout) throws InterruptedException;

    /**
     * Diagnostic output captured so far, possibly truncated.
     */
    String stderrText();
}
