package com.linlay.sessionrelay.relay;

public class SubprocessExitException extends RuntimeException {

    private final int exitCode;
    private final String stderr;

    public SubprocessExitException(int exitCode, String stderr) {
        super(buildMessage(exitCode, stderr));
        this.exitCode = exitCode;
        this.stderr = stderr == null ? "" : stderr;
    }

    public int exitCode() {
        return exitCode;
    }

    public String stderr() {
        return stderr;
    }

    private static String buildMessage(int exitCode, String stderr) {
        if (stderr == null || stderr.isBlank()) {
            return "Exit code: " + exitCode;
        }
        return stderr.trim();
    }
}
