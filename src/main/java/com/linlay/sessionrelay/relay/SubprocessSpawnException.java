package com.linlay.sessionrelay.relay;

public class SubprocessSpawnException extends RuntimeException {

    public SubprocessSpawnException(String message, Throwable cause) {
        super(message, cause);
    }
}
