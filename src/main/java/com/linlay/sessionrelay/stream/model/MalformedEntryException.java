package com.linlay.sessionrelay.stream.model;

public class MalformedEntryException extends RuntimeException {

    private final String line;

    public MalformedEntryException(String message, String line) {
        super(message);
        this.line = line;
    }

    public MalformedEntryException(String message, String line, Throwable cause) {
        super(message, cause);
        this.line = line;
    }

    public String line() {
        return line;
    }
}
