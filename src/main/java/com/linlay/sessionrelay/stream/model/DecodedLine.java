package com.linlay.sessionrelay.stream.model;

/**
 * Outcome of decoding one framed line. Exactly one of {@code entry} and {@code error} is set, so a bad line is an
 * ordinary item of the sequence rather than its end.
 */
public record DecodedLine(
        long lineNumber,
        LogEntry entry,
        MalformedEntryException error
) {

    public DecodedLine {
        if ((entry == null) == (error == null)) {
            throw new IllegalArgumentException("exactly one of entry and error must be set");
        }
    }

    public static DecodedLine ok(long lineNumber, LogEntry entry) {
        return new DecodedLine(lineNumber, entry, null);
    }

    public static DecodedLine malformed(long lineNumber, MalformedEntryException error) {
        return new DecodedLine(lineNumber, null, error);
    }

    public boolean isMalformed() {
        return error != null;
    }
}
