package com.linlay.sessionrelay.stream.model;

import java.util.Locale;

public enum LogEntryType {

    SYSTEM("system"),
    USER("user"),
    ASSISTANT("assistant"),
    RESULT("result"),
    STREAM_EVENT("stream_event"),
    TOOL_PROGRESS("tool_progress"),
    AUTH_STATUS("auth_status"),
    SUMMARY("summary"),
    UNKNOWN("unknown");

    private final String value;

    LogEntryType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static LogEntryType fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return UNKNOWN;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (LogEntryType type : values()) {
            if (type.value.equals(normalized)) {
                return type;
            }
        }
        return UNKNOWN;
    }
}
