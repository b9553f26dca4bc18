package com.linlay.sessionrelay.stream.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;

/**
 * One record of the agent wire protocol, as read from the live stdout pipe or from a transcript file.
 * <p>
 * The decoded discriminators are lifted into fields; the full payload is kept as a private copy so the relay can
 * forward exactly what the agent emitted. Live records name the session {@code session_id}, transcript records
 * name it {@code sessionId}; both end up in {@link #sessionId()}.
 */
public record LogEntry(
        LogEntryType type,
        String rawType,
        String subtype,
        String sessionId,
        String uuid,
        String timestamp,
        ObjectNode raw
) {

    public static final String COMPACT_BOUNDARY_SUBTYPE = "compact_boundary";

    public LogEntry {
        Objects.requireNonNull(type, "type cannot be null");
        Objects.requireNonNull(raw, "raw cannot be null");
        raw = raw.deepCopy();
    }

    public static LogEntry of(ObjectNode raw) {
        String rawType = text(raw.get("type"));
        String sessionId = text(raw.get("session_id"));
        if (sessionId == null) {
            sessionId = text(raw.get("sessionId"));
        }
        return new LogEntry(
                LogEntryType.fromValue(rawType),
                rawType,
                text(raw.get("subtype")),
                sessionId,
                text(raw.get("uuid")),
                text(raw.get("timestamp")),
                raw
        );
    }

    /**
     * Returns a copy of the payload; callers may mutate it freely.
     */
    @Override
    public ObjectNode raw() {
        return raw.deepCopy();
    }

    public boolean isCompactBoundary() {
        return type == LogEntryType.SYSTEM && COMPACT_BOUNDARY_SUBTYPE.equals(subtype);
    }

    public boolean isResult() {
        return type == LogEntryType.RESULT;
    }

    public boolean isErrorResult() {
        return isResult() && raw.path("is_error").asBoolean(false);
    }

    public boolean isMeta() {
        return raw.path("isMeta").asBoolean(false);
    }

    public boolean isSidechain() {
        return raw.path("isSidechain").asBoolean(false);
    }

    public String gitBranch() {
        return text(raw.get("gitBranch"));
    }

    public String assistantError() {
        return text(raw.get("error"));
    }

    /**
     * {@code message.content} of user/assistant records; a missing node when absent.
     */
    public JsonNode messageContent() {
        return raw.path("message").path("content");
    }

    public boolean hasMessageContent() {
        JsonNode content = messageContent();
        if (content.isMissingNode() || content.isNull()) {
            return false;
        }
        return !content.isTextual() || !content.asText().isEmpty();
    }

    /**
     * Read-only view of a payload field, for inspection without copying.
     */
    public JsonNode path(String field) {
        return raw.path(field);
    }

    public String toJson() {
        return raw.toString();
    }

    private static String text(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode() || !node.isValueNode()) {
            return null;
        }
        String value = node.asText();
        return value.isBlank() ? null : value;
    }
}
