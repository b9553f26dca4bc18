package com.linlay.sessionrelay.stream.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.linlay.sessionrelay.stream.model.LogEntry;
import com.linlay.sessionrelay.stream.model.MalformedEntryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Decodes single lines of the agent's newline-delimited JSON protocol into {@link LogEntry} values.
 * Shared by the live relay and the transcript reader; stateless and safe for concurrent use.
 */
@Component
public class LogEntryDecoder {

    private static final Logger log = LoggerFactory.getLogger(LogEntryDecoder.class);
    private static final int PREVIEW_CHARS = 120;

    private final ObjectMapper objectMapper;

    public LogEntryDecoder(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper cannot be null");
    }

    public LogEntry decode(String line) {
        if (line == null || line.isBlank()) {
            throw new MalformedEntryException("blank line", line);
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(line);
        } catch (JsonProcessingException ex) {
            throw new MalformedEntryException("invalid json: " + ex.getOriginalMessage(), line, ex);
        }
        if (!(root instanceof ObjectNode objectNode)) {
            throw new MalformedEntryException("record is not a json object", line);
        }
        JsonNode type = objectNode.get("type");
        if (type == null || !type.isTextual() || type.asText().isBlank()) {
            throw new MalformedEntryException("record has no type", line);
        }
        return LogEntry.of(objectNode);
    }

    /**
     * Decodes every non-blank line, dropping the ones that fail. A bad line never affects its neighbours.
     */
    public List<LogEntry> decodeAll(List<String> lines) {
        if (lines == null || lines.isEmpty()) {
            return List.of();
        }
        List<LogEntry> entries = new ArrayList<>(lines.size());
        int lineNumber = 0;
        for (String line : lines) {
            lineNumber++;
            if (line == null || line.isBlank()) {
                continue;
            }
            try {
                entries.add(decode(line));
            } catch (MalformedEntryException ex) {
                log.debug("Skip malformed entry line={}, reason={}, preview={}", lineNumber, ex.getMessage(), preview(line));
            }
        }
        return entries;
    }

    static String preview(String line) {
        if (line == null) {
            return "";
        }
        if (line.length() <= PREVIEW_CHARS) {
            return line;
        }
        return line.substring(0, PREVIEW_CHARS) + "...(truncated)";
    }
}
