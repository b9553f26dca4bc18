package com.linlay.sessionrelay.transcript;

import com.fasterxml.jackson.databind.JsonNode;
import com.linlay.sessionrelay.config.TranscriptProperties;
import com.linlay.sessionrelay.stream.model.LogEntry;
import com.linlay.sessionrelay.stream.model.LogEntryType;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Rebuilds the display timeline from an ordered run of agent records.
 * <p>
 * Two forward passes over the same list. The first finds the last compaction boundary and collects the outcome
 * (error flag, result images) of every {@code tool_result} keyed by {@code tool_use_id}; the second emits user turns,
 * assistant turns and tool groups from the records after the boundary, resolving tool status from that side table.
 * Adjacent tool groups are merged, so a burst of tool calls spread over several records reads as one group.
 * <p>
 * The correlator keeps no state between calls: the same input always yields an equal timeline.
 */
@Component
public class TranscriptCorrelator {

    public static final int DEFAULT_TITLE_MAX_LENGTH = 100;

    private static final String CONTROL_MARKER = "<";
    private static final String TOOL_GROUP_ID_PREFIX = "tools-";
    // records without a uuid (live stdout) get a positional id
    private static final String ENTRY_ID_PREFIX = "entry-";

    private final int titleMaxLength;

    public TranscriptCorrelator() {
        this(DEFAULT_TITLE_MAX_LENGTH);
    }

    @Autowired
    public TranscriptCorrelator(TranscriptProperties properties) {
        this(properties.getTitleMaxLength());
    }

    public TranscriptCorrelator(int titleMaxLength) {
        this.titleMaxLength = titleMaxLength > 0 ? titleMaxLength : DEFAULT_TITLE_MAX_LENGTH;
    }

    /**
     * Reconstructs a closed log: tool calls without a logged result are shown as complete.
     */
    public TranscriptTimeline reconstruct(List<LogEntry> entries) {
        return reconstruct(entries, ToolStatus.COMPLETE);
    }

    public TranscriptTimeline reconstruct(List<LogEntry> entries, ToolStatus unresolvedStatus) {
        if (entries == null || entries.isEmpty()) {
            return TranscriptTimeline.empty();
        }
        ToolStatus fallback = unresolvedStatus == null ? ToolStatus.COMPLETE : unresolvedStatus;

        ScanResult scan = scan(entries);
        int startIndex = scan.compacted() ? scan.boundaryIndex() + 2 : 0;

        List<TimelineMessage> built = new ArrayList<>();
        for (int i = startIndex; i < entries.size(); i++) {
            LogEntry entry = entries.get(i);
            if (entry == null) {
                continue;
            }
            String id = entry.uuid() != null ? entry.uuid() : ENTRY_ID_PREFIX + i;
            switch (entry.type()) {
                case USER -> buildUserTurn(entry, id, built);
                case ASSISTANT -> buildAssistantTurns(entry, id, scan, fallback, built);
                case RESULT -> buildResultError(entry, id, built);
                default -> {
                    // other record kinds carry no timeline content
                }
            }
        }

        List<TimelineMessage> merged = mergeToolGroups(built);
        return new TranscriptTimeline(merged, scan.compacted(), firstPrompt(merged));
    }

    public String truncateTitle(String text) {
        if (text == null) {
            return null;
        }
        if (text.length() <= titleMaxLength) {
            return text;
        }
        return text.substring(0, titleMaxLength) + "...";
    }

    private ScanResult scan(List<LogEntry> entries) {
        int boundaryIndex = -1;
        Map<String, Boolean> errorByToolUseId = new HashMap<>();
        Map<String, List<String>> imagesByToolUseId = new HashMap<>();

        for (int i = 0; i < entries.size(); i++) {
            LogEntry entry = entries.get(i);
            if (entry == null) {
                continue;
            }
            if (entry.isCompactBoundary()) {
                boundaryIndex = i;
            }
            if (entry.type() != LogEntryType.USER || !entry.hasMessageContent()) {
                continue;
            }
            JsonNode content = entry.messageContent();
            if (!content.isArray()) {
                continue;
            }
            for (JsonNode block : content) {
                if (!"tool_result".equals(block.path("type").asText())) {
                    continue;
                }
                String toolUseId = block.path("tool_use_id").asText(null);
                if (!StringUtils.hasText(toolUseId)) {
                    continue;
                }
                // the first result is terminal for its tool call
                if (errorByToolUseId.putIfAbsent(toolUseId, block.path("is_error").asBoolean(false)) != null) {
                    continue;
                }
                List<String> images = resultImages(block.path("content"));
                if (!images.isEmpty()) {
                    imagesByToolUseId.put(toolUseId, images);
                }
            }
        }
        return new ScanResult(boundaryIndex, errorByToolUseId, imagesByToolUseId);
    }

    private List<String> resultImages(JsonNode resultContent) {
        if (!resultContent.isArray()) {
            return List.of();
        }
        List<String> images = new ArrayList<>();
        for (JsonNode resultBlock : resultContent) {
            if (!"image".equals(resultBlock.path("type").asText())) {
                continue;
            }
            JsonNode source = resultBlock.path("source");
            String mediaType = source.path("media_type").asText("");
            String data = source.path("data").asText("");
            if ("base64".equals(source.path("type").asText()) && !mediaType.isEmpty() && !data.isEmpty()) {
                images.add("data:" + mediaType + ";base64," + data);
            }
        }
        return images;
    }

    private void buildUserTurn(LogEntry entry, String id, List<TimelineMessage> out) {
        if (!entry.hasMessageContent()) {
            return;
        }
        JsonNode content = entry.messageContent();
        if (content.isTextual()) {
            String text = content.asText();
            if (!entry.isMeta() && !text.startsWith(CONTROL_MARKER)) {
                out.add(new TimelineMessage.UserTurn(id, text));
            }
            return;
        }
        if (content.isArray()) {
            String text = joinTextBlocks(content);
            if (!text.isEmpty()) {
                out.add(new TimelineMessage.UserTurn(id, text));
            }
        }
    }

    private void buildAssistantTurns(LogEntry entry, String id, ScanResult scan, ToolStatus fallback, List<TimelineMessage> out) {
        JsonNode content = entry.messageContent();
        if (!content.isArray()) {
            String error = entry.assistantError();
            if (error != null) {
                out.add(new TimelineMessage.ErrorTurn(id, error));
            }
            return;
        }

        String text = joinTextBlocks(content);
        if (!text.isEmpty()) {
            out.add(new TimelineMessage.AssistantTurn(id, text));
        } else if (entry.assistantError() != null) {
            out.add(new TimelineMessage.ErrorTurn(id, entry.assistantError()));
        }

        List<ToolInvocation> tools = new ArrayList<>();
        for (JsonNode block : content) {
            if (!"tool_use".equals(block.path("type").asText())) {
                continue;
            }
            String toolUseId = block.path("id").asText(null);
            tools.add(new ToolInvocation(
                    toolUseId,
                    block.path("name").asText(null),
                    block.get("input"),
                    scan.statusOf(toolUseId, fallback),
                    toolUseId == null ? null : scan.imagesByToolUseId().get(toolUseId)
            ));
        }
        if (!tools.isEmpty()) {
            out.add(new TimelineMessage.ToolGroup(TOOL_GROUP_ID_PREFIX + id, tools));
        }
    }

    private void buildResultError(LogEntry entry, String id, List<TimelineMessage> out) {
        if (!entry.isErrorResult()) {
            return;
        }
        List<String> errors = new ArrayList<>();
        for (JsonNode error : entry.path("errors")) {
            if (error.isTextual() && StringUtils.hasText(error.asText())) {
                errors.add(error.asText());
            }
        }
        String message;
        if (!errors.isEmpty()) {
            message = String.join("\n", errors);
        } else if (StringUtils.hasText(entry.path("result").asText(null))) {
            message = entry.path("result").asText();
        } else {
            message = entry.subtype() == null ? "error" : entry.subtype();
        }
        out.add(new TimelineMessage.ErrorTurn(id, message));
    }

    private String joinTextBlocks(JsonNode content) {
        StringBuilder text = new StringBuilder();
        for (JsonNode block : content) {
            if ("text".equals(block.path("type").asText())) {
                text.append(block.path("text").asText(""));
            }
        }
        return text.toString();
    }

    private List<TimelineMessage> mergeToolGroups(List<TimelineMessage> messages) {
        List<TimelineMessage> merged = new ArrayList<>(messages.size());
        for (TimelineMessage message : messages) {
            int lastIndex = merged.size() - 1;
            if (message instanceof TimelineMessage.ToolGroup next
                    && lastIndex >= 0
                    && merged.get(lastIndex) instanceof TimelineMessage.ToolGroup last) {
                merged.set(lastIndex, last.mergedWith(next));
            } else {
                merged.add(message);
            }
        }
        return merged;
    }

    private String firstPrompt(List<TimelineMessage> messages) {
        for (TimelineMessage message : messages) {
            if (message instanceof TimelineMessage.UserTurn userTurn) {
                return truncateTitle(userTurn.content());
            }
        }
        return null;
    }

    private record ScanResult(
            int boundaryIndex,
            Map<String, Boolean> errorByToolUseId,
            Map<String, List<String>> imagesByToolUseId
    ) {

        boolean compacted() {
            return boundaryIndex >= 0;
        }

        ToolStatus statusOf(String toolUseId, ToolStatus fallback) {
            if (toolUseId == null) {
                return fallback;
            }
            Boolean error = errorByToolUseId.get(toolUseId);
            if (error == null) {
                return fallback;
            }
            return error ? ToolStatus.ERROR : ToolStatus.COMPLETE;
        }
    }
}
