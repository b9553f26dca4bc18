package com.linlay.sessionrelay.transcript;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.ArrayList;
import java.util.List;

/**
 * UI-facing timeline item rebuilt from agent records. Serialized with a {@code type} discriminator:
 * {@code user}, {@code assistant}, {@code tools} or {@code error}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = TimelineMessage.UserTurn.class, name = "user"),
        @JsonSubTypes.Type(value = TimelineMessage.AssistantTurn.class, name = "assistant"),
        @JsonSubTypes.Type(value = TimelineMessage.ToolGroup.class, name = "tools"),
        @JsonSubTypes.Type(value = TimelineMessage.ErrorTurn.class, name = "error")
})
public interface TimelineMessage {

    String id();

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record UserTurn(String id, String content) implements TimelineMessage {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record AssistantTurn(String id, String content) implements TimelineMessage {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record ErrorTurn(String id, String content) implements TimelineMessage {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record ToolGroup(String id, List<ToolInvocation> tools) implements TimelineMessage {

        public ToolGroup {
            tools = tools == null ? List.of() : List.copyOf(tools);
        }

        public ToolGroup mergedWith(ToolGroup next) {
            List<ToolInvocation> merged = new ArrayList<>(tools.size() + next.tools.size());
            merged.addAll(tools);
            merged.addAll(next.tools);
            return new ToolGroup(id, merged);
        }
    }
}
