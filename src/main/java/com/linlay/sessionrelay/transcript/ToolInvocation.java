package com.linlay.sessionrelay.transcript;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ToolInvocation(
        String toolUseId,
        String name,
        JsonNode input,
        ToolStatus status,
        List<String> resultImages
) {

    public ToolInvocation {
        input = input == null || input.isNull() || input.isMissingNode()
                ? JsonNodeFactory.instance.objectNode()
                : input.deepCopy();
        resultImages = resultImages == null || resultImages.isEmpty() ? null : List.copyOf(resultImages);
    }
}
