package com.linlay.sessionrelay.relay;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds the structured {@code user} record sent on the agent's stdin when a message carries images.
 */
@Component
public class MessageContentBuilder {

    private static final Logger log = LoggerFactory.getLogger(MessageContentBuilder.class);
    private static final Pattern DATA_URL_PATTERN = Pattern.compile("^data:([^;]+);base64,(.+)$", Pattern.DOTALL);

    private final ObjectMapper objectMapper;

    public MessageContentBuilder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Image blocks first, in input order, then the text block. Images that are not base64 data URLs are dropped.
     */
    public ArrayNode content(String message, List<String> images) {
        ArrayNode content = objectMapper.createArrayNode();
        if (images != null) {
            for (String image : images) {
                if (image == null) {
                    continue;
                }
                Matcher matcher = DATA_URL_PATTERN.matcher(image);
                if (!matcher.matches()) {
                    log.debug("Skip image that is not a base64 data url, length={}", image.length());
                    continue;
                }
                ObjectNode block = content.addObject();
                block.put("type", "image");
                ObjectNode source = block.putObject("source");
                source.put("type", "base64");
                source.put("media_type", matcher.group(1));
                source.put("data", matcher.group(2));
            }
        }
        if (StringUtils.hasText(message)) {
            ObjectNode text = content.addObject();
            text.put("type", "text");
            text.put("text", message);
        }
        return content;
    }

    /**
     * One newline-terminated stdin record.
     */
    public String stdinRecord(AgentLaunchSpec spec) {
        ObjectNode record = objectMapper.createObjectNode();
        record.put("type", "user");
        record.put("session_id", spec.resumes() ? spec.resumeSessionId().trim() : "");
        ObjectNode message = record.putObject("message");
        message.put("role", "user");
        message.set("content", content(spec.prompt(), spec.images()));
        record.putNull("parent_tool_use_id");
        try {
            return objectMapper.writeValueAsString(record) + "\n";
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Cannot serialize stdin record", ex);
        }
    }
}
