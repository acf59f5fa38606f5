package com.linlay.assistantgw.model.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.assistantgw.stream.model.MessageRole;
import com.linlay.assistantgw.stream.model.RunInput;
import com.linlay.assistantgw.stream.model.RunMessage;
import jakarta.validation.constraints.NotBlank;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Body of {@code POST /runs/stream}. {@code input} is either a message list or an object with a
 * {@code messages} list; each message carries {@code role} (or {@code type}) and {@code content}.
 */
public record RunRequest(
        @NotBlank @JsonProperty("thread_id") String threadId,
        JsonNode input,
        Map<String, Object> config
) {

    private static final TypeReference<Object> CONTENT_TYPE = new TypeReference<>() {
    };

    public RunInput toRunInput(ObjectMapper objectMapper) {
        JsonNode messagesNode = input == null ? null : (input.isArray() ? input : input.get("messages"));
        List<RunMessage> messages = new ArrayList<>();
        if (messagesNode != null && messagesNode.isArray()) {
            for (JsonNode node : messagesNode) {
                messages.add(toMessage(node, objectMapper));
            }
        }
        return new RunInput(threadId, messages, config);
    }

    private static RunMessage toMessage(JsonNode node, ObjectMapper objectMapper) {
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("input messages must be objects");
        }
        String id = node.path("id").asText("");
        String role = node.hasNonNull("role") ? node.get("role").asText() : node.path("type").asText("");
        JsonNode contentNode = node.get("content");
        Object content = contentNode == null || contentNode.isNull()
                ? ""
                : objectMapper.convertValue(contentNode, CONTENT_TYPE);
        return new RunMessage(
                id.isBlank() ? UUID.randomUUID().toString() : id,
                MessageRole.fromValue(role),
                content
        );
    }
}
