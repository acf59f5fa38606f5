package com.linlay.assistantgw.stream.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Map;

/**
 * One message of a run. {@code content} is either a {@link String} or a structured payload
 * made of {@link Map}, {@link List} and scalar values.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RunMessage(String id, MessageRole role, Object content) {

    public RunMessage {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be null or blank");
        }
        if (role == null) {
            throw new IllegalArgumentException("role must not be null");
        }
    }

    public static RunMessage user(String id, String text) {
        return new RunMessage(id, MessageRole.USER, text);
    }

    public static RunMessage assistant(String id, Object content) {
        return new RunMessage(id, MessageRole.ASSISTANT, content);
    }

    public static RunMessage system(String id, String text) {
        return new RunMessage(id, MessageRole.SYSTEM, text);
    }

    public RunMessage withContent(Object newContent) {
        return new RunMessage(id, role, newContent);
    }

    public boolean isAssistant() {
        return role == MessageRole.ASSISTANT;
    }
}
