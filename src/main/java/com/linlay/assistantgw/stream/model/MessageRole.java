package com.linlay.assistantgw.stream.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum MessageRole {
    USER("user"),
    ASSISTANT("assistant"),
    TOOL("tool"),
    SYSTEM("system");

    private final String value;

    MessageRole(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static MessageRole fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("message role must not be null or blank");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "user", "human" -> USER;
            case "assistant", "ai" -> ASSISTANT;
            case "tool", "function" -> TOOL;
            case "system" -> SYSTEM;
            default -> throw new IllegalArgumentException("unsupported message role: " + raw);
        };
    }
}
