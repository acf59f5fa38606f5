package com.linlay.assistantgw.stream.model;

import java.util.List;
import java.util.Map;

public record RunInput(String threadId, List<RunMessage> messages, Map<String, Object> config) {

    public RunInput {
        messages = messages == null ? List.of() : List.copyOf(messages);
        config = config == null ? Map.of() : config;
    }
}
