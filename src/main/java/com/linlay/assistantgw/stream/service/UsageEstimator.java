package com.linlay.assistantgw.stream.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.assistantgw.stream.model.RunMessage;
import com.linlay.assistantgw.stream.model.UsageStats;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Local token estimate used when the generation engine reports no usage.
 * The most recent assistant message counts as completion, everything else as prompt.
 */
public class UsageEstimator {

    private final TokenCounter tokenCounter;
    private final ObjectMapper objectMapper;

    public UsageEstimator(TokenCounter tokenCounter, ObjectMapper objectMapper) {
        this.tokenCounter = tokenCounter;
        this.objectMapper = objectMapper;
    }

    public Optional<UsageStats> estimate(Collection<RunMessage> messages) {
        RunMessage lastAssistant = null;
        for (RunMessage message : messages) {
            if (message.isAssistant()) {
                lastAssistant = message;
            }
        }
        if (lastAssistant == null) {
            return Optional.empty();
        }

        List<String> promptParts = new ArrayList<>();
        for (RunMessage message : messages) {
            if (message != lastAssistant) {
                promptParts.add(toText(message));
            }
        }
        String promptText = String.join("\n", promptParts);
        String completionText = toText(lastAssistant);

        int promptTokens = promptText.isEmpty() ? 0 : tokenCounter.count(promptText);
        int completionTokens = completionText.isEmpty() ? 0 : tokenCounter.count(completionText);
        return Optional.of(UsageStats.estimated(promptTokens, completionTokens));
    }

    private String toText(RunMessage message) {
        Object content = message.content();
        if (content == null) {
            return "";
        }
        if (content instanceof String text) {
            return text;
        }
        try {
            return objectMapper.writeValueAsString(content);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Cannot serialize message content id=" + message.id(), ex);
        }
    }
}
