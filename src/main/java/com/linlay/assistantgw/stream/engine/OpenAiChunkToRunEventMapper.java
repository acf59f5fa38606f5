package com.linlay.assistantgw.stream.engine;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.assistantgw.stream.model.RunEvent;
import com.linlay.assistantgw.stream.model.RunMessage;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps the chunks of one OpenAI-compatible chat completion stream to run events.
 * One instance per run.
 */
public class OpenAiChunkToRunEventMapper {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final String runId;
    private final List<RunMessage> inputMessages;
    private final ObjectMapper objectMapper;
    private final StringBuilder content = new StringBuilder();
    private String messageId;
    private Map<String, Object> tokenUsage;
    private String finishReason;

    public OpenAiChunkToRunEventMapper(String runId, List<RunMessage> inputMessages, ObjectMapper objectMapper) {
        this.runId = runId;
        this.inputMessages = List.copyOf(inputMessages);
        this.objectMapper = objectMapper;
    }

    public List<RunEvent> start() {
        List<RunEvent> events = new ArrayList<>();
        events.add(new RunEvent.RunStart(runId));
        if (!inputMessages.isEmpty()) {
            events.add(new RunEvent.StateSnapshot(inputMessages));
        }
        return events;
    }

    public List<RunEvent> map(JsonNode chunk) {
        if (chunk == null || !chunk.isObject()) {
            return List.of();
        }
        if (messageId == null) {
            String chunkId = chunk.path("id").asText("");
            messageId = chunkId.isBlank() ? runId + "_ai" : chunkId;
        }
        JsonNode usage = chunk.path("usage");
        if (usage.isObject()) {
            tokenUsage = objectMapper.convertValue(usage, MAP_TYPE);
        }

        JsonNode choice = chunk.path("choices").path(0);
        String reason = choice.path("finish_reason").asText("");
        if (!reason.isBlank()) {
            finishReason = reason;
        }
        String delta = choice.path("delta").path("content").asText("");
        if (delta.isEmpty()) {
            return List.of();
        }
        content.append(delta);
        return List.of(new RunEvent.TokenDelta(RunMessage.assistant(messageId, delta)));
    }

    public List<RunEvent> finish() {
        Map<String, Object> llmOutput = new LinkedHashMap<>();
        if (tokenUsage != null) {
            llmOutput.put("token_usage", tokenUsage);
        }
        if (finishReason != null) {
            llmOutput.put("finish_reason", finishReason);
        }
        List<RunEvent> events = new ArrayList<>();
        events.add(new RunEvent.Completion(Map.of("llm_output", llmOutput)));
        if (messageId != null) {
            List<RunMessage> finalState = new ArrayList<>(inputMessages);
            finalState.add(RunMessage.assistant(messageId, content.toString()));
            events.add(new RunEvent.StateSnapshot(finalState));
        }
        return events;
    }
}
