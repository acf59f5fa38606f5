package com.linlay.assistantgw.stream.engine;

import com.linlay.assistantgw.stream.model.RunEvent;
import com.linlay.assistantgw.stream.model.UsageStats;

import java.util.Map;
import java.util.Optional;

/**
 * Extracts usage from completion payloads shaped like
 * {@code {"llm_output": {"token_usage": {...}}}}, {@code {"llm_output": {"usage": {...}}}}
 * or {@code {"response_metadata": {"token_usage": {...}}}}.
 */
public class LlmOutputUsageExtractor implements UsageExtractor {

    @Override
    public Optional<UsageStats> extract(RunEvent.Completion completion) {
        Map<String, Object> output = completion.output();
        Map<?, ?> llmOutput = asMap(output.get("llm_output"));
        if (llmOutput != null) {
            Map<?, ?> tokenUsage = asMap(llmOutput.get("token_usage"));
            if (tokenUsage == null || tokenUsage.isEmpty()) {
                tokenUsage = asMap(llmOutput.get("usage"));
            }
            if (tokenUsage != null && !tokenUsage.isEmpty()) {
                return Optional.of(toUsage(tokenUsage));
            }
        }
        Map<?, ?> responseMetadata = asMap(output.get("response_metadata"));
        if (responseMetadata != null) {
            Map<?, ?> tokenUsage = asMap(responseMetadata.get("token_usage"));
            if (tokenUsage != null && !tokenUsage.isEmpty()) {
                return Optional.of(toUsage(tokenUsage));
            }
        }
        return Optional.empty();
    }

    private UsageStats toUsage(Map<?, ?> tokenUsage) {
        int prompt = intValue(tokenUsage.get("prompt_tokens"));
        int completion = intValue(tokenUsage.get("completion_tokens"));
        Object total = tokenUsage.get("total_tokens");
        return UsageStats.reported(prompt, completion, total == null ? prompt + completion : intValue(total));
    }

    private static Map<?, ?> asMap(Object value) {
        return value instanceof Map<?, ?> map ? map : null;
    }

    private static int intValue(Object value) {
        if (value instanceof Number number) {
            return Math.max(0, number.intValue());
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return Math.max(0, Integer.parseInt(text.trim()));
            } catch (NumberFormatException ignored) {
                return 0;
            }
        }
        return 0;
    }
}
