package com.linlay.assistantgw.stream.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record UsageStats(
        @JsonProperty("prompt_tokens") int promptTokens,
        @JsonProperty("completion_tokens") int completionTokens,
        @JsonProperty("total_tokens") int totalTokens,
        @JsonProperty("estimated") boolean estimated
) {

    public UsageStats {
        if (promptTokens < 0 || completionTokens < 0 || totalTokens < 0) {
            throw new IllegalArgumentException("token counts must be non-negative");
        }
    }

    public static UsageStats reported(int promptTokens, int completionTokens, int totalTokens) {
        return new UsageStats(promptTokens, completionTokens, totalTokens, false);
    }

    public static UsageStats estimated(int promptTokens, int completionTokens) {
        return new UsageStats(promptTokens, completionTokens, promptTokens + completionTokens, true);
    }
}
