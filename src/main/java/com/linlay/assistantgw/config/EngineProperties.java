package com.linlay.assistantgw.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;

@ConfigurationProperties(prefix = "agent.engine")
public record EngineProperties(
        String baseUrl,
        String apiKey,
        String model,
        String completionsPath,
        Boolean includeUsage
) {

    public EngineProperties {
        if (!StringUtils.hasText(model)) {
            model = "gpt-4o-mini";
        }
        if (!StringUtils.hasText(completionsPath)) {
            completionsPath = "/chat/completions";
        }
        if (includeUsage == null) {
            includeUsage = Boolean.TRUE;
        }
    }

    public boolean isConfigured() {
        return StringUtils.hasText(baseUrl);
    }
}
