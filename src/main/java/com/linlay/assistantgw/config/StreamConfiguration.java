package com.linlay.assistantgw.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.assistantgw.stream.engine.GenerationEngine;
import com.linlay.assistantgw.stream.engine.OpenAiCompatibleGenerationEngine;
import com.linlay.assistantgw.stream.service.JTokkitTokenCounter;
import com.linlay.assistantgw.stream.service.RunEventAggregator;
import com.linlay.assistantgw.stream.service.RunStreamService;
import com.linlay.assistantgw.stream.service.StreamFrameEncoder;
import com.linlay.assistantgw.stream.service.TokenCounter;
import com.linlay.assistantgw.stream.service.UsageEstimator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration(proxyBeanMethods = false)
public class StreamConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public TokenCounter tokenCounter() {
        return new JTokkitTokenCounter();
    }

    @Bean
    public RunEventAggregator runEventAggregator(TokenCounter tokenCounter, ObjectMapper objectMapper) {
        return new RunEventAggregator(new UsageEstimator(tokenCounter, objectMapper));
    }

    @Bean
    public StreamFrameEncoder streamFrameEncoder(ObjectMapper objectMapper) {
        return new StreamFrameEncoder(objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public GenerationEngine generationEngine(
            EngineProperties properties,
            WebClient.Builder webClientBuilder,
            ObjectMapper objectMapper
    ) {
        return new OpenAiCompatibleGenerationEngine(properties, webClientBuilder, objectMapper);
    }

    @Bean
    public RunStreamService runStreamService(
            GenerationEngine generationEngine,
            RunEventAggregator runEventAggregator,
            StreamFrameEncoder streamFrameEncoder
    ) {
        return new RunStreamService(generationEngine, runEventAggregator, streamFrameEncoder);
    }
}
