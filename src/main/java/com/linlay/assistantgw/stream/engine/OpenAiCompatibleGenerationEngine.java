package com.linlay.assistantgw.stream.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.assistantgw.config.EngineProperties;
import com.linlay.assistantgw.stream.model.RunEvent;
import com.linlay.assistantgw.stream.model.RunInput;
import com.linlay.assistantgw.stream.model.RunMessage;
import com.linlay.assistantgw.stream.service.RunIdGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Streams a run from an OpenAI-compatible {@code /chat/completions} endpoint.
 */
public class OpenAiCompatibleGenerationEngine implements GenerationEngine {

    private static final Logger log = LoggerFactory.getLogger(OpenAiCompatibleGenerationEngine.class);
    private static final ParameterizedTypeReference<ServerSentEvent<String>> SSE_TYPE =
            new ParameterizedTypeReference<>() {
            };
    private static final String DONE_MARKER = "[DONE]";

    private final EngineProperties properties;
    private final ObjectMapper objectMapper;
    private final WebClient webClient;
    private final UsageExtractor usageExtractor = new LlmOutputUsageExtractor();

    public OpenAiCompatibleGenerationEngine(
            EngineProperties properties,
            WebClient.Builder webClientBuilder,
            ObjectMapper objectMapper
    ) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.webClient = properties.isConfigured() ? buildClient(webClientBuilder, properties) : null;
    }

    @Override
    public Flux<RunEvent> stream(RunInput input) {
        if (webClient == null) {
            return Flux.error(new IllegalStateException("agent.engine.base-url is not configured"));
        }
        return Flux.defer(() -> {
            String runId = RunIdGenerator.nextRunId();
            OpenAiChunkToRunEventMapper mapper = new OpenAiChunkToRunEventMapper(runId, input.messages(), objectMapper);
            log.debug("engine stream start runId={} model={}", runId, properties.model());

            Flux<RunEvent> body = webClient.post()
                    .uri(properties.completionsPath())
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.TEXT_EVENT_STREAM)
                    .bodyValue(requestBody(input))
                    .retrieve()
                    .bodyToFlux(SSE_TYPE)
                    .<String>handle((event, sink) -> {
                        String data = event.data();
                        if (StringUtils.hasText(data)) {
                            sink.next(data.trim());
                        }
                    })
                    .takeWhile(data -> !DONE_MARKER.equals(data))
                    .concatMapIterable(data -> mapper.map(readTree(data)));

            return Flux.concat(
                    Flux.fromIterable(mapper.start()),
                    body,
                    Flux.defer(() -> Flux.fromIterable(mapper.finish()))
            );
        });
    }

    @Override
    public UsageExtractor usageExtractor() {
        return usageExtractor;
    }

    Map<String, Object> requestBody(RunInput input) {
        List<Map<String, Object>> messages = new ArrayList<>();
        for (RunMessage message : input.messages()) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("role", message.role().value());
            item.put("content", message.content() == null ? "" : message.content());
            messages.add(item);
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", properties.model());
        body.put("messages", messages);
        body.put("stream", true);
        if (Boolean.TRUE.equals(properties.includeUsage())) {
            body.put("stream_options", Map.of("include_usage", true));
        }
        return body;
    }

    private JsonNode readTree(String data) {
        try {
            return objectMapper.readTree(data);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Cannot parse completion chunk", ex);
        }
    }

    private static WebClient buildClient(WebClient.Builder builder, EngineProperties properties) {
        WebClient.Builder configured = builder.clone().baseUrl(properties.baseUrl().trim());
        if (StringUtils.hasText(properties.apiKey())) {
            configured.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.apiKey().trim());
        }
        return configured.build();
    }
}
