package com.linlay.assistantgw.stream.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.assistantgw.stream.model.StreamItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.codec.ServerSentEvent;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Serializes aggregator output into SSE frames. A failing upstream yields one redacted
 * {@code error} frame; {@code end} is always the last frame.
 */
public class StreamFrameEncoder {

    public static final String EVENT_METADATA = "metadata";
    public static final String EVENT_DATA = "data";
    public static final String EVENT_USAGE = "usage";
    public static final String EVENT_ERROR = "error";
    public static final String EVENT_END = "end";

    private static final Logger log = LoggerFactory.getLogger(StreamFrameEncoder.class);

    private final ObjectMapper objectMapper;

    public StreamFrameEncoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Flux<ServerSentEvent<String>> encode(Flux<StreamItem> items) {
        return items.map(this::toFrame)
                .onErrorResume(ex -> {
                    log.warn("error in run stream", ex);
                    return Mono.just(errorFrame());
                })
                .concatWith(Mono.fromSupplier(this::endFrame));
    }

    ServerSentEvent<String> toFrame(StreamItem item) {
        if (item instanceof StreamItem.RunId runId) {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("run_id", runId.runId());
            return frame(EVENT_METADATA, toJson(data));
        }
        if (item instanceof StreamItem.Messages messages) {
            return frame(EVENT_DATA, toJson(messages.messages()));
        }
        if (item instanceof StreamItem.Usage usage) {
            return frame(EVENT_USAGE, toJson(usage.usage()));
        }
        throw new IllegalArgumentException("unsupported stream item: " + item);
    }

    private ServerSentEvent<String> errorFrame() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("status_code", 500);
        data.put("message", "Internal Server Error");
        return frame(EVENT_ERROR, toJson(data));
    }

    private ServerSentEvent<String> endFrame() {
        return ServerSentEvent.<String>builder()
                .event(EVENT_END)
                .build();
    }

    private ServerSentEvent<String> frame(String event, String data) {
        return ServerSentEvent.<String>builder()
                .event(event)
                .data(data)
                .build();
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Cannot serialize SSE frame", ex);
        }
    }
}
