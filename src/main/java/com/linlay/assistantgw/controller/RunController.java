package com.linlay.assistantgw.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.assistantgw.model.api.RunRequest;
import com.linlay.assistantgw.stream.service.RunStreamService;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

@RestController
@RequestMapping("/runs")
public class RunController {

    private final RunStreamService runStreamService;
    private final ObjectMapper objectMapper;

    public RunController(RunStreamService runStreamService, ObjectMapper objectMapper) {
        this.runStreamService = runStreamService;
        this.objectMapper = objectMapper;
    }

    @PostMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<String>> stream(
            @Valid @RequestBody RunRequest request,
            ServerHttpResponse response
    ) {
        response.getHeaders().set("X-Accel-Buffering", "no");
        response.getHeaders().set("Cache-Control", "no-cache");
        return runStreamService.stream(request.toRunInput(objectMapper));
    }
}
