package com.linlay.assistantgw.stream.service;

import com.linlay.assistantgw.stream.engine.GenerationEngine;
import com.linlay.assistantgw.stream.model.RunInput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.codec.ServerSentEvent;
import reactor.core.publisher.Flux;

public class RunStreamService {

    private static final Logger log = LoggerFactory.getLogger(RunStreamService.class);

    private final GenerationEngine engine;
    private final RunEventAggregator aggregator;
    private final StreamFrameEncoder encoder;

    public RunStreamService(GenerationEngine engine, RunEventAggregator aggregator, StreamFrameEncoder encoder) {
        this.engine = engine;
        this.aggregator = aggregator;
        this.encoder = encoder;
    }

    public Flux<ServerSentEvent<String>> stream(RunInput input) {
        log.debug("run stream requested threadId={} inputMessages={}", input.threadId(), input.messages().size());
        return encoder.encode(aggregator.aggregate(Flux.defer(() -> engine.stream(input)), engine.usageExtractor()));
    }
}
