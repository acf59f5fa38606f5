package com.linlay.assistantgw.stream.engine;

import com.linlay.assistantgw.stream.model.RunEvent;
import com.linlay.assistantgw.stream.model.RunInput;
import reactor.core.publisher.Flux;

public interface GenerationEngine {

    /**
     * Raw events of one run, in arrival order. Each subscription starts a new run.
     */
    Flux<RunEvent> stream(RunInput input);

    default UsageExtractor usageExtractor() {
        return UsageExtractor.none();
    }
}
