package com.linlay.assistantgw.stream.engine;

import com.linlay.assistantgw.stream.model.RunEvent;
import com.linlay.assistantgw.stream.model.UsageStats;

import java.util.Optional;

/**
 * Reads engine-reported usage from a completion event, if the engine reports any.
 */
@FunctionalInterface
public interface UsageExtractor {

    Optional<UsageStats> extract(RunEvent.Completion completion);

    static UsageExtractor none() {
        return completion -> Optional.empty();
    }
}
