package com.linlay.assistantgw.stream.service;

import com.linlay.assistantgw.stream.engine.UsageExtractor;
import com.linlay.assistantgw.stream.model.RunEvent;
import com.linlay.assistantgw.stream.model.RunMessage;
import com.linlay.assistantgw.stream.model.StreamItem;
import com.linlay.assistantgw.stream.model.UsageStats;
import reactor.core.publisher.Flux;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns the raw event sequence of one run into a deduplicated, incrementally growing
 * message stream. Accumulation state is created per subscription and only touched from
 * the upstream's signal thread.
 */
public class RunEventAggregator {

    private final UsageEstimator usageEstimator;

    public RunEventAggregator(UsageEstimator usageEstimator) {
        this.usageEstimator = usageEstimator;
    }

    public Flux<StreamItem> aggregate(Flux<RunEvent> events, UsageExtractor usageExtractor) {
        Objects.requireNonNull(events, "events must not be null");
        UsageExtractor extractor = usageExtractor == null ? UsageExtractor.none() : usageExtractor;
        return Flux.defer(() -> {
            RunState state = new RunState(extractor);
            return events.concatMapIterable(state::accept);
        });
    }

    private final class RunState {

        private final UsageExtractor usageExtractor;
        private final Map<String, RunMessage> messages = new LinkedHashMap<>();
        private String runId;

        private RunState(UsageExtractor usageExtractor) {
            this.usageExtractor = usageExtractor;
        }

        List<StreamItem> accept(RunEvent event) {
            if (event instanceof RunEvent.RunStart start) {
                return onRunStart(start);
            }
            if (event instanceof RunEvent.StateSnapshot snapshot) {
                return onSnapshot(snapshot);
            }
            if (event instanceof RunEvent.TokenDelta delta) {
                return onDelta(delta);
            }
            if (event instanceof RunEvent.Completion completion) {
                return onCompletion(completion);
            }
            return List.of();
        }

        private List<StreamItem> onRunStart(RunEvent.RunStart start) {
            if (runId != null) {
                return List.of();
            }
            runId = start.runId();
            return List.of(new StreamItem.RunId(runId));
        }

        private List<StreamItem> onSnapshot(RunEvent.StateSnapshot snapshot) {
            List<RunMessage> changed = new ArrayList<>();
            for (RunMessage message : snapshot.messages()) {
                RunMessage stored = messages.get(message.id());
                if (message.equals(stored)) {
                    continue;
                }
                messages.put(message.id(), message);
                changed.add(message);
            }
            if (changed.isEmpty()) {
                return List.of();
            }
            return List.of(new StreamItem.Messages(changed));
        }

        private List<StreamItem> onDelta(RunEvent.TokenDelta delta) {
            RunMessage chunk = delta.chunk();
            RunMessage merged = messages.merge(chunk.id(), chunk, MessageMerger::merge);
            return List.of(new StreamItem.Messages(List.of(merged)));
        }

        private List<StreamItem> onCompletion(RunEvent.Completion completion) {
            Optional<UsageStats> usage = usageExtractor.extract(completion);
            if (usage.isEmpty()) {
                usage = usageEstimator.estimate(messages.values());
            }
            return usage.<List<StreamItem>>map(stats -> List.of(new StreamItem.Usage(stats)))
                    .orElse(List.of());
        }
    }
}
