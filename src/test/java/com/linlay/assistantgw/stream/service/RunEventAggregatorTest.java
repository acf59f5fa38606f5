package com.linlay.assistantgw.stream.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.assistantgw.stream.engine.LlmOutputUsageExtractor;
import com.linlay.assistantgw.stream.engine.UsageExtractor;
import com.linlay.assistantgw.stream.model.RunEvent;
import com.linlay.assistantgw.stream.model.RunMessage;
import com.linlay.assistantgw.stream.model.StreamItem;
import com.linlay.assistantgw.stream.model.UsageStats;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RunEventAggregatorTest {

    private final RunEventAggregator aggregator =
            new RunEventAggregator(new UsageEstimator(text -> text.length(), new ObjectMapper()));

    @Test
    void runIdShouldBeEmittedOnlyOnce() {
        List<StreamItem> items = aggregate(
                new RunEvent.RunStart("run_a"),
                new RunEvent.RunStart("run_b")
        );

        assertThat(items).containsExactly(new StreamItem.RunId("run_a"));
    }

    @Test
    void identicalSnapshotsShouldEmitOnce() {
        RunMessage user = RunMessage.user("m1", "hi");

        List<StreamItem> items = aggregate(
                new RunEvent.StateSnapshot(List.of(user)),
                new RunEvent.StateSnapshot(List.of(user))
        );

        assertThat(items).containsExactly(new StreamItem.Messages(List.of(user)));
    }

    @Test
    void snapshotShouldOnlyCarryChangedMessages() {
        RunMessage user = RunMessage.user("m1", "hi");
        RunMessage assistant = RunMessage.assistant("m2", "hello");

        List<StreamItem> items = aggregate(
                new RunEvent.StateSnapshot(List.of(user)),
                new RunEvent.StateSnapshot(List.of(user, assistant))
        );

        assertThat(items).hasSize(2);
        assertThat(((StreamItem.Messages) items.get(1)).messages()).containsExactly(assistant);
    }

    @Test
    void deltasShouldEmitCumulativeText() {
        List<StreamItem> items = aggregate(
                new RunEvent.TokenDelta(RunMessage.assistant("m2", "Hel")),
                new RunEvent.TokenDelta(RunMessage.assistant("m2", "lo"))
        );

        assertThat(items).containsExactly(
                new StreamItem.Messages(List.of(RunMessage.assistant("m2", "Hel"))),
                new StreamItem.Messages(List.of(RunMessage.assistant("m2", "Hello")))
        );
    }

    @Test
    void snapshotMatchingMergedDeltasShouldBeSuppressed() {
        List<StreamItem> items = aggregate(
                new RunEvent.TokenDelta(RunMessage.assistant("m2", "Hel")),
                new RunEvent.TokenDelta(RunMessage.assistant("m2", "lo")),
                new RunEvent.StateSnapshot(List.of(RunMessage.assistant("m2", "Hello")))
        );

        assertThat(items).hasSize(2);
    }

    @Test
    void structuredDeltasShouldMergeKeyByKey() {
        List<StreamItem> items = aggregate(
                new RunEvent.TokenDelta(RunMessage.assistant("m2", Map.of("text", "a", "tool", "search"))),
                new RunEvent.TokenDelta(RunMessage.assistant("m2", Map.of("text", "b")))
        );

        RunMessage last = ((StreamItem.Messages) items.get(1)).messages().get(0);
        assertThat(last.content()).isEqualTo(Map.of("text", "ab", "tool", "search"));
    }

    @Test
    void completionWithoutReportedUsageShouldUseEstimate() {
        List<StreamItem> items = aggregate(
                new RunEvent.StateSnapshot(List.of(RunMessage.user("m1", "abcd"))),
                new RunEvent.TokenDelta(RunMessage.assistant("m2", "xy")),
                RunEvent.Completion.empty()
        );

        assertThat(items.get(items.size() - 1)).isEqualTo(new StreamItem.Usage(UsageStats.estimated(4, 2)));
    }

    @Test
    void estimateShouldBeReproducibleAcrossRuns() {
        RunEvent[] events = {
                new RunEvent.StateSnapshot(List.of(RunMessage.user("m1", "question"))),
                new RunEvent.TokenDelta(RunMessage.assistant("m2", "answer")),
                RunEvent.Completion.empty()
        };

        assertThat(aggregate(events)).isEqualTo(aggregate(events));
    }

    @Test
    void completionWithoutAssistantMessageShouldEmitNoUsage() {
        List<StreamItem> items = aggregate(
                new RunEvent.StateSnapshot(List.of(RunMessage.user("m1", "hi"))),
                RunEvent.Completion.empty()
        );

        assertThat(items).noneMatch(item -> item instanceof StreamItem.Usage);
    }

    @Test
    void reportedUsageShouldWinOverEstimate() {
        Map<String, Object> output = Map.of("llm_output", Map.of("token_usage",
                Map.of("prompt_tokens", 10, "completion_tokens", 5, "total_tokens", 15)));

        List<StreamItem> items = aggregator.aggregate(
                Flux.just(
                        new RunEvent.TokenDelta(RunMessage.assistant("m2", "xy")),
                        new RunEvent.Completion(output)
                ),
                new LlmOutputUsageExtractor()
        ).collectList().block();

        assertThat(items).last().isEqualTo(new StreamItem.Usage(UsageStats.reported(10, 5, 15)));
    }

    @Test
    void eachSubscriptionShouldStartFromEmptyState() {
        Flux<StreamItem> stream = aggregator.aggregate(
                Flux.just(new RunEvent.TokenDelta(RunMessage.assistant("m2", "x"))),
                UsageExtractor.none()
        );

        stream.collectList().block();
        List<StreamItem> second = stream.collectList().block();

        assertThat(second).containsExactly(new StreamItem.Messages(List.of(RunMessage.assistant("m2", "x"))));
    }

    private List<StreamItem> aggregate(RunEvent... events) {
        return aggregator.aggregate(Flux.just(events), UsageExtractor.none()).collectList().block();
    }
}
