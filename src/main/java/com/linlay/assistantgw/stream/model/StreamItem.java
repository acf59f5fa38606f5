package com.linlay.assistantgw.stream.model;

import java.util.List;

/**
 * Output of the run aggregator, one case per frame kind.
 */
public sealed interface StreamItem permits StreamItem.RunId, StreamItem.Messages, StreamItem.Usage {

    record RunId(String runId) implements StreamItem {
    }

    record Messages(List<RunMessage> messages) implements StreamItem {
        public Messages {
            if (messages == null || messages.isEmpty()) {
                throw new IllegalArgumentException("messages must not be empty");
            }
            messages = List.copyOf(messages);
        }
    }

    record Usage(UsageStats usage) implements StreamItem {
    }
}
