package com.linlay.assistantgw.stream.model;

import java.util.List;
import java.util.Map;

public sealed interface RunEvent permits
        RunEvent.RunStart,
        RunEvent.StateSnapshot,
        RunEvent.TokenDelta,
        RunEvent.Completion {

    record RunStart(String runId) implements RunEvent {
        public RunStart {
            requireNonBlank(runId, "runId");
        }
    }

    record StateSnapshot(List<RunMessage> messages) implements RunEvent {
        public StateSnapshot {
            requireNonNull(messages, "messages");
            messages = List.copyOf(messages);
        }
    }

    /**
     * A partial message: the content carries only the fragment to merge onto the stored value.
     */
    record TokenDelta(RunMessage chunk) implements RunEvent {
        public TokenDelta {
            requireNonNull(chunk, "chunk");
        }
    }

    record Completion(Map<String, Object> output) implements RunEvent {
        public Completion {
            output = output == null ? Map.of() : output;
        }

        public static Completion empty() {
            return new Completion(Map.of());
        }
    }

    private static void requireNonBlank(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be null or blank");
        }
    }

    private static void requireNonNull(Object value, String fieldName) {
        if (value == null) {
            throw new IllegalArgumentException(fieldName + " must not be null");
        }
    }
}
