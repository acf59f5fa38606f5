package com.linlay.assistantgw.ingest.model;

import org.springframework.util.StringUtils;

/**
 * Retrieval scope of ingested chunks: either one assistant or one thread.
 */
public record ChunkNamespace(Scope scope, String value) {

    public enum Scope {
        ASSISTANT,
        THREAD
    }

    public ChunkNamespace {
        if (scope == null) {
            throw new IllegalArgumentException("scope must not be null");
        }
        if (!StringUtils.hasText(value)) {
            throw new IllegalArgumentException("namespace must not be null or blank");
        }
        value = value.trim();
    }

    public static ChunkNamespace resolve(String assistantId, String threadId) {
        boolean hasAssistant = StringUtils.hasText(assistantId);
        boolean hasThread = StringUtils.hasText(threadId);
        if (hasAssistant == hasThread) {
            throw new IllegalArgumentException("Exactly one of assistant_id or thread_id must be provided");
        }
        return hasAssistant
                ? new ChunkNamespace(Scope.ASSISTANT, assistantId)
                : new ChunkNamespace(Scope.THREAD, threadId);
    }
}
