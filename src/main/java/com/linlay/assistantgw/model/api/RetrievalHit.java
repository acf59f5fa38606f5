package com.linlay.assistantgw.model.api;

import com.linlay.assistantgw.ingest.model.DocumentChunk;

import java.util.Map;

public record RetrievalHit(String namespace, String content, Map<String, Object> metadata) {

    public static RetrievalHit from(DocumentChunk chunk) {
        return new RetrievalHit(chunk.namespace(), chunk.text(), chunk.metadata());
    }
}
