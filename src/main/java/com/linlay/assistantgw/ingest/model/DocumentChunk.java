package com.linlay.assistantgw.ingest.model;

import java.util.LinkedHashMap;
import java.util.Map;

public record DocumentChunk(String namespace, String text, Map<String, Object> metadata) {

    public static final String NAMESPACE_KEY = "namespace";

    public DocumentChunk {
        if (namespace == null || namespace.isBlank()) {
            throw new IllegalArgumentException("namespace must not be null or blank");
        }
        text = text == null ? "" : text;
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    /**
     * Builds a chunk with NUL characters replaced by {@code x}; some stores reject them.
     */
    public static DocumentChunk sanitized(ChunkNamespace namespace, String text, Map<String, Object> metadata) {
        String cleaned = text == null ? "" : text.replace('\u0000', 'x');
        return new DocumentChunk(namespace.value(), cleaned, metadata);
    }

    public Map<String, Object> metadataWithNamespace() {
        Map<String, Object> merged = new LinkedHashMap<>(metadata);
        merged.put(NAMESPACE_KEY, namespace);
        return merged;
    }
}
