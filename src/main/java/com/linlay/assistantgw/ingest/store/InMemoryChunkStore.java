package com.linlay.assistantgw.ingest.store;

import com.linlay.assistantgw.ingest.model.DocumentChunk;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Keyword-overlap store used when no vector store is configured.
 */
public class InMemoryChunkStore implements ChunkStore {

    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}]+");

    private final Map<String, DocumentChunk> chunks = new LinkedHashMap<>();
    private final Object lock = new Object();

    @Override
    public List<String> add(List<DocumentChunk> batch) {
        List<String> ids = new ArrayList<>(batch.size());
        synchronized (lock) {
            for (DocumentChunk chunk : batch) {
                String id = UUID.randomUUID().toString();
                chunks.put(id, chunk);
                ids.add(id);
            }
        }
        return ids;
    }

    @Override
    public List<DocumentChunk> search(String namespace, String query, int topK) {
        Set<String> terms = terms(query);
        List<DocumentChunk> candidates;
        synchronized (lock) {
            candidates = chunks.values().stream()
                    .filter(chunk -> chunk.namespace().equals(namespace))
                    .toList();
        }
        return candidates.stream()
                .map(chunk -> Map.entry(chunk, score(terms, chunk)))
                .filter(entry -> terms.isEmpty() || entry.getValue() > 0)
                .sorted(Map.Entry.<DocumentChunk, Long>comparingByValue(Comparator.reverseOrder()))
                .limit(Math.max(0, topK))
                .map(Map.Entry::getKey)
                .toList();
    }

    public int size() {
        synchronized (lock) {
            return chunks.size();
        }
    }

    private static long score(Set<String> terms, DocumentChunk chunk) {
        Set<String> chunkTerms = terms(chunk.text());
        return terms.stream().filter(chunkTerms::contains).count();
    }

    private static Set<String> terms(String text) {
        if (text == null || text.isBlank()) {
            return Set.of();
        }
        return NON_WORD.splitAsStream(text.toLowerCase(Locale.ROOT))
                .filter(term -> !term.isBlank())
                .collect(Collectors.toSet());
    }
}
