package com.linlay.assistantgw.ingest.store;

import com.linlay.assistantgw.ingest.model.DocumentChunk;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.document.Document;
import org.springframework.ai.vectorstore.SearchRequest;
import org.springframework.ai.vectorstore.VectorStore;
import org.springframework.ai.vectorstore.filter.FilterExpressionBuilder;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public class VectorStoreChunkStore implements ChunkStore {

    private static final Logger log = LoggerFactory.getLogger(VectorStoreChunkStore.class);

    private final VectorStore vectorStore;

    public VectorStoreChunkStore(VectorStore vectorStore) {
        this.vectorStore = vectorStore;
    }

    @Override
    public List<String> add(List<DocumentChunk> chunks) {
        if (chunks.isEmpty()) {
            return List.of();
        }
        List<Document> documents = new ArrayList<>(chunks.size());
        List<String> ids = new ArrayList<>(chunks.size());
        for (DocumentChunk chunk : chunks) {
            String id = UUID.randomUUID().toString();
            documents.add(new Document(id, chunk.text(), chunk.metadataWithNamespace()));
            ids.add(id);
        }
        long t0 = System.nanoTime();
        vectorStore.add(documents);
        log.debug("event=vector_store_add chunks={} ms={}", documents.size(), (System.nanoTime() - t0) / 1_000_000);
        return ids;
    }

    @Override
    public List<DocumentChunk> search(String namespace, String query, int topK) {
        SearchRequest request = SearchRequest.builder()
                .query(query)
                .topK(topK)
                .filterExpression(new FilterExpressionBuilder().eq(DocumentChunk.NAMESPACE_KEY, namespace).build())
                .build();
        List<Document> documents = vectorStore.similaritySearch(request);
        List<DocumentChunk> out = new ArrayList<>(documents.size());
        for (Document document : documents) {
            Map<String, Object> metadata = new LinkedHashMap<>(document.getMetadata());
            metadata.remove(DocumentChunk.NAMESPACE_KEY);
            out.add(new DocumentChunk(namespace, document.getText(), metadata));
        }
        log.info("event=vector_search namespace={} topK={} returned={}", namespace, topK, out.size());
        return out;
    }
}
