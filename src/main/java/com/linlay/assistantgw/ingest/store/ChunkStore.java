package com.linlay.assistantgw.ingest.store;

import com.linlay.assistantgw.ingest.model.DocumentChunk;

import java.util.List;

public interface ChunkStore {

    /**
     * Stores one batch and returns the assigned ids in input order.
     */
    List<String> add(List<DocumentChunk> chunks);

    List<DocumentChunk> search(String namespace, String query, int topK);
}
