package com.linlay.assistantgw.controller;

import com.linlay.assistantgw.ingest.store.ChunkStore;
import com.linlay.assistantgw.model.api.RetrievalHit;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/retrieval")
public class RetrievalController {

    private static final int MAX_TOP_K = 50;

    private final ChunkStore chunkStore;

    public RetrievalController(ChunkStore chunkStore) {
        this.chunkStore = chunkStore;
    }

    @GetMapping
    public List<RetrievalHit> search(
            @RequestParam String namespace,
            @RequestParam String query,
            @RequestParam(defaultValue = "4") int k
    ) {
        if (!StringUtils.hasText(namespace)) {
            throw new IllegalArgumentException("namespace must not be blank");
        }
        int topK = Math.max(1, Math.min(k, MAX_TOP_K));
        return chunkStore.search(namespace.trim(), query, topK).stream()
                .map(RetrievalHit::from)
                .toList();
    }
}
