package com.linlay.assistantgw.ingest.service;

import com.linlay.assistantgw.ingest.model.Blob;
import com.linlay.assistantgw.ingest.model.ChunkNamespace;
import com.linlay.assistantgw.ingest.model.DocumentChunk;
import com.linlay.assistantgw.ingest.model.IngestBatchPolicy;
import com.linlay.assistantgw.ingest.parser.BlobParser;
import com.linlay.assistantgw.ingest.store.ChunkStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.document.Document;
import org.springframework.ai.transformer.splitter.TextSplitter;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.function.BooleanSupplier;
import java.util.function.LongConsumer;
import java.util.stream.Stream;

/**
 * Parses, splits and stores one blob in batches.
 * <p>
 * Cancellation is polled before each chunk, before a threshold flush and before the final
 * flush; once observed, the ids stored so far are returned.
 */
public class BatchIngestor {

    private static final Logger log = LoggerFactory.getLogger(BatchIngestor.class);

    private final BlobParser parser;
    private final TextSplitter splitter;
    private final ChunkStore store;
    private final IngestBatchPolicy policy;

    public BatchIngestor(BlobParser parser, TextSplitter splitter, ChunkStore store) {
        this(parser, splitter, store, IngestBatchPolicy.BULK);
    }

    public BatchIngestor(BlobParser parser, TextSplitter splitter, ChunkStore store, IngestBatchPolicy policy) {
        this.parser = parser;
        this.splitter = splitter;
        this.store = store;
        this.policy = policy;
    }

    public List<String> ingest(Blob blob, ChunkNamespace namespace) {
        return ingest(blob, namespace, bytes -> {
        }, () -> false);
    }

    public List<String> ingest(
            Blob blob,
            ChunkNamespace namespace,
            LongConsumer progressSink,
            BooleanSupplier shouldCancel
    ) {
        List<String> ids = new ArrayList<>();
        List<DocumentChunk> buffer = new ArrayList<>();
        int bufferedChars = 0;

        try (Stream<Document> documents = parser.parse(blob)) {
            Iterator<Document> iterator = documents.iterator();
            while (iterator.hasNext()) {
                Document document = iterator.next();
                for (Document piece : splitter.apply(List.of(document))) {
                    if (shouldCancel.getAsBoolean()) {
                        log.info("ingest canceled blob={} stored={}", blob.name(), ids.size());
                        return ids;
                    }
                    DocumentChunk chunk = DocumentChunk.sanitized(namespace, piece.getText(), piece.getMetadata());
                    buffer.add(chunk);
                    bufferedChars += chunk.text().codePointCount(0, chunk.text().length());

                    long processedBytes = chunk.text().getBytes(StandardCharsets.UTF_8).length;
                    if (processedBytes > 0) {
                        progressSink.accept(processedBytes);
                    }

                    if (buffer.size() >= policy.batchSize() || bufferedChars >= policy.maxBatchChars()) {
                        if (shouldCancel.getAsBoolean()) {
                            log.info("ingest canceled before flush blob={} stored={}", blob.name(), ids.size());
                            return ids;
                        }
                        ids.addAll(store.add(List.copyOf(buffer)));
                        buffer.clear();
                        bufferedChars = 0;
                    }
                }
            }
        }

        if (!buffer.isEmpty()) {
            if (shouldCancel.getAsBoolean()) {
                log.info("ingest canceled before final flush blob={} stored={}", blob.name(), ids.size());
                return ids;
            }
            ids.addAll(store.add(List.copyOf(buffer)));
        }
        log.debug("ingest finished blob={} namespace={} stored={}", blob.name(), namespace.value(), ids.size());
        return ids;
    }
}
