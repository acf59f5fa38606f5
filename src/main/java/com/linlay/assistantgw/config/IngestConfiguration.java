package com.linlay.assistantgw.config;

import com.linlay.assistantgw.ingest.model.IngestBatchPolicy;
import com.linlay.assistantgw.ingest.parser.BlobParser;
import com.linlay.assistantgw.ingest.parser.MimeTypeBasedBlobParser;
import com.linlay.assistantgw.ingest.service.BatchIngestor;
import com.linlay.assistantgw.ingest.service.IngestJobRegistry;
import com.linlay.assistantgw.ingest.service.IngestJobService;
import com.linlay.assistantgw.ingest.split.CharacterWindowTextSplitter;
import com.linlay.assistantgw.ingest.store.ChunkStore;
import com.linlay.assistantgw.ingest.store.InMemoryChunkStore;
import com.linlay.assistantgw.ingest.store.VectorStoreChunkStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.transformer.splitter.TextSplitter;
import org.springframework.ai.vectorstore.VectorStore;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

@Configuration(proxyBeanMethods = false)
public class IngestConfiguration {

    private static final Logger log = LoggerFactory.getLogger(IngestConfiguration.class);

    @Bean
    public IngestJobRegistry ingestJobRegistry() {
        return new IngestJobRegistry();
    }

    @Bean
    @ConditionalOnMissingBean
    public BlobParser blobParser() {
        return MimeTypeBasedBlobParser.standard();
    }

    @Bean
    @ConditionalOnMissingBean
    public TextSplitter ingestTextSplitter(IngestProperties properties) {
        return new CharacterWindowTextSplitter(properties.getChunkSize(), properties.getChunkOverlap());
    }

    @Bean
    @ConditionalOnMissingBean
    public ChunkStore chunkStore(ObjectProvider<VectorStore> vectorStore) {
        VectorStore available = vectorStore.getIfAvailable();
        if (available == null) {
            log.warn("No VectorStore configured, ingested chunks are kept in memory only");
            return new InMemoryChunkStore();
        }
        return new VectorStoreChunkStore(available);
    }

    @Bean
    public BatchIngestor batchIngestor(
            BlobParser blobParser,
            TextSplitter ingestTextSplitter,
            ChunkStore chunkStore,
            IngestProperties properties
    ) {
        IngestBatchPolicy policy = new IngestBatchPolicy(properties.getBatchSize(), properties.getMaxBatchChars());
        return new BatchIngestor(blobParser, ingestTextSplitter, chunkStore, policy);
    }

    @Bean(destroyMethod = "dispose")
    public Scheduler ingestScheduler() {
        return Schedulers.newBoundedElastic(
                Schedulers.DEFAULT_BOUNDED_ELASTIC_SIZE,
                Schedulers.DEFAULT_BOUNDED_ELASTIC_QUEUESIZE,
                "ingest"
        );
    }

    @Bean
    public IngestJobService ingestJobService(
            IngestJobRegistry ingestJobRegistry,
            BatchIngestor batchIngestor,
            Scheduler ingestScheduler
    ) {
        return new IngestJobService(ingestJobRegistry, batchIngestor, ingestScheduler);
    }
}
