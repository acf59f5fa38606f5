package com.linlay.assistantgw.ingest.service;

import com.linlay.assistantgw.ingest.model.Blob;
import com.linlay.assistantgw.ingest.model.ChunkNamespace;
import com.linlay.assistantgw.ingest.model.IngestJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Creates ingest jobs and runs them in the background, detached from the submitting request.
 */
public class IngestJobService {

    private static final Logger log = LoggerFactory.getLogger(IngestJobService.class);

    private final IngestJobRegistry registry;
    private final BatchIngestor ingestor;
    private final Scheduler scheduler;

    public IngestJobService(IngestJobRegistry registry, BatchIngestor ingestor, Scheduler scheduler) {
        this.registry = registry;
        this.ingestor = ingestor;
        this.scheduler = scheduler;
    }

    public IngestJob submit(List<Blob> blobs, ChunkNamespace namespace) {
        if (blobs == null || blobs.isEmpty()) {
            throw new IllegalArgumentException("at least one file is required");
        }
        long totalBytes = blobs.stream().mapToLong(Blob::size).sum();
        IngestJob job = registry.create(totalBytes);
        log.info("ingest job submitted jobId={} files={} totalBytes={} namespace={}",
                job.jobId(), blobs.size(), totalBytes, namespace.value());

        List<Blob> files = List.copyOf(blobs);
        Mono.fromRunnable(() -> run(job.jobId(), files, namespace))
                .subscribeOn(scheduler)
                .subscribe(null, ex -> {
                    log.error("ingest job dispatch failed jobId={}", job.jobId(), ex);
                    registry.markError(job.jobId(), describe(ex));
                });
        return job;
    }

    public Optional<IngestJob> find(String jobId) {
        return registry.get(jobId);
    }

    public boolean cancel(String jobId) {
        boolean canceled = registry.cancel(jobId);
        if (canceled) {
            log.info("ingest job cancel requested jobId={}", jobId);
        }
        return canceled;
    }

    void run(String jobId, List<Blob> blobs, ChunkNamespace namespace) {
        AtomicLong processedBytes = new AtomicLong();
        try {
            if (registry.isCanceled(jobId)) {
                return;
            }
            int stored = 0;
            for (Blob blob : blobs) {
                if (registry.isCanceled(jobId)) {
                    log.info("ingest job canceled jobId={} stored={}", jobId, stored);
                    return;
                }
                List<String> ids = ingestor.ingest(
                        blob,
                        namespace,
                        delta -> registry.updateProgress(jobId, processedBytes.addAndGet(delta)),
                        () -> registry.isCanceled(jobId)
                );
                stored += ids.size();
            }
            registry.markDone(jobId);
            log.info("ingest job done jobId={} stored={} processedBytes={}", jobId, stored, processedBytes.get());
        } catch (Exception ex) {
            log.error("ingest job failed jobId={}", jobId, ex);
            registry.markError(jobId, describe(ex));
        } catch (Error err) {
            log.error("ingest job aborted jobId={}", jobId, err);
            registry.markError(jobId, describe(err));
            throw err;
        }
    }

    private static String describe(Throwable ex) {
        String message = ex.getMessage();
        return message == null || message.isBlank() ? ex.getClass().getSimpleName() : message;
    }
}
