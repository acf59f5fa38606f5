package com.linlay.assistantgw.ingest.model;

import java.time.Instant;

/**
 * Point-in-time copy of a registry entry. Never a live view.
 */
public record IngestJob(
        String jobId,
        IngestJobStatus status,
        double progress,
        String error,
        long totalBytes,
        long processedBytes,
        Instant createdAt,
        Instant updatedAt
) {

    public boolean isCanceled() {
        return status == IngestJobStatus.CANCELED;
    }
}
