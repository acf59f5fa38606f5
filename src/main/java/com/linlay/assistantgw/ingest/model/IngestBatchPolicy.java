package com.linlay.assistantgw.ingest.model;

/**
 * Flush thresholds of the batching ingestor: whichever is reached first triggers a flush.
 */
public record IngestBatchPolicy(int batchSize, int maxBatchChars) {

    public static final IngestBatchPolicy BULK = new IngestBatchPolicy(100, 50_000);
    public static final IngestBatchPolicy PER_REQUEST = new IngestBatchPolicy(5, 50_000);

    public IngestBatchPolicy {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0");
        }
        if (maxBatchChars <= 0) {
            throw new IllegalArgumentException("maxBatchChars must be > 0");
        }
    }
}
