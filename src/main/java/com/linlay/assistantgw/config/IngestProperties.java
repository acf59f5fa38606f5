package com.linlay.assistantgw.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "agent.ingest")
public class IngestProperties {

    private int batchSize = 5;
    private int maxBatchChars = 50_000;
    private int chunkSize = 1_000;
    private int chunkOverlap = 200;
    private int maxFiles = 20;

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public int getMaxBatchChars() {
        return maxBatchChars;
    }

    public void setMaxBatchChars(int maxBatchChars) {
        this.maxBatchChars = maxBatchChars;
    }

    public int getChunkSize() {
        return chunkSize;
    }

    public void setChunkSize(int chunkSize) {
        this.chunkSize = chunkSize;
    }

    public int getChunkOverlap() {
        return chunkOverlap;
    }

    public void setChunkOverlap(int chunkOverlap) {
        this.chunkOverlap = chunkOverlap;
    }

    public int getMaxFiles() {
        return maxFiles;
    }

    public void setMaxFiles(int maxFiles) {
        this.maxFiles = maxFiles;
    }
}
