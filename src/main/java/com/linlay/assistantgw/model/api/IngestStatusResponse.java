package com.linlay.assistantgw.model.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.linlay.assistantgw.ingest.model.IngestJob;

public record IngestStatusResponse(
        @JsonProperty("job_id") String jobId,
        String status,
        double progress,
        String error
) {

    public static IngestStatusResponse from(IngestJob job) {
        return new IngestStatusResponse(job.jobId(), job.status().value(), job.progress(), job.error());
    }
}
