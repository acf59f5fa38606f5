package com.linlay.assistantgw.model.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.linlay.assistantgw.ingest.model.IngestJob;

public record IngestSubmitResponse(
        @JsonProperty("job_id") String jobId,
        String status
) {

    public static IngestSubmitResponse from(IngestJob job) {
        return new IngestSubmitResponse(job.jobId(), job.status().value());
    }
}
