package com.linlay.assistantgw.model.api;

import com.fasterxml.jackson.annotation.JsonProperty;

public record IngestCancelResponse(
        @JsonProperty("job_id") String jobId,
        String status
) {
}
