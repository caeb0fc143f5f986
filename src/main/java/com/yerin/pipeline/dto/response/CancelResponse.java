package com.yerin.pipeline.dto.response;

import com.yerin.pipeline.domain.JobStatus;
import com.yerin.pipeline.service.PipelineOrchestrator;

public record CancelResponse(Long jobId, JobStatus status, boolean cancelled, String message) {

    public static CancelResponse from(PipelineOrchestrator.CancelOutcome outcome) {
        return new CancelResponse(
                outcome.job().getId(),
                outcome.job().getStatus(),
                outcome.cancelled(),
                outcome.message()
        );
    }
}
