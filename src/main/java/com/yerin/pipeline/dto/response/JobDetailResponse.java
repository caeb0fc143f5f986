package com.yerin.pipeline.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.yerin.pipeline.domain.DataTier;
import com.yerin.pipeline.domain.ErrorStage;
import com.yerin.pipeline.domain.FailureCode;
import com.yerin.pipeline.domain.Job;
import com.yerin.pipeline.domain.JobStatus;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobDetailResponse(
        Long jobId,
        String contentId,
        JobStatus status,
        Instant createdAt,
        Instant startedAt,
        Instant finishedAt,
        FailureCode errorCode,
        String errorMessage,
        ErrorStage errorStage,
        String resourceKey,
        String pipelineVersion,
        DataTier dataTier,
        Boolean cancelRequested,
        JsonNode metadata
) {
    public static JobDetailResponse from(Job j, JsonNode metadata) {
        return new JobDetailResponse(
                j.getId(),
                j.getContentId(),
                j.getStatus(),
                j.getCreatedAt(),
                j.getStartedAt(),
                j.getFinishedAt(),
                j.getErrorCode(),
                j.getErrorMessage(),
                j.getErrorStage(),
                j.getResourceKey(),
                j.getPipelineVersion(),
                j.getDataTier(),
                j.isCancelRequested(),
                metadata
        );
    }
}
