package com.yerin.pipeline.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.yerin.pipeline.domain.Job;
import com.yerin.pipeline.domain.JobStatus;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobResponse(
        Long jobId,
        String contentId,
        JobStatus status,
        Instant createdAt,
        Instant startedAt,
        Instant finishedAt
) {
    public static JobResponse from(Job j) {
        return new JobResponse(
                j.getId(),
                j.getContentId(),
                j.getStatus(),
                j.getCreatedAt(),
                j.getStartedAt(),
                j.getFinishedAt()
        );
    }
}
