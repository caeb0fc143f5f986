package com.yerin.pipeline.dto.response;

import com.yerin.pipeline.domain.JobStore;

import java.util.List;

public record JobListResponse(List<JobResponse> jobs, long total) {

    public static JobListResponse from(JobStore.JobPage page) {
        return new JobListResponse(page.items().stream().map(JobResponse::from).toList(), page.total());
    }
}
