package com.yerin.pipeline.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yerin.pipeline.domain.Job;
import com.yerin.pipeline.domain.JobStatus;
import com.yerin.pipeline.domain.JobStore;
import com.yerin.pipeline.dto.response.JobDetailResponse;
import com.yerin.pipeline.dto.response.JobListResponse;
import com.yerin.pipeline.dto.response.JobResponse;
import com.yerin.pipeline.dto.response.JobStatsResponse;
import com.yerin.pipeline.global.exception.AppException;
import com.yerin.pipeline.global.exception.JobNotFoundException;
import com.yerin.pipeline.global.exception.code.JobErrorCode;
import com.yerin.pipeline.infra.BackgroundTasks;
import com.yerin.pipeline.infra.ConcurrencyGate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class JobQueryService {

    private final JobStore jobStore;
    private final ConcurrencyGate gate;
    private final BackgroundTasks backgroundTasks;
    private final ObjectMapper objectMapper;

    public JobResponse get(Long jobId) {
        return JobResponse.from(require(jobId));
    }

    /** Full record including error fields and FULL tier metadata. Audited. */
    public JobDetailResponse getVerbose(Long jobId) {
        Job job = require(jobId);
        log.info("audit.full_tier_access job_id={} tier={}", jobId, job.getDataTier().wireName());
        return JobDetailResponse.from(job, parseMetadata(job));
    }

    public JobListResponse list(String contentId, String status, int limit, int offset) {
        JobStatus filter = null;
        if (status != null && !status.isBlank()) {
            filter = JobStatus.parse(status).orElseThrow(() -> new AppException(
                    JobErrorCode.INVALID_STATUS.withDetail("알 수 없는 작업 상태입니다: " + status + " (허용: "
                            + Arrays.stream(JobStatus.values()).map(JobStatus::wireName).collect(Collectors.joining(", "))
                            + ")")));
        }
        return JobListResponse.from(jobStore.list(contentId, filter, limit, offset));
    }

    public JobStatsResponse stats() {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (JobStatus s : JobStatus.values()) {
            counts.put(s.wireName(), jobStore.countByStatus(s));
        }
        return new JobStatsResponse(counts, gate.inFlight(), gate.maxConcurrency(),
                gate.queueLength(), backgroundTasks.inFlight());
    }

    private Job require(Long jobId) {
        return jobStore.get(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    private JsonNode parseMetadata(Job job) {
        if (job.getMetadataJson() == null) return null;
        try {
            return objectMapper.readTree(job.getMetadataJson());
        } catch (JsonProcessingException e) {
            log.warn("[JobQuery] unreadable metadata jobId={}: {}", job.getId(), e.getOriginalMessage());
            return objectMapper.getNodeFactory().textNode(job.getMetadataJson());
        }
    }
}
