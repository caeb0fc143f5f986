package com.yerin.pipeline.controller;

import com.yerin.pipeline.domain.Job;
import com.yerin.pipeline.domain.JobStatus;
import com.yerin.pipeline.dto.response.JobListResponse;
import com.yerin.pipeline.dto.response.JobResponse;
import com.yerin.pipeline.dto.response.JobStatsResponse;
import com.yerin.pipeline.dto.response.VersionDriftResponse;
import com.yerin.pipeline.global.exception.AppException;
import com.yerin.pipeline.global.exception.JobNotFoundException;
import com.yerin.pipeline.global.exception.code.JobErrorCode;
import com.yerin.pipeline.service.JobQueryService;
import com.yerin.pipeline.service.PipelineOrchestrator;
import com.yerin.pipeline.service.VersionDriftService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(controllers = JobController.class)
@DisplayName("작업 API 컨트롤러 테스트")
class JobControllerTest {

    @Autowired MockMvc mvc;

    @MockBean JobQueryService jobQueryService;
    @MockBean PipelineOrchestrator orchestrator;
    @MockBean VersionDriftService versionDriftService;

    static final Instant T0 = Instant.parse("2024-03-01T00:00:00Z");

    @Test
    @DisplayName("GET /jobs/{id} → data 안에 소문자 상태")
    void get_job() throws Exception {
        when(jobQueryService.get(3L)).thenReturn(new JobResponse(3L, "c-3", JobStatus.PROCESSING, T0, T0, null));

        mvc.perform(get("/jobs/3"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.jobId").value(3))
                .andExpect(jsonPath("$.data.status").value("processing"))
                .andExpect(jsonPath("$.data.finishedAt").doesNotExist());
        verify(jobQueryService, never()).getVerbose(any());
    }

    @Test
    @DisplayName("없는 작업은 404 JOB-001")
    void get_missing_job() throws Exception {
        when(jobQueryService.get(9L)).thenThrow(new JobNotFoundException(9L));

        mvc.perform(get("/jobs/9"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("JOB-001"))
                .andExpect(jsonPath("$.path").value("/jobs/9"));
    }

    @Test
    @DisplayName("limit 범위를 벗어나면 400")
    void list_rejects_bad_limit() throws Exception {
        mvc.perform(get("/jobs").param("limit", "0"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("COMMON-002"));
        mvc.perform(get("/jobs").param("limit", "101"))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(jobQueryService);
    }

    @Test
    @DisplayName("목록 조회는 필터를 그대로 넘기고 기본 limit 50")
    void list_passes_filters() throws Exception {
        when(jobQueryService.list(eq("c-1"), eq("pending"), anyInt(), anyInt()))
                .thenReturn(new JobListResponse(List.of(new JobResponse(1L, "c-1", JobStatus.PENDING, T0, null, null)), 1));

        mvc.perform(get("/jobs").param("contentId", "c-1").param("status", "pending"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.total").value(1))
                .andExpect(jsonPath("$.data.jobs[0].status").value("pending"));
        verify(jobQueryService).list("c-1", "pending", 50, 0);
    }

    @Test
    @DisplayName("알 수 없는 상태 필터는 400 JOB-003")
    void list_unknown_status() throws Exception {
        when(jobQueryService.list(isNull(), eq("queued"), anyInt(), anyInt()))
                .thenThrow(new AppException(JobErrorCode.INVALID_STATUS));

        mvc.perform(get("/jobs").param("status", "queued"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("JOB-003"));
    }

    @Test
    @DisplayName("POST /jobs/{id}/cancel → 취소 결과")
    void cancel_job() throws Exception {
        Job job = Job.builder().id(4L).contentId("c-4").status(JobStatus.CANCELLED).build();
        when(orchestrator.cancel(4L)).thenReturn(new PipelineOrchestrator.CancelOutcome(job, true, "작업이 취소되었습니다."));

        mvc.perform(post("/jobs/4/cancel"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("cancelled"))
                .andExpect(jsonPath("$.data.cancelled").value(true));
    }

    @Test
    @DisplayName("드리프트와 통계 엔드포인트")
    void drift_and_stats() throws Exception {
        when(versionDriftService.report()).thenReturn(new VersionDriftResponse("0.5.0",
                List.of(new VersionDriftResponse.VersionCount("0.4.0", 2)), 2, 1, 10));
        when(jobQueryService.stats()).thenReturn(new JobStatsResponse(Map.of("pending", 1L), 0, 4, 0, 0));

        mvc.perform(get("/jobs/drift"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.staleContent[0].version").value("0.4.0"))
                .andExpect(jsonPath("$.data.totalStale").value(2));
        mvc.perform(get("/jobs/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.jobs.pending").value(1))
                .andExpect(jsonPath("$.data.maxConcurrency").value(4));
    }
}
