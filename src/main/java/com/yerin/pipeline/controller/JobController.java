package com.yerin.pipeline.controller;

import com.yerin.pipeline.dto.response.CancelResponse;
import com.yerin.pipeline.dto.response.JobListResponse;
import com.yerin.pipeline.dto.response.JobStatsResponse;
import com.yerin.pipeline.dto.response.VersionDriftResponse;
import com.yerin.pipeline.global.dto.DataResponse;
import com.yerin.pipeline.service.JobQueryService;
import com.yerin.pipeline.service.PipelineOrchestrator;
import com.yerin.pipeline.service.VersionDriftService;
import io.swagger.v3.oas.annotations.Parameter;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/jobs")
@RequiredArgsConstructor
public class JobController {

    private final JobQueryService jobQueryService;
    private final PipelineOrchestrator orchestrator;
    private final VersionDriftService versionDriftService;

    @GetMapping("/{jobId}")
    public ResponseEntity<DataResponse<?>> get(@PathVariable Long jobId,
                                               @RequestParam(defaultValue = "false")
                                               @Parameter(description = "오류/메타데이터 포함 여부 (감사 로그 기록)")
                                               boolean verbose) {
        if (verbose) {
            return ResponseEntity.ok(DataResponse.from(jobQueryService.getVerbose(jobId)));
        }
        return ResponseEntity.ok(DataResponse.from(jobQueryService.get(jobId)));
    }

    @GetMapping
    public ResponseEntity<DataResponse<JobListResponse>> list(
            @RequestParam(required = false) @Parameter(description = "콘텐츠 ID 필터") String contentId,
            @RequestParam(required = false) @Parameter(description = "상태 필터", example = "pending") String status,
            @RequestParam(defaultValue = "50") @Min(1) @Max(100) int limit,
            @RequestParam(defaultValue = "0") @Min(0) int offset) {
        return ResponseEntity.ok(DataResponse.from(jobQueryService.list(contentId, status, limit, offset)));
    }

    @PostMapping("/{jobId}/cancel")
    public ResponseEntity<DataResponse<CancelResponse>> cancel(@PathVariable Long jobId) {
        return ResponseEntity.ok(DataResponse.from(CancelResponse.from(orchestrator.cancel(jobId))));
    }

    @GetMapping("/drift")
    public ResponseEntity<DataResponse<VersionDriftResponse>> drift() {
        return ResponseEntity.ok(DataResponse.from(versionDriftService.report()));
    }

    @GetMapping("/stats")
    public ResponseEntity<DataResponse<JobStatsResponse>> stats() {
        return ResponseEntity.ok(DataResponse.from(jobQueryService.stats()));
    }
}
