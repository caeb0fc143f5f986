package com.yerin.pipeline.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yerin.pipeline.application.Processor;
import com.yerin.pipeline.application.ProcessorException;
import com.yerin.pipeline.application.ProcessorRegistry;
import com.yerin.pipeline.domain.ContentStatusProjector;
import com.yerin.pipeline.domain.DataTier;
import com.yerin.pipeline.domain.FailureCode;
import com.yerin.pipeline.domain.Job;
import com.yerin.pipeline.domain.JobFailure;
import com.yerin.pipeline.domain.JobStatus;
import com.yerin.pipeline.domain.JobStore;
import com.yerin.pipeline.domain.PipelineMetrics;
import com.yerin.pipeline.domain.ProcessingResult;
import com.yerin.pipeline.domain.ResultSink;
import com.yerin.pipeline.global.exception.AppException;
import com.yerin.pipeline.global.exception.InvalidTransitionException;
import com.yerin.pipeline.global.exception.JobNotFoundException;
import com.yerin.pipeline.global.exception.code.CommonErrorCode;
import com.yerin.pipeline.infra.BackgroundTasks;
import com.yerin.pipeline.infra.CallbackDispatcher;
import com.yerin.pipeline.infra.ConcurrencyGate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Owns the job lifecycle: submission with deduplication, gated execution in the background,
 * and cooperative cancellation.
 * <p>
 * {@link #execute(Long)} never throws; every failure ends up on the job as a classified
 * error or, when even that write fails, in the log.
 */
@Slf4j
@Service
public class PipelineOrchestrator {

    private static final int CANCEL_ATTEMPTS = 3;

    private final JobStore jobStore;
    private final ContentStatusProjector projector;
    private final ResultSink resultSink;
    private final ProcessorRegistry processors;
    private final ConcurrencyGate gate;
    private final BackgroundTasks backgroundTasks;
    private final CallbackDispatcher callbacks;
    private final PipelineMetrics metrics;
    private final ObjectMapper objectMapper;
    private final String pipelineVersion;

    public PipelineOrchestrator(JobStore jobStore,
                                ContentStatusProjector projector,
                                ResultSink resultSink,
                                ProcessorRegistry processors,
                                ConcurrencyGate gate,
                                BackgroundTasks backgroundTasks,
                                CallbackDispatcher callbacks,
                                PipelineMetrics metrics,
                                ObjectMapper objectMapper,
                                @Value("${pipeline.version}") String pipelineVersion) {
        this.jobStore = jobStore;
        this.projector = projector;
        this.resultSink = resultSink;
        this.processors = processors;
        this.gate = gate;
        this.backgroundTasks = backgroundTasks;
        this.callbacks = callbacks;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
        this.pipelineVersion = pipelineVersion;
    }

    public String pipelineVersion() {
        return pipelineVersion;
    }

    /**
     * Returns the active (or idempotent) job for the command, or creates a PENDING job and
     * schedules it. Never waits for the gate or the processor.
     */
    public Submission submit(SubmitCommand cmd) {
        DataTier tier = cmd.dataTier() == null ? DataTier.COMPACT : cmd.dataTier();
        JobStore.CreateResult created = jobStore.createIfAbsent(new JobStore.NewJob(
                cmd.resourceKey(), cmd.contentId(), pipelineVersion, tier, cmd.idempotencyKey()));
        Job job = created.job();

        if (!created.created()) {
            metrics.incDeduplicated();
            log.info("[Orchestrator] reuse jobId={} status={} resourceKey={}",
                    job.getId(), job.getStatus().wireName(), job.getResourceKey());
            return new Submission(job, false);
        }

        metrics.incSubmitted();
        projectQuietly(job, JobStatus.PENDING);
        try {
            backgroundTasks.submit("pipeline-job-" + job.getId(), () -> execute(job.getId()));
        } catch (IllegalStateException e) {
            // shutting down: do not leave an orphan PENDING job holding the resource key
            log.warn("[Orchestrator] rejected jobId={} during shutdown", job.getId());
            finishQuietly(job.getId(), JobStatus.CANCELLED, null);
            throw new AppException(CommonErrorCode.SERVICE_UNAVAILABLE, e);
        }
        log.info("[Orchestrator] submitted jobId={} contentId={} resourceKey={} tier={}",
                job.getId(), job.getContentId(), job.getResourceKey(), tier.wireName());
        return new Submission(job, true);
    }

    public void execute(Long jobId) {
        Finished finished = null;
        try (ConcurrencyGate.Permit permit = gate.acquire()) {
            finished = runAdmitted(jobId);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Orchestrator] interrupted before completion jobId={}", jobId);
            finished = abandon(jobId);
        } catch (RuntimeException e) {
            // processor exceptions are classified in runAdmitted; this is the store or projector
            log.error("[Orchestrator] unexpected error jobId={}", jobId, e);
            finished = settleAfterCrash(jobId, JobFailure.of(FailureCode.PERSISTENCE_ERROR, e.toString()));
        } catch (Error e) {
            log.error("[Orchestrator] fatal error jobId={}", jobId, e);
            Finished settled = settleAfterCrash(jobId, JobFailure.of(FailureCode.PROCESSOR_ERROR, e.toString()));
            if (settled != null) {
                callbacks.notifyAsync(settled.job(), settled.summary());
            }
            throw e;
        }

        if (finished != null) {
            callbacks.notifyAsync(finished.job(), finished.summary());
        }
    }

    private Finished runAdmitted(Long jobId) {
        Job job = jobStore.get(jobId).orElse(null);
        if (job == null) {
            log.warn("[Orchestrator] jobId={} vanished before execution", jobId);
            return null;
        }
        if (job.getStatus() != JobStatus.PENDING) {
            log.info("[Orchestrator] skip jobId={} status={}", jobId, job.getStatus().wireName());
            return null;
        }

        try {
            job = jobStore.transitionIf(jobId, JobStatus.PENDING, JobStatus.PROCESSING);
        } catch (InvalidTransitionException e) {
            log.info("[Orchestrator] jobId={} left PENDING before start ({})", jobId, e.getFrom().wireName());
            return null;
        }
        projectQuietly(job, JobStatus.PROCESSING);

        // stage boundary
        Job current = jobStore.get(jobId).orElse(job);
        if (current.isCancelRequested()) {
            Job cancelled = finishQuietly(jobId, JobStatus.CANCELLED, null);
            if (cancelled == null) return null;
            metrics.incCancelled();
            log.info("[Orchestrator] jobId={} cancelled at stage boundary", jobId);
            projectQuietly(cancelled, JobStatus.CANCELLED);
            return new Finished(cancelled, null);
        }

        Processor processor = processors.active();
        ProcessingResult result;
        Duration elapsed;
        long started = System.nanoTime();
        try {
            result = processor.process(current);
        } catch (ProcessorException e) {
            return fail(current, e.toFailure(), e);
        } catch (RuntimeException e) {
            return fail(current, JobFailure.of(FailureCode.PROCESSOR_ERROR, e.toString()), e);
        } finally {
            elapsed = Duration.ofNanos(System.nanoTime() - started);
            metrics.processorTimer(processor.name()).record(elapsed);
        }

        if (result == null || result.summary() == null) {
            return fail(current, JobFailure.of(FailureCode.VALIDATION_FAILED,
                    "processor " + processor.name() + " returned no summary"), null);
        }

        try {
            resultSink.store(current, result);
        } catch (RuntimeException e) {
            return fail(current, JobFailure.of(FailureCode.PERSISTENCE_ERROR, e.toString()), e);
        }

        if (current.getDataTier() == DataTier.FULL) {
            attachDiagnostics(jobId, processor.name(), elapsed, result);
        }

        Job completed = finishQuietly(jobId, JobStatus.COMPLETED, null);
        if (completed == null) return null;
        metrics.incCompleted();
        log.info("[Orchestrator] completed jobId={} in {} ms", jobId, elapsed.toMillis());
        projectQuietly(completed, JobStatus.COMPLETED);
        return new Finished(completed, result.summary());
    }

    private Finished fail(Job job, JobFailure failure, Throwable cause) {
        if (cause != null) {
            log.warn("[Orchestrator] jobId={} failed code={} stage={}: {}", job.getId(),
                    failure.code(), failure.stage().wireName(), failure.message(), cause);
        } else {
            log.warn("[Orchestrator] jobId={} failed code={} stage={}: {}", job.getId(),
                    failure.code(), failure.stage().wireName(), failure.message());
        }
        Job failed = finishQuietly(job.getId(), JobStatus.FAILED, failure);
        if (failed == null) return null;
        metrics.incFailed(failure.code());
        projectQuietly(failed, JobStatus.FAILED);
        return new Finished(failed, null);
    }

    private Finished abandon(Long jobId) {
        Job job = jobStore.get(jobId).orElse(null);
        if (job == null || job.getStatus().isTerminal()) return null;
        Job cancelled = finishQuietly(jobId, JobStatus.CANCELLED, null);
        if (cancelled == null) return null;
        metrics.incCancelled();
        projectQuietly(cancelled, JobStatus.CANCELLED);
        return new Finished(cancelled, null);
    }

    /**
     * Best effort after execute blew up: a PROCESSING job is failed with {@code failure}, a
     * PENDING one is cancelled, so the resource key is released either way.
     */
    private Finished settleAfterCrash(Long jobId, JobFailure failure) {
        Job job;
        try {
            job = jobStore.get(jobId).orElse(null);
        } catch (RuntimeException e) {
            log.error("[Orchestrator] jobId={} left unsettled, store unreachable", jobId, e);
            return null;
        }
        if (job == null || job.getStatus().isTerminal()) return null;
        if (job.getStatus() == JobStatus.PENDING) return abandon(jobId);
        return fail(job, failure, null);
    }

    /**
     * PENDING jobs are cancelled at once; PROCESSING jobs are flagged and stop at the next
     * stage boundary; terminal jobs are left alone.
     */
    public CancelOutcome cancel(Long jobId) {
        Job job = jobStore.get(jobId).orElseThrow(() -> new JobNotFoundException(jobId));

        for (int attempt = 0; attempt < CANCEL_ATTEMPTS; attempt++) {
            switch (job.getStatus()) {
                case PENDING -> {
                    try {
                        Job cancelled = jobStore.transitionIf(jobId, JobStatus.PENDING, JobStatus.CANCELLED);
                        metrics.incCancelled();
                        projectQuietly(cancelled, JobStatus.CANCELLED);
                        log.info("audit.cancellation job_id={} outcome=cancelled", jobId);
                        callbacks.notifyAsync(cancelled, null);
                        return new CancelOutcome(cancelled, true, "작업이 취소되었습니다.");
                    } catch (InvalidTransitionException e) {
                        log.debug("[Orchestrator] cancel raced with executor jobId={}", jobId);
                    }
                }
                case PROCESSING -> {
                    try {
                        Job flagged = jobStore.requestCancel(jobId);
                        log.info("audit.cancellation job_id={} outcome=cancel_requested", jobId);
                        return new CancelOutcome(flagged, true, "취소가 요청되었습니다. 처리 시작 전 단계에서 적용됩니다.");
                    } catch (InvalidTransitionException e) {
                        log.debug("[Orchestrator] cancel request raced with completion jobId={}", jobId);
                    }
                }
                default -> {
                    log.info("audit.cancellation job_id={} outcome=already_{}", jobId, job.getStatus().wireName());
                    return new CancelOutcome(job, false, "이미 종료된 작업입니다: " + job.getStatus().wireName());
                }
            }
            job = jobStore.get(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
        }
        log.info("audit.cancellation job_id={} outcome=unchanged status={}", jobId, job.getStatus().wireName());
        return new CancelOutcome(job, false, "작업 상태가 계속 바뀌고 있어 취소하지 못했습니다.");
    }

    private void attachDiagnostics(Long jobId, String processor, Duration elapsed, ProcessingResult result) {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("processor", processor);
        meta.put("duration_ms", elapsed.toMillis());
        meta.put("diagnostics", result.diagnostics());
        try {
            jobStore.attachMetadata(jobId, objectMapper.writeValueAsString(meta));
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("[Orchestrator] diagnostics not stored jobId={}: {}", jobId, e.toString());
        }
    }

    private Job finishQuietly(Long jobId, JobStatus next, JobFailure failure) {
        try {
            return jobStore.transition(jobId, next, failure);
        } catch (RuntimeException e) {
            log.error("[Orchestrator] could not move jobId={} to {}", jobId, next.wireName(), e);
            return null;
        }
    }

    private void projectQuietly(Job job, JobStatus status) {
        try {
            projector.project(job.getContentId(), status, job.getPipelineVersion(), job.getId());
        } catch (RuntimeException e) {
            log.warn("[Orchestrator] projection failed contentId={} status={}: {}",
                    job.getContentId(), status.wireName(), e.toString());
        }
    }

    public record Submission(Job job, boolean created) {}

    public record CancelOutcome(Job job, boolean cancelled, String message) {}

    private record Finished(Job job, Map<String, Object> summary) {}
}
