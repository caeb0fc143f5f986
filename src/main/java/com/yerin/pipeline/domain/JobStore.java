package com.yerin.pipeline.domain;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable record of every pipeline job; the single source of truth for job status.
 * <p>
 * Implementations must keep {@link #createIfAbsent} atomic against the
 * one-active-job-per-resource-key rule and must apply transitions for a single job
 * in a total order.
 */
public interface JobStore {

    CreateResult createIfAbsent(NewJob newJob);

    /**
     * @throws com.yerin.pipeline.global.exception.InvalidTransitionException if {@code next} is not reachable
     * @throws com.yerin.pipeline.global.exception.JobNotFoundException if the job does not exist
     */
    Job transition(Long jobId, JobStatus next, JobFailure failure);

    default Job transition(Long jobId, JobStatus next) {
        return transition(jobId, next, null);
    }

    /**
     * Compare-and-set variant of {@link #transition}: applies {@code next} only while the job is
     * still in {@code expected}.
     *
     * @throws com.yerin.pipeline.global.exception.InvalidTransitionException if the job has moved on
     */
    Job transitionIf(Long jobId, JobStatus expected, JobStatus next);

    /** Flags a PROCESSING job for cancellation at its next stage boundary. */
    Job requestCancel(Long jobId);

    void attachMetadata(Long jobId, String metadataJson);

    Optional<Job> get(Long jobId);

    JobPage list(String contentId, JobStatus status, int limit, int offset);

    /** Deletes jobs of {@code tier} finished before {@code cutoff}. Safe to repeat. */
    int purgeExpired(DataTier tier, Instant cutoff);

    long countByStatus(JobStatus status);

    record NewJob(String resourceKey,
                  String contentId,
                  String pipelineVersion,
                  DataTier dataTier,
                  String idempotencyKey) {

        public boolean hasIdempotencyKey() {
            return idempotencyKey != null && !idempotencyKey.isBlank();
        }
    }

    record CreateResult(Job job, boolean created) {}

    record JobPage(List<Job> items, long total) {}
}
