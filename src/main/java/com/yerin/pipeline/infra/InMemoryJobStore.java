package com.yerin.pipeline.infra;

import com.yerin.pipeline.domain.DataTier;
import com.yerin.pipeline.domain.Job;
import com.yerin.pipeline.domain.JobFailure;
import com.yerin.pipeline.domain.JobStatus;
import com.yerin.pipeline.domain.JobStore;
import com.yerin.pipeline.global.exception.InvalidTransitionException;
import com.yerin.pipeline.global.exception.JobNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local {@link JobStore} for running without a database. Every operation holds the
 * store monitor, which gives the same check-then-create atomicity the unique constraints give
 * the JPA store. Callers always receive copies.
 */
@Slf4j
@Component
@Profile("local-inmem")
public class InMemoryJobStore implements JobStore {

    private final Map<Long, Job> jobs = new LinkedHashMap<>();
    private final Map<String, Long> activeByKey = new HashMap<>();
    private final Map<String, Long> byIdempotencyKey = new HashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final Clock clock;

    public InMemoryJobStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized CreateResult createIfAbsent(NewJob newJob) {
        if (newJob.hasIdempotencyKey()) {
            Long hit = byIdempotencyKey.get(newJob.idempotencyKey());
            if (hit != null) return new CreateResult(copy(jobs.get(hit)), false);
        }
        Long active = activeByKey.get(newJob.resourceKey());
        if (active != null) return new CreateResult(copy(jobs.get(active)), false);

        Instant now = clock.instant();
        Job job = Job.builder()
                .id(sequence.incrementAndGet())
                .resourceKey(newJob.resourceKey())
                .activeKey(newJob.resourceKey())
                .contentId(newJob.contentId())
                .status(JobStatus.PENDING)
                .pipelineVersion(newJob.pipelineVersion())
                .dataTier(newJob.dataTier() == null ? DataTier.COMPACT : newJob.dataTier())
                .idempotencyKey(newJob.hasIdempotencyKey() ? newJob.idempotencyKey() : null)
                .createdAt(now)
                .updatedAt(now)
                .build();
        jobs.put(job.getId(), job);
        activeByKey.put(job.getResourceKey(), job.getId());
        if (job.getIdempotencyKey() != null) byIdempotencyKey.put(job.getIdempotencyKey(), job.getId());
        log.debug("[InMemoryJobStore] created jobId={}, resourceKey={}", job.getId(), job.getResourceKey());
        return new CreateResult(copy(job), true);
    }

    @Override
    public synchronized Job transition(Long jobId, JobStatus next, JobFailure failure) {
        Job job = require(jobId);
        job.transitionTo(next, failure, clock.instant());
        if (next.isTerminal()) {
            activeByKey.remove(job.getResourceKey(), jobId);
        }
        return copy(job);
    }

    @Override
    public synchronized Job transitionIf(Long jobId, JobStatus expected, JobStatus next) {
        Job job = require(jobId);
        if (job.getStatus() != expected) {
            throw new InvalidTransitionException(jobId, job.getStatus(), next);
        }
        return transition(jobId, next, null);
    }

    @Override
    public synchronized Job requestCancel(Long jobId) {
        Job job = require(jobId);
        if (job.getStatus() != JobStatus.PROCESSING) {
            throw new InvalidTransitionException(jobId, job.getStatus(), JobStatus.CANCELLED);
        }
        job.setCancelRequested(true);
        job.setUpdatedAt(clock.instant());
        return copy(job);
    }

    @Override
    public synchronized void attachMetadata(Long jobId, String metadataJson) {
        Job job = require(jobId);
        job.setMetadataJson(metadataJson);
        job.setUpdatedAt(clock.instant());
    }

    @Override
    public synchronized Optional<Job> get(Long jobId) {
        return Optional.ofNullable(jobs.get(jobId)).map(InMemoryJobStore::copy);
    }

    @Override
    public synchronized JobPage list(String contentId, JobStatus status, int limit, int offset) {
        List<Job> filtered = jobs.values().stream()
                .filter(j -> contentId == null || contentId.isBlank() || contentId.equals(j.getContentId()))
                .filter(j -> status == null || status == j.getStatus())
                .sorted(Comparator.comparing(Job::getCreatedAt).thenComparing(Job::getId).reversed())
                .toList();
        List<Job> items = filtered.stream()
                .skip(offset)
                .limit(limit)
                .map(InMemoryJobStore::copy)
                .toList();
        return new JobPage(items, filtered.size());
    }

    @Override
    public synchronized int purgeExpired(DataTier tier, Instant cutoff) {
        int removed = 0;
        Iterator<Job> it = jobs.values().iterator();
        while (it.hasNext()) {
            Job job = it.next();
            if (job.getDataTier() == tier && job.getFinishedAt() != null && job.getFinishedAt().isBefore(cutoff)) {
                it.remove();
                if (job.getIdempotencyKey() != null) byIdempotencyKey.remove(job.getIdempotencyKey(), job.getId());
                removed++;
            }
        }
        return removed;
    }

    @Override
    public synchronized long countByStatus(JobStatus status) {
        return jobs.values().stream().filter(j -> j.getStatus() == status).count();
    }

    private Job require(Long jobId) {
        Job job = jobs.get(jobId);
        if (job == null) throw new JobNotFoundException(jobId);
        return job;
    }

    private static Job copy(Job job) {
        return job.toBuilder().build();
    }
}
