package com.yerin.pipeline.infra;

import com.yerin.pipeline.domain.DataTier;
import com.yerin.pipeline.domain.Job;
import com.yerin.pipeline.domain.JobFailure;
import com.yerin.pipeline.domain.JobStatus;
import com.yerin.pipeline.domain.JobStore;
import com.yerin.pipeline.global.exception.InvalidTransitionException;
import com.yerin.pipeline.global.exception.JobNotFoundException;
import com.yerin.pipeline.repository.JobRepository;
import com.yerin.pipeline.repository.JobSpecifications;
import com.yerin.pipeline.repository.OffsetLimitRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * PostgreSQL-backed {@link JobStore}.
 * <p>
 * Deduplication rests on two unique constraints: {@code active_key} (set only while a job is
 * non-terminal) and {@code idempotency_key}. Status changes are compare-and-set updates on the
 * current status, so concurrent writers for one job are serialized by the database.
 */
@Slf4j
@Component
@Profile("!local-inmem")
public class JpaJobStore implements JobStore {

    private static final int MAX_ATTEMPTS = 3;

    private final JobRepository jobRepository;
    private final TransactionTemplate tx;
    private final Clock clock;

    public JpaJobStore(JobRepository jobRepository, PlatformTransactionManager txManager, Clock clock) {
        this.jobRepository = jobRepository;
        this.tx = new TransactionTemplate(txManager);
        this.clock = clock;
    }

    @Override
    public CreateResult createIfAbsent(NewJob newJob) {
        DataIntegrityViolationException lastConflict = null;
        for (int attempt = 0; attempt < MAX_ATTEMPTS; attempt++) {
            Optional<Job> existing = findExisting(newJob);
            if (existing.isPresent()) {
                return new CreateResult(existing.get(), false);
            }

            try {
                Job saved = tx.execute(status -> jobRepository.saveAndFlush(Job.builder()
                        .resourceKey(newJob.resourceKey())
                        .activeKey(newJob.resourceKey())
                        .contentId(newJob.contentId())
                        .status(JobStatus.PENDING)
                        .pipelineVersion(newJob.pipelineVersion())
                        .dataTier(newJob.dataTier())
                        .idempotencyKey(newJob.hasIdempotencyKey() ? newJob.idempotencyKey() : null)
                        .createdAt(clock.instant())
                        .build()));
                return new CreateResult(saved, true);
            } catch (DataIntegrityViolationException e) {
                // another submission won the insert; re-read the winner
                log.debug("[JobStore] create conflict resourceKey={}, attempt={}", newJob.resourceKey(), attempt + 1);
                lastConflict = e;
            }
        }
        throw lastConflict;
    }

    private Optional<Job> findExisting(NewJob newJob) {
        if (newJob.hasIdempotencyKey()) {
            Optional<Job> hit = jobRepository.findByIdempotencyKey(newJob.idempotencyKey());
            if (hit.isPresent()) return hit;
        }
        return jobRepository.findByActiveKey(newJob.resourceKey());
    }

    @Override
    public Job transition(Long jobId, JobStatus next, JobFailure failure) {
        Job current = null;
        for (int attempt = 0; attempt < MAX_ATTEMPTS; attempt++) {
            current = jobRepository.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
            JobStatus from = current.getStatus();
            if (!from.canTransitionTo(next)) {
                throw new InvalidTransitionException(jobId, from, next);
            }

            Instant now = clock.instant();
            JobFailure f = next == JobStatus.FAILED ? failure : null;
            Integer updated = tx.execute(status -> next == JobStatus.PROCESSING
                    ? jobRepository.startIfPending(jobId, now)
                    : jobRepository.finishIf(jobId, from, next, now,
                            f == null ? null : f.code(),
                            f == null ? null : f.message(),
                            f == null ? null : f.stage()));

            if (updated != null && updated == 1) {
                return jobRepository.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
            }
            log.debug("[JobStore] transition lost race jobId={}, {}->{}", jobId, from, next);
        }
        throw new InvalidTransitionException(jobId, current.getStatus(), next);
    }

    @Override
    public Job transitionIf(Long jobId, JobStatus expected, JobStatus next) {
        Job current = jobRepository.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
        if (current.getStatus() != expected || !expected.canTransitionTo(next)) {
            throw new InvalidTransitionException(jobId, current.getStatus(), next);
        }
        Instant now = clock.instant();
        Integer updated = tx.execute(status -> next == JobStatus.PROCESSING
                ? jobRepository.startIfPending(jobId, now)
                : jobRepository.finishIf(jobId, expected, next, now, null, null, null));
        Job after = jobRepository.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
        if (updated == null || updated == 0) {
            throw new InvalidTransitionException(jobId, after.getStatus(), next);
        }
        return after;
    }

    @Override
    public Job requestCancel(Long jobId) {
        Integer updated = tx.execute(status -> jobRepository.requestCancelIfProcessing(jobId, clock.instant()));
        Job job = jobRepository.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
        if ((updated == null || updated == 0) && job.getStatus() != JobStatus.PROCESSING) {
            throw new InvalidTransitionException(jobId, job.getStatus(), JobStatus.CANCELLED);
        }
        return job;
    }

    @Override
    public void attachMetadata(Long jobId, String metadataJson) {
        tx.executeWithoutResult(status -> jobRepository.updateMetadata(jobId, metadataJson, clock.instant()));
    }

    @Override
    public Optional<Job> get(Long jobId) {
        return jobRepository.findById(jobId);
    }

    @Override
    public JobPage list(String contentId, JobStatus status, int limit, int offset) {
        Page<Job> page = jobRepository.findAll(
                JobSpecifications.filter(contentId, status),
                OffsetLimitRequest.of(offset, limit, Sort.by(Sort.Direction.DESC, "createdAt", "id")));
        return new JobPage(page.getContent(), page.getTotalElements());
    }

    @Override
    public int purgeExpired(DataTier tier, Instant cutoff) {
        Integer deleted = tx.execute(status -> jobRepository.deleteFinishedBefore(tier, cutoff));
        return deleted == null ? 0 : deleted;
    }

    @Override
    public long countByStatus(JobStatus status) {
        return jobRepository.countByStatus(status);
    }
}
