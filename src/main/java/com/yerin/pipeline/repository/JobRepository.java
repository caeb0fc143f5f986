package com.yerin.pipeline.repository;

import com.yerin.pipeline.domain.DataTier;
import com.yerin.pipeline.domain.ErrorStage;
import com.yerin.pipeline.domain.FailureCode;
import com.yerin.pipeline.domain.Job;
import com.yerin.pipeline.domain.JobStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Optional;

public interface JobRepository extends JpaRepository<Job, Long>, JpaSpecificationExecutor<Job> {

    Optional<Job> findByIdempotencyKey(String idempotencyKey);

    Optional<Job> findByActiveKey(String activeKey);

    long countByStatus(JobStatus status);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
       update Job j
          set j.status = com.yerin.pipeline.domain.JobStatus.PROCESSING,
              j.startedAt = :now,
              j.updatedAt = :now
        where j.id = :id
          and j.status = com.yerin.pipeline.domain.JobStatus.PENDING
       """)
    int startIfPending(@Param("id") Long id, @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
       update Job j
          set j.status = :status,
              j.finishedAt = :now,
              j.updatedAt = :now,
              j.activeKey = null,
              j.errorCode = :errorCode,
              j.errorMessage = :errorMessage,
              j.errorStage = :errorStage
        where j.id = :id
          and j.status = :expectedCurrent
       """)
    int finishIf(@Param("id") Long id,
                 @Param("expectedCurrent") JobStatus expectedCurrent,
                 @Param("status") JobStatus terminalStatus,
                 @Param("now") Instant now,
                 @Param("errorCode") FailureCode errorCode,
                 @Param("errorMessage") String errorMessage,
                 @Param("errorStage") ErrorStage errorStage);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
       update Job j
          set j.cancelRequested = true,
              j.updatedAt = :now
        where j.id = :id
          and j.status = com.yerin.pipeline.domain.JobStatus.PROCESSING
       """)
    int requestCancelIfProcessing(@Param("id") Long id, @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update Job j set j.metadataJson = :json, j.updatedAt = :now where j.id = :id")
    int updateMetadata(@Param("id") Long id, @Param("json") String json, @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
       delete from Job j
        where j.dataTier = :tier
          and j.finishedAt is not null
          and j.finishedAt < :cutoff
       """)
    int deleteFinishedBefore(@Param("tier") DataTier tier, @Param("cutoff") Instant cutoff);
}
