package com.yerin.pipeline.domain;

import com.yerin.pipeline.global.exception.InvalidTransitionException;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.DynamicUpdate;

import java.time.Instant;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@Entity
@Table(name = "pipeline_job",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_pipeline_job_active_key", columnNames = "active_key"),
                @UniqueConstraint(name = "uk_pipeline_job_idem_key", columnNames = "idempotency_key")
        },
        indexes = {
                @Index(name = "ix_pipeline_job_resource_key", columnList = "resource_key"),
                @Index(name = "ix_pipeline_job_content_id", columnList = "content_id"),
                @Index(name = "ix_pipeline_job_tier_finished", columnList = "data_tier, finished_at")
        })
@DynamicUpdate
public class Job {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "resource_key", nullable = false)
    private String resourceKey;

    // resource_key while PENDING/PROCESSING, null once terminal
    @Column(name = "active_key")
    private String activeKey;

    @Column(name = "content_id", nullable = false)
    private String contentId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private JobStatus status;

    @Column(name = "pipeline_version", nullable = false, length = 50, updatable = false)
    private String pipelineVersion;

    @Enumerated(EnumType.STRING)
    @Column(name = "data_tier", nullable = false, length = 20, updatable = false)
    private DataTier dataTier;

    @Column(name = "idempotency_key")
    private String idempotencyKey;

    @Column(name = "cancel_requested", nullable = false)
    private boolean cancelRequested;

    @Enumerated(EnumType.STRING)
    @Column(name = "error_code", length = 50)
    private FailureCode errorCode;

    @Column(name = "error_message", length = JobFailure.MAX_MESSAGE_LENGTH)
    private String errorMessage;

    @Enumerated(EnumType.STRING)
    @Column(name = "error_stage", length = 50)
    private ErrorStage errorStage;

    @Column(name = "metadata_json", columnDefinition = "text")
    private String metadataJson;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void prePersist() {
        Instant now = Instant.now();
        if (createdAt == null) createdAt = now;
        if (updatedAt == null) updatedAt = now;
        if (status == null) status = JobStatus.PENDING;
        if (dataTier == null) dataTier = DataTier.COMPACT;
        if (activeKey == null && !status.isTerminal()) activeKey = resourceKey;
    }

    @PreUpdate
    void preUpdate() { updatedAt = Instant.now(); }

    /**
     * Applies {@code next} in place. Used by stores that mutate the entity directly;
     * the JPA store performs the same field changes with a conditional update.
     *
     * @throws InvalidTransitionException when {@code next} is not reachable from the current status
     */
    public void transitionTo(JobStatus next, JobFailure failure, Instant now) {
        if (!status.canTransitionTo(next)) {
            throw new InvalidTransitionException(id, status, next);
        }
        status = next;
        updatedAt = now;
        if (next == JobStatus.PROCESSING) {
            startedAt = now;
        }
        if (next.isTerminal()) {
            finishedAt = now;
            activeKey = null;
        }
        if (next == JobStatus.FAILED && failure != null) {
            errorCode = failure.code();
            errorMessage = failure.message();
            errorStage = failure.stage();
        }
    }

    public boolean isActive() {
        return status != null && !status.isTerminal();
    }
}
