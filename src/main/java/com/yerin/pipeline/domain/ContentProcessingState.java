package com.yerin.pipeline.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Read-optimized processing status per content. Derived from job transitions, last write wins.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Entity
@Table(name = "content_processing_state",
        indexes = @Index(name = "ix_content_state_version", columnList = "pipeline_version"))
public class ContentProcessingState {

    @Id
    @Column(name = "content_id", length = 255)
    private String contentId;

    @Enumerated(EnumType.STRING)
    @Column(name = "processing_status", nullable = false, length = 30)
    private JobStatus processingStatus;

    @Column(name = "pipeline_version", length = 50)
    private String pipelineVersion;

    @Column(name = "last_job_id")
    private Long lastJobId;

    @Column(name = "result_json", columnDefinition = "text")
    private String resultJson;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
}
