package com.yerin.pipeline.domain;

import java.util.Map;
import java.util.Optional;

/**
 * Mirrors job status onto the per-content projection. Never authoritative; the job store is.
 */
public interface ContentStatusProjector {

    void project(String contentId, JobStatus status, String pipelineVersion, Long jobId);

    Optional<ContentProcessingState> find(String contentId);

    /** Content count per recorded pipeline version. A null key collects content with no version. */
    Map<String, Long> countByVersion();
}
