package com.yerin.pipeline.repository;

import com.yerin.pipeline.domain.Job;
import com.yerin.pipeline.domain.JobStatus;
import org.springframework.data.jpa.domain.Specification;

public final class JobSpecifications {
    private JobSpecifications() {}

    public static Specification<Job> filter(String contentId, JobStatus status) {
        Specification<Job> spec = Specification.where(null);
        if (contentId != null && !contentId.isBlank()) {
            spec = spec.and((root, q, cb) -> cb.equal(root.get("contentId"), contentId));
        }
        if (status != null) {
            spec = spec.and((root, q, cb) -> cb.equal(root.get("status"), status));
        }
        return spec;
    }
}
