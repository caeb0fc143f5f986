package com.yerin.pipeline.global.exception;

import com.yerin.pipeline.global.exception.code.JobErrorCode;
import lombok.Getter;

@Getter
public class JobNotFoundException extends AppException {

    private final Long jobId;

    public JobNotFoundException(Long jobId) {
        super(JobErrorCode.JOB_NOT_FOUND);
        this.jobId = jobId;
    }
}
