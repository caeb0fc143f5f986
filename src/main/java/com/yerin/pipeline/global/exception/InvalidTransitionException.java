package com.yerin.pipeline.global.exception;

import com.yerin.pipeline.domain.JobStatus;
import com.yerin.pipeline.global.exception.code.JobErrorCode;
import lombok.Getter;

@Getter
public class InvalidTransitionException extends AppException {

    private final Long jobId;
    private final JobStatus from;
    private final JobStatus to;

    public InvalidTransitionException(Long jobId, JobStatus from, JobStatus to) {
        super(JobErrorCode.INVALID_TRANSITION.withDetail(
                "작업 " + jobId + " 상태를 " + from.wireName() + " 에서 " + to.wireName() + " 로 바꿀 수 없습니다."));
        this.jobId = jobId;
        this.from = from;
        this.to = to;
    }
}
