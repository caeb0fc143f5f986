package com.yerin.pipeline.global.exception;

import com.yerin.pipeline.domain.ErrorStage;
import com.yerin.pipeline.domain.FailureCode;
import com.yerin.pipeline.global.exception.code.JobErrorCode;

public class ResourceKeyException extends AppException {

    public ResourceKeyException(String detail) {
        super(JobErrorCode.INVALID_RESOURCE_KEY.withDetail(detail));
    }

    public ResourceKeyException(String detail, Throwable cause) {
        super(JobErrorCode.INVALID_RESOURCE_KEY.withDetail(detail), cause);
    }

    public FailureCode failureCode() {
        return FailureCode.RESOURCE_KEY_INVALID;
    }

    public ErrorStage stage() {
        return ErrorStage.RESOURCE_KEY_DERIVATION;
    }
}
