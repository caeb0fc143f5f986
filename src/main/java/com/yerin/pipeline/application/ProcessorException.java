package com.yerin.pipeline.application;

import com.yerin.pipeline.domain.FailureCode;
import com.yerin.pipeline.domain.JobFailure;
import lombok.Getter;

@Getter
public class ProcessorException extends Exception {

    private final FailureCode code;

    public ProcessorException(FailureCode code, String message) {
        super(message);
        this.code = code;
    }

    public ProcessorException(FailureCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public JobFailure toFailure() {
        return JobFailure.of(code, getMessage());
    }
}
