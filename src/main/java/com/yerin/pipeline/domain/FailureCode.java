package com.yerin.pipeline.domain;

/**
 * Machine-readable failure tokens stored in {@code pipeline_job.error_code}.
 */
public enum FailureCode {
    RESOURCE_KEY_INVALID(ErrorStage.RESOURCE_KEY_DERIVATION),
    PROCESSOR_TIMEOUT(ErrorStage.PROCESSOR_INVOCATION),
    PROCESSOR_ERROR(ErrorStage.PROCESSOR_INVOCATION),
    PROCESSOR_UNAVAILABLE(ErrorStage.PROCESSOR_INVOCATION),
    VALIDATION_FAILED(ErrorStage.RESULT_VALIDATION),
    PERSISTENCE_ERROR(ErrorStage.PERSISTENCE);

    private final ErrorStage defaultStage;

    FailureCode(ErrorStage defaultStage) {
        this.defaultStage = defaultStage;
    }

    public ErrorStage defaultStage() {
        return defaultStage;
    }
}
