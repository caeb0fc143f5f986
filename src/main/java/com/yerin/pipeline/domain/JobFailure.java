package com.yerin.pipeline.domain;

import java.util.Objects;

/**
 * Classified failure written onto a FAILED job.
 */
public record JobFailure(FailureCode code, String message, ErrorStage stage) {

    public static final int MAX_MESSAGE_LENGTH = 500;

    public JobFailure {
        Objects.requireNonNull(code, "code");
        if (stage == null) stage = code.defaultStage();
        message = truncate(message);
    }

    public static JobFailure of(FailureCode code, String message) {
        return new JobFailure(code, message, code.defaultStage());
    }

    static String truncate(String message) {
        if (message == null || message.isBlank()) return "no detail";
        return message.length() <= MAX_MESSAGE_LENGTH ? message : message.substring(0, MAX_MESSAGE_LENGTH);
    }
}
