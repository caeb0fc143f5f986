package com.yerin.pipeline.domain;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ErrorStage {
    RESOURCE_KEY_DERIVATION("resource_key_derivation"),
    PROCESSOR_INVOCATION("processor_invocation"),
    RESULT_VALIDATION("result_validation"),
    PERSISTENCE("persistence");

    private final String wireName;

    ErrorStage(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
