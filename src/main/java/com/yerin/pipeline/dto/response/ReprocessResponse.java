package com.yerin.pipeline.dto.response;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public record ReprocessResponse(Long jobId, String contentId, Outcome status) {

    public enum Outcome {
        SUBMITTED,
        ALREADY_ACTIVE,
        ALREADY_COMPLETED;

        @JsonValue
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
