package com.yerin.pipeline.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Output of one processor run. {@code summary} is what gets persisted on the content and sent
 * in the callback; {@code diagnostics} is kept only for FULL tier jobs.
 */
public record ProcessingResult(Map<String, Object> summary, Map<String, Object> diagnostics) {

    public ProcessingResult {
        summary = summary == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(summary));
        diagnostics = diagnostics == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(diagnostics));
    }

    public static ProcessingResult of(Map<String, Object> summary) {
        return new ProcessingResult(summary, Map.of());
    }
}
