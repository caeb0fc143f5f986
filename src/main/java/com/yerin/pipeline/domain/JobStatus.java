package com.yerin.pipeline.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Pipeline job lifecycle.
 * <p>
 * PENDING → PROCESSING → COMPLETED | FAILED, and PENDING | PROCESSING → CANCELLED.
 * Terminal states never move again.
 */
public enum JobStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public boolean canTransitionTo(JobStatus next) {
        return allowedNext().contains(next);
    }

    public Set<JobStatus> allowedNext() {
        return switch (this) {
            case PENDING -> Set.of(PROCESSING, CANCELLED);
            case PROCESSING -> Set.of(COMPLETED, FAILED, CANCELLED);
            case COMPLETED, FAILED, CANCELLED -> Set.of();
        };
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static JobStatus fromWire(String value) {
        return parse(value).orElseThrow(() -> new IllegalArgumentException("unknown job status: " + value));
    }

    public static Optional<JobStatus> parse(String value) {
        if (value == null || value.isBlank()) return Optional.empty();
        return Arrays.stream(values())
                .filter(s -> s.name().equalsIgnoreCase(value.trim()))
                .findFirst();
    }

    public static Set<JobStatus> active() {
        return Set.of(PENDING, PROCESSING);
    }
}
