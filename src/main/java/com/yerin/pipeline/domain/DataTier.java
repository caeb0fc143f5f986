package com.yerin.pipeline.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Retention class of a job record. FULL keeps verbose diagnostics for a short window,
 * COMPACT keeps minimal status history for longer.
 */
public enum DataTier {
    COMPACT,
    FULL;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static DataTier fromWire(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
