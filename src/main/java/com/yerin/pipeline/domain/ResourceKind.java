package com.yerin.pipeline.domain;

import java.util.Locale;

/**
 * Source kinds with their resource-key prefix.
 */
public enum ResourceKind {
    YOUTUBE("yt"),
    URL("url"),
    CONTENT("cid");

    private final String prefix;

    ResourceKind(String prefix) {
        this.prefix = prefix;
    }

    public String prefix() {
        return prefix;
    }

    /** Unknown or missing kinds fall back to CONTENT. */
    public static ResourceKind from(String kind) {
        if (kind == null) return CONTENT;
        return switch (kind.trim().toLowerCase(Locale.ROOT)) {
            case "youtube", "yt" -> YOUTUBE;
            case "url", "web" -> URL;
            default -> CONTENT;
        };
    }
}
