package com.yerin.pipeline.dto.response;

import java.util.List;

public record VersionDriftResponse(
        String currentVersion,
        List<VersionCount> staleContent,
        long totalStale,
        long unknownVersionCount,
        long totalContent
) {
    public record VersionCount(String version, long count) {}
}
