package com.yerin.pipeline.dto.response;

import java.util.Map;

/**
 * Job counts keyed by wire status name plus the live gate occupancy.
 */
public record JobStatsResponse(
        Map<String, Long> jobs,
        int inFlight,
        int maxConcurrency,
        int waiting,
        int backgroundTasks
) {
}
