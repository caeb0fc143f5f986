package com.yerin.pipeline.service;

import com.yerin.pipeline.domain.ContentStatusProjector;
import com.yerin.pipeline.domain.PipelineVersion;
import com.yerin.pipeline.dto.response.VersionDriftResponse;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Reports content last processed by a pipeline whose major or minor version differs from the
 * running one.
 */
@Service
public class VersionDriftService {

    private final ContentStatusProjector projector;
    private final String currentVersion;

    public VersionDriftService(ContentStatusProjector projector,
                               @Value("${pipeline.version}") String currentVersion) {
        this.projector = projector;
        this.currentVersion = currentVersion;
    }

    public VersionDriftResponse report() {
        List<VersionDriftResponse.VersionCount> stale = new ArrayList<>();
        long totalStale = 0;
        long unknown = 0;
        long total = 0;

        for (Map.Entry<String, Long> e : projector.countByVersion().entrySet()) {
            long count = e.getValue();
            total += count;
            if (PipelineVersion.parse(e.getKey()).isEmpty()) {
                unknown += count;
            } else if (PipelineVersion.hasDrift(e.getKey(), currentVersion)) {
                stale.add(new VersionDriftResponse.VersionCount(e.getKey(), count));
                totalStale += count;
            }
        }

        stale.sort(Comparator.comparingLong(VersionDriftResponse.VersionCount::count).reversed()
                .thenComparing(VersionDriftResponse.VersionCount::version));
        return new VersionDriftResponse(currentVersion, stale, totalStale, unknown, total);
    }
}
