package com.yerin.pipeline.infra;

import com.yerin.pipeline.domain.DataTier;
import com.yerin.pipeline.domain.JobStore;
import com.yerin.pipeline.domain.PipelineMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Deletes finished jobs past their tier's retention window, once at startup and then on a
 * fixed delay. Each tier is purged independently; a failing tier is retried on the next run.
 */
@Slf4j
@Component
public class RetentionPurger {

    private final JobStore jobStore;
    private final PipelineMetrics metrics;
    private final Clock clock;
    private final Map<DataTier, Duration> windows;

    public RetentionPurger(JobStore jobStore,
                           PipelineMetrics metrics,
                           Clock clock,
                           @Value("${pipeline.retention.full:60d}") Duration fullWindow,
                           @Value("${pipeline.retention.compact:180d}") Duration compactWindow) {
        this.jobStore = jobStore;
        this.metrics = metrics;
        this.clock = clock;
        Map<DataTier, Duration> w = new EnumMap<>(DataTier.class);
        w.put(DataTier.FULL, fullWindow);
        w.put(DataTier.COMPACT, compactWindow);
        this.windows = Collections.unmodifiableMap(w);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onStartup() {
        purge();
    }

    @Scheduled(fixedDelayString = "${pipeline.retention.purge-interval:PT6H}",
            initialDelayString = "${pipeline.retention.purge-interval:PT6H}")
    public void scheduled() {
        purge();
    }

    public PurgeReport purge() {
        Instant now = clock.instant();
        Map<DataTier, Integer> deleted = new EnumMap<>(DataTier.class);
        Set<DataTier> failed = EnumSet.noneOf(DataTier.class);

        for (Map.Entry<DataTier, Duration> e : windows.entrySet()) {
            DataTier tier = e.getKey();
            Instant cutoff = now.minus(e.getValue());
            try {
                int n = jobStore.purgeExpired(tier, cutoff);
                deleted.put(tier, n);
                if (n > 0) metrics.incPurged(tier, n);
            } catch (RuntimeException ex) {
                failed.add(tier);
                log.error("[RetentionPurger] tier={} cutoff={} failed", tier.wireName(), cutoff, ex);
            }
        }

        PurgeReport report = new PurgeReport(deleted, failed);
        log.info("[RetentionPurger] purged={} failedTiers={}", report.deleted(), report.failedTiers());
        return report;
    }

    public record PurgeReport(Map<DataTier, Integer> deleted, Set<DataTier> failedTiers) {

        public int total() {
            return deleted.values().stream().mapToInt(Integer::intValue).sum();
        }

        public int deleted(DataTier tier) {
            return deleted.getOrDefault(tier, 0);
        }
    }
}
