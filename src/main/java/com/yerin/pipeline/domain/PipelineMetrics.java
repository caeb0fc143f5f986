package com.yerin.pipeline.domain;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

@Component
public class PipelineMetrics {

    private final MeterRegistry registry;

    private final Counter jobSubmitted;
    private final Counter jobDeduplicated;
    private final Counter jobCompleted;
    private final Counter jobCancelled;
    private final Counter callbackDelivered;
    private final Counter callbackFailed;

    public PipelineMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.jobSubmitted      = Counter.builder("pipeline_jobs_submitted_total")
                .description("jobs created by submit").register(registry);
        this.jobDeduplicated   = Counter.builder("pipeline_jobs_deduplicated_total")
                .description("submits answered with an existing job").register(registry);
        this.jobCompleted      = Counter.builder("pipeline_jobs_completed_total")
                .description("jobs completed").register(registry);
        this.jobCancelled      = Counter.builder("pipeline_jobs_cancelled_total")
                .description("jobs cancelled").register(registry);
        this.callbackDelivered = Counter.builder("pipeline_callbacks_delivered_total")
                .description("callbacks acknowledged with 2xx").register(registry);
        this.callbackFailed    = Counter.builder("pipeline_callbacks_failed_total")
                .description("callbacks given up after all attempts").register(registry);
    }

    public void incSubmitted()         { jobSubmitted.increment(); }
    public void incDeduplicated()      { jobDeduplicated.increment(); }
    public void incCompleted()         { jobCompleted.increment(); }
    public void incCancelled()         { jobCancelled.increment(); }
    public void incCallbackDelivered() { callbackDelivered.increment(); }
    public void incCallbackFailed()    { callbackFailed.increment(); }

    // 실패는 error_code 태그로 구분
    public void incFailed(FailureCode code) {
        Counter.builder("pipeline_jobs_failed_total")
                .description("jobs failed by error code")
                .tag("code", code.name())
                .register(registry)
                .increment();
    }

    public void incPurged(DataTier tier, int count) {
        Counter.builder("pipeline_jobs_purged_total")
                .description("jobs deleted by retention")
                .tag("tier", tier.wireName())
                .register(registry)
                .increment(count);
    }

    public Timer processorTimer(String processor) {
        return Timer.builder("pipeline_processor_duration_seconds")
                .description("processor duration by name")
                .tag("processor", processor)
                .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                .register(registry);
    }
}
