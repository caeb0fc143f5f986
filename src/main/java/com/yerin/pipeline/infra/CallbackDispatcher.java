package com.yerin.pipeline.infra;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.yerin.pipeline.domain.Job;
import com.yerin.pipeline.domain.PipelineMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Signed webhook notifications for finished jobs. Delivery is at-least-once: receivers
 * deduplicate on {@code event_id}, which is stable per job. Outcomes are logged and counted,
 * never written back to the job.
 */
@Slf4j
@Component
public class CallbackDispatcher {

    public static final String SIGNATURE_HEADER = "X-Pipeline-Signature";
    public static final String EVENT_ID_HEADER = "X-Pipeline-Event-Id";
    static final String SCHEMA_VERSION = "1";

    private final RestTemplate restTemplate;
    private final BackgroundTasks backgroundTasks;
    private final PipelineMetrics metrics;
    private final ObjectMapper canonicalMapper;
    private final String url;
    private final CallbackSigner signer;
    private final int maxAttempts;
    private final List<Duration> delays;

    public CallbackDispatcher(@Qualifier("callbackRestTemplate") RestTemplate restTemplate,
                              BackgroundTasks backgroundTasks,
                              PipelineMetrics metrics,
                              ObjectMapper objectMapper,
                              @Value("${pipeline.callback.url:}") String url,
                              @Value("${pipeline.callback.secret:}") String secret,
                              @Value("${pipeline.callback.max-attempts:3}") int maxAttempts,
                              @Value("${pipeline.callback.base-backoff:1s}") Duration baseBackoff) {
        this.restTemplate = restTemplate;
        this.backgroundTasks = backgroundTasks;
        this.metrics = metrics;
        // sorted keys, compact output; nested maps too
        this.canonicalMapper = objectMapper.copy()
                .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
                .configure(SerializationFeature.INDENT_OUTPUT, false);
        this.url = url;
        this.signer = (secret == null || secret.isBlank()) ? null : new CallbackSigner(secret);
        this.maxAttempts = Math.max(1, maxAttempts);
        this.delays = Backoff.schedule(baseBackoff, 4, this.maxAttempts);
    }

    public boolean isEnabled() {
        return url != null && !url.isBlank() && signer != null;
    }

    public static String eventId(Long jobId) {
        return UUID.nameUUIDFromBytes(("pipeline-job:" + jobId).getBytes(StandardCharsets.UTF_8)).toString();
    }

    /** Schedules delivery on the tracked task set and returns immediately. */
    public void notifyAsync(Job job, Map<String, Object> result) {
        if (!isEnabled()) return;
        try {
            backgroundTasks.submit("callback-" + job.getId(), () -> deliver(job, result));
        } catch (IllegalStateException e) {
            log.warn("[Callback] not scheduled jobId={}: {}", job.getId(), e.getMessage());
        }
    }

    /**
     * Sends the callback, retrying on transport errors and non-2xx answers.
     * Blocks the calling thread through the backoff waits.
     */
    public DeliveryReport deliver(Job job, Map<String, Object> result) {
        String eventId = eventId(job.getId());
        if (!isEnabled()) {
            return new DeliveryReport(false, 0, eventId);
        }

        byte[] body;
        try {
            body = canonicalMapper.writeValueAsBytes(payload(job, result, eventId));
        } catch (JsonProcessingException e) {
            log.error("[Callback] payload not serializable jobId={}", job.getId(), e);
            metrics.incCallbackFailed();
            return new DeliveryReport(false, 0, eventId);
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set(SIGNATURE_HEADER, signer.sign(body));
        headers.set(EVENT_ID_HEADER, eventId);
        HttpEntity<byte[]> request = new HttpEntity<>(body, headers);

        int attempt = 0;
        while (attempt < maxAttempts) {
            attempt++;
            try {
                restTemplate.exchange(url, HttpMethod.POST, request, Void.class);
                log.info("audit.callback_delivery job_id={} event_id={} attempts={} success=true",
                        job.getId(), eventId, attempt);
                metrics.incCallbackDelivered();
                return new DeliveryReport(true, attempt, eventId);
            } catch (RestClientException e) {
                log.warn("[Callback] attempt {}/{} failed jobId={}: {}", attempt, maxAttempts, job.getId(), e.getMessage());
            }

            if (attempt < maxAttempts && !pause(delays.get(attempt - 1))) {
                log.warn("[Callback] interrupted while backing off jobId={}", job.getId());
                break;
            }
        }

        log.error("audit.callback_delivery job_id={} event_id={} attempts={} success=false",
                job.getId(), eventId, attempt);
        metrics.incCallbackFailed();
        return new DeliveryReport(false, attempt, eventId);
    }

    Map<String, Object> payload(Job job, Map<String, Object> result, String eventId) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("schema_version", SCHEMA_VERSION);
        payload.put("event_id", eventId);
        payload.put("job_id", job.getId());
        payload.put("content_id", job.getContentId());
        payload.put("resource_key", job.getResourceKey());
        payload.put("status", job.getStatus().wireName());
        payload.put("pipeline_version", job.getPipelineVersion());
        if (result != null && !result.isEmpty()) payload.put("result", result);
        if (job.getErrorCode() != null) payload.put("error_code", job.getErrorCode().name());
        if (job.getErrorMessage() != null) payload.put("error_message", job.getErrorMessage());
        return payload;
    }

    private static boolean pause(Duration delay) {
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public record DeliveryReport(boolean delivered, int attempts, String eventId) {}
}
