package com.yerin.pipeline.application;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yerin.pipeline.domain.FailureCode;
import com.yerin.pipeline.domain.Job;
import com.yerin.pipeline.domain.ProcessingResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.net.SocketTimeoutException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Delegates processing to a remote service. The service answers
 * {@code {"summary": {...}, "diagnostics": {...}}}.
 */
@Slf4j
@Component
public class HttpProcessor implements Processor {

    private static final ParameterizedTypeReference<Map<String, Object>> BODY_TYPE =
            new ParameterizedTypeReference<>() {};
    private static final TypeReference<Map<String, Object>> SECTION_TYPE = new TypeReference<>() {};

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String url;

    public HttpProcessor(@Qualifier("processorRestTemplate") RestTemplate restTemplate,
                         ObjectMapper objectMapper,
                         @Value("${pipeline.processor.http.url:}") String url) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.url = url;
    }

    @Override
    public String name() {
        return "http";
    }

    @Override
    public ProcessingResult process(Job job) throws ProcessorException {
        if (url == null || url.isBlank()) {
            throw new ProcessorException(FailureCode.PROCESSOR_UNAVAILABLE, "pipeline.processor.http.url is not configured");
        }

        Map<String, Object> request = new LinkedHashMap<>();
        request.put("job_id", job.getId());
        request.put("content_id", job.getContentId());
        request.put("resource_key", job.getResourceKey());
        request.put("pipeline_version", job.getPipelineVersion());
        request.put("data_tier", job.getDataTier().wireName());

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        ResponseEntity<Map<String, Object>> response;
        try {
            response = restTemplate.exchange(url, HttpMethod.POST, new HttpEntity<>(request, headers), BODY_TYPE);
        } catch (ResourceAccessException e) {
            if (e.getCause() instanceof SocketTimeoutException) {
                throw new ProcessorException(FailureCode.PROCESSOR_TIMEOUT, "processor timed out: " + e.getMessage(), e);
            }
            throw new ProcessorException(FailureCode.PROCESSOR_UNAVAILABLE, "processor unreachable: " + e.getMessage(), e);
        } catch (RestClientResponseException e) {
            FailureCode code = e.getStatusCode().isSameCodeAs(HttpStatus.SERVICE_UNAVAILABLE)
                    ? FailureCode.PROCESSOR_UNAVAILABLE
                    : FailureCode.PROCESSOR_ERROR;
            throw new ProcessorException(code, "processor answered " + e.getStatusCode().value() + ": "
                    + e.getResponseBodyAsString(), e);
        } catch (RestClientException e) {
            throw new ProcessorException(FailureCode.PROCESSOR_ERROR, e.getMessage(), e);
        }

        Map<String, Object> body = response.getBody();
        if (body == null) {
            log.warn("[Processor.http] empty body jobId={}", job.getId());
            return null;
        }
        return new ProcessingResult(section(body.get("summary")), section(body.get("diagnostics")));
    }

    // non-object sections count as missing
    private Map<String, Object> section(Object value) {
        return value instanceof Map<?, ?> ? objectMapper.convertValue(value, SECTION_TYPE) : null;
    }
}
