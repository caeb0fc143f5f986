package com.yerin.pipeline.application;

import com.yerin.pipeline.domain.Job;
import com.yerin.pipeline.domain.ProcessingResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Accepts every job and echoes its identity back as the summary. Default for local runs.
 */
@Slf4j
@Component
public class NoopProcessor implements Processor {

    @Override
    public String name() {
        return "noop";
    }

    @Override
    public ProcessingResult process(Job job) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("content_id", job.getContentId());
        summary.put("resource_key", job.getResourceKey());
        summary.put("pipeline_version", job.getPipelineVersion());

        log.info("[Processor.noop] jobId={}, contentId={}", job.getId(), job.getContentId());
        return new ProcessingResult(summary, Map.of("processor", name()));
    }
}
