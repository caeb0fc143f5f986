package com.yerin.pipeline.infra;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yerin.pipeline.domain.ContentProcessingState;
import com.yerin.pipeline.domain.ContentStatusProjector;
import com.yerin.pipeline.domain.Job;
import com.yerin.pipeline.domain.JobStatus;
import com.yerin.pipeline.domain.ProcessingResult;
import com.yerin.pipeline.domain.ResultSink;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

@Component
@Profile("local-inmem")
public class InMemoryContentStatusProjector implements ContentStatusProjector, ResultSink {

    private final Map<String, ContentProcessingState> states = new HashMap<>();
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public InMemoryContentStatusProjector(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public synchronized void project(String contentId, JobStatus status, String pipelineVersion, Long jobId) {
        ContentProcessingState s = stateOf(contentId);
        s.setProcessingStatus(status);
        if (pipelineVersion != null) s.setPipelineVersion(pipelineVersion);
        if (jobId != null) s.setLastJobId(jobId);
        s.setUpdatedAt(clock.instant());
    }

    @Override
    public synchronized void store(Job job, ProcessingResult result) {
        String json;
        try {
            json = objectMapper.writeValueAsString(result.summary());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("result is not serializable: " + e.getOriginalMessage(), e);
        }
        ContentProcessingState s = stateOf(job.getContentId());
        if (s.getProcessingStatus() == null) s.setProcessingStatus(JobStatus.PROCESSING);
        s.setResultJson(json);
        s.setPipelineVersion(job.getPipelineVersion());
        s.setLastJobId(job.getId());
        s.setUpdatedAt(clock.instant());
    }

    @Override
    public synchronized Optional<ContentProcessingState> find(String contentId) {
        ContentProcessingState s = states.get(contentId);
        if (s == null) return Optional.empty();
        return Optional.of(ContentProcessingState.builder()
                .contentId(s.getContentId())
                .processingStatus(s.getProcessingStatus())
                .pipelineVersion(s.getPipelineVersion())
                .lastJobId(s.getLastJobId())
                .resultJson(s.getResultJson())
                .updatedAt(s.getUpdatedAt())
                .build());
    }

    @Override
    public synchronized Map<String, Long> countByVersion() {
        Map<String, Long> out = new HashMap<>();
        for (ContentProcessingState s : states.values()) {
            out.merge(s.getPipelineVersion(), 1L, Long::sum);
        }
        return out;
    }

    private ContentProcessingState stateOf(String contentId) {
        return states.computeIfAbsent(contentId, id -> ContentProcessingState.builder().contentId(id).build());
    }
}
