package com.yerin.pipeline.infra;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yerin.pipeline.domain.ContentProcessingState;
import com.yerin.pipeline.domain.ContentStatusProjector;
import com.yerin.pipeline.domain.Job;
import com.yerin.pipeline.domain.JobStatus;
import com.yerin.pipeline.domain.ProcessingResult;
import com.yerin.pipeline.domain.ResultSink;
import com.yerin.pipeline.repository.ContentProcessingStateRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

@Slf4j
@Component
@Profile("!local-inmem")
public class JpaContentStatusProjector implements ContentStatusProjector, ResultSink {

    private final ContentProcessingStateRepository repository;
    private final TransactionTemplate tx;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public JpaContentStatusProjector(ContentProcessingStateRepository repository,
                                     PlatformTransactionManager txManager,
                                     ObjectMapper objectMapper,
                                     Clock clock) {
        this.repository = repository;
        this.tx = new TransactionTemplate(txManager);
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public void project(String contentId, JobStatus status, String pipelineVersion, Long jobId) {
        upsert(contentId, s -> {
            s.setProcessingStatus(status);
            if (pipelineVersion != null) s.setPipelineVersion(pipelineVersion);
            if (jobId != null) s.setLastJobId(jobId);
        });
    }

    @Override
    public void store(Job job, ProcessingResult result) {
        String json;
        try {
            json = objectMapper.writeValueAsString(result.summary());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("result is not serializable: " + e.getOriginalMessage(), e);
        }
        upsert(job.getContentId(), s -> {
            if (s.getProcessingStatus() == null) s.setProcessingStatus(JobStatus.PROCESSING);
            s.setResultJson(json);
            s.setPipelineVersion(job.getPipelineVersion());
            s.setLastJobId(job.getId());
        });
    }

    @Override
    public Optional<ContentProcessingState> find(String contentId) {
        return repository.findById(contentId);
    }

    @Override
    public Map<String, Long> countByVersion() {
        Map<String, Long> out = new HashMap<>();
        for (ContentProcessingStateRepository.VersionCount vc : repository.countGroupByVersion()) {
            out.merge(vc.getPipelineVersion(), vc.getTotal(), Long::sum);
        }
        return out;
    }

    private void upsert(String contentId, Consumer<ContentProcessingState> change) {
        try {
            tx.executeWithoutResult(status -> apply(contentId, change));
        } catch (DataIntegrityViolationException e) {
            // concurrent first insert for the same content; the row exists now
            log.debug("[Projector] insert conflict contentId={}, retrying as update", contentId);
            tx.executeWithoutResult(status -> apply(contentId, change));
        }
    }

    private void apply(String contentId, Consumer<ContentProcessingState> change) {
        ContentProcessingState state = repository.findById(contentId)
                .orElseGet(() -> ContentProcessingState.builder().contentId(contentId).build());
        change.accept(state);
        state.setUpdatedAt(clock.instant());
        repository.saveAndFlush(state);
    }
}
