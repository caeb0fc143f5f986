package com.yerin.pipeline.service;

import com.yerin.pipeline.domain.ContentProcessingState;
import com.yerin.pipeline.domain.ContentStatusProjector;
import com.yerin.pipeline.domain.DataTier;
import com.yerin.pipeline.domain.JobStatus;
import com.yerin.pipeline.domain.ResourceKeyCodec;
import com.yerin.pipeline.domain.ResourceKind;
import com.yerin.pipeline.dto.request.ReprocessRequest;
import com.yerin.pipeline.dto.response.ReprocessResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Entry point for content (re)processing. Derives the resource key and hands the work to the
 * orchestrator; an already completed content is skipped unless forced.
 */
@Slf4j
@Service
public class ReprocessService {

    private final PipelineOrchestrator orchestrator;
    private final ContentStatusProjector projector;
    private final ResourceKeyCodec keyCodec;
    private final DataTier defaultTier;

    public ReprocessService(PipelineOrchestrator orchestrator,
                            ContentStatusProjector projector,
                            ResourceKeyCodec keyCodec,
                            @Value("${pipeline.default-data-tier:compact}") String defaultTier) {
        this.orchestrator = orchestrator;
        this.projector = projector;
        this.keyCodec = keyCodec;
        this.defaultTier = DataTier.fromWire(defaultTier);
    }

    public ReprocessResponse reprocess(String contentId, boolean force, ReprocessRequest request) {
        ReprocessRequest req = request == null ? ReprocessRequest.empty() : request;
        log.info("audit.reprocess_trigger content_id={} force={}", contentId, force);

        if (!force) {
            Optional<ContentProcessingState> state = projector.find(contentId);
            if (state.isPresent() && state.get().getProcessingStatus() == JobStatus.COMPLETED) {
                return new ReprocessResponse(state.get().getLastJobId(), contentId,
                        ReprocessResponse.Outcome.ALREADY_COMPLETED);
            }
        }

        ResourceKind kind = ResourceKind.from(req.kind());
        String identifier = (req.identifier() == null || req.identifier().isBlank()) ? contentId : req.identifier();
        String resourceKey = keyCodec.derive(kind, identifier);

        PipelineOrchestrator.Submission submission = orchestrator.submit(new SubmitCommand(
                contentId,
                resourceKey,
                req.dataTier() == null ? defaultTier : req.dataTier(),
                req.idempotencyKey()));

        return new ReprocessResponse(submission.job().getId(), contentId,
                submission.created() ? ReprocessResponse.Outcome.SUBMITTED : ReprocessResponse.Outcome.ALREADY_ACTIVE);
    }
}
