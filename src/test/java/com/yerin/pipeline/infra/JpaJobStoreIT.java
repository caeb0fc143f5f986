package com.yerin.pipeline.infra;

import com.yerin.pipeline.domain.DataTier;
import com.yerin.pipeline.domain.FailureCode;
import com.yerin.pipeline.domain.Job;
import com.yerin.pipeline.domain.JobFailure;
import com.yerin.pipeline.domain.JobStatus;
import com.yerin.pipeline.domain.JobStore;
import com.yerin.pipeline.domain.ProcessingResult;
import com.yerin.pipeline.global.exception.InvalidTransitionException;
import com.yerin.pipeline.support.IntegrationTestBase;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
@DisplayName("PostgreSQL 작업 저장소 통합 테스트")
class JpaJobStoreIT extends IntegrationTestBase {

    @Autowired JpaJobStore store;
    @Autowired JpaContentStatusProjector projector;

    private static String key() {
        return "cid:" + UUID.randomUUID();
    }

    private JobStore.NewJob newJob(String key, String idem) {
        return new JobStore.NewJob(key, "content-" + key, "0.5.0", DataTier.COMPACT, idem);
    }

    @Test
    @DisplayName("같은 키로 동시에 16번 생성해도 활성 작업은 하나")
    void concurrent_create_is_deduplicated() throws Exception {
        String key = key();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Callable<Long>> calls = new ArrayList<>();
            for (int i = 0; i < 16; i++) {
                calls.add(() -> store.createIfAbsent(newJob(key, null)).job().getId());
            }
            Set<Long> ids = new HashSet<>();
            for (Future<Long> f : pool.invokeAll(calls)) ids.add(f.get());
            assertThat(ids).hasSize(1);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    @DisplayName("종료된 뒤에는 같은 키로 새 작업을 만들 수 있음")
    void terminal_job_releases_key() {
        String key = key();
        Job first = store.createIfAbsent(newJob(key, null)).job();
        store.transition(first.getId(), JobStatus.PROCESSING, null);
        Job failed = store.transition(first.getId(), JobStatus.FAILED,
                JobFailure.of(FailureCode.PROCESSOR_ERROR, "boom"));

        assertThat(failed.getActiveKey()).isNull();
        assertThat(failed.getErrorCode()).isEqualTo(FailureCode.PROCESSOR_ERROR);
        assertThat(failed.getFinishedAt()).isNotNull();

        JobStore.CreateResult again = store.createIfAbsent(newJob(key, null));
        assertThat(again.created()).isTrue();
        assertThat(again.job().getId()).isNotEqualTo(first.getId());
    }

    @Test
    @DisplayName("멱등키는 종료 후에도 같은 작업을 돌려줌")
    void idempotency_key_survives_completion() {
        String idem = "idem-" + UUID.randomUUID();
        Job first = store.createIfAbsent(newJob(key(), idem)).job();
        store.transition(first.getId(), JobStatus.PROCESSING, null);
        store.transition(first.getId(), JobStatus.COMPLETED, null);

        JobStore.CreateResult again = store.createIfAbsent(newJob(key(), idem));
        assertThat(again.created()).isFalse();
        assertThat(again.job().getId()).isEqualTo(first.getId());
    }

    @Test
    @DisplayName("기대 상태가 다르면 transitionIf 는 거부, 처리 중 취소 요청은 플래그만")
    void conditional_transitions() {
        Job job = store.createIfAbsent(newJob(key(), null)).job();

        Job started = store.transitionIf(job.getId(), JobStatus.PENDING, JobStatus.PROCESSING);
        assertThat(started.getStartedAt()).isNotNull();
        assertThatThrownBy(() -> store.transitionIf(job.getId(), JobStatus.PENDING, JobStatus.CANCELLED))
                .isInstanceOf(InvalidTransitionException.class);

        Job flagged = store.requestCancel(job.getId());
        assertThat(flagged.isCancelRequested()).isTrue();
        assertThat(flagged.getStatus()).isEqualTo(JobStatus.PROCESSING);

        store.transition(job.getId(), JobStatus.CANCELLED, null);
        assertThatThrownBy(() -> store.transition(job.getId(), JobStatus.COMPLETED, null))
                .isInstanceOf(InvalidTransitionException.class);
        assertThatThrownBy(() -> store.requestCancel(job.getId()))
                .isInstanceOf(InvalidTransitionException.class);
    }

    @Test
    @DisplayName("보존 기한이 지난 종료 작업만 삭제")
    void purge_removes_only_finished_before_cutoff() {
        Job done = store.createIfAbsent(newJob(key(), null)).job();
        store.transition(done.getId(), JobStatus.PROCESSING, null);
        store.transition(done.getId(), JobStatus.COMPLETED, null);
        Job active = store.createIfAbsent(newJob(key(), null)).job();

        int deleted = store.purgeExpired(DataTier.COMPACT, Instant.now().plusSeconds(60));

        assertThat(deleted).isGreaterThanOrEqualTo(1);
        assertThat(store.get(done.getId())).isEmpty();
        assertThat(store.get(active.getId())).isPresent();
    }

    @Test
    @DisplayName("콘텐츠 상태는 upsert 되고 결과와 버전별 집계가 반영됨")
    void content_projection_upserts() {
        String contentId = "content-" + UUID.randomUUID();
        Job job = Job.builder().id(77L).contentId(contentId).pipelineVersion("0.4.2").build();

        projector.project(contentId, JobStatus.PENDING, "0.4.2", 77L);
        projector.project(contentId, JobStatus.PROCESSING, "0.4.2", 77L);
        projector.store(job, ProcessingResult.of(Map.of("chunks", 2)));
        projector.project(contentId, JobStatus.COMPLETED, "0.4.2", 77L);

        var state = projector.find(contentId).orElseThrow();
        assertThat(state.getProcessingStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(state.getResultJson()).isEqualTo("{\"chunks\":2}");
        assertThat(projector.countByVersion()).containsKey("0.4.2");
        assertThat(projector.countByVersion().get("0.4.2")).isGreaterThanOrEqualTo(1L);
    }
}
