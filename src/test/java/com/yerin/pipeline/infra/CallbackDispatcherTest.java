package com.yerin.pipeline.infra;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.yerin.pipeline.domain.DataTier;
import com.yerin.pipeline.domain.FailureCode;
import com.yerin.pipeline.domain.Job;
import com.yerin.pipeline.domain.JobStatus;
import com.yerin.pipeline.domain.PipelineMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.mock.http.client.MockClientHttpRequest;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.*;
import static org.springframework.test.web.client.ExpectedCount.times;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

@DisplayName("콜백 전송(서명/재시도) 테스트")
public class CallbackDispatcherTest {

    static final String URL = "http://callback.test/hook";
    static final String SECRET = "s3cr3t";
    static final Duration BASE = Duration.ofMillis(50);

    RestTemplate restTemplate = new RestTemplate();
    MockRestServiceServer server = MockRestServiceServer.bindTo(restTemplate).build();
    SimpleMeterRegistry registry = new SimpleMeterRegistry();
    BackgroundTasks tasks = new BackgroundTasks(Duration.ofSeconds(2));

    List<Long> stamps = new CopyOnWriteArrayList<>();
    List<MockClientHttpRequest> requests = new CopyOnWriteArrayList<>();

    @AfterEach
    void tearDown() {
        tasks.shutdown();
    }

    private CallbackDispatcher dispatcher(String secret) {
        return new CallbackDispatcher(restTemplate, tasks, new PipelineMetrics(registry), new ObjectMapper(),
                URL, secret, 3, BASE);
    }

    private static Job completedJob(long id) {
        return Job.builder()
                .id(id).contentId("c-" + id).resourceKey("yt:vid" + id)
                .status(JobStatus.COMPLETED).pipelineVersion("0.5.0").dataTier(DataTier.COMPACT)
                .build();
    }

    private void respond(int status) {
        server.expect(requestTo(URL))
                .andExpect(method(HttpMethod.POST))
                .andRespond(req -> {
                    stamps.add(System.nanoTime());
                    requests.add((MockClientHttpRequest) req);
                    return status == 200 ? withSuccess().createResponse(req) : withServerError().createResponse(req);
                });
    }

    @Test
    @DisplayName("500, 500, 200 이면 세 번 시도하고 시도 간격은 백오프 이상")
    void retries_with_backoff_until_success() {
        respond(500);
        respond(500);
        respond(200);

        CallbackDispatcher.DeliveryReport report = dispatcher(SECRET).deliver(completedJob(7L), Map.of("words", 120));

        server.verify();
        assertThat(report.delivered()).isTrue();
        assertThat(report.attempts()).isEqualTo(3);
        assertThat(stamps).hasSize(3);
        assertThat(Duration.ofNanos(stamps.get(1) - stamps.get(0))).isGreaterThanOrEqualTo(BASE);
        assertThat(Duration.ofNanos(stamps.get(2) - stamps.get(1))).isGreaterThanOrEqualTo(BASE.multipliedBy(4));
        assertThat(registry.find("pipeline_callbacks_delivered_total").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("모든 시도가 실패하면 전달 실패로 보고하고 예외는 던지지 않는다")
    void gives_up_after_max_attempts() {
        server.expect(times(3), requestTo(URL)).andRespond(withServerError());

        CallbackDispatcher.DeliveryReport report = dispatcher(SECRET).deliver(completedJob(8L), null);

        server.verify();
        assertThat(report.delivered()).isFalse();
        assertThat(report.attempts()).isEqualTo(3);
        assertThat(registry.find("pipeline_callbacks_failed_total").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("본문은 키 정렬된 compact JSON 이고 서명은 본문 그대로에 대해 검증된다")
    void body_is_canonical_and_signed() {
        respond(200);
        Job failed = completedJob(9L).toBuilder()
                .status(JobStatus.FAILED)
                .errorCode(FailureCode.PROCESSOR_TIMEOUT)
                .errorMessage("timeout")
                .build();

        dispatcher(SECRET).deliver(failed, null);

        MockClientHttpRequest req = requests.get(0);
        byte[] body = req.getBodyAsBytes();
        String json = new String(body, StandardCharsets.UTF_8);

        assertThat(json).startsWith("{\"content_id\":\"c-9\",\"error_code\":\"PROCESSOR_TIMEOUT\"");
        assertThat(json).doesNotContain(" ").contains("\"schema_version\":\"1\"").contains("\"status\":\"failed\"");
        assertThat(json).doesNotContain("\"result\"");

        String signature = req.getHeaders().getFirst(CallbackDispatcher.SIGNATURE_HEADER);
        assertThat(signature).startsWith("sha256=");
        assertThat(new CallbackSigner(SECRET).verify(body, signature)).isTrue();
        assertThat(new CallbackSigner("other").verify(body, signature)).isFalse();
    }

    @Test
    @DisplayName("중첩된 결과 맵도 키 정렬된다")
    void nested_result_keys_sorted() {
        respond(200);

        dispatcher(SECRET).deliver(completedJob(10L), Map.of("zeta", 1, "alpha", 2));

        String json = new String(requests.get(0).getBodyAsBytes(), StandardCharsets.UTF_8);
        assertThat(json).contains("\"result\":{\"alpha\":2,\"zeta\":1}");
    }

    @Test
    @DisplayName("event_id 는 작업마다 고정이고 헤더와 본문에 같은 값이 실린다")
    void event_id_is_stable() {
        respond(200);

        CallbackDispatcher.DeliveryReport report = dispatcher(SECRET).deliver(completedJob(11L), null);

        assertThat(report.eventId()).isEqualTo(CallbackDispatcher.eventId(11L));
        assertThat(CallbackDispatcher.eventId(11L)).isEqualTo(CallbackDispatcher.eventId(11L))
                .isNotEqualTo(CallbackDispatcher.eventId(12L));
        assertThat(requests.get(0).getHeaders().getFirst(CallbackDispatcher.EVENT_ID_HEADER)).isEqualTo(report.eventId());
        assertThat(new String(requests.get(0).getBodyAsBytes(), StandardCharsets.UTF_8))
                .contains("\"event_id\":\"" + report.eventId() + "\"");
    }

    @Test
    @DisplayName("비밀키가 없으면 전송하지 않는다")
    void disabled_without_secret() {
        CallbackDispatcher d = dispatcher("");

        assertThat(d.isEnabled()).isFalse();
        assertThat(d.deliver(completedJob(12L), null).attempts()).isZero();
        server.verify();
    }

    @Test
    @DisplayName("비동기 전송은 백그라운드 작업으로 추적된다")
    void notify_async_runs_in_background() throws Exception {
        respond(200);

        dispatcher(SECRET).notifyAsync(completedJob(13L), null);

        assertThat(tasks.awaitIdle(Duration.ofSeconds(2))).isTrue();
        server.verify();
    }
}
