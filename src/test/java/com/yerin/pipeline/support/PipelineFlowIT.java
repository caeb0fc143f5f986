package com.yerin.pipeline.support;

import com.fasterxml.jackson.databind.JsonNode;
import org.awaitility.Awaitility;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
@DisplayName("E2E: reprocess → noop 처리기 → completed")
class PipelineFlowIT extends IntegrationTestBase {

    @Autowired
    TestRestTemplate rest;

    private static JsonNode data(ResponseEntity<JsonNode> r) {
        assertThat(r.getStatusCode().is2xxSuccessful()).isTrue();
        assertThat(r.getBody()).isNotNull();
        return r.getBody().get("data");
    }

    private JsonNode reprocess(String contentId, boolean force) {
        return data(rest.postForEntity("/content/{id}/reprocess?force={force}",
                Map.of("kind", "youtube", "identifier", "vid-" + contentId, "dataTier", "full"),
                JsonNode.class, contentId, force));
    }

    @Test
    @DisplayName("성공 플로우와 완료 후 재처리 분기")
    void reprocess_flow() {
        String contentId = "it-" + UUID.randomUUID();

        JsonNode first = reprocess(contentId, false);
        assertThat(first.get("status").asText()).isIn("submitted", "already_active");
        String jobId = first.get("jobId").asText();

        Awaitility.await()
                .atMost(Duration.ofSeconds(8))
                .pollInterval(Duration.ofMillis(200))
                .untilAsserted(() -> assertThat(
                        data(rest.getForEntity("/jobs/{id}", JsonNode.class, jobId)).get("status").asText())
                        .isEqualTo("completed"));

        JsonNode verbose = data(rest.getForEntity("/jobs/{id}?verbose=true", JsonNode.class, jobId));
        assertThat(verbose.get("resourceKey").asText()).isEqualTo("yt:vid-" + contentId);
        assertThat(verbose.get("dataTier").asText()).isEqualTo("full");
        assertThat(verbose.get("metadata").get("processor").asText()).isEqualTo("noop");

        JsonNode skipped = reprocess(contentId, false);
        assertThat(skipped.get("status").asText()).isEqualTo("already_completed");

        JsonNode forced = reprocess(contentId, true);
        assertThat(forced.get("status").asText()).isEqualTo("submitted");
        assertThat(forced.get("jobId").asText()).isNotEqualTo(jobId);
    }

    @Test
    @DisplayName("드리프트/통계/목록 엔드포인트 응답 형태")
    void read_endpoints() {
        JsonNode drift = data(rest.getForEntity("/jobs/drift", JsonNode.class));
        assertThat(drift.get("currentVersion").asText()).isEqualTo("0.5.0");
        assertThat(drift.has("staleContent")).isTrue();
        assertThat(drift.has("totalStale")).isTrue();
        assertThat(drift.has("unknownVersionCount")).isTrue();
        assertThat(drift.has("totalContent")).isTrue();

        JsonNode stats = data(rest.getForEntity("/jobs/stats", JsonNode.class));
        assertThat(stats.get("maxConcurrency").asInt()).isEqualTo(2);

        ResponseEntity<JsonNode> bad = rest.getForEntity("/jobs?status=queued", JsonNode.class);
        assertThat(bad.getStatusCode().value()).isEqualTo(400);
        assertThat(bad.getBody().get("code").asText()).isEqualTo("JOB-003");
    }
}
