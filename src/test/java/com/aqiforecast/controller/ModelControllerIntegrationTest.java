package com.aqiforecast.controller;

import com.aqiforecast.dto.RetrainRequest;
import com.aqiforecast.domain.Severity;
import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.client.WireMock;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import org.junit.jupiter.api.*;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.*;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;
import java.util.Map;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
class ModelControllerIntegrationTest {

    private static WireMockServer wireMock;

    @Autowired TestRestTemplate restTemplate;

    @BeforeAll
    static void startWireMock() {
        wireMock = new WireMockServer(WireMockConfiguration.wireMockConfig().port(9090));
        wireMock.start();
        WireMock.configureFor("localhost", 9090);
    }

    @AfterAll
    static void stopWireMock() { wireMock.stop(); }

    @AfterEach
    void resetStubs() { wireMock.resetAll(); }

    private void stubTraining(String predictor, String version, double rmse, double accuracy) {
        stubFor(post(urlEqualTo("/" + predictor + "/train")).willReturn(okJson(
            "{\"version\": \"" + version + "\", \"metrics\": {\"train_rmse\": " + rmse + "}}")));
        stubFor(post(urlEqualTo("/" + predictor + "/validate")).willReturn(okJson(
            "{\"rmse\": " + rmse + ", \"mae\": " + (rmse * 0.8) + ", \"accuracy_within_threshold\": " + accuracy
                + ", \"sample_count\": 72}")));
    }

    @SuppressWarnings("unchecked")
    private List<Map<String, Object>> awaitHistory(String predictor, String version) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 10_000;
        List<Map<String, Object>> history = List.of();
        while (System.currentTimeMillis() < deadline) {
            history = restTemplate.getForObject("/api/v1/models/" + predictor + "/history", List.class);
            boolean finished = history.stream().anyMatch(r -> version.equals(r.get("version"))
                && !List.of("TRIGGERED", "RUNNING", "VALIDATING").contains(r.get("state")));
            if (finished) {
                return history;
            }
            Thread.sleep(50);
        }
        return history;
    }

    @Test
    void models_listsConfiguredPredictors() {
        ResponseEntity<List> resp = restTemplate.getForEntity("/api/v1/models", List.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(resp.getBody()).containsExactlyInAnyOrder("xgboost", "lstm");
    }

    @Test
    void retrain_passingCandidate_isPromoted() throws Exception {
        stubTraining("xgboost", "xgboost-it-1", 11.0, 0.86);
        RetrainRequest request = RetrainRequest.builder().reason("sensor recalibration").severity(Severity.HIGH).build();
        HttpHeaders headers = new HttpHeaders();
        headers.set("X-Request-ID", "retrain-test-1");

        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/models/xgboost/retrain",
            new HttpEntity<>(request, headers), Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.ACCEPTED);
        assertThat(resp.getBody().get("triggerId")).isNotNull();
        assertThat(resp.getBody().get("severity")).isEqualTo("HIGH");
        assertThat(resp.getBody().get("requestId")).isEqualTo("retrain-test-1");

        List<Map<String, Object>> history = awaitHistory("xgboost", "xgboost-it-1");
        assertThat(history).anyMatch(r -> "xgboost-it-1".equals(r.get("version")) && "PROMOTED".equals(r.get("state")));

        ResponseEntity<Map> status = restTemplate.getForEntity("/api/v1/models/xgboost/status", Map.class);
        assertThat(status.getBody().get("activeVersion")).isEqualTo("xgboost-it-1");
        assertThat(status.getBody().get("lifecycleState")).isEqualTo("IDLE");

        ResponseEntity<Map> best = restTemplate.getForEntity("/api/v1/models/xgboost/best?metric=RMSE", Map.class);
        assertThat(best.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(best.getBody().get("version")).isEqualTo("xgboost-it-1");

        ResponseEntity<Map> report = restTemplate.getForEntity("/api/v1/retraining/report", Map.class);
        assertThat(((Number) report.getBody().get("promoted")).intValue()).isGreaterThanOrEqualTo(1);
    }

    @Test
    void retrain_failingQualityGate_isRecordedAsFailed() throws Exception {
        stubTraining("lstm", "lstm-it-bad", 42.0, 0.4);

        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/models/lstm/retrain",
            RetrainRequest.builder().reason("weekly check").build(), Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.ACCEPTED);
        assertThat(resp.getBody().get("severity")).isEqualTo("LOW");
        List<Map<String, Object>> history = awaitHistory("lstm", "lstm-it-bad");
        assertThat(history).anyMatch(r -> "lstm-it-bad".equals(r.get("version")) && "FAILED".equals(r.get("state")));
    }

    @Test
    void retrain_unknownModel_returns404() {
        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/models/arima/retrain",
            RetrainRequest.builder().reason("manual").build(), Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(resp.getBody().get("errorCode")).isEqualTo("UNKNOWN_MODEL");
    }

    @Test
    void retrain_blankReason_returns422() {
        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/models/xgboost/retrain",
            RetrainRequest.builder().reason(" ").build(), Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        assertThat((List<?>) resp.getBody().get("fieldErrors")).isNotEmpty();
    }

    @Test
    void status_unknownModel_returns404() {
        ResponseEntity<Map> resp = restTemplate.getForEntity("/api/v1/models/gnn/status", Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    }

    @Test
    void drift_withoutSamples_returns422() {
        ResponseEntity<Map> resp = restTemplate.getForEntity("/api/v1/models/lstm/drift", Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        assertThat(resp.getBody().get("errorCode")).isEqualTo("INSUFFICIENT_DATA");
    }

    @Test
    void best_invalidMetric_returns400() {
        ResponseEntity<Map> resp = restTemplate.getForEntity("/api/v1/models/xgboost/best?metric=R2", Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    }

    @Test
    void triggerCheck_reportsCreatedTriggersAndStartedRuns() throws Exception {
        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/retraining/triggers/check", null, Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(resp.getBody()).containsKeys("triggersCreated", "runsStarted", "checkedAt");
        List<Map<String, Object>> created = (List<Map<String, Object>>) resp.getBody().get("triggersCreated");
        assertThat(created).allMatch(t -> List.of("xgboost", "lstm").contains(t.get("predictorId")));
        assertThat(((Number) resp.getBody().get("runsStarted")).intValue()).isLessThanOrEqualTo(2);

        awaitIdle("xgboost");
        awaitIdle("lstm");
    }

    @Test
    void config_exposesRetrainingSettings() {
        ResponseEntity<Map> resp = restTemplate.getForEntity("/api/v1/retraining/config", Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(((Number) resp.getBody().get("maxRmse")).doubleValue()).isEqualTo(25.0);
        assertThat(((Number) resp.getBody().get("rmseDegradationThreshold")).doubleValue()).isEqualTo(0.15);
        assertThat(((Number) resp.getBody().get("timeoutSeconds")).longValue()).isEqualTo(30L);
        assertThat(resp.getBody().get("conflictPolicy")).isEqualTo("QUEUE");
        assertThat((Map<String, Object>) resp.getBody().get("schedule")).containsKeys("xgboost", "lstm");
    }

    private void awaitIdle(String predictor) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 10_000;
        while (System.currentTimeMillis() < deadline) {
            Map<?, ?> status = restTemplate.getForObject("/api/v1/models/" + predictor + "/status", Map.class);
            if ("IDLE".equals(status.get("lifecycleState"))) {
                return;
            }
            Thread.sleep(50);
        }
        throw new AssertionError(predictor + " still retraining");
    }
}
