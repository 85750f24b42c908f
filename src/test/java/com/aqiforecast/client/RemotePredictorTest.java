package com.aqiforecast.client;

import com.aqiforecast.domain.PredictionResult;
import com.aqiforecast.domain.ValidationMetrics;
import com.aqiforecast.exception.PredictorException;
import com.aqiforecast.exception.PredictorUnavailableException;
import com.aqiforecast.predictor.HoldoutWindow;
import com.aqiforecast.predictor.TrainingRequest;
import com.aqiforecast.predictor.TrainingResult;
import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import org.junit.jupiter.api.*;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.assertj.core.api.Assertions.*;

class RemotePredictorTest {

    private static final Instant NOW = Instant.parse("2025-06-15T12:00:00Z");

    private static WireMockServer wireMock;

    private RemotePredictor predictor;

    @BeforeAll
    static void startWireMock() {
        wireMock = new WireMockServer(WireMockConfiguration.wireMockConfig().dynamicPort());
        wireMock.start();
    }

    @AfterAll
    static void stopWireMock() { wireMock.stop(); }

    @BeforeEach
    void setUp() {
        predictor = new RemotePredictor("xgboost", wireMock.baseUrl() + "/xgboost",
            Duration.ofMillis(500), Duration.ofSeconds(2), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @AfterEach
    void resetStubs() { wireMock.resetAll(); }

    @Test
    void predict_parsesValueAndUncertainty() {
        wireMock.stubFor(post(urlEqualTo("/xgboost/predict")).willReturn(okJson(
            "{\"value\": 87.5, \"uncertainty\": 6.25, \"timestamp\": \"2025-06-15T13:00:00Z\"}")));

        PredictionResult result = predictor.predict(Map.of("pm25", 41.0));

        assertThat(result.value()).isEqualTo(87.5);
        assertThat(result.uncertainty()).isEqualTo(6.25);
        assertThat(result.timestamp()).isEqualTo(Instant.parse("2025-06-15T13:00:00Z"));
        wireMock.verify(postRequestedFor(urlEqualTo("/xgboost/predict"))
            .withRequestBody(matchingJsonPath("$.features.pm25")));
    }

    @Test
    void predict_withoutTimestamp_usesClock() {
        wireMock.stubFor(post(urlEqualTo("/xgboost/predict")).willReturn(okJson("{\"value\": 50}")));

        PredictionResult result = predictor.predict(Map.of("pm25", 20.0));

        assertThat(result.timestamp()).isEqualTo(NOW);
        assertThat(result.uncertainty()).isZero();
    }

    @Test
    void predict_missingValue_throwsPredictorException() {
        wireMock.stubFor(post(urlEqualTo("/xgboost/predict")).willReturn(okJson("{\"uncertainty\": 3.0}")));

        assertThatThrownBy(() -> predictor.predict(Map.of("pm25", 20.0)))
            .isInstanceOf(PredictorException.class)
            .hasMessageContaining("missing 'value'");
    }

    @Test
    void predict_serverError_isUnavailable() {
        wireMock.stubFor(post(urlEqualTo("/xgboost/predict")).willReturn(serverError().withBody("model not loaded")));

        assertThatThrownBy(() -> predictor.predict(Map.of("pm25", 20.0)))
            .isInstanceOf(PredictorUnavailableException.class);
    }

    @Test
    void predict_clientError_isPredictorException() {
        wireMock.stubFor(post(urlEqualTo("/xgboost/predict")).willReturn(badRequest().withBody("unknown feature")));

        assertThatThrownBy(() -> predictor.predict(Map.of("bogus", 1.0)))
            .isInstanceOf(PredictorException.class)
            .hasMessageContaining("unknown feature");
    }

    @Test
    void predict_slowResponse_timesOut() {
        wireMock.stubFor(post(urlEqualTo("/xgboost/predict"))
            .willReturn(okJson("{\"value\": 50}").withFixedDelay(2_000)));

        assertThatThrownBy(() -> predictor.predict(Map.of("pm25", 20.0)))
            .isInstanceOf(PredictorUnavailableException.class);
    }

    @Test
    void train_sendsWindowAndParsesVersion() {
        UUID triggerId = UUID.randomUUID();
        wireMock.stubFor(post(urlEqualTo("/xgboost/train")).willReturn(okJson(
            "{\"version\": \"xgboost-20250615\", \"metrics\": {\"train_rmse\": 9.5, \"note\": \"ok\"}}")));

        TrainingResult result = predictor.train(new TrainingRequest("xgboost", triggerId,
            NOW.minus(Duration.ofDays(30)), NOW, new AtomicBoolean()));

        assertThat(result.version()).isEqualTo("xgboost-20250615");
        assertThat(result.metrics()).containsOnly(entry("train_rmse", 9.5));
        wireMock.verify(postRequestedFor(urlEqualTo("/xgboost/train"))
            .withRequestBody(matchingJsonPath("$.trigger_id", equalTo(triggerId.toString())))
            .withRequestBody(matchingJsonPath("$.data_to", equalTo(NOW.toString()))));
    }

    @Test
    void train_cancelledBeforeStart_doesNotCallSidecar() {
        TrainingRequest request = new TrainingRequest("xgboost", UUID.randomUUID(), NOW.minusSeconds(60), NOW,
            new AtomicBoolean(true));

        assertThatThrownBy(() -> predictor.train(request)).isInstanceOf(PredictorException.class);
        wireMock.verify(0, postRequestedFor(urlEqualTo("/xgboost/train")));
    }

    @Test
    void validate_parsesMetrics() {
        wireMock.stubFor(post(urlEqualTo("/xgboost/validate")).willReturn(okJson(
            "{\"rmse\": 12.1, \"mae\": 9.4, \"accuracy_within_threshold\": 0.78, \"sample_count\": 72}")));

        ValidationMetrics metrics = predictor.validate("xgboost-20250615",
            new HoldoutWindow(NOW.minus(Duration.ofDays(3)), NOW));

        assertThat(metrics).isEqualTo(new ValidationMetrics(12.1, 9.4, 0.78, 72));
    }

    @Test
    void predict_unreachableSidecar_isUnavailable() {
        RemotePredictor offline = new RemotePredictor("lstm", "http://localhost:1",
            Duration.ofMillis(500), Duration.ofSeconds(1), Clock.fixed(NOW, ZoneOffset.UTC));

        assertThatThrownBy(() -> offline.predict(Map.of("pm25", 20.0)))
            .isInstanceOf(PredictorUnavailableException.class);
    }
}
