package com.aqiforecast.client;

import com.aqiforecast.domain.PredictionResult;
import com.aqiforecast.domain.ValidationMetrics;
import com.aqiforecast.exception.PredictorException;
import com.aqiforecast.exception.PredictorUnavailableException;
import com.aqiforecast.predictor.HoldoutWindow;
import com.aqiforecast.predictor.Predictor;
import com.aqiforecast.predictor.TrainingRequest;
import com.aqiforecast.predictor.TrainingResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.netty.channel.ChannelOption;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;
import reactor.util.retry.Retry;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * {@link Predictor} backed by a model sidecar speaking JSON over HTTP:
 * {@code POST /predict}, {@code POST /train} and {@code POST /validate}.
 * Calls block the caller; the ensemble and the orchestrator invoke them off the request threads.
 */
@Slf4j
public class RemotePredictor implements Predictor {

    private final String id;
    private final WebClient webClient;
    private final Duration callTimeout;
    private final Duration trainTimeout;
    private final Clock clock;
    private final ObjectMapper mapper = new ObjectMapper();

    public RemotePredictor(String id, String baseUrl, Duration callTimeout, Duration trainTimeout, Clock clock) {
        this.id = id;
        this.callTimeout = callTimeout;
        this.trainTimeout = trainTimeout;
        this.clock = clock;
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 5_000);
        this.webClient = WebClient.builder()
            .baseUrl(baseUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .defaultHeader("Content-Type", "application/json")
            .build();
        log.info("RemotePredictor initialised | predictor={} | baseUrl={}", id, baseUrl);
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public PredictionResult predict(Map<String, Double> features) {
        ObjectNode body = mapper.createObjectNode();
        ObjectNode featureNode = body.putObject("features");
        features.forEach((name, value) -> {
            if (value != null) {
                featureNode.put(name, value);
            }
        });
        JsonNode json = post("/predict", body, callTimeout, true);
        if (json == null || !json.hasNonNull("value")) {
            throw new PredictorException("Predictor '" + id + "' response missing 'value': " + json);
        }
        try {
            Instant timestamp = json.hasNonNull("timestamp") ? Instant.parse(json.get("timestamp").asText()) : clock.instant();
            return new PredictionResult(
                json.get("value").asDouble(),
                json.path("uncertainty").asDouble(0.0d),
                timestamp);
        } catch (IllegalArgumentException | DateTimeException ex) {
            throw new PredictorException("Predictor '" + id + "' returned an invalid prediction: " + json, ex);
        }
    }

    @Override
    public TrainingResult train(TrainingRequest request) {
        if (request.isCancelled()) {
            throw new PredictorException("Training of '" + id + "' cancelled before start");
        }
        ObjectNode body = mapper.createObjectNode();
        body.put("predictor_id", id);
        body.put("trigger_id", request.triggerId() != null ? request.triggerId().toString() : null);
        body.put("data_from", request.dataFrom().toString());
        body.put("data_to", request.dataTo().toString());

        JsonNode json = post("/train", body, trainTimeout, false);
        if (json == null || !json.hasNonNull("version")) {
            throw new PredictorException("Predictor '" + id + "' training response missing 'version': " + json);
        }
        Map<String, Double> metrics = new LinkedHashMap<>();
        JsonNode metricsNode = json.path("metrics");
        Iterator<Map.Entry<String, JsonNode>> fields = metricsNode.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (field.getValue().isNumber()) {
                metrics.put(field.getKey(), field.getValue().asDouble());
            }
        }
        return new TrainingResult(json.get("version").asText(), metrics);
    }

    @Override
    public ValidationMetrics validate(String version, HoldoutWindow holdout) {
        ObjectNode body = mapper.createObjectNode();
        body.put("version", version);
        body.put("holdout_from", holdout.from().toString());
        body.put("holdout_to", holdout.to().toString());

        JsonNode json = post("/validate", body, callTimeout, true);
        if (json == null || !json.hasNonNull("rmse")) {
            throw new PredictorException("Predictor '" + id + "' validation response missing 'rmse': " + json);
        }
        return new ValidationMetrics(
            json.get("rmse").asDouble(),
            json.path("mae").asDouble(Double.NaN),
            json.path("accuracy_within_threshold").asDouble(0.0d),
            json.path("sample_count").asLong(0L));
    }

    private JsonNode post(String path, ObjectNode body, Duration timeout, boolean retryOnConnectFailure) {
        Mono<JsonNode> call = webClient.post().uri(path)
            .bodyValue(body)
            .retrieve()
            .onStatus(HttpStatusCode::is4xxClientError, resp ->
                resp.bodyToMono(String.class).defaultIfEmpty("")
                    .map(b -> new PredictorException("Predictor '" + id + "' rejected " + path + " (4xx): " + b)))
            .onStatus(HttpStatusCode::is5xxServerError, resp ->
                resp.bodyToMono(String.class).defaultIfEmpty("")
                    .map(b -> new PredictorUnavailableException(id, new RuntimeException(b))))
            .bodyToMono(JsonNode.class)
            .timeout(timeout);
        if (retryOnConnectFailure) {
            call = call.retryWhen(Retry.backoff(2, Duration.ofMillis(300))
                .filter(ex -> ex instanceof WebClientRequestException)
                .onRetryExhaustedThrow((retrySpec, sig) -> new PredictorUnavailableException(id, sig.failure())));
        }
        return call
            .onErrorMap(WebClientRequestException.class, ex -> new PredictorUnavailableException(id, ex))
            .onErrorMap(TimeoutException.class, ex -> new PredictorUnavailableException(id, ex))
            .block();
    }
}
