package com.aqiforecast.store;

import com.aqiforecast.config.ForecastProperties;
import com.aqiforecast.exception.PersistenceException;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Retries every store call with exponential backoff and surfaces {@link PersistenceException}
 * once the attempts are exhausted. Blocks the calling thread between attempts, so it must not be
 * used from an event-loop thread.
 */
@Slf4j
public class RetryingModelRunStore implements ModelRunStore {

    private final ModelRunStore delegate;
    private final int maxAttempts;
    private final Duration initialBackoff;
    private final Duration maxBackoff;

    public RetryingModelRunStore(ModelRunStore delegate, ForecastProperties.Persistence config) {
        this.delegate = delegate;
        this.maxAttempts = config.getMaxAttempts();
        this.initialBackoff = config.getInitialBackoff();
        this.maxBackoff = config.getMaxBackoff();
    }

    @Override
    public String saveRun(Map<String, Object> params, Map<String, Double> metrics, Map<String, String> artifacts) {
        return call("saveRun", () -> delegate.saveRun(params, metrics, artifacts));
    }

    @Override
    public Optional<StoredModelVersion> loadModel(String name, String version) {
        return call("loadModel", () -> delegate.loadModel(name, version));
    }

    @Override
    public List<StoredModelVersion> listVersions(String name) {
        return call("listVersions", () -> delegate.listVersions(name));
    }

    @Override
    public void promote(String name, String version, String stage) {
        call("promote", () -> {
            delegate.promote(name, version, stage);
            return Boolean.TRUE;
        });
    }

    private <T> T call(String operation, Callable<T> action) {
        return Mono.fromCallable(action)
            .doOnError(ex -> log.warn("Model store call failed | operation={} | reason={}", operation, ex.toString()))
            .retryWhen(Retry.backoff(maxAttempts - 1L, initialBackoff)
                .maxBackoff(maxBackoff)
                .filter(ex -> !(ex instanceof IllegalArgumentException))
                .onRetryExhaustedThrow((retrySpec, sig) -> new PersistenceException(operation, maxAttempts, sig.failure())))
            .block();
    }
}
