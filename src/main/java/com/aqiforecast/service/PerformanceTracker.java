package com.aqiforecast.service;

import com.aqiforecast.config.ForecastProperties;
import com.aqiforecast.domain.PerformanceRecord;
import com.aqiforecast.exception.InsufficientDataException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Rolling accuracy of each predictor over its most recent (predicted, actual) pairs. The
 * window is bounded by sample count and by age relative to the newest sample, so
 * measurements may arrive out of order.
 */
@Slf4j
@Service
public class PerformanceTracker {

    private final int windowSize;
    private final Duration windowDuration;
    private final int minSamples;
    private final double accuracyThreshold;
    private final ConcurrentHashMap<String, SampleWindow> windows = new ConcurrentHashMap<>();

    public PerformanceTracker(ForecastProperties properties) {
        ForecastProperties.Performance config = properties.getPerformance();
        this.windowSize = config.getWindowSize();
        this.windowDuration = config.getWindowDuration();
        this.minSamples = config.getMinSamples();
        this.accuracyThreshold = config.getAccuracyThreshold();
    }

    public void record(String predictorId, double predicted, double actual, Instant timestamp) {
        if (!Double.isFinite(predicted) || !Double.isFinite(actual)) {
            log.warn("Non-finite sample ignored | predictor={} | predicted={} | actual={}", predictorId, predicted, actual);
            return;
        }
        windows.computeIfAbsent(predictorId, id -> new SampleWindow())
            .add(new Sample(predicted, actual, timestamp));
    }

    /**
     * @throws InsufficientDataException when fewer than the configured minimum samples are held
     */
    public PerformanceRecord snapshot(String predictorId) {
        SampleWindow window = windows.get(predictorId);
        if (window == null) {
            throw new InsufficientDataException(predictorId, 0, minSamples);
        }
        return window.snapshot(predictorId);
    }

    public Optional<PerformanceRecord> latest(String predictorId) {
        try {
            return Optional.of(snapshot(predictorId));
        } catch (InsufficientDataException ex) {
            return Optional.empty();
        }
    }

    public int sampleCount(String predictorId) {
        SampleWindow window = windows.get(predictorId);
        return window == null ? 0 : window.size();
    }

    public void reset(String predictorId) {
        windows.remove(predictorId);
        log.info("Performance window reset | predictor={}", predictorId);
    }

    private record Sample(double predicted, double actual, Instant timestamp) {}

    private final class SampleWindow {
        private final PriorityQueue<Sample> samples = new PriorityQueue<>(Comparator.comparing(Sample::timestamp));
        private Instant newest = Instant.MIN;

        private synchronized void add(Sample sample) {
            samples.add(sample);
            if (sample.timestamp().isAfter(newest)) {
                newest = sample.timestamp();
            }
            evict();
        }

        private void evict() {
            Instant cutoff = newest.minus(windowDuration);
            while (!samples.isEmpty() && (samples.size() > windowSize || samples.peek().timestamp().isBefore(cutoff))) {
                samples.poll();
            }
        }

        private synchronized int size() {
            return samples.size();
        }

        private synchronized PerformanceRecord snapshot(String predictorId) {
            if (samples.size() < minSamples) {
                throw new InsufficientDataException(predictorId, samples.size(), minSamples);
            }

            double absErrorSum = 0.0;
            double squaredErrorSum = 0.0;
            int accurate = 0;

            for (Sample sample : samples) {
                double error = sample.predicted() - sample.actual();
                absErrorSum += Math.abs(error);
                squaredErrorSum += error * error;
                if (Math.abs(error) <= accuracyThreshold * Math.abs(sample.actual())) {
                    accurate++;
                }
            }

            double n = samples.size();
            return new PerformanceRecord(
                predictorId,
                samples.peek().timestamp(),
                newest,
                Math.sqrt(squaredErrorSum / n),
                absErrorSum / n,
                accurate / n,
                samples.size());
        }
    }
}
