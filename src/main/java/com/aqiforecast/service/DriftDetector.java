package com.aqiforecast.service;

import com.aqiforecast.config.ForecastProperties;
import com.aqiforecast.domain.DriftSummary;
import com.aqiforecast.domain.FeatureDrift;
import com.aqiforecast.exception.InsufficientDataException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Compares the recent input distribution of each predictor with the baseline captured after
 * its last promotion. The baseline holds the first {@code baselineWindowSize} feature vectors
 * seen since the last reset; the recent window rolls over the latest {@code recentWindowSize}.
 */
@Slf4j
@Service
public class DriftDetector {

    private final int baselineWindowSize;
    private final int recentWindowSize;
    private final int minSamples;
    private final double meanShiftThreshold;
    private final double varianceRatioLower;
    private final double varianceRatioUpper;
    private final ConcurrentHashMap<String, FeatureHistory> histories = new ConcurrentHashMap<>();

    public DriftDetector(ForecastProperties properties) {
        ForecastProperties.Drift config = properties.getDrift();
        this.baselineWindowSize = config.getBaselineWindowSize();
        this.recentWindowSize = config.getRecentWindowSize();
        this.minSamples = config.getMinSamples();
        this.meanShiftThreshold = config.getMeanShiftThreshold();
        this.varianceRatioLower = config.getVarianceRatioLower();
        this.varianceRatioUpper = config.getVarianceRatioUpper();
    }

    public void ingest(String predictorId, Map<String, Double> features) {
        if (features == null || features.isEmpty()) {
            return;
        }
        Map<String, Double> finite = new TreeMap<>();
        features.forEach((name, value) -> {
            if (value != null && Double.isFinite(value)) {
                finite.put(name, value);
            }
        });
        if (!finite.isEmpty()) {
            histories.computeIfAbsent(predictorId, id -> new FeatureHistory()).add(finite);
        }
    }

    /**
     * @throws InsufficientDataException when either window holds fewer than the minimum samples
     */
    public DriftSummary compare(String predictorId) {
        FeatureHistory history = histories.get(predictorId);
        if (history == null) {
            throw new InsufficientDataException(predictorId, 0, minSamples);
        }
        return history.compare(predictorId);
    }

    public void resetBaseline(String predictorId) {
        histories.remove(predictorId);
        log.info("Drift baseline reset | predictor={}", predictorId);
    }

    private FeatureDrift featureDrift(String feature, RunningStats baseline, RunningStats recent) {
        double baselineMean = baseline.mean();
        double recentMean = recent.mean();
        double baselineStd = baseline.std();
        double recentStd = recent.std();

        double diff = Math.abs(recentMean - baselineMean);
        double meanShift;
        if (baselineMean == 0.0d) {
            meanShift = diff == 0.0d ? 0.0d : Double.POSITIVE_INFINITY;
        } else {
            meanShift = diff / Math.abs(baselineMean);
        }
        double varianceRatio;
        if (baselineStd > 0.0d) {
            varianceRatio = recentStd / baselineStd;
        } else {
            varianceRatio = recentStd > 0.0d ? Double.POSITIVE_INFINITY : 1.0d;
        }

        boolean drift = meanShift > meanShiftThreshold
            || varianceRatio < varianceRatioLower
            || varianceRatio > varianceRatioUpper;
        return new FeatureDrift(feature, baselineMean, baselineStd, recentMean, recentStd, meanShift, varianceRatio, drift);
    }

    private final class FeatureHistory {
        private final Map<String, RunningStats> baseline = new TreeMap<>();
        private final Deque<Map<String, Double>> recent = new ArrayDeque<>();
        private long baselineCount;

        private synchronized void add(Map<String, Double> features) {
            if (baselineCount < baselineWindowSize) {
                features.forEach((name, value) -> baseline.computeIfAbsent(name, n -> new RunningStats()).add(value));
                baselineCount++;
            }
            recent.addLast(features);
            while (recent.size() > recentWindowSize) {
                recent.removeFirst();
            }
        }

        private synchronized DriftSummary compare(String predictorId) {
            if (baselineCount < minSamples || recent.size() < minSamples) {
                throw new InsufficientDataException(predictorId, Math.min(baselineCount, recent.size()), minSamples);
            }

            List<FeatureDrift> features = new ArrayList<>();
            for (Map.Entry<String, RunningStats> entry : baseline.entrySet()) {
                RunningStats recentStats = new RunningStats();
                for (Map<String, Double> vector : recent) {
                    Double value = vector.get(entry.getKey());
                    if (value != null) {
                        recentStats.add(value);
                    }
                }
                if (entry.getValue().count() < 2 || recentStats.count() < 2) {
                    continue;
                }
                features.add(featureDrift(entry.getKey(), entry.getValue(), recentStats));
            }
            if (features.isEmpty()) {
                throw new InsufficientDataException(predictorId, 0, minSamples);
            }

            FeatureDrift dominant = features.stream()
                .max(Comparator.comparing(FeatureDrift::driftDetected)
                    .thenComparingDouble(FeatureDrift::meanShift)
                    .thenComparingDouble(f -> Math.abs(Math.log(Math.max(f.varianceRatio(), Double.MIN_NORMAL)))))
                .orElseThrow();
            boolean drift = features.stream().anyMatch(FeatureDrift::driftDetected);

            return new DriftSummary(
                predictorId,
                dominant.baselineMean(),
                dominant.baselineStd(),
                dominant.recentMean(),
                dominant.recentStd(),
                baselineCount,
                recent.size(),
                dominant.meanShift(),
                dominant.varianceRatio(),
                drift,
                dominant.feature(),
                features);
        }
    }

    /**
     * Welford running mean and sample variance.
     */
    private static final class RunningStats {
        private long count;
        private double mean;
        private double m2;

        private void add(double value) {
            count++;
            double delta = value - mean;
            mean += delta / count;
            m2 += delta * (value - mean);
        }

        private long count() {
            return count;
        }

        private double mean() {
            return mean;
        }

        private double std() {
            return count > 1 ? Math.sqrt(m2 / (count - 1)) : 0.0d;
        }
    }
}
