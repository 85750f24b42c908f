package com.aqiforecast.config;

import com.aqiforecast.exception.ConfigurationValidationException;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@Validated
@ConfigurationProperties(prefix = "forecast")
public class ForecastProperties {

    @Valid private Ensemble ensemble = new Ensemble();
    @Valid private Performance performance = new Performance();
    @Valid private Drift drift = new Drift();
    @Valid private Weights weights = new Weights();
    @Valid private Triggers triggers = new Triggers();
    @Valid private Schedule schedule = new Schedule();
    @Valid private Retraining retraining = new Retraining();
    @Valid private Persistence persistence = new Persistence();
    @Valid private Jobs jobs = new Jobs();
    @Valid private Fallback fallback = new Fallback();
    @Valid private List<PredictorEndpoint> predictors = new ArrayList<>();

    /**
     * Cross-field rules bean validation cannot express.
     */
    public void validate() {
        if (drift.getVarianceRatioLower() >= drift.getVarianceRatioUpper()) {
            throw new ConfigurationValidationException(
                "forecast.drift.variance-ratio-lower must be below variance-ratio-upper");
        }
        if (weights.getSmoothingAlpha() <= 0.0d || weights.getSmoothingAlpha() > 1.0d) {
            throw new ConfigurationValidationException("forecast.weights.smoothing-alpha must be within (0, 1]");
        }
        if (!predictors.isEmpty() && weights.getMinWeightFloor() * predictors.size() > 1.0d) {
            throw new ConfigurationValidationException(
                "forecast.weights.min-weight-floor of " + weights.getMinWeightFloor()
                    + " cannot be honoured by " + predictors.size() + " predictors");
        }
        if (schedule.getMinIntervalDays() > schedule.getMaxIntervalDays()) {
            throw new ConfigurationValidationException(
                "forecast.schedule.min-interval-days must not exceed max-interval-days");
        }
        if (schedule.getLowScoreThreshold() > schedule.getHighScoreThreshold()) {
            throw new ConfigurationValidationException(
                "forecast.schedule.low-score-threshold must not exceed high-score-threshold");
        }
        long distinct = predictors.stream().map(PredictorEndpoint::getId).distinct().count();
        if (distinct != predictors.size()) {
            throw new ConfigurationValidationException("forecast.predictors contains duplicate ids");
        }
    }

    @Data
    public static class Ensemble {
        @DecimalMin(value = "0.5", message = "confidenceLevel must be >= 0.5")
        @DecimalMax(value = "0.999", message = "confidenceLevel must be < 1")
        private double confidenceLevel = 0.8;
        private boolean clampLowerBoundAtZero = true;
        @NotNull private Duration predictTimeout = Duration.ofSeconds(5);
        /** Longest horizon, in hourly steps, of a sequence forecast. */
        @Min(1) private int maxHorizonHours = 72;
        /** Feature that carries the previous step's value into the next step of a sequence. */
        private String lagFeature = "pm25_lag1";
    }

    @Data
    public static class Performance {
        @Min(1) private int windowSize = 500;
        @NotNull private Duration windowDuration = Duration.ofDays(30);
        @Min(1) private int minSamples = 10;
        /** Relative error under which a prediction counts as accurate (0.2 = within 20 percent). */
        @DecimalMin("0.0") private double accuracyThreshold = 0.2;
    }

    @Data
    public static class Drift {
        @Min(2) private int baselineWindowSize = 1000;
        @Min(2) private int recentWindowSize = 100;
        @Min(2) private int minSamples = 30;
        @DecimalMin("0.0") private double meanShiftThreshold = 0.25;
        @DecimalMin("0.0") private double varianceRatioLower = 0.5;
        @DecimalMin("0.0") private double varianceRatioUpper = 2.0;
    }

    @Data
    public static class Weights {
        private double smoothingAlpha = 0.3;
        @DecimalMin("0.0") @DecimalMax("1.0") private double minWeightFloor = 0.05;
        @DecimalMin(value = "0.0", inclusive = false) private double rmseFloor = 1.0;
        /** Share of its previous weight kept by a predictor that produced no snapshot. */
        @DecimalMin("0.0") @DecimalMax("1.0") private double missingSnapshotDecay = 0.5;
        @NotNull private Duration tickInterval = Duration.ofHours(1);
    }

    @Data
    public static class Triggers {
        @DecimalMin("0.0") private double rmseDegradationThreshold = 0.15;
        @DecimalMin("0.0") private double accuracyDegradationThreshold = 0.10;
        @Min(1) private int baselineHistorySize = 24;
        @Min(1) private int minBaselineSnapshots = 1;
        @Min(1) private int auditTrailSize = 50;
        @NotNull private Duration evaluationInterval = Duration.ofMinutes(30);
    }

    @Data
    public static class Schedule {
        @NotNull private Duration checkInterval = Duration.ofMinutes(30);
        @Min(1) private int defaultIntervalDays = 7;
        @Min(1) private int minIntervalDays = 3;
        @Min(1) private int maxIntervalDays = 30;
        @DecimalMin("0.0") @DecimalMax("1.0") private double lowScoreThreshold = 0.7;
        @DecimalMin("0.0") @DecimalMax("1.0") private double highScoreThreshold = 0.9;
        @DecimalMin(value = "0.5", inclusive = false) private double shortenFactor = 0.7;
        @DecimalMax("1.3") private double extendFactor = 1.3;
        /** RMSE at which the validation score's RMSE component is 1. */
        private double scoreBestRmse = 15.0;
        @DecimalMin(value = "0.0", inclusive = false) private double scoreRmseSpan = 20.0;
    }

    @Data
    public static class Retraining {
        @Min(1) private int maxConcurrentRetrainings = 1;
        @NotNull private Duration timeout = Duration.ofMinutes(60);
        @DecimalMin("0.0") private double maxRmse = 25.0;
        @DecimalMin("0.0") @DecimalMax("1.0") private double minAccuracy = 0.7;
        private boolean requireImprovement = true;
        @NotNull private ConflictPolicy conflictPolicy = ConflictPolicy.QUEUE;
        @NotNull private Duration trainingWindow = Duration.ofDays(30);
        @NotNull private Duration validationWindow = Duration.ofDays(3);
        @NotBlank private String productionStage = "Production";
        @Min(1) private int outcomeHistorySize = 100;
    }

    public enum ConflictPolicy {
        QUEUE,
        REJECT
    }

    @Data
    public static class Persistence {
        @Min(1) private int maxAttempts = 3;
        @NotNull private Duration initialBackoff = Duration.ofMillis(200);
        @NotNull private Duration maxBackoff = Duration.ofSeconds(5);
    }

    @Data
    public static class Jobs {
        private boolean enabled = true;
        @Min(1) private int poolSize = 2;
    }

    @Data
    public static class Fallback {
        @DecimalMin("0.0") private double defaultValue = 100.0;
        @DecimalMin("0.0") private double bandFraction = 0.2;
    }

    @Data
    public static class PredictorEndpoint {
        @NotBlank private String id;
        @NotBlank private String baseUrl;
        @Min(1) private int timeoutSeconds = 10;
        @Min(1) private Integer initialIntervalDays;
    }
}
