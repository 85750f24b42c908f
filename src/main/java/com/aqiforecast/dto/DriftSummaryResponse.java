package com.aqiforecast.dto;

import com.aqiforecast.domain.DriftSummary;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class DriftSummaryResponse {
    String predictorId;
    long baselineSampleSize;
    long recentSampleSize;
    String dominantFeature;
    double meanShift;
    double varianceRatio;
    boolean driftDetected;
    List<FeatureDrift> featureDrift;

    @Value
    @Builder
    public static class FeatureDrift {
        String feature;
        double baselineMean;
        double baselineStd;
        double recentMean;
        double recentStd;
        double meanShift;
        double varianceRatio;
        boolean driftDetected;
    }

    public static DriftSummaryResponse from(DriftSummary summary) {
        return DriftSummaryResponse.builder()
            .predictorId(summary.predictorId())
            .baselineSampleSize(summary.baselineSampleCount())
            .recentSampleSize(summary.recentSampleCount())
            .dominantFeature(summary.dominantFeature())
            .meanShift(summary.meanShift())
            .varianceRatio(summary.varianceRatio())
            .driftDetected(summary.driftDetected())
            .featureDrift(summary.features().stream()
                .map(f -> FeatureDrift.builder()
                    .feature(f.feature())
                    .baselineMean(f.baselineMean())
                    .baselineStd(f.baselineStd())
                    .recentMean(f.recentMean())
                    .recentStd(f.recentStd())
                    .meanShift(f.meanShift())
                    .varianceRatio(f.varianceRatio())
                    .driftDetected(f.driftDetected())
                    .build())
                .toList())
            .build();
    }
}
