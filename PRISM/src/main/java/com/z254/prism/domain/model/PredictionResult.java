package com.z254.prism.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Forecast of alerts for a service.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PredictionResult {

    private String service;

    private Duration horizon;

    /** Share of pattern occurrences followed by a cluster within the horizon (0.0 to 1.0) */
    private double predictionScore;

    /** Confidence in the score, driven by sample size */
    private double confidence;

    /** Pattern occurrences considered */
    private int sampleSize;

    @Builder.Default
    private List<ContributingPattern> contributingPatterns = new ArrayList<>();

    /** Most frequent titles for the service */
    @Builder.Default
    private List<String> expectedAlertTitles = new ArrayList<>();

    @Builder.Default
    private List<String> riskFactors = new ArrayList<>();

    private Instant generatedAt;

    public static PredictionResult empty(String service, Duration horizon, Instant now) {
        return PredictionResult.builder()
                .service(service)
                .horizon(horizon)
                .generatedAt(now)
                .build();
    }

    /**
     * Pattern that fed into a prediction.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ContributingPattern {
        private String patternKey;
        private String host;
        private String title;
        private int occurrences;
        private int followedByCluster;
    }
}
