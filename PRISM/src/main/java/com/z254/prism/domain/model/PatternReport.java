package com.z254.prism.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Recurring alert patterns found over a lookback period.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PatternReport {

    @Builder.Default
    private List<PeriodicPattern> patterns = new ArrayList<>();

    @Builder.Default
    private List<NoisePattern> noisePatterns = new ArrayList<>();

    private Duration analysisPeriod;

    private int totalAlertsAnalyzed;

    /**
     * Service whose alerts arrive at a regular interval.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PeriodicPattern {
        private String service;
        private double averageIntervalSeconds;
        private double standardDeviationSeconds;
        private int occurrences;
        private double confidence;
    }

    /**
     * High-frequency signature.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class NoisePattern {
        private String patternKey;
        private String service;
        private String host;
        private String title;
        private int frequency;
        private double percentage;
    }
}
