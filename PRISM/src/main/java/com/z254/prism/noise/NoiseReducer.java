package com.z254.prism.noise;

import com.z254.prism.config.PrismProperties;
import com.z254.prism.domain.model.Alert;
import com.z254.prism.domain.model.PatternReport;
import com.z254.prism.domain.repository.AlertStore;
import com.z254.prism.observability.PrismStructuredLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Statistical noise detection on top of the {@link PatternLibrary}.
 * <p>
 * An alert is noise when its pattern has already been seen at least {@code min-occurrences}
 * times in the trailing horizon and accounts for more than {@code frequency-threshold} of all
 * occurrences in that horizon. The decision is best-effort and may be reversed later by
 * {@link #reevaluateSuppressed(AlertStore, Instant)}.
 */
@Slf4j
@Component
public class NoiseReducer {

    private static final int MIN_PERIODIC_ALERTS = 5;
    private static final double MAX_PERIODIC_VARIATION = 0.3;
    private static final double MAX_PERIODIC_INTERVAL_SECONDS = 86_400;
    private static final double NOISE_PATTERN_SHARE = 0.1;

    private final PatternLibrary patternLibrary;
    private final PrismProperties.Noise config;
    private final PrismStructuredLogger logger;

    public NoiseReducer(PatternLibrary patternLibrary,
                        PrismProperties properties,
                        PrismStructuredLogger logger) {
        this.patternLibrary = patternLibrary;
        this.config = properties.getNoise();
        this.logger = logger;
    }

    /**
     * Decide whether an alert whose occurrence has just been recorded is noise.
     */
    public boolean isNoise(String patternKey, Instant at) {
        if (!config.isLearningEnabled()) {
            return false;
        }
        PatternLibrary.Frequency frequency = patternLibrary.frequency(patternKey, at, config.getHorizon());
        return exceedsThreshold(frequency.keyOccurrences() - 1, frequency);
    }

    /**
     * Whether a pattern is still noise at {@code at}, with no new occurrence recorded.
     */
    public boolean isStillNoise(String patternKey, Instant at) {
        if (!config.isLearningEnabled()) {
            return false;
        }
        PatternLibrary.Frequency frequency = patternLibrary.frequency(patternKey, at, config.getHorizon());
        return exceedsThreshold(frequency.keyOccurrences(), frequency);
    }

    private boolean exceedsThreshold(int occurrences, PatternLibrary.Frequency frequency) {
        return occurrences >= config.getMinOccurrences()
                && frequency.share() > config.getFrequencyThreshold();
    }

    /**
     * Clear the noise flag of stored alerts whose pattern frequency has decayed.
     * Clusters already built are left untouched.
     *
     * @return number of alerts un-suppressed
     */
    public int reevaluateSuppressed(AlertStore store, Instant now) {
        int cleared = 0;
        for (Alert alert : store.findSuppressed()) {
            String key = alert.getPatternKey() != null
                    ? alert.getPatternKey()
                    : PatternLibrary.patternKey(alert.getService(), alert.getHost(), alert.getTitle());
            if (isStillNoise(key, now)) {
                continue;
            }
            if (store.updateSuppressed(alert.getId(), false)) {
                cleared++;
                logger.logAlertEvent(alert.getId(), PrismStructuredLogger.AlertEventType.UNSUPPRESSED,
                        "Noise flag cleared after frequency decay", Map.of("patternKey", key));
            }
        }
        if (cleared > 0) {
            logger.logPatternEvent(null, PrismStructuredLogger.PatternEventType.NOISE_DECAYED,
                    "Re-evaluated suppressed alerts", Map.of("unsuppressed", cleared));
        }
        return cleared;
    }

    /**
     * Find periodic and high-frequency patterns among the given alerts.
     */
    public PatternReport detectPatterns(List<Alert> alerts, Duration lookback) {
        Map<String, List<Instant>> byService = new TreeMap<>();
        Map<String, List<Alert>> byPattern = new LinkedHashMap<>();
        for (Alert alert : alerts) {
            byService.computeIfAbsent(alert.getService(), s -> new ArrayList<>()).add(alert.getTimestamp());
            String key = PatternLibrary.patternKey(alert.getService(), alert.getHost(), alert.getTitle());
            byPattern.computeIfAbsent(key, k -> new ArrayList<>()).add(alert);
        }

        List<PatternReport.PeriodicPattern> periodic = new ArrayList<>();
        byService.forEach((service, timestamps) -> periodicPattern(service, timestamps).ifPresent(periodic::add));

        List<PatternReport.NoisePattern> noise = new ArrayList<>();
        int total = alerts.size();
        byPattern.forEach((key, members) -> {
            double share = (double) members.size() / total;
            if (share > NOISE_PATTERN_SHARE) {
                Alert sample = members.get(0);
                noise.add(PatternReport.NoisePattern.builder()
                        .patternKey(key)
                        .service(sample.getService())
                        .host(sample.getHost())
                        .title(sample.getTitle())
                        .frequency(members.size())
                        .percentage(share * 100)
                        .build());
            }
        });
        noise.sort(Comparator.comparingInt(PatternReport.NoisePattern::getFrequency).reversed()
                .thenComparing(PatternReport.NoisePattern::getPatternKey));

        return PatternReport.builder()
                .patterns(periodic)
                .noisePatterns(noise)
                .analysisPeriod(lookback)
                .totalAlertsAnalyzed(total)
                .build();
    }

    private Optional<PatternReport.PeriodicPattern> periodicPattern(String service, List<Instant> timestamps) {
        if (timestamps.size() < MIN_PERIODIC_ALERTS) {
            return Optional.empty();
        }
        List<Instant> sorted = new ArrayList<>(timestamps);
        sorted.sort(Comparator.naturalOrder());

        double[] intervals = new double[sorted.size() - 1];
        double sum = 0;
        for (int i = 1; i < sorted.size(); i++) {
            intervals[i - 1] = Duration.between(sorted.get(i - 1), sorted.get(i)).toMillis() / 1000.0;
            sum += intervals[i - 1];
        }
        double mean = sum / intervals.length;
        if (mean <= 0) {
            return Optional.empty();
        }
        double variance = 0;
        for (double interval : intervals) {
            variance += (interval - mean) * (interval - mean);
        }
        double stddev = Math.sqrt(variance / intervals.length);

        if (stddev >= MAX_PERIODIC_VARIATION * mean || mean >= MAX_PERIODIC_INTERVAL_SECONDS) {
            return Optional.empty();
        }
        return Optional.of(PatternReport.PeriodicPattern.builder()
                .service(service)
                .averageIntervalSeconds(mean)
                .standardDeviationSeconds(stddev)
                .occurrences(sorted.size())
                .confidence(1.0 - stddev / mean)
                .build());
    }
}
