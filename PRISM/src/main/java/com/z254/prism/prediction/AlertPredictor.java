package com.z254.prism.prediction;

import com.z254.prism.config.PrismProperties;
import com.z254.prism.domain.model.Alert;
import com.z254.prism.domain.model.AlertQuery;
import com.z254.prism.domain.model.PredictionResult;
import com.z254.prism.domain.repository.AlertStore;
import com.z254.prism.noise.PatternLibrary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Forecasts whether a service is heading into an incident.
 * <p>
 * The score is the share of the service's pattern occurrences (within the lookback) that were
 * followed by a published cluster involving the service within the horizon. Prediction never
 * fails: missing history or internal errors yield an empty result.
 */
@Slf4j
@Service
public class AlertPredictor {

    private static final int EXPECTED_TITLES = 5;
    private static final int HIGH_VOLUME_ALERTS = 50;
    private static final int HIGH_CRITICAL_ALERTS = 5;
    private static final int WIDE_HOST_SPREAD = 10;

    private final PatternLibrary patternLibrary;
    private final AlertStore store;
    private final PrismProperties.Prediction config;
    private final Clock clock;

    public AlertPredictor(PatternLibrary patternLibrary,
                          AlertStore store,
                          PrismProperties properties,
                          Clock clock) {
        this.patternLibrary = patternLibrary;
        this.store = store;
        this.config = properties.getPrediction();
        this.clock = clock;
    }

    public PredictionResult predictAlerts(String service, Duration horizon) {
        Instant now = clock.instant();
        Duration effectiveHorizon = horizon != null && !horizon.isNegative() && !horizon.isZero()
                ? horizon
                : config.getDefaultHorizon();
        if (service == null || service.isBlank()) {
            return PredictionResult.empty(service, effectiveHorizon, now);
        }

        try {
            return predict(service, effectiveHorizon, now);
        } catch (RuntimeException e) {
            log.warn("Prediction for service {} failed, returning empty prediction: {}", service, e.getMessage(), e);
            return PredictionResult.empty(service, effectiveHorizon, now);
        }
    }

    private PredictionResult predict(String service, Duration horizon, Instant now) {
        Instant since = now.minus(config.getLookback());
        List<PredictionResult.ContributingPattern> contributing = new ArrayList<>();
        Map<String, Integer> titleFrequency = new LinkedHashMap<>();
        int total = 0;
        int followed = 0;

        for (PatternLibrary.PatternView pattern : patternLibrary.patternsForService(service)) {
            int occurrences = 0;
            int followedByCluster = 0;
            for (Instant at : pattern.occurrences()) {
                if (at.isBefore(since) || at.isAfter(now)) {
                    continue;
                }
                occurrences++;
                if (patternLibrary.clusterSeenBetween(service, at, at.plus(horizon))) {
                    followedByCluster++;
                }
            }
            if (occurrences == 0) {
                continue;
            }
            total += occurrences;
            followed += followedByCluster;
            titleFrequency.merge(pattern.sampleTitle(), occurrences, Integer::sum);
            contributing.add(PredictionResult.ContributingPattern.builder()
                    .patternKey(pattern.key())
                    .host(pattern.host())
                    .title(pattern.sampleTitle())
                    .occurrences(occurrences)
                    .followedByCluster(followedByCluster)
                    .build());
        }

        if (total == 0) {
            return PredictionResult.empty(service, horizon, now);
        }

        contributing.sort(Comparator.comparingInt(PredictionResult.ContributingPattern::getFollowedByCluster).reversed()
                .thenComparing(Comparator.comparingInt(PredictionResult.ContributingPattern::getOccurrences).reversed())
                .thenComparing(PredictionResult.ContributingPattern::getPatternKey));

        List<String> expectedTitles = titleFrequency.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed()
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(EXPECTED_TITLES)
                .map(Map.Entry::getKey)
                .toList();

        double score = Math.max(0.0, Math.min(1.0, (double) followed / total));
        return PredictionResult.builder()
                .service(service)
                .horizon(horizon)
                .predictionScore(score)
                .confidence(Math.min(0.9, total / 100.0))
                .sampleSize(total)
                .contributingPatterns(contributing)
                .expectedAlertTitles(new ArrayList<>(expectedTitles))
                .riskFactors(riskFactors(service, since, now))
                .generatedAt(now)
                .build();
    }

    private List<String> riskFactors(String service, Instant since, Instant now) {
        List<Alert> recent = store.query(AlertQuery.builder()
                .service(service)
                .from(since)
                .to(now)
                .build());

        List<String> risks = new ArrayList<>();
        if (recent.size() > HIGH_VOLUME_ALERTS) {
            risks.add("High alert volume: " + recent.size() + " alerts");
        }
        long critical = recent.stream().filter(alert -> alert.getSeverity() == Alert.Severity.CRITICAL).count();
        if (critical > HIGH_CRITICAL_ALERTS) {
            risks.add("Frequent critical alerts: " + critical);
        }
        Set<String> hosts = new HashSet<>();
        recent.forEach(alert -> hosts.add(alert.getHost()));
        if (hosts.size() > WIDE_HOST_SPREAD) {
            risks.add("Alerts spread across " + hosts.size() + " hosts");
        }
        return risks;
    }
}
