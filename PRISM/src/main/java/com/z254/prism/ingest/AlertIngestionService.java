package com.z254.prism.ingest;

import com.z254.prism.domain.model.Alert;
import com.z254.prism.domain.model.AlertRecord;
import com.z254.prism.domain.model.IngestResult;
import com.z254.prism.domain.repository.AlertStore;
import com.z254.prism.noise.NoiseReducer;
import com.z254.prism.noise.PatternLibrary;
import com.z254.prism.observability.CorrelationMetrics;
import com.z254.prism.observability.PrismStructuredLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Orchestrates the ingestion of alert records into the store.
 * <p>
 * Pipeline: validate, fingerprint, record the pattern occurrence, decide noise, then
 * deduplicate/resolve/admit in the store. A repeat of a firing fingerprint is always folded, so
 * it reports {@link IngestResult#DEDUPLICATED} even when its pattern is noise; such an alert is
 * counted as noise rather than as a duplicate. Pattern library and store mutations are
 * serialized by one lock per engine; counters are updated outside of it.
 */
@Slf4j
@Component
public class AlertIngestionService {

    private final AlertValidator validator;
    private final FingerprintGenerator fingerprintGenerator;
    private final PatternLibrary patternLibrary;
    private final NoiseReducer noiseReducer;
    private final AlertStore store;
    private final CorrelationMetrics metrics;
    private final PrismStructuredLogger logger;
    private final Clock clock;
    private final ReentrantLock writeLock = new ReentrantLock();

    public AlertIngestionService(AlertValidator validator,
                                 FingerprintGenerator fingerprintGenerator,
                                 PatternLibrary patternLibrary,
                                 NoiseReducer noiseReducer,
                                 AlertStore store,
                                 CorrelationMetrics metrics,
                                 PrismStructuredLogger logger,
                                 Clock clock) {
        this.validator = validator;
        this.fingerprintGenerator = fingerprintGenerator;
        this.patternLibrary = patternLibrary;
        this.noiseReducer = noiseReducer;
        this.store = store;
        this.metrics = metrics;
        this.logger = logger;
        this.clock = clock;
    }

    /**
     * Ingest one alert record.
     *
     * @throws AlertValidator.InvalidAlertException if the record is malformed; nothing is
     *         stored and no counter changes
     */
    public IngestResult ingest(AlertRecord record) {
        Alert alert;
        try {
            alert = validator.toAlert(record, clock.instant());
        } catch (AlertValidator.InvalidAlertException e) {
            logger.logAlertEvent(record != null ? record.getId() : null,
                    PrismStructuredLogger.AlertEventType.REJECTED,
                    "Rejected invalid alert",
                    Map.of("problems", String.join("; ", e.getProblems())));
            throw e;
        }
        alert.setFingerprint(fingerprintGenerator.fingerprint(alert.getService(), alert.getHost(), alert.getTitle()));

        IngestResult result;
        writeLock.lock();
        try {
            if (alert.isFiring()) {
                String key = patternLibrary.recordOccurrence(alert);
                alert.setPatternKey(key);
                boolean repeatDelivery = store.contains(alert.getId());
                if (!repeatDelivery && noiseReducer.isNoise(key, alert.getTimestamp())) {
                    alert.setSuppressed(true);
                }
            } else {
                alert.setPatternKey(PatternLibrary.patternKey(alert.getService(), alert.getHost(), alert.getTitle()));
            }

            result = store.ingest(alert);
            if (result == IngestResult.ACCEPTED && alert.isSuppressed()) {
                result = IngestResult.NOISE;
            }
        } finally {
            writeLock.unlock();
        }

        record(alert, result);
        return result;
    }

    /**
     * Re-check every suppressed alert against the current pattern frequencies.
     *
     * @return number of alerts un-suppressed
     */
    public int reevaluateSuppressed() {
        writeLock.lock();
        try {
            return noiseReducer.reevaluateSuppressed(store, clock.instant());
        } finally {
            writeLock.unlock();
        }
    }

    @Scheduled(fixedDelayString = "${prism.noise.reevaluation-interval:PT5M}",
            initialDelayString = "${prism.noise.reevaluation-interval:PT5M}")
    public void scheduledReevaluation() {
        try {
            int cleared = reevaluateSuppressed();
            log.debug("Scheduled noise re-evaluation cleared {} alert(s)", cleared);
        } catch (RuntimeException e) {
            log.error("Scheduled noise re-evaluation failed: {}", e.getMessage(), e);
        }
    }

    private void record(Alert alert, IngestResult result) {
        metrics.recordIngested();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("service", alert.getService());
        details.put("host", alert.getHost());
        details.put("fingerprint", alert.getFingerprint());

        switch (result) {
            case DEDUPLICATED -> {
                if (alert.isSuppressed()) {
                    metrics.recordNoiseSuppressed();
                    details.put("patternKey", alert.getPatternKey());
                    logger.logAlertEvent(alert.getId(), PrismStructuredLogger.AlertEventType.NOISE_SUPPRESSED,
                            "Noise alert folded into firing duplicate", details);
                    return;
                }
                metrics.recordDeduplicated();
                logger.logAlertEvent(alert.getId(), PrismStructuredLogger.AlertEventType.DEDUPLICATED,
                        "Alert folded into firing duplicate", details);
            }
            case NOISE -> {
                metrics.recordNoiseSuppressed();
                details.put("patternKey", alert.getPatternKey());
                logger.logAlertEvent(alert.getId(), PrismStructuredLogger.AlertEventType.NOISE_SUPPRESSED,
                        "Alert suppressed as recurring noise", details);
            }
            case RESOLVED -> {
                metrics.recordResolved();
                logger.logAlertEvent(alert.getId(), PrismStructuredLogger.AlertEventType.RESOLVED,
                        "Firing alert resolved", details);
            }
            default -> logger.logAlertEvent(alert.getId(), PrismStructuredLogger.AlertEventType.ACCEPTED,
                    "Alert accepted", details);
        }
    }
}
