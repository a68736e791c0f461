package com.z254.prism.domain.service;

import com.z254.prism.config.PrismProperties;
import com.z254.prism.correlation.ClusterRegistry;
import com.z254.prism.correlation.CorrelationRuleRegistry;
import com.z254.prism.correlation.Correlator;
import com.z254.prism.domain.model.Alert;
import com.z254.prism.domain.model.AlertCluster;
import com.z254.prism.domain.model.AlertQuery;
import com.z254.prism.domain.model.AlertRecord;
import com.z254.prism.domain.model.CorrelationQuery;
import com.z254.prism.domain.model.CorrelationRule;
import com.z254.prism.domain.model.IncidentAnalysis;
import com.z254.prism.domain.model.IngestResult;
import com.z254.prism.domain.model.MetricsSnapshot;
import com.z254.prism.domain.model.PatternReport;
import com.z254.prism.domain.model.PredictionResult;
import com.z254.prism.domain.repository.AlertStore;
import com.z254.prism.graph.DependencyGraphHolder;
import com.z254.prism.ingest.AlertIngestionService;
import com.z254.prism.noise.NoiseReducer;
import com.z254.prism.observability.CorrelationMetrics;
import com.z254.prism.observability.PrismStructuredLogger;
import com.z254.prism.prediction.AlertPredictor;
import com.z254.prism.rca.IncidentAnalyzer;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Entry point of the correlation engine used by the ingestion and query layer.
 * <p>
 * Every operation delegates to the owning component; the engine itself holds no state.
 */
@Service
public class AlertCorrelationEngine {

    private final AlertIngestionService ingestionService;
    private final AlertStore store;
    private final DependencyGraphHolder graphHolder;
    private final CorrelationRuleRegistry ruleRegistry;
    private final Correlator correlator;
    private final ClusterRegistry clusterRegistry;
    private final IncidentAnalyzer incidentAnalyzer;
    private final NoiseReducer noiseReducer;
    private final AlertPredictor predictor;
    private final CorrelationMetrics metrics;
    private final PrismStructuredLogger logger;
    private final PrismProperties properties;
    private final Clock clock;

    public AlertCorrelationEngine(AlertIngestionService ingestionService,
                                  AlertStore store,
                                  DependencyGraphHolder graphHolder,
                                  CorrelationRuleRegistry ruleRegistry,
                                  Correlator correlator,
                                  ClusterRegistry clusterRegistry,
                                  IncidentAnalyzer incidentAnalyzer,
                                  NoiseReducer noiseReducer,
                                  AlertPredictor predictor,
                                  CorrelationMetrics metrics,
                                  PrismStructuredLogger logger,
                                  PrismProperties properties,
                                  Clock clock) {
        this.ingestionService = ingestionService;
        this.store = store;
        this.graphHolder = graphHolder;
        this.ruleRegistry = ruleRegistry;
        this.correlator = correlator;
        this.clusterRegistry = clusterRegistry;
        this.incidentAnalyzer = incidentAnalyzer;
        this.noiseReducer = noiseReducer;
        this.predictor = predictor;
        this.metrics = metrics;
        this.logger = logger;
        this.properties = properties;
        this.clock = clock;
    }

    // ========== Ingestion ==========

    /**
     * @throws com.z254.prism.ingest.AlertValidator.InvalidAlertException for malformed records
     */
    public IngestResult ingest(AlertRecord record) {
        return ingestionService.ingest(record);
    }

    public Optional<Alert> acknowledgeAlert(String alertId, String acknowledgedBy) {
        Optional<Alert> acknowledged = store.acknowledge(alertId, acknowledgedBy, clock.instant());
        acknowledged.ifPresent(alert -> logger.logAlertEvent(alertId,
                PrismStructuredLogger.AlertEventType.ACKNOWLEDGED, "Alert acknowledged",
                Map.of("acknowledgedBy", String.valueOf(acknowledgedBy))));
        return acknowledged;
    }

    public List<Alert> queryAlerts(AlertQuery query) {
        return store.query(query != null ? query : new AlertQuery());
    }

    // ========== Configuration ==========

    /**
     * Replace the service dependency graph wholesale. Passes already running keep the old graph.
     *
     * @throws com.z254.prism.graph.ServiceDependencyGraph.InvalidDependencyException for malformed mappings
     */
    public void setServiceDependencies(Map<String, ? extends List<String>> dependencies) {
        graphHolder.replace(dependencies);
        incidentAnalyzer.invalidate();
    }

    /**
     * @throws CorrelationRuleRegistry.InvalidRuleException for malformed rules
     */
    public CorrelationRule registerCorrelationRule(CorrelationRule rule) {
        return ruleRegistry.register(rule);
    }

    public boolean removeCorrelationRule(String ruleId) {
        return ruleRegistry.remove(ruleId);
    }

    public List<CorrelationRule> correlationRules() {
        return ruleRegistry.list();
    }

    // ========== Correlation ==========

    public Mono<List<AlertCluster>> correlate(CorrelationQuery query) {
        return correlator.correlate(query);
    }

    /**
     * @throws Correlator.CorrelationCancelledException when the pass exceeds its deadline
     */
    public List<AlertCluster> correlateBlocking(CorrelationQuery query) {
        return correlator.correlateBlocking(query);
    }

    public List<AlertCluster> correlate(long timeWindowSeconds) {
        return correlateBlocking(CorrelationQuery.ofWindowSeconds(timeWindowSeconds));
    }

    public List<AlertCluster> activeClusters() {
        return clusterRegistry.activeClusters();
    }

    /**
     * @throws IncidentAnalyzer.ClusterNotFoundException if the cluster is unknown
     */
    public IncidentAnalysis analyzeIncident(String clusterId) {
        return incidentAnalyzer.analyzeIncident(clusterId);
    }

    // ========== Patterns and prediction ==========

    public PatternReport detectAlertPatterns(Duration lookback) {
        Duration period = lookback != null ? lookback : properties.getPrediction().getLookback();
        Instant now = clock.instant();
        List<Alert> alerts = store.query(AlertQuery.builder()
                .from(now.minus(period))
                .to(now)
                .build());
        return noiseReducer.detectPatterns(alerts, period);
    }

    public int reevaluateSuppressedAlerts() {
        return ingestionService.reevaluateSuppressed();
    }

    public PredictionResult predictAlerts(String service, Duration horizon) {
        return predictor.predictAlerts(service, horizon);
    }

    public PredictionResult predictAlerts(String service, long horizonSeconds) {
        return predictAlerts(service, Duration.ofSeconds(horizonSeconds));
    }

    // ========== Metrics ==========

    public MetricsSnapshot getMetrics() {
        return metrics.snapshot(
                clusterRegistry.liveMemberCount(),
                clusterRegistry.activeClusters().size(),
                ruleRegistry.size(),
                store.size(),
                clock.instant());
    }
}
