package com.z254.prism.observability;

import com.z254.prism.domain.model.MetricsSnapshot;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Centralized metrics for the PRISM correlation engine.
 * <p>
 * Provides metrics for:
 * <ul>
 *     <li>Alert ingestion (accepted, deduplicated, noise, resolved)</li>
 *     <li>Cluster creation</li>
 *     <li>Correlation pass outcome and latency</li>
 * </ul>
 * Counters are lock-free, so recording never blocks ingestion.
 */
@Component
public class CorrelationMetrics {

    private final MeterRegistry meterRegistry;

    // Ingestion metrics
    @Getter
    private final Counter alertsIngested;
    @Getter
    private final Counter alertsDeduplicated;
    @Getter
    private final Counter alertsNoiseSuppressed;
    @Getter
    private final Counter alertsResolved;

    // Correlation metrics
    @Getter
    private final Counter clustersCreated;
    @Getter
    private final Counter passesCompleted;
    @Getter
    private final Counter passesCancelled;
    @Getter
    private final Counter passesFailed;
    private final Timer passLatency;
    private final DistributionSummary clusterSize;

    public CorrelationMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.alertsIngested = Counter.builder("prism.alerts.ingested")
                .description("Alerts accepted at the ingestion boundary")
                .register(meterRegistry);
        this.alertsDeduplicated = Counter.builder("prism.alerts.deduplicated")
                .description("Alerts folded into an existing firing alert")
                .register(meterRegistry);
        this.alertsNoiseSuppressed = Counter.builder("prism.alerts.noise_suppressed")
                .description("Alerts flagged as recurring noise")
                .register(meterRegistry);
        this.alertsResolved = Counter.builder("prism.alerts.resolved")
                .description("Firing alerts resolved by a resolution record")
                .register(meterRegistry);

        this.clustersCreated = Counter.builder("prism.clusters.created")
                .description("Distinct clusters published")
                .register(meterRegistry);
        this.passesCompleted = Counter.builder("prism.correlation.passes.completed")
                .description("Correlation passes completed")
                .register(meterRegistry);
        this.passesCancelled = Counter.builder("prism.correlation.passes.cancelled")
                .description("Correlation passes cancelled or past their deadline")
                .register(meterRegistry);
        this.passesFailed = Counter.builder("prism.correlation.passes.failed")
                .description("Correlation passes that failed")
                .register(meterRegistry);
        this.passLatency = Timer.builder("prism.correlation.latency")
                .description("Correlation pass latency")
                .publishPercentiles(0.5, 0.75, 0.95, 0.99)
                .register(meterRegistry);
        this.clusterSize = DistributionSummary.builder("prism.clusters.size")
                .description("Members per published cluster")
                .register(meterRegistry);
    }

    public void recordIngested() {
        alertsIngested.increment();
    }

    public void recordDeduplicated() {
        alertsDeduplicated.increment();
    }

    public void recordNoiseSuppressed() {
        alertsNoiseSuppressed.increment();
    }

    public void recordResolved() {
        alertsResolved.increment();
    }

    public void recordClusterCreated(int size) {
        clustersCreated.increment();
        clusterSize.record(size);
    }

    public Timer.Sample startPass() {
        return Timer.start(meterRegistry);
    }

    public void recordPassCompleted(Timer.Sample sample) {
        sample.stop(passLatency);
        passesCompleted.increment();
    }

    public void recordPassCancelled(Timer.Sample sample) {
        sample.stop(passLatency);
        passesCancelled.increment();
    }

    public void recordPassFailed(Timer.Sample sample) {
        sample.stop(passLatency);
        passesFailed.increment();
    }

    /**
     * Assemble a read-only view of the counters.
     *
     * @param liveClusterMembers distinct alerts currently held by published clusters
     */
    public MetricsSnapshot snapshot(int liveClusterMembers, int activeClusters, int rules,
                                    int storedAlerts, Instant now) {
        long ingested = (long) alertsIngested.count();
        long deduplicated = (long) alertsDeduplicated.count();
        long noise = (long) alertsNoiseSuppressed.count();

        long nonNoise = ingested - deduplicated - noise;
        double correlationRate = nonNoise > 0
                ? Math.min(100.0, liveClusterMembers * 100.0 / nonNoise)
                : 0.0;
        double noiseReductionRate = ingested > 0 ? noise * 100.0 / ingested : 0.0;

        return MetricsSnapshot.builder()
                .totalAlertsIngested(ingested)
                .totalDeduplicated(deduplicated)
                .totalNoiseSuppressed(noise)
                .totalResolved((long) alertsResolved.count())
                .totalClustersCreated((long) clustersCreated.count())
                .correlationRate(correlationRate)
                .noiseReductionRate(noiseReductionRate)
                .activeClusters(activeClusters)
                .correlationRules(rules)
                .storedAlerts(storedAlerts)
                .correlationPassesCompleted((long) passesCompleted.count())
                .correlationPassesCancelled((long) passesCancelled.count())
                .capturedAt(now)
                .build();
    }
}
