package com.z254.prism.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Point-in-time view of the engine counters.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MetricsSnapshot {
    private long totalAlertsIngested;
    private long totalDeduplicated;
    private long totalNoiseSuppressed;
    private long totalResolved;
    private long totalClustersCreated;
    /** Distinct live cluster members over non-noise alerts, as a percentage */
    private double correlationRate;
    /** Noise suppressed over ingested alerts, as a percentage */
    private double noiseReductionRate;
    private int activeClusters;
    private int correlationRules;
    private int storedAlerts;
    private long correlationPassesCompleted;
    private long correlationPassesCancelled;
    private Instant capturedAt;
}
