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
 * Detailed analysis of the incident represented by a cluster.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IncidentAnalysis {

    private String incidentId;

    private AlertCluster cluster;

    /** Member alerts in chronological order */
    @Builder.Default
    private List<TimelineEntry> timeline = new ArrayList<>();

    @Builder.Default
    private List<RootCauseEvidence> rootCauseAnalysis = new ArrayList<>();

    private AlertCluster.ImpactAssessment impactAssessment;

    /** Ordered remediation recommendations */
    @Builder.Default
    private List<String> recommendations = new ArrayList<>();

    private IncidentSeverity severity;

    private Duration estimatedDuration;

    @Builder.Default
    private List<String> affectedServices = new ArrayList<>();

    private Instant analyzedAt;

    /**
     * Incident severity levels, SEV1 being the most severe.
     */
    public enum IncidentSeverity {
        SEV1,
        SEV2,
        SEV3,
        SEV4
    }

    /**
     * One member alert on the incident timeline.
     */
    public record TimelineEntry(
            Instant timestamp,
            String alertId,
            String service,
            String host,
            Alert.Severity severity,
            String title
    ) {}

    /**
     * Evidence gathered for one root cause candidate.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RootCauseEvidence {
        private String alertId;
        private String service;
        private String host;
        private String title;
        private Instant timestamp;
        /** Likelihood in the range 0.0 to 1.0 */
        private double likelihood;
        @Builder.Default
        private List<Evidence> evidence = new ArrayList<>();
    }

    /**
     * Single supporting observation for a root cause candidate.
     */
    public record Evidence(EvidenceType type, String description, double confidence) {}

    public enum EvidenceType {
        TEMPORAL_PRIMACY,
        UPSTREAM_DEPENDENCY,
        DOWNSTREAM_IMPACT
    }
}
