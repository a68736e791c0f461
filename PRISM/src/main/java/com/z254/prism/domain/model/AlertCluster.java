package com.z254.prism.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Group of at least two correlated alerts judged to represent one underlying incident.
 * <p>
 * Membership is held by alert id; {@link #alerts} are the copies the cluster was built from.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AlertCluster {

    /** Stable identifier derived from the sorted member ids */
    private String id;

    /** Member alert ids, sorted */
    @Builder.Default
    private List<String> alertIds = new ArrayList<>();

    /** Member alerts as seen by the pass that built the cluster, ordered by timestamp */
    @Builder.Default
    private List<Alert> alerts = new ArrayList<>();

    /** Type with the most contributing edges */
    private CorrelationType correlationType;

    /** Mean weight of the edges inside the cluster (0.0 to 1.0) */
    private double confidenceScore;

    /** Ordered root cause candidates (alert ids) */
    @Builder.Default
    private List<String> rootCauseCandidates = new ArrayList<>();

    private ImpactAssessment impactAssessment;

    /** Number of pairwise edges inside the cluster */
    private int edgeCount;

    /** Highest member severity */
    private Alert.Severity severity;

    /** Window of the pass that built the cluster */
    private Instant windowStart;

    private Instant windowEnd;

    private Instant createdAt;

    /** Ids of earlier clusters absorbed by this one */
    @Builder.Default
    private Set<String> mergedFrom = new LinkedHashSet<>();

    public int size() {
        return alertIds.size();
    }

    public boolean involvesService(String service) {
        return alerts.stream().anyMatch(alert -> service.equals(alert.getService()));
    }

    public boolean involvesHost(String host) {
        return alerts.stream().anyMatch(alert -> host.equals(alert.getHost()));
    }

    /**
     * Relationship of an affected entity to a root cause candidate.
     */
    public enum Relation {
        /** The root cause candidate itself */
        ROOT,
        /** The candidate's service depends on this entity's service */
        UPSTREAM,
        /** This entity's service depends on the candidate's service */
        DOWNSTREAM,
        /** No dependency path either way */
        UNRELATED
    }

    /**
     * Blast radius summary of a cluster.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ImpactAssessment {
        @Builder.Default
        private List<AffectedEntity> entities = new ArrayList<>();
        private int affectedServices;
        private int affectedHosts;
        private int totalAlerts;
        @Builder.Default
        private Map<Alert.Severity, Integer> severityBreakdown = new EnumMap<>(Alert.Severity.class);
        private int severityScore;
        private String businessImpact;
        private String summary;
    }

    /**
     * Distinct (service, host) pair touched by a cluster.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AffectedEntity {
        private String service;
        private String host;
        /** Relation keyed by root cause candidate alert id */
        @Builder.Default
        private Map<String, Relation> relationToRootCauses = new LinkedHashMap<>();
    }
}
