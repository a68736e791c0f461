package com.z254.prism.rca;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.z254.prism.config.PrismProperties;
import com.z254.prism.correlation.ClusterRegistry;
import com.z254.prism.domain.model.Alert;
import com.z254.prism.domain.model.AlertCluster;
import com.z254.prism.domain.model.CorrelationType;
import com.z254.prism.domain.model.IncidentAnalysis;
import com.z254.prism.graph.DependencyGraphHolder;
import com.z254.prism.graph.ServiceDependencyGraph;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Turns a published cluster into an incident analysis: timeline, root cause evidence, impact,
 * recommendations, severity and an estimated duration.
 * <p>
 * Analyses are cached per cluster id and live membership for {@code prism.analysis.cache-ttl}.
 */
@Slf4j
@Service
public class IncidentAnalyzer {

    private static final Map<CorrelationType, List<String>> TYPE_RECOMMENDATIONS = Map.of(
            CorrelationType.DEPENDENCY, List.of(
                    "Check service dependencies and upstream components",
                    "Verify network connectivity between services"),
            CorrelationType.SPATIAL, List.of(
                    "Investigate infrastructure issues on affected hosts",
                    "Check system resources (CPU, memory, disk)"),
            CorrelationType.TEMPORAL, List.of(
                    "Review recent deployments or configuration changes",
                    "Check for scheduled maintenance or batch jobs"),
            CorrelationType.SIMILARITY, List.of(
                    "Compare the alerts reporting similar symptoms for a shared change"));

    private static final Duration BASE_DURATION = Duration.ofMinutes(30);

    private final ClusterRegistry clusterRegistry;
    private final DependencyGraphHolder graphHolder;
    private final Clock clock;
    private final Cache<String, IncidentAnalysis> cache;

    public IncidentAnalyzer(ClusterRegistry clusterRegistry,
                            DependencyGraphHolder graphHolder,
                            PrismProperties properties,
                            Clock clock) {
        this.clusterRegistry = clusterRegistry;
        this.graphHolder = graphHolder;
        this.clock = clock;

        Duration ttl = properties.getAnalysis().getCacheTtl();
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .maximumSize(properties.getAnalysis().getCacheSize())
                .recordStats()
                .build();

        log.info("Initialized incident analysis cache: ttl={}, maxSize={}",
                ttl, properties.getAnalysis().getCacheSize());
    }

    /**
     * @throws ClusterNotFoundException if no live cluster has the given id
     */
    public IncidentAnalysis analyzeIncident(String clusterId) {
        AlertCluster cluster = clusterRegistry.find(clusterId)
                .orElseThrow(() -> new ClusterNotFoundException(clusterId));
        return cache.get(cacheKey(cluster), key -> analyze(cluster));
    }

    public void invalidate() {
        cache.invalidateAll();
    }

    private static String cacheKey(AlertCluster cluster) {
        // keyed on the surviving members, so a cluster shrunk by eviction is analyzed afresh
        return cluster.getId() + "/" + String.join(",", cluster.getAlertIds());
    }

    IncidentAnalysis analyze(AlertCluster cluster) {
        ServiceDependencyGraph graph = graphHolder.current();
        List<Alert> members = new ArrayList<>(cluster.getAlerts());
        members.sort(Comparator.comparing(Alert::getTimestamp).thenComparing(Alert::getId));

        List<IncidentAnalysis.TimelineEntry> timeline = members.stream()
                .map(alert -> new IncidentAnalysis.TimelineEntry(alert.getTimestamp(), alert.getId(),
                        alert.getService(), alert.getHost(), alert.getSeverity(), alert.getTitle()))
                .toList();

        Set<String> services = new LinkedHashSet<>();
        members.forEach(alert -> services.add(alert.getService()));

        AlertCluster.ImpactAssessment impact = cluster.getImpactAssessment();
        int severityScore = impact != null
                ? impact.getSeverityScore()
                : members.stream().mapToInt(alert -> alert.getSeverity().getWeight()).sum();
        boolean critical = members.stream().anyMatch(alert -> alert.getSeverity() == Alert.Severity.CRITICAL);

        return IncidentAnalysis.builder()
                .incidentId("INC-" + cluster.getId().substring("CLU-".length()))
                .cluster(cluster)
                .timeline(new ArrayList<>(timeline))
                .rootCauseAnalysis(rootCauseEvidence(cluster, members, graph))
                .impactAssessment(impact)
                .recommendations(recommendations(cluster, services, critical))
                .severity(incidentSeverity(severityScore, services.size()))
                .estimatedDuration(estimateDuration(members.size(), critical))
                .affectedServices(new ArrayList<>(services))
                .analyzedAt(clock.instant())
                .build();
    }

    private List<IncidentAnalysis.RootCauseEvidence> rootCauseEvidence(AlertCluster cluster, List<Alert> members,
                                                                       ServiceDependencyGraph graph) {
        Alert earliest = members.get(0);
        List<IncidentAnalysis.RootCauseEvidence> result = new ArrayList<>();

        for (String candidateId : cluster.getRootCauseCandidates()) {
            Alert candidate = members.stream()
                    .filter(alert -> alert.getId().equals(candidateId))
                    .findFirst()
                    .orElse(null);
            if (candidate == null) {
                continue;
            }

            List<IncidentAnalysis.Evidence> evidence = new ArrayList<>();
            if (candidate.getId().equals(earliest.getId())) {
                evidence.add(new IncidentAnalysis.Evidence(IncidentAnalysis.EvidenceType.TEMPORAL_PRIMACY,
                        "First alert of the incident", 0.6));
            }

            Set<String> affectedDependents = new LinkedHashSet<>();
            for (Alert other : members) {
                if (!other.getService().equals(candidate.getService())
                        && graph.isDownstreamOf(other.getService(), candidate.getService())) {
                    affectedDependents.add(other.getService());
                }
            }
            if (!affectedDependents.isEmpty()) {
                evidence.add(new IncidentAnalysis.Evidence(IncidentAnalysis.EvidenceType.UPSTREAM_DEPENDENCY,
                        "Services depending on " + candidate.getService() + " also alerted: "
                                + String.join(", ", affectedDependents),
                        Math.min(0.9, 0.5 + 0.1 * affectedDependents.size())));
            }

            double likelihood = evidence.stream()
                    .mapToDouble(IncidentAnalysis.Evidence::confidence)
                    .max()
                    .orElse(0.3);

            result.add(IncidentAnalysis.RootCauseEvidence.builder()
                    .alertId(candidate.getId())
                    .service(candidate.getService())
                    .host(candidate.getHost())
                    .title(candidate.getTitle())
                    .timestamp(candidate.getTimestamp())
                    .likelihood(likelihood)
                    .evidence(evidence)
                    .build());
        }

        result.sort(Comparator.comparingDouble(IncidentAnalysis.RootCauseEvidence::getLikelihood).reversed());
        return result;
    }

    private static List<String> recommendations(AlertCluster cluster, Set<String> services, boolean critical) {
        List<String> recommendations = new ArrayList<>();
        if (cluster.getCorrelationType() != null) {
            recommendations.addAll(TYPE_RECOMMENDATIONS.get(cluster.getCorrelationType()));
        }
        if (critical) {
            recommendations.add("Escalate to on-call engineer immediately");
            recommendations.add("Consider activating incident response team");
        }
        if (services.contains("database")) {
            recommendations.add("Check database connections and query performance");
        }
        if (services.stream().anyMatch(service -> service.toLowerCase(Locale.ROOT).contains("api"))) {
            recommendations.add("Monitor API response times and error rates");
        }
        return recommendations;
    }

    static IncidentAnalysis.IncidentSeverity incidentSeverity(int severityScore, int affectedServices) {
        if (severityScore >= 15 || affectedServices >= 5) {
            return IncidentAnalysis.IncidentSeverity.SEV1;
        }
        if (severityScore >= 10 || affectedServices >= 3) {
            return IncidentAnalysis.IncidentSeverity.SEV2;
        }
        if (severityScore >= 5 || affectedServices >= 1) {
            return IncidentAnalysis.IncidentSeverity.SEV3;
        }
        return IncidentAnalysis.IncidentSeverity.SEV4;
    }

    static Duration estimateDuration(int alertCount, boolean critical) {
        double factor = alertCount / 10.0 * (critical ? 2 : 1);
        return Duration.ofSeconds(Math.round(BASE_DURATION.toSeconds() * factor));
    }

    /**
     * Thrown when the requested cluster is unknown or no longer has two live members.
     */
    public static class ClusterNotFoundException extends RuntimeException {
        public ClusterNotFoundException(String clusterId) {
            super("Cluster not found: " + clusterId);
        }
    }
}
