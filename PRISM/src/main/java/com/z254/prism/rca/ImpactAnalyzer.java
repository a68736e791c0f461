package com.z254.prism.rca;

import com.z254.prism.domain.model.Alert;
import com.z254.prism.domain.model.AlertCluster;
import com.z254.prism.graph.ServiceDependencyGraph;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Builds the impact assessment of a cluster: the distinct (service, host) entities touched,
 * their relation to each root cause candidate and a severity-weighted business impact.
 */
@Component
public class ImpactAnalyzer {

    static final int HIGH_IMPACT_SCORE = 10;
    static final int MEDIUM_IMPACT_SCORE = 5;

    public AlertCluster.ImpactAssessment assess(List<Alert> members, List<String> rootCauseIds,
                                                ServiceDependencyGraph graph) {
        Map<String, Alert> byId = new HashMap<>();
        members.forEach(alert -> byId.put(alert.getId(), alert));

        Map<String, AlertCluster.AffectedEntity> entities = new TreeMap<>();
        Set<String> services = new LinkedHashSet<>();
        Set<String> hosts = new LinkedHashSet<>();
        Map<Alert.Severity, Integer> breakdown = new EnumMap<>(Alert.Severity.class);
        int severityScore = 0;

        for (Alert alert : members) {
            services.add(alert.getService());
            hosts.add(alert.getHost());
            breakdown.merge(alert.getSeverity(), 1, Integer::sum);
            severityScore += alert.getSeverity().getWeight();
            entities.computeIfAbsent(alert.getService() + "\u0000" + alert.getHost(),
                    key -> AlertCluster.AffectedEntity.builder()
                            .service(alert.getService())
                            .host(alert.getHost())
                            .build());
        }

        for (AlertCluster.AffectedEntity entity : entities.values()) {
            Map<String, AlertCluster.Relation> relations = new LinkedHashMap<>();
            for (String rootId : rootCauseIds) {
                Alert root = byId.get(rootId);
                if (root != null) {
                    relations.put(rootId, relation(entity, root, graph));
                }
            }
            entity.setRelationToRootCauses(relations);
        }

        String businessImpact = businessImpact(severityScore);
        List<AlertCluster.AffectedEntity> ordered = new ArrayList<>(entities.values());
        ordered.sort(Comparator.comparing(AlertCluster.AffectedEntity::getService)
                .thenComparing(AlertCluster.AffectedEntity::getHost));

        return AlertCluster.ImpactAssessment.builder()
                .entities(ordered)
                .affectedServices(services.size())
                .affectedHosts(hosts.size())
                .totalAlerts(members.size())
                .severityBreakdown(breakdown)
                .severityScore(severityScore)
                .businessImpact(businessImpact)
                .summary(String.format("%d alerts across %d services and %d hosts; business impact %s",
                        members.size(), services.size(), hosts.size(), businessImpact))
                .build();
    }

    static String businessImpact(int severityScore) {
        if (severityScore > HIGH_IMPACT_SCORE) {
            return "high";
        }
        if (severityScore > MEDIUM_IMPACT_SCORE) {
            return "medium";
        }
        return "low";
    }

    private static AlertCluster.Relation relation(AlertCluster.AffectedEntity entity, Alert root,
                                                  ServiceDependencyGraph graph) {
        if (entity.getService().equals(root.getService())) {
            return AlertCluster.Relation.ROOT;
        }
        if (graph.isDownstreamOf(root.getService(), entity.getService())) {
            return AlertCluster.Relation.UPSTREAM;
        }
        if (graph.isDownstreamOf(entity.getService(), root.getService())) {
            return AlertCluster.Relation.DOWNSTREAM;
        }
        return AlertCluster.Relation.UNRELATED;
    }
}
