package com.z254.prism.health;

import com.z254.prism.correlation.ClusterRegistry;
import com.z254.prism.correlation.CorrelationRuleRegistry;
import com.z254.prism.domain.repository.AlertStore;
import com.z254.prism.graph.DependencyGraphHolder;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health indicator for the correlation engine.
 * <p>
 * Reports on:
 * <ul>
 *     <li>Alert store fill level</li>
 *     <li>Registered correlation rules</li>
 *     <li>Dependency graph size</li>
 *     <li>Last published correlation pass</li>
 * </ul>
 * The engine is down when no correlation rule is enabled.
 */
@Component
public class CorrelationHealthIndicator implements ReactiveHealthIndicator {

    private final AlertStore store;
    private final CorrelationRuleRegistry ruleRegistry;
    private final DependencyGraphHolder graphHolder;
    private final ClusterRegistry clusterRegistry;

    public CorrelationHealthIndicator(AlertStore store,
                                      CorrelationRuleRegistry ruleRegistry,
                                      DependencyGraphHolder graphHolder,
                                      ClusterRegistry clusterRegistry) {
        this.store = store;
        this.ruleRegistry = ruleRegistry;
        this.graphHolder = graphHolder;
        this.clusterRegistry = clusterRegistry;
    }

    @Override
    public Mono<Health> health() {
        return Mono.fromCallable(this::checkHealth);
    }

    private Health checkHealth() {
        Map<String, Object> details = new LinkedHashMap<>();

        int size = store.size();
        int capacity = store.capacity();
        details.put("store.size", size);
        details.put("store.capacity", capacity);
        details.put("store.fill", String.format("%.1f%%", size * 100.0 / capacity));

        int rules = ruleRegistry.size();
        boolean anyEnabled = !ruleRegistry.maxTimeWindow().isZero();
        details.put("rules.registered", rules);
        details.put("graph.services", graphHolder.current().services().size());
        details.put("clusters.active", clusterRegistry.activeClusters().size());
        clusterRegistry.lastPublishedAt().ifPresent(at -> details.put("lastPass.publishedAt", at.toString()));
        clusterRegistry.lastPassId().ifPresent(id -> details.put("lastPass.id", id));

        if (!anyEnabled) {
            details.put("rules.error", "No enabled correlation rule");
            return Health.down().withDetails(details).build();
        }
        return Health.up().withDetails(details).build();
    }
}
