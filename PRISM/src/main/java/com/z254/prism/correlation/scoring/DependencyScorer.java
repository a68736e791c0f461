package com.z254.prism.correlation.scoring;

import com.z254.prism.domain.model.Alert;
import com.z254.prism.domain.model.CorrelationRule;
import com.z254.prism.domain.model.CorrelationType;
import com.z254.prism.graph.ServiceDependencyGraph;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Scores {@code 1 / (1 + hops)} when a failure of the earlier alert's service can reach the
 * later alert's service through the dependency graph within the rule's hop and time limits.
 * <p>
 * Alerts with equal timestamps are tried in both directions. Alerts on the same service get no
 * opinion from this scorer.
 */
@Component
public class DependencyScorer implements AlertScorer {

    @Override
    public CorrelationType type() {
        return CorrelationType.DEPENDENCY;
    }

    @Override
    public Optional<PairScore> score(Alert earlier, Alert later, List<CorrelationRule> rules, ScoringContext context) {
        if (earlier.getService().equals(later.getService())) {
            return Optional.empty();
        }
        ServiceDependencyGraph graph = context.graph();
        if (graph.isEmpty()) {
            return Optional.empty();
        }

        long gap = AlertScorer.gapMillis(earlier, later);
        boolean simultaneous = gap == 0;
        PairScore best = null;
        for (CorrelationRule rule : rules) {
            if (gap > rule.maxPropagationTime().toMillis()) {
                continue;
            }
            int maxHops = rule.maxHopDistance();
            Set<String> sources = rule.sourceServices();

            int hops = hops(graph, earlier.getService(), later.getService(), maxHops, sources);
            if (simultaneous) {
                int reverse = hops(graph, later.getService(), earlier.getService(), maxHops, sources);
                if (reverse > 0 && (hops < 0 || reverse < hops)) {
                    hops = reverse;
                }
            }
            if (hops < 1) {
                continue;
            }
            double score = 1.0 / (1 + hops);
            if (score >= rule.getConfidenceThreshold()) {
                best = AlertScorer.better(best, new PairScore(score, rule.getId(), type()));
            }
        }
        return Optional.ofNullable(best);
    }

    private static int hops(ServiceDependencyGraph graph, String from, String to, int maxHops, Set<String> sources) {
        if (!sources.isEmpty() && !sources.contains(from)) {
            return -1;
        }
        OptionalInt distance = graph.propagationDistance(from, to, maxHops);
        return distance.isPresent() ? distance.getAsInt() : -1;
    }
}
