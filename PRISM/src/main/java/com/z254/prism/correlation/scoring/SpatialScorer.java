package com.z254.prism.correlation.scoring;

import com.z254.prism.domain.model.Alert;
import com.z254.prism.domain.model.CorrelationRule;
import com.z254.prism.domain.model.CorrelationType;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Scores alerts sharing a service (0.9) or, failing that, a host (0.8) within the rule window.
 * Both weights can be overridden through rule conditions.
 */
@Component
public class SpatialScorer implements AlertScorer {

    static final double SAME_SERVICE_WEIGHT = 0.9;
    static final double SAME_HOST_WEIGHT = 0.8;

    @Override
    public CorrelationType type() {
        return CorrelationType.SPATIAL;
    }

    @Override
    public Optional<PairScore> score(Alert earlier, Alert later, List<CorrelationRule> rules, ScoringContext context) {
        boolean sameService = earlier.getService().equals(later.getService());
        boolean sameHost = earlier.getHost().equals(later.getHost());
        if (!sameService && !sameHost) {
            return Optional.empty();
        }

        long gap = AlertScorer.gapMillis(earlier, later);
        PairScore best = null;
        for (CorrelationRule rule : rules) {
            if (gap > rule.getTimeWindow().toMillis()) {
                continue;
            }
            double score = sameService
                    ? rule.doubleCondition(CorrelationRule.SAME_SERVICE_WEIGHT, SAME_SERVICE_WEIGHT)
                    : rule.doubleCondition(CorrelationRule.SAME_HOST_WEIGHT, SAME_HOST_WEIGHT);
            if (score >= rule.getConfidenceThreshold()) {
                best = AlertScorer.better(best, new PairScore(score, rule.getId(), type()));
            }
        }
        return Optional.ofNullable(best);
    }
}
