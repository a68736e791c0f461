package com.z254.prism.correlation.scoring;

import com.z254.prism.domain.model.Alert;
import com.z254.prism.domain.model.CorrelationRule;
import com.z254.prism.domain.model.CorrelationType;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Scores 1.0 for alerts within the rule window, falling linearly to 0 at twice the window.
 */
@Component
public class TemporalScorer implements AlertScorer {

    @Override
    public CorrelationType type() {
        return CorrelationType.TEMPORAL;
    }

    @Override
    public Optional<PairScore> score(Alert earlier, Alert later, List<CorrelationRule> rules, ScoringContext context) {
        long gap = AlertScorer.gapMillis(earlier, later);
        PairScore best = null;
        for (CorrelationRule rule : rules) {
            long window = rule.getTimeWindow().toMillis();
            double score;
            if (gap <= window) {
                score = 1.0;
            } else if (gap < 2 * window) {
                score = 1.0 - (double) (gap - window) / window;
            } else {
                continue;
            }
            if (score >= rule.getConfidenceThreshold()) {
                best = AlertScorer.better(best, new PairScore(score, rule.getId(), type()));
            }
        }
        return Optional.ofNullable(best);
    }
}
