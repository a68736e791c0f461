package com.z254.prism.correlation.scoring;

import com.z254.prism.domain.model.Alert;
import com.z254.prism.domain.model.CorrelationRule;
import com.z254.prism.domain.model.CorrelationType;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Cosine similarity of the TF-IDF vectors of the two alert texts, within the rule window.
 */
@Component
public class TextSimilarityScorer implements AlertScorer {

    @Override
    public CorrelationType type() {
        return CorrelationType.SIMILARITY;
    }

    @Override
    public Optional<PairScore> score(Alert earlier, Alert later, List<CorrelationRule> rules, ScoringContext context) {
        long gap = AlertScorer.gapMillis(earlier, later);
        if (rules.stream().noneMatch(rule -> gap <= rule.getTimeWindow().toMillis())) {
            return Optional.empty();
        }

        Map<String, Double> left = context.vector(earlier.getId());
        Map<String, Double> right = context.vector(later.getId());
        if (left == null || right == null) {
            return Optional.empty();
        }
        double similarity = TfIdfVectorizer.cosine(left, right);

        PairScore best = null;
        for (CorrelationRule rule : rules) {
            if (gap <= rule.getTimeWindow().toMillis() && similarity >= rule.getConfidenceThreshold()) {
                best = AlertScorer.better(best, new PairScore(similarity, rule.getId(), type()));
            }
        }
        return Optional.ofNullable(best);
    }
}
