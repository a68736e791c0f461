package com.z254.prism.correlation.scoring;

import com.z254.prism.domain.model.Alert;
import com.z254.prism.domain.model.CorrelationRule;
import com.z254.prism.domain.model.CorrelationType;

import java.util.List;
import java.util.Optional;

/**
 * Scores an alert pair under the active rules of one correlation type.
 * <p>
 * {@code earlier} never has a later (timestamp, id) than {@code later}. Implementations return
 * the best score that reaches its rule's confidence threshold, preferring the earlier
 * registered rule on ties, or empty for "no opinion".
 */
public interface AlertScorer {

    CorrelationType type();

    Optional<PairScore> score(Alert earlier, Alert later, List<CorrelationRule> rules, ScoringContext context);

    /**
     * Keep the higher of two candidate scores; the incumbent wins ties.
     */
    static PairScore better(PairScore incumbent, PairScore candidate) {
        if (incumbent == null || candidate.score() > incumbent.score()) {
            return candidate;
        }
        return incumbent;
    }

    static long gapMillis(Alert earlier, Alert later) {
        return Math.abs(later.getTimestamp().toEpochMilli() - earlier.getTimestamp().toEpochMilli());
    }
}
