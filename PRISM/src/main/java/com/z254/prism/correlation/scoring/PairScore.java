package com.z254.prism.correlation.scoring;

import com.z254.prism.domain.model.CorrelationType;

/**
 * Score a rule assigned to an alert pair.
 */
public record PairScore(double score, String ruleId, CorrelationType type) {
}
