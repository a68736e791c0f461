package com.z254.prism.correlation;

import com.z254.prism.config.PrismProperties;
import com.z254.prism.domain.model.CorrelationRule;
import com.z254.prism.domain.model.CorrelationType;
import com.z254.prism.observability.PrismStructuredLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Registry of correlation rules, kept in registration order.
 * <p>
 * Replacing a rule keeps its original registration slot, which is the tie-break order
 * between rules of the same type.
 */
@Slf4j
@Component
public class CorrelationRuleRegistry {

    public static final String ALERT_BURST = "alert_burst";
    public static final String HOST_LOCALITY = "host_locality";
    public static final String TEXT_SIMILARITY = "text_similarity";
    public static final String SERVICE_CASCADE = "service_cascade";

    private final Map<String, CorrelationRule> rules = new LinkedHashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final PrismStructuredLogger logger;
    private final Clock clock;

    public CorrelationRuleRegistry(PrismProperties properties, PrismStructuredLogger logger, Clock clock) {
        this.logger = logger;
        this.clock = clock;
        if (properties.getRules().isRegisterDefaults()) {
            defaultRules().forEach(this::register);
        }
    }

    /**
     * Add a rule or replace the rule with the same id.
     *
     * @throws InvalidRuleException if the rule is malformed; the registry is left unchanged
     */
    public CorrelationRule register(CorrelationRule rule) {
        try {
            validate(rule);
        } catch (InvalidRuleException e) {
            logger.logRuleEvent(rule != null ? rule.getId() : null,
                    PrismStructuredLogger.RuleEventType.REJECTED, "Rejected correlation rule",
                    Map.of("reason", e.getMessage()));
            throw e;
        }

        CorrelationRule stored = rule.toBuilder()
                .conditions(rule.getConditions() != null ? new HashMap<>(rule.getConditions()) : new HashMap<>())
                .createdAt(rule.getCreatedAt() != null ? rule.getCreatedAt() : clock.instant())
                .build();

        CorrelationRule previous;
        lock.writeLock().lock();
        try {
            previous = rules.put(stored.getId(), stored);
        } finally {
            lock.writeLock().unlock();
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("type", stored.getCorrelationType().wireName());
        details.put("timeWindow", stored.getTimeWindow().toString());
        details.put("confidenceThreshold", stored.getConfidenceThreshold());
        logger.logRuleEvent(stored.getId(),
                previous == null ? PrismStructuredLogger.RuleEventType.REGISTERED : PrismStructuredLogger.RuleEventType.REPLACED,
                previous == null ? "Correlation rule registered" : "Correlation rule replaced",
                details);
        return stored;
    }

    public boolean remove(String ruleId) {
        CorrelationRule removed;
        lock.writeLock().lock();
        try {
            removed = rules.remove(ruleId);
        } finally {
            lock.writeLock().unlock();
        }
        if (removed != null) {
            logger.logRuleEvent(ruleId, PrismStructuredLogger.RuleEventType.REMOVED, "Correlation rule removed", null);
        }
        return removed != null;
    }

    public Optional<CorrelationRule> get(String ruleId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(rules.get(ruleId));
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<CorrelationRule> list() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(rules.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Enabled rules of the given type in registration order.
     */
    public List<CorrelationRule> activeRules(CorrelationType type) {
        return activeRulesByType().get(type);
    }

    /**
     * Enabled rules grouped by type, each list in registration order. Every type is present.
     */
    public Map<CorrelationType, List<CorrelationRule>> activeRulesByType() {
        Map<CorrelationType, List<CorrelationRule>> byType = new EnumMap<>(CorrelationType.class);
        for (CorrelationType type : CorrelationType.values()) {
            byType.put(type, new ArrayList<>());
        }
        lock.readLock().lock();
        try {
            for (CorrelationRule rule : rules.values()) {
                if (rule.isEnabled()) {
                    byType.get(rule.getCorrelationType()).add(rule);
                }
            }
        } finally {
            lock.readLock().unlock();
        }
        return byType;
    }

    /**
     * Largest time window among enabled rules, or zero when none is enabled.
     */
    public Duration maxTimeWindow() {
        lock.readLock().lock();
        try {
            return rules.values().stream()
                    .filter(CorrelationRule::isEnabled)
                    .map(CorrelationRule::getTimeWindow)
                    .max(Duration::compareTo)
                    .orElse(Duration.ZERO);
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return rules.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    private static void validate(CorrelationRule rule) {
        if (rule == null) {
            throw new InvalidRuleException("Rule must not be null");
        }
        if (rule.getId() == null || rule.getId().isBlank()) {
            throw new InvalidRuleException("Rule id is required");
        }
        if (rule.getName() == null || rule.getName().isBlank()) {
            throw new InvalidRuleException("Rule " + rule.getId() + ": name is required");
        }
        if (rule.getCorrelationType() == null) {
            throw new InvalidRuleException("Rule " + rule.getId() + ": correlation type is required");
        }
        double threshold = rule.getConfidenceThreshold();
        if (Double.isNaN(threshold) || threshold < 0.0 || threshold > 1.0) {
            throw new InvalidRuleException("Rule " + rule.getId() + ": confidence threshold must be within [0, 1], was " + threshold);
        }
        if (rule.getTimeWindow() == null || rule.getTimeWindow().isNegative() || rule.getTimeWindow().isZero()) {
            throw new InvalidRuleException("Rule " + rule.getId() + ": time window must be positive, was " + rule.getTimeWindow());
        }
        try {
            if (rule.maxHopDistance() < 1) {
                throw new InvalidRuleException("Rule " + rule.getId() + ": max_hop_distance must be positive");
            }
            Duration propagation = rule.maxPropagationTime();
            if (propagation.isNegative() || propagation.isZero()) {
                throw new InvalidRuleException("Rule " + rule.getId() + ": max_propagation_time must be positive");
            }
            rule.doubleCondition(CorrelationRule.SAME_SERVICE_WEIGHT, 0.0);
            rule.doubleCondition(CorrelationRule.SAME_HOST_WEIGHT, 0.0);
        } catch (IllegalArgumentException e) {
            throw new InvalidRuleException("Rule " + rule.getId() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Built-in rules registered at startup unless disabled.
     */
    public static List<CorrelationRule> defaultRules() {
        return List.of(
                CorrelationRule.builder()
                        .id(ALERT_BURST)
                        .name("Alert Burst")
                        .description("Alerts firing in a short burst")
                        .correlationType(CorrelationType.TEMPORAL)
                        .timeWindow(Duration.ofMinutes(5))
                        .confidenceThreshold(0.8)
                        .build(),
                CorrelationRule.builder()
                        .id(HOST_LOCALITY)
                        .name("Host Locality")
                        .description("Alerts on the same service or host")
                        .correlationType(CorrelationType.SPATIAL)
                        .timeWindow(Duration.ofMinutes(10))
                        .confidenceThreshold(0.75)
                        .build(),
                CorrelationRule.builder()
                        .id(TEXT_SIMILARITY)
                        .name("Text Similarity")
                        .description("Alerts describing similar symptoms")
                        .correlationType(CorrelationType.SIMILARITY)
                        .timeWindow(Duration.ofMinutes(15))
                        .confidenceThreshold(0.6)
                        .build(),
                CorrelationRule.builder()
                        .id(SERVICE_CASCADE)
                        .name("Service Cascade")
                        .description("Failures propagating through service dependencies")
                        .correlationType(CorrelationType.DEPENDENCY)
                        .timeWindow(Duration.ofMinutes(10))
                        .confidenceThreshold(0.25)
                        .conditions(new HashMap<>(Map.of(
                                CorrelationRule.MAX_PROPAGATION_TIME, 300,
                                CorrelationRule.MAX_HOP_DISTANCE, 3)))
                        .build());
    }

    /**
     * Thrown for malformed correlation rules.
     */
    public static class InvalidRuleException extends RuntimeException {
        public InvalidRuleException(String message) {
            super(message);
        }

        public InvalidRuleException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
