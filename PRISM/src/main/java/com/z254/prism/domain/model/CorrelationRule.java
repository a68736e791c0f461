package com.z254.prism.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Named, configurable correlation rule.
 * <p>
 * A rule binds one {@link CorrelationType} to a time window, a confidence threshold and a set
 * of type-specific conditions. Several rules of the same type may coexist; each contributes an
 * independent edge score.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CorrelationRule {

    public static final String MAX_PROPAGATION_TIME = "max_propagation_time";
    public static final String MAX_HOP_DISTANCE = "max_hop_distance";
    public static final String SOURCE_SERVICES = "source_services";
    public static final String SAME_SERVICE_WEIGHT = "same_service_weight";
    public static final String SAME_HOST_WEIGHT = "same_host_weight";

    private static final int DEFAULT_MAX_HOP_DISTANCE = 3;

    private String id;

    private String name;

    private String description;

    private CorrelationType correlationType;

    /** Type-specific parameters, e.g. max propagation time (seconds) or source services */
    @Builder.Default
    private Map<String, Object> conditions = new HashMap<>();

    private Duration timeWindow;

    @Builder.Default
    private double confidenceThreshold = 0.8;

    @Builder.Default
    private boolean enabled = true;

    private Instant createdAt;

    /**
     * Longest gap over which a dependency failure is assumed to propagate.
     * Falls back to the rule's time window.
     */
    public Duration maxPropagationTime() {
        Object raw = condition(MAX_PROPAGATION_TIME);
        if (raw == null) {
            return timeWindow;
        }
        return Duration.ofMillis(Math.round(toDouble(MAX_PROPAGATION_TIME, raw) * 1000));
    }

    public int maxHopDistance() {
        Object raw = condition(MAX_HOP_DISTANCE);
        if (raw == null) {
            return DEFAULT_MAX_HOP_DISTANCE;
        }
        return (int) toDouble(MAX_HOP_DISTANCE, raw);
    }

    /**
     * Services a propagation may originate from; empty means any service.
     */
    public Set<String> sourceServices() {
        Object raw = condition(SOURCE_SERVICES);
        if (raw == null) {
            return Collections.emptySet();
        }
        Set<String> services = new LinkedHashSet<>();
        if (raw instanceof Collection<?> collection) {
            collection.forEach(item -> {
                if (item != null) {
                    services.add(item.toString());
                }
            });
        } else {
            for (String part : raw.toString().split(",")) {
                if (!part.isBlank()) {
                    services.add(part.trim());
                }
            }
        }
        return services;
    }

    public double doubleCondition(String key, double defaultValue) {
        Object raw = condition(key);
        return raw == null ? defaultValue : toDouble(key, raw);
    }

    private Object condition(String key) {
        return conditions != null ? conditions.get(key) : null;
    }

    private static double toDouble(String key, Object raw) {
        if (raw instanceof Number number) {
            return number.doubleValue();
        }
        try {
            return Double.parseDouble(raw.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Condition " + key + " is not numeric: " + raw, e);
        }
    }
}
