package com.z254.prism.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * A single reported problem from a monitored service/host.
 * <p>
 * Instances held by the alert store are owned by it; every other component works on copies
 * obtained through {@link #copy()}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Alert {

    /** Caller-supplied identifier, unique within the store */
    private String id;

    /** Dedup key: hash of service, host and normalized title */
    private String fingerprint;

    /** Event time, refreshed when a duplicate is folded into this alert */
    private Instant timestamp;

    /** Event time of the first delivery */
    private Instant firstSeenAt;

    private String service;

    private String host;

    private Severity severity;

    @Builder.Default
    private Status status = Status.FIRING;

    private String title;

    private String description;

    @Builder.Default
    private Map<String, String> labels = new HashMap<>();

    private Instant resolvedAt;

    private Instant acknowledgedAt;

    private String acknowledgedBy;

    /** Number of duplicate deliveries folded into this alert */
    private int duplicateCount;

    /** Marked as recurring noise; kept in the store but excluded from correlation */
    private boolean suppressed;

    /** Pattern library key: service, host and normalized title */
    private String patternKey;

    public boolean isFiring() {
        return status == Status.FIRING;
    }

    /**
     * Whether this alert may take part in a new correlation pair.
     */
    public boolean isCorrelatable() {
        return isFiring() && !suppressed;
    }

    /**
     * Title and description joined, as used by the text similarity scorer.
     */
    public String text() {
        String body = description != null ? description : "";
        return (title != null ? title : "") + " " + body;
    }

    /**
     * Detached copy, safe to hand out of the store.
     */
    public Alert copy() {
        return toBuilder()
                .labels(labels != null ? new HashMap<>(labels) : new HashMap<>())
                .build();
    }

    /**
     * Alert severity levels.
     */
    public enum Severity {
        INFO(1),
        WARNING(2),
        CRITICAL(4);

        private final int weight;

        Severity(int weight) {
            this.weight = weight;
        }

        /** Weight used for impact scoring */
        public int getWeight() {
            return weight;
        }

        public static Optional<Severity> parse(String value) {
            if (value == null) {
                return Optional.empty();
            }
            try {
                return Optional.of(valueOf(value.trim().toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                return Optional.empty();
            }
        }
    }

    /**
     * Alert status. The only permitted transition is FIRING to RESOLVED.
     */
    public enum Status {
        FIRING,
        RESOLVED;

        public static Optional<Status> parse(String value) {
            if (value == null) {
                return Optional.empty();
            }
            try {
                return Optional.of(valueOf(value.trim().toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                return Optional.empty();
            }
        }
    }
}
