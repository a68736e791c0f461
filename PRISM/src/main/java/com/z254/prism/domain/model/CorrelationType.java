package com.z254.prism.domain.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Types of alert correlation.
 * <p>
 * Declaration order is the tie-break precedence when two types produce the same score.
 */
public enum CorrelationType {
    /** Time-based proximity */
    TEMPORAL,
    /** Same service or host */
    SPATIAL,
    /** Similar alert text */
    SIMILARITY,
    /** Service dependency propagation */
    DEPENDENCY;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<CorrelationType> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
