package com.z254.prism.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Filter for alert store queries. Null fields do not filter.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertQuery {

    /** Inclusive lower bound on timestamp */
    private Instant from;

    /** Inclusive upper bound on timestamp */
    private Instant to;

    private String service;

    private String host;

    @Builder.Default
    private boolean includeSuppressed = true;

    @Builder.Default
    private boolean includeResolved = true;

    public boolean matches(Alert alert) {
        if (from != null && alert.getTimestamp().isBefore(from)) {
            return false;
        }
        if (to != null && alert.getTimestamp().isAfter(to)) {
            return false;
        }
        if (service != null && !service.equals(alert.getService())) {
            return false;
        }
        if (host != null && !host.equals(alert.getHost())) {
            return false;
        }
        if (!includeSuppressed && alert.isSuppressed()) {
            return false;
        }
        return includeResolved || alert.isFiring();
    }
}
