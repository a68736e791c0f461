package com.z254.prism.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

/**
 * Parameters of a correlation pass.
 * <p>
 * Filters apply to cluster membership: a cluster matches when any member matches.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CorrelationQuery {

    /** Trailing window ending now; engine default when null */
    private Duration timeWindow;

    private String service;

    private String host;

    /** Matches the cluster's dominant correlation type */
    private CorrelationType type;

    /** Pass deadline; engine default when null */
    private Duration deadline;

    public static CorrelationQuery ofWindowSeconds(long timeWindowSeconds) {
        return CorrelationQuery.builder()
                .timeWindow(Duration.ofSeconds(timeWindowSeconds))
                .build();
    }

    public boolean matches(AlertCluster cluster) {
        if (service != null && !cluster.involvesService(service)) {
            return false;
        }
        if (host != null && !cluster.involvesHost(host)) {
            return false;
        }
        return type == null || type == cluster.getCorrelationType();
    }
}
