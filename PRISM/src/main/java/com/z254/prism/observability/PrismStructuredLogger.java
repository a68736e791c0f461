package com.z254.prism.observability;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured logging utility for the correlation engine.
 * <p>
 * Emits {@code message | data={json}} lines and keeps alert, cluster and pass ids in the MDC
 * while an event is logged.
 */
@Slf4j
@Component
public class PrismStructuredLogger {

    // MDC keys
    public static final String MDC_ALERT_ID = "alertId";
    public static final String MDC_CLUSTER_ID = "clusterId";
    public static final String MDC_PASS_ID = "passId";
    public static final String MDC_RULE_ID = "ruleId";

    /**
     * Log an alert ingestion event.
     */
    public void logAlertEvent(String alertId, AlertEventType eventType, String message,
                              Map<String, Object> details) {
        try (var scope = withContext(Map.of(MDC_ALERT_ID, nullToEmpty(alertId)))) {
            Map<String, Object> logData = new LinkedHashMap<>();
            logData.put("event", eventType.name());
            logData.put("alertId", alertId);
            if (details != null) {
                logData.putAll(details);
            }

            switch (eventType) {
                case REJECTED -> log.warn("{} | data={}", message, formatLogData(logData));
                case DEDUPLICATED, NOISE_SUPPRESSED, UNSUPPRESSED ->
                        log.debug("{} | data={}", message, formatLogData(logData));
                default -> log.info("{} | data={}", message, formatLogData(logData));
            }
        }
    }

    /**
     * Log a correlation pass event.
     */
    public void logCorrelationEvent(String passId, CorrelationEventType eventType, String message,
                                    Map<String, Object> details) {
        try (var scope = withContext(Map.of(MDC_PASS_ID, nullToEmpty(passId)))) {
            Map<String, Object> logData = new LinkedHashMap<>();
            logData.put("event", eventType.name());
            logData.put("passId", passId);
            if (details != null) {
                logData.putAll(details);
            }

            switch (eventType) {
                case PASS_CANCELLED, PASS_FAILED, WINDOW_REJECTED ->
                        log.warn("{} | data={}", message, formatLogData(logData));
                case PASS_STARTED -> log.debug("{} | data={}", message, formatLogData(logData));
                default -> log.info("{} | data={}", message, formatLogData(logData));
            }
        }
    }

    /**
     * Log a cluster lifecycle event.
     */
    public void logClusterEvent(String clusterId, ClusterEventType eventType, String message,
                                Map<String, Object> details) {
        try (var scope = withContext(Map.of(MDC_CLUSTER_ID, nullToEmpty(clusterId)))) {
            Map<String, Object> logData = new LinkedHashMap<>();
            logData.put("event", eventType.name());
            logData.put("clusterId", clusterId);
            if (details != null) {
                logData.putAll(details);
            }
            log.info("{} | data={}", message, formatLogData(logData));
        }
    }

    /**
     * Log a correlation rule change.
     */
    public void logRuleEvent(String ruleId, RuleEventType eventType, String message,
                             Map<String, Object> details) {
        try (var scope = withContext(Map.of(MDC_RULE_ID, nullToEmpty(ruleId)))) {
            Map<String, Object> logData = new LinkedHashMap<>();
            logData.put("event", eventType.name());
            logData.put("ruleId", ruleId);
            if (details != null) {
                logData.putAll(details);
            }

            if (eventType == RuleEventType.REJECTED) {
                log.warn("{} | data={}", message, formatLogData(logData));
            } else {
                log.info("{} | data={}", message, formatLogData(logData));
            }
        }
    }

    /**
     * Log a pattern learning event.
     */
    public void logPatternEvent(String patternKey, PatternEventType eventType, String message,
                                Map<String, Object> details) {
        Map<String, Object> logData = new LinkedHashMap<>();
        logData.put("event", eventType.name());
        logData.put("patternKey", patternKey);
        if (details != null) {
            logData.putAll(details);
        }
        log.info("{} | data={}", message, formatLogData(logData));
    }

    /**
     * Log a performance metric.
     */
    public void logPerformance(String operation, Duration duration, boolean success,
                               Map<String, Object> details) {
        Map<String, Object> logData = new LinkedHashMap<>();
        logData.put("event", "PERFORMANCE");
        logData.put("operation", operation);
        logData.put("durationMs", duration.toMillis());
        logData.put("success", success);
        if (details != null) {
            logData.putAll(details);
        }

        if (duration.toMillis() > 5000) {
            log.warn("Slow operation: {} took {}ms | data={}",
                    operation, duration.toMillis(), formatLogData(logData));
        } else {
            log.debug("Performance: {} completed in {}ms | data={}",
                    operation, duration.toMillis(), formatLogData(logData));
        }
    }

    /**
     * Set MDC context.
     */
    public MDCScope withContext(Map<String, String> context) {
        context.forEach(MDC::put);
        return new MDCScope(context.keySet().toArray(new String[0]));
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }

    private String formatLogData(Map<String, Object> data) {
        StringBuilder sb = new StringBuilder("{");
        boolean first = true;
        for (Map.Entry<String, Object> entry : data.entrySet()) {
            if (!first) sb.append(", ");
            first = false;

            sb.append("\"").append(entry.getKey()).append("\": ");
            Object value = entry.getValue();
            if (value == null) {
                sb.append("null");
            } else if (value instanceof Number || value instanceof Boolean) {
                sb.append(value);
            } else {
                sb.append("\"").append(escapeJson(value.toString())).append("\"");
            }
        }
        sb.append("}");
        return sb.toString();
    }

    private String escapeJson(String value) {
        return value.replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", "\\n")
                .replace("\r", "\\r")
                .replace("\t", "\\t");
    }

    // ========== Event Type Enums ==========

    public enum AlertEventType {
        ACCEPTED, DEDUPLICATED, NOISE_SUPPRESSED, UNSUPPRESSED, RESOLVED, ACKNOWLEDGED, REJECTED
    }

    public enum CorrelationEventType {
        PASS_STARTED, PASS_COMPLETED, PASS_CANCELLED, PASS_FAILED, WINDOW_REJECTED
    }

    public enum ClusterEventType {
        CREATED, MERGED
    }

    public enum RuleEventType {
        REGISTERED, REPLACED, REMOVED, REJECTED
    }

    public enum PatternEventType {
        NOISE_DECAYED
    }

    /**
     * Auto-closeable MDC scope for cleanup.
     */
    public static class MDCScope implements AutoCloseable {
        private final String[] keys;

        public MDCScope(String... keys) {
            this.keys = keys;
        }

        @Override
        public void close() {
            for (String key : keys) {
                MDC.remove(key);
            }
        }
    }
}
