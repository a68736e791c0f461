package com.z254.prism.ingest;

import com.z254.prism.domain.model.Alert;
import com.z254.prism.domain.model.AlertRecord;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;

/**
 * Validates inbound alert records and converts them into typed alerts.
 * <p>
 * Required fields are {@code id}, {@code service}, {@code host}, {@code severity} and
 * {@code title}. Unknown severity or status values are rejected rather than defaulted.
 */
@Component
public class AlertValidator {

    /**
     * Convert a record into an alert.
     *
     * @param record     the inbound record
     * @param receivedAt used as the timestamp when the record carries none
     * @throws InvalidAlertException if the record is malformed
     */
    public Alert toAlert(AlertRecord record, Instant receivedAt) {
        if (record == null) {
            throw new InvalidAlertException("Alert record is null", List.of("record"));
        }

        List<String> problems = new ArrayList<>();
        requireText(record.getId(), "id", problems);
        requireText(record.getService(), "service", problems);
        requireText(record.getHost(), "host", problems);
        requireText(record.getTitle(), "title", problems);

        Alert.Severity severity = null;
        if (isBlank(record.getSeverity())) {
            problems.add("severity is required");
        } else {
            severity = Alert.Severity.parse(record.getSeverity()).orElse(null);
            if (severity == null) {
                problems.add("unknown severity '" + record.getSeverity() + "'");
            }
        }

        Alert.Status status = Alert.Status.FIRING;
        if (record.getStatus() != null) {
            status = Alert.Status.parse(record.getStatus()).orElse(null);
            if (status == null) {
                problems.add("unknown status '" + record.getStatus() + "'");
            }
        }

        if (!problems.isEmpty()) {
            throw new InvalidAlertException(
                    "Invalid alert " + record.getId() + ": " + String.join(", ", problems), problems);
        }

        Instant timestamp = record.getTimestamp() != null ? record.getTimestamp() : receivedAt;
        return Alert.builder()
                .id(record.getId().trim())
                .service(record.getService().trim())
                .host(record.getHost().trim())
                .severity(severity)
                .status(status)
                .title(record.getTitle().trim())
                .description(record.getDescription() != null ? record.getDescription() : "")
                .labels(record.getLabels() != null ? new HashMap<>(record.getLabels()) : new HashMap<>())
                .timestamp(timestamp)
                .firstSeenAt(timestamp)
                .resolvedAt(status == Alert.Status.RESOLVED ? timestamp : null)
                .build();
    }

    private static void requireText(String value, String field, List<String> problems) {
        if (isBlank(value)) {
            problems.add(field + " is required");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    /**
     * Thrown for malformed alert records. Nothing is stored and no counter changes.
     */
    public static class InvalidAlertException extends RuntimeException {
        private final List<String> problems;

        public InvalidAlertException(String message, List<String> problems) {
            super(message);
            this.problems = List.copyOf(problems);
        }

        public List<String> getProblems() {
            return problems;
        }
    }
}
