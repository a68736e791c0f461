package com.z254.prism.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Inbound alert payload as handed over by the ingestion layer.
 * <p>
 * Severity and status arrive as free text and are only turned into typed values by
 * {@link com.z254.prism.ingest.AlertValidator}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertRecord {

    private String id;
    private String service;
    private String host;
    private String severity;
    /** Defaults to {@code firing} when absent */
    private String status;
    private String title;
    private String description;
    /** Defaults to receipt time when absent */
    private Instant timestamp;
    @Builder.Default
    private Map<String, String> labels = new HashMap<>();
}
