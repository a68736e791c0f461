package com.z254.prism;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * PRISM - Alert Correlation Engine.
 *
 * <p>PRISM provides:
 * <ul>
 *   <li>Alert Store - bounded, deduplicated holding area for recent alerts</li>
 *   <li>Correlation - temporal, spatial, textual and dependency scoring combined into clusters</li>
 *   <li>Root Cause Ranking - dependency-graph sources and blast radius per cluster</li>
 *   <li>Noise Reduction - learned recurring signatures suppressed before clustering</li>
 *   <li>Prediction - pattern-based forecast of alerts for a service</li>
 * </ul>
 *
 * <p>The webhook receiver, REST query layer and dashboards live outside this service and call
 * {@link com.z254.prism.domain.service.AlertCorrelationEngine} directly.
 */
@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties
public class PrismApplication {

    public static void main(String[] args) {
        SpringApplication.run(PrismApplication.class, args);
    }
}
