package com.z254.prism.correlation;

import com.z254.prism.config.PrismProperties;
import com.z254.prism.domain.model.AlertCluster;
import com.z254.prism.domain.model.CorrelationQuery;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Runs the default correlation query on a fixed delay.
 */
@Slf4j
@Component
public class CorrelationScheduler {

    private final Correlator correlator;
    private final PrismProperties.Correlation config;

    public CorrelationScheduler(Correlator correlator, PrismProperties properties) {
        this.correlator = correlator;
        this.config = properties.getCorrelation();
    }

    @Scheduled(fixedDelayString = "${prism.correlation.periodic-interval:PT1M}",
            initialDelayString = "${prism.correlation.periodic-interval:PT1M}")
    public void runPeriodicPass() {
        if (!config.isPeriodicEnabled()) {
            return;
        }
        try {
            List<AlertCluster> clusters = correlator.correlateBlocking(CorrelationQuery.builder()
                    .timeWindow(config.getDefaultWindow())
                    .build());
            log.debug("Periodic correlation pass produced {} cluster(s)", clusters.size());
        } catch (Correlator.CorrelationCancelledException e) {
            log.warn("Periodic correlation pass cancelled: {}", e.getMessage());
        } catch (RuntimeException e) {
            log.error("Periodic correlation pass failed: {}", e.getMessage(), e);
        }
    }
}
