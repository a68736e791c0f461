package com.z254.prism;

import com.z254.prism.domain.model.AlertCluster;
import com.z254.prism.domain.model.AlertRecord;
import com.z254.prism.domain.model.CorrelationQuery;
import com.z254.prism.domain.service.AlertCorrelationEngine;
import com.z254.prism.health.CorrelationHealthIndicator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.actuate.health.Status;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.web.context.WebServerApplicationContext;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;
import reactor.test.StepVerifier;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Integration tests for the wired {@link PrismApplication} context.
 */
@SpringBootTest
@ActiveProfiles("test")
class PrismApplicationTest {

    @Autowired
    private AlertCorrelationEngine engine;

    @Autowired
    private CorrelationHealthIndicator healthIndicator;

    @Autowired
    private ApplicationContext context;

    @Test
    @DisplayName("should register the default correlation rules")
    void defaultRules() {
        assertThat(engine.correlationRules()).hasSize(4);
    }

    @Test
    @DisplayName("should run without a web server or web endpoint settings")
    void noWebSurface() {
        assertThat(context).isNotInstanceOf(WebServerApplicationContext.class);
        assertThat(context.getEnvironment().getProperty("management.endpoints.web.exposure.include")).isNull();
    }

    @Test
    @DisplayName("should report UP with store and rule details")
    void healthUp() {
        StepVerifier.create(healthIndicator.health())
                .assertNext(health -> {
                    assertThat(health.getStatus()).isEqualTo(Status.UP);
                    assertThat(health.getDetails()).containsKeys("store.size", "store.capacity", "rules.registered");
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("should ingest and correlate through the wired engine")
    void ingestAndCorrelate() {
        engine.ingest(AlertRecord.builder().id("ctx-1").service("checkout").host("co01")
                .severity("critical").title("Payment errors").build());
        engine.ingest(AlertRecord.builder().id("ctx-2").service("checkout").host("co01")
                .severity("warning").title("Cart latency").build());

        StepVerifier.create(engine.correlate(CorrelationQuery.ofWindowSeconds(900)))
                .assertNext(clusters -> assertThat(clusters)
                        .extracting(AlertCluster::getAlertIds)
                        .contains(List.of("ctx-1", "ctx-2")))
                .verifyComplete();
    }
}
