package com.z254.prism.health;

import com.z254.prism.support.EngineFixture;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Status;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static com.z254.prism.support.EngineFixture.record;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link CorrelationHealthIndicator}.
 */
class CorrelationHealthIndicatorTest {

    private static CorrelationHealthIndicator indicator(EngineFixture fixture) {
        return new CorrelationHealthIndicator(fixture.store, fixture.ruleRegistry, fixture.graphHolder,
                fixture.clusterRegistry);
    }

    @Test
    @DisplayName("should report UP with the last pass after a correlation")
    void upAfterPass() {
        EngineFixture fixture = EngineFixture.create();
        fixture.engine.setServiceDependencies(Map.of("api", List.of("database")));
        fixture.engine.ingest(record("a1", "web", "web01", "warning", "High latency", fixture.ago(Duration.ofSeconds(20))));
        fixture.engine.ingest(record("a2", "web", "web01", "warning", "Slow checkout", fixture.ago(Duration.ofSeconds(10))));
        fixture.engine.correlate(900);

        StepVerifier.create(indicator(fixture).health())
                .assertNext(health -> {
                    assertThat(health.getStatus()).isEqualTo(Status.UP);
                    assertThat(health.getDetails())
                            .containsEntry("store.size", 2)
                            .containsEntry("rules.registered", 4)
                            .containsEntry("graph.services", 2)
                            .containsEntry("clusters.active", 1)
                            .containsKey("lastPass.id");
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("should report DOWN without any enabled rule")
    void downWithoutRules() {
        EngineFixture fixture = EngineFixture.create(p -> p.getRules().setRegisterDefaults(false));

        StepVerifier.create(indicator(fixture).health())
                .assertNext(health -> assertThat(health.getStatus()).isEqualTo(Status.DOWN))
                .verifyComplete();
    }
}
