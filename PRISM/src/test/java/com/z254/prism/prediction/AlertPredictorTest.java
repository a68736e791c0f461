package com.z254.prism.prediction;

import com.z254.prism.domain.model.PredictionResult;
import com.z254.prism.support.EngineFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static com.z254.prism.support.EngineFixture.record;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link AlertPredictor}.
 */
class AlertPredictorTest {

    private EngineFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = EngineFixture.create();
    }

    @Test
    @DisplayName("should score the share of occurrences followed by a cluster")
    void scoreFollowedOccurrences() {
        fixture.engine.ingest(record("a", "api", "api01", "warning", "Latency high", fixture.ago(Duration.ofMinutes(50))));
        fixture.engine.ingest(record("b", "api", "api02", "critical", "Timeouts", fixture.ago(Duration.ofSeconds(60))));
        fixture.engine.ingest(record("c", "web", "web01", "warning", "Bad gateway", fixture.ago(Duration.ofSeconds(30))));
        assertThat(fixture.engine.correlate(900)).hasSize(1);

        PredictionResult result = fixture.engine.predictAlerts("api", Duration.ofMinutes(10));

        assertThat(result.getPredictionScore()).isCloseTo(0.5, within(1e-9));
        assertThat(result.getConfidence()).isCloseTo(0.02, within(1e-9));
        assertThat(result.getSampleSize()).isEqualTo(2);
        assertThat(result.getExpectedAlertTitles()).containsExactly("Latency high", "Timeouts");
        assertThat(result.getContributingPatterns()).first()
                .satisfies(pattern -> assertThat(pattern.getFollowedByCluster()).isEqualTo(1));
        assertThat(result.getRiskFactors()).isEmpty();
        assertThat(result.getHorizon()).isEqualTo(Duration.ofMinutes(10));
    }

    @Test
    @DisplayName("should return an empty prediction for a service without history")
    void unknownService() {
        PredictionResult result = fixture.predictor.predictAlerts("ghost", Duration.ofMinutes(10));

        assertThat(result.getPredictionScore()).isZero();
        assertThat(result.getSampleSize()).isZero();
        assertThat(result.getExpectedAlertTitles()).isEmpty();
    }

    @Test
    @DisplayName("should fall back to the default horizon for a non-positive horizon")
    void defaultHorizon() {
        PredictionResult result = fixture.engine.predictAlerts("api", 0);

        assertThat(result.getHorizon()).isEqualTo(fixture.properties.getPrediction().getDefaultHorizon());
    }
}
