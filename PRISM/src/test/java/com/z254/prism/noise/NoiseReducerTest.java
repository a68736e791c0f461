package com.z254.prism.noise;

import com.z254.prism.domain.model.Alert;
import com.z254.prism.domain.model.IngestResult;
import com.z254.prism.domain.model.PatternReport;
import com.z254.prism.support.EngineFixture;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static com.z254.prism.support.EngineFixture.alert;
import static com.z254.prism.support.EngineFixture.record;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link NoiseReducer}.
 */
class NoiseReducerTest {

    private static List<IngestResult> ingestStorm(EngineFixture fixture, int count) {
        List<IngestResult> results = new ArrayList<>();
        Instant start = fixture.ago(Duration.ofMinutes(1));
        for (int i = 1; i <= count; i++) {
            results.add(fixture.engine.ingest(record("n" + i, "batch", "batch01", "warning",
                    "Job retry exhausted", start.plusMillis(i * 1000L))));
        }
        return results;
    }

    private static List<IngestResult> ingestSpaced(EngineFixture fixture, int count) {
        List<IngestResult> results = new ArrayList<>();
        Instant start = fixture.ago(Duration.ofMinutes(6L * (count - 1)));
        for (int i = 0; i < count; i++) {
            results.add(fixture.engine.ingest(record("s" + i, "batch", "batch01", "warning",
                    "Job retry exhausted", start.plus(Duration.ofMinutes(6L * i)))));
        }
        return results;
    }

    @Nested
    @DisplayName("Suppression")
    class SuppressionTests {

        @Test
        @DisplayName("should count a storm as noise once it has enough history while folding the repeats")
        void flagAfterMinOccurrences() {
            EngineFixture fixture = EngineFixture.create();

            List<IngestResult> results = ingestStorm(fixture, 50);

            assertThat(results.get(0)).isEqualTo(IngestResult.ACCEPTED);
            assertThat(results.subList(1, 50)).containsOnly(IngestResult.DEDUPLICATED);
            assertThat(fixture.store.size()).isEqualTo(1);
            assertThat(fixture.metrics.getAlertsNoiseSuppressed().count()).isEqualTo(44.0);
            assertThat(fixture.metrics.getAlertsDeduplicated().count()).isEqualTo(5.0);
        }

        @Test
        @DisplayName("should store recurring alerts outside the repeat window as noise")
        void flagSpacedRecurrences() {
            EngineFixture fixture = EngineFixture.create();

            List<IngestResult> results = ingestSpaced(fixture, 10);

            assertThat(results.subList(0, 6)).containsOnly(IngestResult.ACCEPTED);
            assertThat(results.subList(6, 10)).containsOnly(IngestResult.NOISE);
            assertThat(fixture.store.findSuppressed()).extracting(Alert::getId)
                    .containsExactly("s6", "s7", "s8", "s9");
            assertThat(fixture.store.size()).isEqualTo(10);
        }

        @Test
        @DisplayName("should not flag a pattern below the frequency threshold")
        void belowThreshold() {
            EngineFixture fixture = EngineFixture.create(p -> p.getNoise().setFrequencyThreshold(0.5));
            Instant start = fixture.ago(Duration.ofMinutes(2));
            for (int i = 0; i < 20; i++) {
                fixture.engine.ingest(record("other" + i, "web", "web" + i, "info", "Heartbeat " + i,
                        start.plusSeconds(i)));
            }

            List<IngestResult> results = ingestStorm(fixture, 10);

            assertThat(results).doesNotContain(IngestResult.NOISE);
        }

        @Test
        @DisplayName("should never flag noise with learning disabled")
        void learningDisabled() {
            EngineFixture fixture = EngineFixture.create(p -> p.getNoise().setLearningEnabled(false));

            List<IngestResult> results = ingestStorm(fixture, 20);

            assertThat(results).doesNotContain(IngestResult.NOISE);
            assertThat(fixture.store.size()).isEqualTo(1);
        }

        @Test
        @DisplayName("should clear the noise flag once the pattern has decayed")
        void reevaluate() {
            EngineFixture fixture = EngineFixture.create();
            ingestSpaced(fixture, 10);

            assertThat(fixture.engine.reevaluateSuppressedAlerts()).isZero();

            fixture.clock.advance(Duration.ofHours(2));

            assertThat(fixture.engine.reevaluateSuppressedAlerts()).isEqualTo(4);
            assertThat(fixture.store.findSuppressed()).isEmpty();
        }

        @Test
        @DisplayName("should keep the flag while the horizon still holds the minimum occurrences")
        void reevaluateAtMinimum() {
            EngineFixture fixture = EngineFixture.create();
            ingestSpaced(fixture, 7);
            assertThat(fixture.store.findSuppressed()).extracting(Alert::getId).containsExactly("s6");

            // six occurrences left in the trailing hour
            fixture.clock.advance(Duration.ofMinutes(25));
            assertThat(fixture.engine.reevaluateSuppressedAlerts()).isZero();

            // five left
            fixture.clock.advance(Duration.ofMinutes(6));
            assertThat(fixture.engine.reevaluateSuppressedAlerts()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Pattern detection")
    class DetectionTests {

        private final NoiseReducer reducer = EngineFixture.create().noiseReducer;

        @Test
        @DisplayName("should detect a service alerting at a regular interval")
        void periodic() {
            Instant t0 = Instant.parse("2026-03-02T00:00:00Z");
            List<Alert> alerts = new ArrayList<>();
            for (int i = 0; i < 6; i++) {
                alerts.add(alert("cron" + i, "reports", "rep01", t0.plus(Duration.ofMinutes(10L * i))));
            }

            PatternReport report = reducer.detectPatterns(alerts, Duration.ofDays(1));

            assertThat(report.getPatterns()).singleElement().satisfies(pattern -> {
                assertThat(pattern.getService()).isEqualTo("reports");
                assertThat(pattern.getAverageIntervalSeconds()).isCloseTo(600.0, within(1e-9));
                assertThat(pattern.getConfidence()).isCloseTo(1.0, within(1e-9));
                assertThat(pattern.getOccurrences()).isEqualTo(6);
            });
            assertThat(report.getTotalAlertsAnalyzed()).isEqualTo(6);
        }

        @Test
        @DisplayName("should ignore irregular services and report frequent patterns")
        void irregularAndNoisy() {
            Instant t0 = Instant.parse("2026-03-02T00:00:00Z");
            long[] offsets = {0, 5, 300, 310, 4000, 4100};
            List<Alert> alerts = new ArrayList<>();
            for (int i = 0; i < offsets.length; i++) {
                Alert alert = alert("x" + i, "web", "web01", t0.plusSeconds(offsets[i]));
                alert.setTitle(i < 4 ? "Disk full" : "Alert " + i);
                alerts.add(alert);
            }

            PatternReport report = reducer.detectPatterns(alerts, Duration.ofDays(1));

            assertThat(report.getPatterns()).isEmpty();
            assertThat(report.getNoisePatterns()).first().satisfies(noise -> {
                assertThat(noise.getPatternKey()).isEqualTo("web|web01|disk full");
                assertThat(noise.getFrequency()).isEqualTo(4);
            });
        }
    }
}
