package com.z254.prism.ingest;

import com.z254.prism.domain.model.Alert;
import com.z254.prism.domain.model.AlertRecord;
import com.z254.prism.domain.model.IngestResult;
import com.z254.prism.domain.repository.AlertStore;
import com.z254.prism.noise.NoiseReducer;
import com.z254.prism.noise.PatternLibrary;
import com.z254.prism.observability.CorrelationMetrics;
import com.z254.prism.observability.PrismStructuredLogger;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static com.z254.prism.support.EngineFixture.record;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link AlertIngestionService}.
 */
@ExtendWith(MockitoExtension.class)
class AlertIngestionServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");

    @Mock
    private AlertStore store;

    @Mock
    private PatternLibrary patternLibrary;

    @Mock
    private NoiseReducer noiseReducer;

    private CorrelationMetrics metrics;
    private AlertIngestionService service;

    @BeforeEach
    void setUp() {
        metrics = new CorrelationMetrics(new SimpleMeterRegistry());
        service = new AlertIngestionService(new AlertValidator(), new FingerprintGenerator(),
                patternLibrary, noiseReducer, store, metrics, new PrismStructuredLogger(),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Nested
    @DisplayName("Invalid records")
    class InvalidRecordTests {

        @Test
        @DisplayName("should reject without touching the store or counters")
        void rejectWithoutSideEffects() {
            AlertRecord invalid = record("a1", "web", null, "warning", "High CPU", NOW);

            assertThatThrownBy(() -> service.ingest(invalid))
                    .isInstanceOf(AlertValidator.InvalidAlertException.class);

            verifyNoInteractions(store, patternLibrary, noiseReducer);
            assertThat(metrics.getAlertsIngested().count()).isZero();
        }
    }

    @Nested
    @DisplayName("Firing alerts")
    class FiringTests {

        @Test
        @DisplayName("should flag noise and report it as such")
        void flagNoise() {
            when(patternLibrary.recordOccurrence(any(Alert.class))).thenReturn("web|web01|high cpu");
            when(store.contains("a1")).thenReturn(false);
            when(noiseReducer.isNoise(eq("web|web01|high cpu"), any(Instant.class))).thenReturn(true);
            when(store.ingest(any(Alert.class))).thenReturn(IngestResult.ACCEPTED);

            IngestResult result = service.ingest(record("a1", "web", "web01", "warning", "High CPU", NOW));

            assertThat(result).isEqualTo(IngestResult.NOISE);
            ArgumentCaptor<Alert> captor = ArgumentCaptor.forClass(Alert.class);
            verify(store).ingest(captor.capture());
            assertThat(captor.getValue().isSuppressed()).isTrue();
            assertThat(captor.getValue().getPatternKey()).isEqualTo("web|web01|high cpu");
            assertThat(captor.getValue().getFingerprint()).hasSize(16);
            assertThat(metrics.getAlertsIngested().count()).isEqualTo(1.0);
            assertThat(metrics.getAlertsNoiseSuppressed().count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should report a folded noise alert as deduplicated and count it as noise")
        void foldedNoise() {
            when(patternLibrary.recordOccurrence(any(Alert.class))).thenReturn("web|web01|high cpu");
            when(store.contains("a2")).thenReturn(false);
            when(noiseReducer.isNoise(eq("web|web01|high cpu"), any(Instant.class))).thenReturn(true);
            when(store.ingest(any(Alert.class))).thenReturn(IngestResult.DEDUPLICATED);

            IngestResult result = service.ingest(record("a2", "web", "web01", "warning", "High CPU", NOW));

            assertThat(result).isEqualTo(IngestResult.DEDUPLICATED);
            assertThat(metrics.getAlertsNoiseSuppressed().count()).isEqualTo(1.0);
            assertThat(metrics.getAlertsDeduplicated().count()).isZero();
        }

        @Test
        @DisplayName("should not judge a repeated id as noise")
        void skipNoiseForRepeatDelivery() {
            when(patternLibrary.recordOccurrence(any(Alert.class))).thenReturn("key");
            when(store.contains("a1")).thenReturn(true);
            when(store.ingest(any(Alert.class))).thenReturn(IngestResult.DEDUPLICATED);

            IngestResult result = service.ingest(record("a1", "web", "web01", "warning", "High CPU", NOW));

            assertThat(result).isEqualTo(IngestResult.DEDUPLICATED);
            verify(noiseReducer, never()).isNoise(anyString(), any(Instant.class));
            assertThat(metrics.getAlertsDeduplicated().count()).isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("Resolution records")
    class ResolutionTests {

        @Test
        @DisplayName("should resolve without recording a pattern occurrence")
        void resolveWithoutOccurrence() {
            when(store.ingest(any(Alert.class))).thenReturn(IngestResult.RESOLVED);
            AlertRecord resolution = record("r1", "web", "web01", "warning", "High CPU", NOW);
            resolution.setStatus("resolved");

            IngestResult result = service.ingest(resolution);

            assertThat(result).isEqualTo(IngestResult.RESOLVED);
            verify(patternLibrary, never()).recordOccurrence(any(Alert.class));
            verifyNoInteractions(noiseReducer);
            assertThat(metrics.getAlertsResolved().count()).isEqualTo(1.0);
        }
    }

    @Test
    @DisplayName("should delegate re-evaluation to the noise reducer with the current time")
    void reevaluateWithClock() {
        when(noiseReducer.reevaluateSuppressed(store, NOW)).thenReturn(3);

        assertThat(service.reevaluateSuppressed()).isEqualTo(3);
    }
}
