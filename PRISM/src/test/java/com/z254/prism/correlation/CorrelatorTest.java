package com.z254.prism.correlation;

import com.z254.prism.correlation.scoring.DependencyScorer;
import com.z254.prism.correlation.scoring.SpatialScorer;
import com.z254.prism.correlation.scoring.TemporalScorer;
import com.z254.prism.correlation.scoring.TextSimilarityScorer;
import com.z254.prism.correlation.scoring.TfIdfVectorizer;
import com.z254.prism.domain.model.Alert;
import com.z254.prism.domain.model.AlertCluster;
import com.z254.prism.domain.model.AlertRecord;
import com.z254.prism.domain.model.CorrelationQuery;
import com.z254.prism.domain.model.CorrelationType;
import com.z254.prism.domain.model.IngestResult;
import com.z254.prism.domain.repository.AlertStore;
import com.z254.prism.rca.ImpactAnalyzer;
import com.z254.prism.rca.RootCauseAnalyzer;
import com.z254.prism.support.EngineFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static com.z254.prism.support.EngineFixture.record;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;

/**
 * Unit tests for {@link Correlator}.
 */
class CorrelatorTest {

    private EngineFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = EngineFixture.create();
    }

    private List<AlertCluster> correlate(Duration window) {
        return fixture.correlator.correlateBlocking(CorrelationQuery.builder().timeWindow(window).build());
    }

    @Nested
    @DisplayName("Cluster formation")
    class FormationTests {

        @Test
        @DisplayName("should cluster a burst on one host")
        void burstOnOneHost() {
            fixture.engine.ingest(record("a1", "web", "web01", "warning", "High latency",
                    fixture.ago(Duration.ofSeconds(65))));
            fixture.engine.ingest(record("a2", "web", "web01", "warning", "High latency on /checkout",
                    fixture.ago(Duration.ofSeconds(60))));

            List<AlertCluster> clusters = correlate(Duration.ofMinutes(15));

            assertThat(clusters).hasSize(1);
            AlertCluster cluster = clusters.get(0);
            assertThat(cluster.getAlertIds()).containsExactly("a1", "a2");
            assertThat(cluster.getCorrelationType()).isEqualTo(CorrelationType.TEMPORAL);
            assertThat(cluster.getConfidenceScore()).isEqualTo(1.0);
            assertThat(cluster.getEdgeCount()).isEqualTo(1);
            assertThat(cluster.getId()).isEqualTo(Correlator.clusterId(List.of("a1", "a2")));
            assertThat(cluster.getRootCauseCandidates()).containsExactly("a1");
        }

        @Test
        @DisplayName("should name the failing dependency as root cause")
        void dependencyRootCause() {
            fixture.engine.setServiceDependencies(Map.of("api", List.of("database")));
            fixture.engine.ingest(record("db", "database", "db01", "critical", "Connection refused",
                    fixture.ago(Duration.ofSeconds(90))));
            fixture.engine.ingest(record("api", "api", "api01", "warning", "Upstream timeout",
                    fixture.ago(Duration.ofSeconds(60))));

            List<AlertCluster> clusters = correlate(Duration.ofMinutes(15));

            assertThat(clusters).hasSize(1);
            assertThat(clusters.get(0).getRootCauseCandidates()).containsExactly("db");
            assertThat(clusters.get(0).getSeverity()).isEqualTo(Alert.Severity.CRITICAL);
            assertThat(clusters.get(0).getImpactAssessment().getEntities())
                    .extracting(AlertCluster.AffectedEntity::getService)
                    .containsExactly("api", "database");
        }

        @Test
        @DisplayName("should not cluster unrelated alerts far apart")
        void unrelatedAlerts() {
            fixture.engine.ingest(record("a1", "billing", "bill01", "warning", "Invoice queue backlog",
                    fixture.ago(Duration.ofMinutes(50))));
            fixture.engine.ingest(record("a2", "search", "idx07", "info", "Reindex finished slowly",
                    fixture.ago(Duration.ofMinutes(20))));

            assertThat(fixture.engine.correlate(3600)).isEmpty();
            assertThat(fixture.engine.activeClusters()).isEmpty();
        }

        @Test
        @DisplayName("should never build a cluster of one alert")
        void singleAlert() {
            fixture.engine.ingest(record("a1", "web", "web01", "critical", "Down", fixture.ago(Duration.ofSeconds(10))));

            assertThat(correlate(Duration.ofMinutes(15))).isEmpty();
        }

        @Test
        @DisplayName("should leave resolved alerts out of new clusters")
        void resolvedExcluded() {
            fixture.engine.ingest(record("a1", "web", "web01", "warning", "High latency",
                    fixture.ago(Duration.ofSeconds(60))));
            fixture.engine.ingest(record("a2", "web", "web01", "warning", "Error rate above target",
                    fixture.ago(Duration.ofSeconds(50))));
            AlertRecord resolution = record("r1", "web", "web01", "warning", "High latency",
                    fixture.ago(Duration.ofSeconds(40)));
            resolution.setStatus("resolved");

            assertThat(fixture.engine.ingest(resolution)).isEqualTo(IngestResult.RESOLVED);
            assertThat(correlate(Duration.ofMinutes(15))).isEmpty();
        }
    }

    @Nested
    @DisplayName("Determinism")
    class DeterminismTests {

        private List<AlertRecord> records(EngineFixture target) {
            List<AlertRecord> records = new ArrayList<>();
            records.add(record("a1", "web", "web01", "warning", "High latency", target.ago(Duration.ofSeconds(300))));
            records.add(record("a2", "web", "web02", "warning", "High latency", target.ago(Duration.ofSeconds(290))));
            records.add(record("a3", "database", "db01", "critical", "Replication lag", target.ago(Duration.ofSeconds(200))));
            records.add(record("a4", "api", "api01", "warning", "Upstream timeout", target.ago(Duration.ofSeconds(170))));
            records.add(record("a5", "search", "idx01", "info", "Segment merge", target.ago(Duration.ofMinutes(14))));
            return records;
        }

        @Test
        @DisplayName("should produce the same clusters regardless of ingestion order")
        void orderIndependent() {
            EngineFixture forward = EngineFixture.create(p -> p.getNoise().setLearningEnabled(false));
            EngineFixture reverse = EngineFixture.create(p -> p.getNoise().setLearningEnabled(false));
            Map<String, List<String>> graph = Map.of("api", List.of("database"));
            forward.engine.setServiceDependencies(graph);
            reverse.engine.setServiceDependencies(graph);

            records(forward).forEach(forward.engine::ingest);
            List<AlertRecord> reversed = records(reverse);
            Collections.reverse(reversed);
            reversed.forEach(reverse.engine::ingest);

            List<AlertCluster> left = forward.engine.correlate(900);
            List<AlertCluster> right = reverse.engine.correlate(900);

            assertThat(left).isNotEmpty();
            assertThat(left).extracting(AlertCluster::getId)
                    .containsExactlyElementsOf(right.stream().map(AlertCluster::getId).toList());
            assertThat(left).extracting(AlertCluster::getRootCauseCandidates)
                    .containsExactlyElementsOf(right.stream().map(AlertCluster::getRootCauseCandidates).toList());
            assertThat(left).extracting(AlertCluster::getConfidenceScore)
                    .containsExactlyElementsOf(right.stream().map(AlertCluster::getConfidenceScore).toList());
        }

        @Test
        @DisplayName("should keep every cluster within twice the largest rule window")
        void respectWindow() {
            EngineFixture chain = EngineFixture.create(p -> p.getNoise().setLearningEnabled(false));
            for (int i = 0; i < 30; i++) {
                chain.engine.ingest(record("c" + i, "web", "h" + i, "warning", "Health check failed",
                        chain.ago(Duration.ofMinutes(120 - 4L * i))));
            }

            List<AlertCluster> clusters = chain.engine.correlate(Duration.ofHours(3).toSeconds());

            assertThat(clusters).hasSizeGreaterThan(1);
            long bound = Duration.ofMinutes(30).toMillis();
            assertThat(clusters).allSatisfy(cluster -> {
                List<Alert> members = cluster.getAlerts();
                Instant first = members.get(0).getTimestamp();
                Instant last = members.get(members.size() - 1).getTimestamp();
                assertThat(Duration.between(first, last).toMillis()).isLessThanOrEqualTo(bound);
            });
            assertThat(clusters.stream().mapToInt(AlertCluster::size).sum()).isEqualTo(30);
        }
    }

    @Nested
    @DisplayName("Queries")
    class QueryTests {

        @BeforeEach
        void ingestTwoBursts() {
            fixture.engine.ingest(record("w1", "web", "web01", "warning", "High latency", fixture.ago(Duration.ofSeconds(65))));
            fixture.engine.ingest(record("w2", "web", "web01", "warning", "Slow responses", fixture.ago(Duration.ofSeconds(60))));
            fixture.engine.ingest(record("p1", "payments", "pay01", "critical", "Card gateway errors", fixture.ago(Duration.ofMinutes(12))));
            fixture.engine.ingest(record("p2", "payments", "pay01", "critical", "Card gateway unreachable", fixture.ago(Duration.ofMinutes(11))));
        }

        @Test
        @DisplayName("should filter returned clusters by service and host")
        void filterByServiceAndHost() {
            List<AlertCluster> web = fixture.correlator.correlateBlocking(CorrelationQuery.builder()
                    .timeWindow(Duration.ofMinutes(15)).service("web").build());
            List<AlertCluster> payments = fixture.correlator.correlateBlocking(CorrelationQuery.builder()
                    .timeWindow(Duration.ofMinutes(15)).host("pay01").build());

            assertThat(web).singleElement().satisfies(c -> assertThat(c.getAlertIds()).containsExactly("w1", "w2"));
            assertThat(payments).singleElement().satisfies(c -> assertThat(c.getAlertIds()).containsExactly("p1", "p2"));
            assertThat(fixture.engine.activeClusters()).hasSize(2);
        }

        @Test
        @DisplayName("should filter returned clusters by dominant type")
        void filterByType() {
            assertThat(fixture.correlator.correlateBlocking(CorrelationQuery.builder()
                    .timeWindow(Duration.ofMinutes(15)).type(CorrelationType.DEPENDENCY).build())).isEmpty();
            assertThat(fixture.correlator.correlateBlocking(CorrelationQuery.builder()
                    .timeWindow(Duration.ofMinutes(15)).type(CorrelationType.TEMPORAL).build())).hasSize(2);
        }

        @Test
        @DisplayName("should return nothing for a window outside the accepted bounds")
        void rejectWindow() {
            assertThat(correlate(Duration.ofSeconds(30))).isEmpty();
            assertThat(correlate(Duration.ofDays(2))).isEmpty();
            assertThat(fixture.engine.activeClusters()).isEmpty();
        }

        @Test
        @DisplayName("should only see alerts inside the requested window")
        void narrowWindow() {
            assertThat(correlate(Duration.ofMinutes(5))).extracting(AlertCluster::getId)
                    .containsExactly(Correlator.clusterId(List.of("w1", "w2")));
        }
    }

    @Nested
    @DisplayName("Deadlines")
    class DeadlineTests {

        private AlertStore slowStore;
        private Correlator correlator;
        private ClusterRegistry registry;

        @BeforeEach
        void setUp() {
            Instant now = fixture.clock.instant();
            slowStore = mock(AlertStore.class);
            doAnswer(invocation -> {
                try {
                    Thread.sleep(500);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return List.of(
                        EngineFixture.alert("s1", "web", "web01", now.minusSeconds(20)),
                        EngineFixture.alert("s2", "web", "web01", now.minusSeconds(10)));
            }).when(slowStore).snapshot(any(Instant.class), any(Instant.class));

            registry = new ClusterRegistry(slowStore, fixture.patternLibrary, fixture.metrics, fixture.logger);
            correlator = new Correlator(slowStore, fixture.ruleRegistry, fixture.graphHolder,
                    List.of(new TemporalScorer(), new SpatialScorer(), new TextSimilarityScorer(), new DependencyScorer()),
                    new TfIdfVectorizer(), new RootCauseAnalyzer(), new ImpactAnalyzer(), registry,
                    fixture.properties, fixture.metrics, fixture.logger, fixture.clock);
        }

        private CorrelationQuery tightDeadline() {
            return CorrelationQuery.builder()
                    .timeWindow(Duration.ofMinutes(15))
                    .deadline(Duration.ofMillis(50))
                    .build();
        }

        @Test
        @DisplayName("should signal cancellation and publish nothing past the deadline")
        void cancelOnDeadline() throws InterruptedException {
            StepVerifier.create(correlator.correlate(tightDeadline()))
                    .expectError(Correlator.CorrelationCancelledException.class)
                    .verify(Duration.ofSeconds(5));

            // let the abandoned pass reach its next checkpoint
            Thread.sleep(700);
            assertThat(registry.lastPublishedAt()).isEmpty();
            assertThat(fixture.metrics.getPassesCancelled().count()).isEqualTo(1.0);
            assertThat(fixture.metrics.getPassesCompleted().count()).isZero();
        }

        @Test
        @DisplayName("should throw from the blocking variant past the deadline")
        void blockingCancellation() {
            assertThatThrownBy(() -> correlator.correlateBlocking(tightDeadline()))
                    .isInstanceOf(Correlator.CorrelationCancelledException.class)
                    .satisfies(e -> assertThat(((Correlator.CorrelationCancelledException) e).getPassId())
                            .startsWith("PASS-"));
        }
    }

    @Nested
    @DisplayName("Publication")
    class PublicationTests {

        private SlowPublishRegistry registry;
        private Correlator correlator;

        @BeforeEach
        void setUp() {
            registry = new SlowPublishRegistry(fixture);
            correlator = new Correlator(fixture.store, fixture.ruleRegistry, fixture.graphHolder,
                    List.of(new TemporalScorer(), new SpatialScorer(), new TextSimilarityScorer(), new DependencyScorer()),
                    new TfIdfVectorizer(), new RootCauseAnalyzer(), new ImpactAnalyzer(), registry,
                    fixture.properties, fixture.metrics, fixture.logger, fixture.clock);
            fixture.engine.ingest(record("a1", "web", "web01", "warning", "High latency",
                    fixture.ago(Duration.ofSeconds(65))));
            fixture.engine.ingest(record("a2", "web", "web01", "warning", "High latency on /checkout",
                    fixture.ago(Duration.ofSeconds(60))));
        }

        @Test
        @DisplayName("should complete a pass whose deadline expires while it is publishing")
        void deadlineDuringPublish() throws InterruptedException {
            correlator.correlateBlocking(CorrelationQuery.builder().timeWindow(Duration.ofMinutes(15)).build());
            registry.publishDelay = Duration.ofMillis(400);

            StepVerifier.create(correlator.correlate(CorrelationQuery.builder()
                            .timeWindow(Duration.ofMinutes(15))
                            .deadline(Duration.ofMillis(150))
                            .build()))
                    .assertNext(clusters -> assertThat(clusters).singleElement()
                            .satisfies(cluster -> assertThat(cluster.getAlertIds()).containsExactly("a1", "a2")))
                    .expectComplete()
                    .verify(Duration.ofSeconds(5));

            Thread.sleep(200);
            assertThat(registry.publications).isEqualTo(2);
            assertThat(fixture.metrics.getPassesCompleted().count()).isEqualTo(2.0);
            assertThat(fixture.metrics.getPassesCancelled().count()).isZero();
        }
    }

    private static final class SlowPublishRegistry extends ClusterRegistry {
        private volatile Duration publishDelay = Duration.ZERO;
        private volatile int publications;

        SlowPublishRegistry(EngineFixture fixture) {
            super(fixture.store, fixture.patternLibrary, fixture.metrics, fixture.logger);
        }

        @Override
        public List<AlertCluster> publish(List<AlertCluster> clusters, String passId, Instant at) {
            try {
                Thread.sleep(publishDelay.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            publications++;
            return super.publish(clusters, passId, at);
        }
    }
}
