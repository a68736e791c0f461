package com.z254.prism.correlation;

import com.z254.prism.config.PrismProperties;
import com.z254.prism.correlation.scoring.AlertScorer;
import com.z254.prism.correlation.scoring.PairScore;
import com.z254.prism.correlation.scoring.ScoringContext;
import com.z254.prism.correlation.scoring.TfIdfVectorizer;
import com.z254.prism.domain.model.Alert;
import com.z254.prism.domain.model.AlertCluster;
import com.z254.prism.domain.model.CorrelationQuery;
import com.z254.prism.domain.model.CorrelationRule;
import com.z254.prism.domain.model.CorrelationType;
import com.z254.prism.domain.repository.AlertStore;
import com.z254.prism.graph.DependencyGraphHolder;
import com.z254.prism.graph.ServiceDependencyGraph;
import com.z254.prism.observability.CorrelationMetrics;
import com.z254.prism.observability.PrismStructuredLogger;
import com.z254.prism.rca.ImpactAnalyzer;
import com.z254.prism.rca.RootCauseAnalyzer;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Groups correlated alerts into clusters.
 * <p>
 * A pass:
 * <ol>
 *     <li>Snapshots the correlatable alerts of the requested window</li>
 *     <li>Scores every pair whose gap is within twice the largest rule window</li>
 *     <li>Forms connected components of the edge graph with union-find</li>
 *     <li>Splits components spanning more than that bound into time slices</li>
 *     <li>Builds a cluster for every component of two or more alerts</li>
 * </ol>
 * The result depends only on the alert set and the rules, never on ingestion order. Passes run
 * on the bounded elastic scheduler and stop cooperatively on deadline or cancellation, in which
 * case nothing is published.
 */
@Slf4j
@Service
public class Correlator {

    private static final Comparator<Alert> CHRONOLOGICAL =
            Comparator.comparing(Alert::getTimestamp).thenComparing(Alert::getId);
    private static final int CHECKPOINT_INTERVAL = 1024;

    private final AlertStore store;
    private final CorrelationRuleRegistry ruleRegistry;
    private final DependencyGraphHolder graphHolder;
    private final Map<CorrelationType, AlertScorer> scorers;
    private final TfIdfVectorizer vectorizer;
    private final RootCauseAnalyzer rootCauseAnalyzer;
    private final ImpactAnalyzer impactAnalyzer;
    private final ClusterRegistry clusterRegistry;
    private final PrismProperties.Correlation config;
    private final CorrelationMetrics metrics;
    private final PrismStructuredLogger logger;
    private final Clock clock;

    public Correlator(AlertStore store,
                      CorrelationRuleRegistry ruleRegistry,
                      DependencyGraphHolder graphHolder,
                      List<AlertScorer> scorers,
                      TfIdfVectorizer vectorizer,
                      RootCauseAnalyzer rootCauseAnalyzer,
                      ImpactAnalyzer impactAnalyzer,
                      ClusterRegistry clusterRegistry,
                      PrismProperties properties,
                      CorrelationMetrics metrics,
                      PrismStructuredLogger logger,
                      Clock clock) {
        this.store = store;
        this.ruleRegistry = ruleRegistry;
        this.graphHolder = graphHolder;
        this.scorers = new EnumMap<>(CorrelationType.class);
        scorers.forEach(scorer -> this.scorers.put(scorer.type(), scorer));
        this.vectorizer = vectorizer;
        this.rootCauseAnalyzer = rootCauseAnalyzer;
        this.impactAnalyzer = impactAnalyzer;
        this.clusterRegistry = clusterRegistry;
        this.config = properties.getCorrelation();
        this.metrics = metrics;
        this.logger = logger;
        this.clock = clock;
    }

    /**
     * Run a correlation pass and publish its clusters.
     *
     * @return clusters matching the query filters; errors with
     *         {@link CorrelationCancelledException} when the deadline expires
     */
    public Mono<List<AlertCluster>> correlate(CorrelationQuery query) {
        CorrelationQuery effective = query != null ? query : new CorrelationQuery();
        Duration deadline = effective.getDeadline() != null ? effective.getDeadline() : config.getDefaultDeadline();
        PassControl control = new PassControl(newPassId(), System.nanoTime() + deadline.toNanos(),
                metrics.startPass());

        // the deadline only fires while the pass has not yet committed its result
        Mono<Long> deadlineSignal = Mono.delay(deadline)
                .filter(tick -> control.cancel())
                .switchIfEmpty(Mono.never());

        return Mono.fromCallable(() -> runGuarded(effective, control))
                .doOnCancel(control::abandon)
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(deadlineSignal)
                .onErrorMap(TimeoutException.class, e -> new CorrelationCancelledException(control.passId,
                        "Correlation pass " + control.passId + " exceeded its deadline of " + deadline))
                .doOnError(error -> {
                    if (!control.finish()) {
                        return;
                    }
                    if (error instanceof CorrelationCancelledException) {
                        metrics.recordPassCancelled(control.sample);
                        logger.logCorrelationEvent(control.passId, PrismStructuredLogger.CorrelationEventType.PASS_CANCELLED,
                                "Correlation pass cancelled", Map.of("reason", String.valueOf(error.getMessage())));
                    } else {
                        metrics.recordPassFailed(control.sample);
                        logger.logCorrelationEvent(control.passId, PrismStructuredLogger.CorrelationEventType.PASS_FAILED,
                                "Correlation pass failed", Map.of("error", String.valueOf(error.getMessage())));
                    }
                })
                .doOnCancel(() -> {
                    if (control.abandon() && control.finish()) {
                        metrics.recordPassCancelled(control.sample);
                        logger.logCorrelationEvent(control.passId, PrismStructuredLogger.CorrelationEventType.PASS_CANCELLED,
                                "Correlation pass cancelled by subscriber", null);
                    }
                });
    }

    /**
     * Blocking variant of {@link #correlate(CorrelationQuery)}.
     *
     * @throws CorrelationCancelledException when the deadline expires
     */
    public List<AlertCluster> correlateBlocking(CorrelationQuery query) {
        List<AlertCluster> clusters = correlate(query).block();
        return clusters != null ? clusters : List.of();
    }

    private List<AlertCluster> runGuarded(CorrelationQuery query, PassControl control) {
        try {
            List<AlertCluster> clusters = runPass(query, control);
            if (control.finish()) {
                metrics.recordPassCompleted(control.sample);
            }
            return clusters;
        } catch (CorrelationCancelledException e) {
            if (control.isAbandoned()) {
                // the subscriber is gone, the value is discarded
                return List.of();
            }
            throw e;
        }
    }

    List<AlertCluster> runPass(CorrelationQuery query, PassControl control) {
        Duration window = query.getTimeWindow() != null ? query.getTimeWindow() : config.getDefaultWindow();
        if (window.compareTo(config.getMinWindow()) < 0 || window.compareTo(config.getMaxWindow()) > 0) {
            logger.logCorrelationEvent(control.passId, PrismStructuredLogger.CorrelationEventType.WINDOW_REJECTED,
                    "Correlation window outside accepted bounds",
                    Map.of("window", window.toString(),
                            "min", config.getMinWindow().toString(),
                            "max", config.getMaxWindow().toString()));
            return List.of();
        }

        long started = System.nanoTime();
        Instant now = clock.instant();
        Instant from = now.minus(window);
        ServiceDependencyGraph graph = graphHolder.current();
        Map<CorrelationType, List<CorrelationRule>> rules = ruleRegistry.activeRulesByType();
        long boundMillis = 2 * maxWindow(rules).toMillis();

        List<Alert> alerts = new ArrayList<>(store.snapshot(from, now));
        alerts.sort(CHRONOLOGICAL);
        logger.logCorrelationEvent(control.passId, PrismStructuredLogger.CorrelationEventType.PASS_STARTED,
                "Correlation pass started",
                Map.of("window", window.toString(), "alerts", alerts.size()));

        List<AlertCluster> clusters = new ArrayList<>();
        if (alerts.size() >= 2 && boundMillis > 0) {
            ScoringContext context = ScoringContext.forCorpus(graph, alerts, vectorizer);
            List<Edge> edges = scoreEdges(alerts, rules, context, boundMillis, control);
            for (List<Integer> component : components(alerts.size(), edges, boundMillis, alerts)) {
                control.checkpoint();
                clusters.add(buildCluster(component, alerts, edges, graph, from, now));
            }
        }
        clusters.sort(Comparator.comparing((AlertCluster cluster) -> cluster.getAlerts().get(0).getTimestamp())
                .thenComparing(AlertCluster::getId));

        control.commit();
        List<AlertCluster> published = clusterRegistry.publish(clusters, control.passId, now);

        List<AlertCluster> matching = published.stream().filter(query::matches).toList();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("alerts", alerts.size());
        details.put("clusters", published.size());
        details.put("matching", matching.size());
        logger.logCorrelationEvent(control.passId, PrismStructuredLogger.CorrelationEventType.PASS_COMPLETED,
                "Correlation pass completed", details);
        logger.logPerformance("correlation_pass", Duration.ofNanos(System.nanoTime() - started), true,
                Map.of("passId", control.passId));
        return matching;
    }

    private List<Edge> scoreEdges(List<Alert> alerts, Map<CorrelationType, List<CorrelationRule>> rules,
                                  ScoringContext context, long boundMillis, PassControl control) {
        List<Edge> edges = new ArrayList<>();
        long evaluated = 0;
        for (int i = 0; i < alerts.size(); i++) {
            Alert earlier = alerts.get(i);
            for (int j = i + 1; j < alerts.size(); j++) {
                Alert later = alerts.get(j);
                if (AlertScorer.gapMillis(earlier, later) > boundMillis) {
                    break;
                }
                if (++evaluated % CHECKPOINT_INTERVAL == 0) {
                    control.checkpoint();
                }
                bestScore(earlier, later, rules, context)
                        .ifPresent(score -> edges.add(new Edge(earlier.getId(), later.getId(), score)));
            }
        }
        return edges;
    }

    private Optional<PairScore> bestScore(Alert earlier, Alert later,
                                          Map<CorrelationType, List<CorrelationRule>> rules,
                                          ScoringContext context) {
        PairScore best = null;
        for (CorrelationType type : CorrelationType.values()) {
            List<CorrelationRule> typeRules = rules.get(type);
            AlertScorer scorer = scorers.get(type);
            if (typeRules.isEmpty() || scorer == null) {
                continue;
            }
            try {
                Optional<PairScore> score = scorer.score(earlier, later, typeRules, context);
                if (score.isPresent()) {
                    best = AlertScorer.better(best, score.get());
                }
            } catch (RuntimeException e) {
                log.warn("{} scorer failed on alerts {} and {}, skipping pair: {}",
                        type, earlier.getId(), later.getId(), e.getMessage());
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * Connected components of at least two alerts, each spanning no more than the bound.
     */
    private List<List<Integer>> components(int size, List<Edge> edges, long boundMillis, List<Alert> alerts) {
        Map<String, Integer> index = new LinkedHashMap<>();
        for (int i = 0; i < size; i++) {
            index.put(alerts.get(i).getId(), i);
        }

        DisjointSet sets = new DisjointSet(size);
        edges.forEach(edge -> sets.union(index.get(edge.earlierId), index.get(edge.laterId)));

        Map<Integer, List<Integer>> byRoot = new TreeMap<>();
        for (int i = 0; i < size; i++) {
            byRoot.computeIfAbsent(sets.find(i), root -> new ArrayList<>()).add(i);
        }

        List<List<Integer>> result = new ArrayList<>();
        for (List<Integer> component : byRoot.values()) {
            if (component.size() < 2) {
                continue;
            }
            long span = AlertScorer.gapMillis(alerts.get(component.get(0)), alerts.get(component.get(component.size() - 1)));
            if (span <= boundMillis) {
                result.add(component);
            } else {
                result.addAll(splitBySpan(component, edges, index, boundMillis, alerts));
            }
        }
        return result;
    }

    /**
     * Cut a chronologically ordered component into slices no longer than the bound, then
     * recompute connectivity inside each slice.
     */
    private List<List<Integer>> splitBySpan(List<Integer> component, List<Edge> edges, Map<String, Integer> index,
                                            long boundMillis, List<Alert> alerts) {
        List<List<Integer>> slices = new ArrayList<>();
        List<Integer> slice = new ArrayList<>();
        for (int member : component) {
            if (!slice.isEmpty()
                    && AlertScorer.gapMillis(alerts.get(slice.get(0)), alerts.get(member)) > boundMillis) {
                slices.add(slice);
                slice = new ArrayList<>();
            }
            slice.add(member);
        }
        slices.add(slice);

        List<List<Integer>> result = new ArrayList<>();
        for (List<Integer> members : slices) {
            if (members.size() < 2) {
                continue;
            }
            Set<Integer> inSlice = new HashSet<>(members);
            DisjointSet sets = new DisjointSet(alerts.size());
            for (Edge edge : edges) {
                int left = index.get(edge.earlierId);
                int right = index.get(edge.laterId);
                if (inSlice.contains(left) && inSlice.contains(right)) {
                    sets.union(left, right);
                }
            }
            Map<Integer, List<Integer>> byRoot = new TreeMap<>();
            for (int member : members) {
                byRoot.computeIfAbsent(sets.find(member), root -> new ArrayList<>()).add(member);
            }
            byRoot.values().stream().filter(group -> group.size() >= 2).forEach(result::add);
        }
        return result;
    }

    private AlertCluster buildCluster(List<Integer> component, List<Alert> alerts, List<Edge> edges,
                                      ServiceDependencyGraph graph, Instant windowStart, Instant windowEnd) {
        List<Alert> members = new ArrayList<>(component.size());
        component.forEach(i -> members.add(alerts.get(i)));
        List<String> ids = members.stream().map(Alert::getId).sorted().toList();

        double weightSum = 0;
        int edgeCount = 0;
        Map<CorrelationType, Integer> typeCounts = new EnumMap<>(CorrelationType.class);
        Set<String> memberIds = new HashSet<>(ids);
        for (Edge edge : edges) {
            if (memberIds.contains(edge.earlierId) && memberIds.contains(edge.laterId)) {
                weightSum += edge.score.score();
                edgeCount++;
                typeCounts.merge(edge.score.type(), 1, Integer::sum);
            }
        }

        CorrelationType dominant = null;
        int dominantCount = -1;
        for (CorrelationType type : CorrelationType.values()) {
            int count = typeCounts.getOrDefault(type, 0);
            if (count > dominantCount) {
                dominant = type;
                dominantCount = count;
            }
        }

        Alert.Severity severity = members.stream()
                .map(Alert::getSeverity)
                .max(Comparator.comparingInt(Alert.Severity::getWeight))
                .orElse(Alert.Severity.INFO);

        List<String> rootCauses = rootCauseAnalyzer.rootCauseCandidates(members, graph);
        return AlertCluster.builder()
                .id(clusterId(ids))
                .alertIds(new ArrayList<>(ids))
                .alerts(members)
                .correlationType(dominant)
                .confidenceScore(edgeCount > 0 ? weightSum / edgeCount : 0.0)
                .edgeCount(edgeCount)
                .severity(severity)
                .rootCauseCandidates(rootCauses)
                .impactAssessment(impactAnalyzer.assess(members, rootCauses, graph))
                .windowStart(windowStart)
                .windowEnd(windowEnd)
                .createdAt(windowEnd)
                .build();
    }

    /**
     * Stable cluster id derived from the sorted member ids.
     */
    public static String clusterId(List<String> sortedMemberIds) {
        String joined = String.join("\n", sortedMemberIds);
        return "CLU-" + UUID.nameUUIDFromBytes(joined.getBytes(StandardCharsets.UTF_8));
    }

    private static Duration maxWindow(Map<CorrelationType, List<CorrelationRule>> rules) {
        return rules.values().stream()
                .flatMap(List::stream)
                .map(CorrelationRule::getTimeWindow)
                .max(Duration::compareTo)
                .orElse(Duration.ZERO);
    }

    private static String newPassId() {
        return "PASS-" + UUID.randomUUID().toString().substring(0, 8);
    }

    private record Edge(String earlierId, String laterId, PairScore score) {}

    /**
     * Cooperative cancellation state of one pass.
     */
    static final class PassControl {
        private static final int RUNNING = 0;
        private static final int COMMITTED = 1;
        private static final int CANCELLED = 2;

        private final String passId;
        private final long deadlineNanos;
        private final Timer.Sample sample;
        private final AtomicInteger state = new AtomicInteger(RUNNING);
        private final AtomicBoolean abandoned = new AtomicBoolean();
        private final AtomicBoolean finished = new AtomicBoolean();

        PassControl(String passId, long deadlineNanos, Timer.Sample sample) {
            this.passId = passId;
            this.deadlineNanos = deadlineNanos;
            this.sample = sample;
        }

        /**
         * @return true if the pass was still running and is now cancelled
         */
        boolean cancel() {
            return state.compareAndSet(RUNNING, CANCELLED);
        }

        /**
         * Cancel on behalf of a subscriber that is gone.
         *
         * @return true if the pass was still running and is now cancelled
         */
        boolean abandon() {
            abandoned.set(true);
            return cancel();
        }

        boolean isAbandoned() {
            return abandoned.get();
        }

        /**
         * @return true for the first caller only
         */
        boolean finish() {
            return finished.compareAndSet(false, true);
        }

        void checkpoint() {
            if (state.get() == CANCELLED) {
                throw new CorrelationCancelledException(passId, "Correlation pass " + passId + " was cancelled");
            }
            if (System.nanoTime() - deadlineNanos > 0) {
                cancel();
                throw new CorrelationCancelledException(passId, "Correlation pass " + passId + " exceeded its deadline");
            }
        }

        /**
         * Claim the right to publish. Once claimed, the deadline and cancellation no longer apply.
         */
        void commit() {
            checkpoint();
            if (!state.compareAndSet(RUNNING, COMMITTED)) {
                throw new CorrelationCancelledException(passId, "Correlation pass " + passId + " was cancelled");
            }
        }
    }

    /**
     * Signals that a pass was cancelled or ran past its deadline. Nothing was published.
     */
    public static class CorrelationCancelledException extends RuntimeException {
        private final String passId;

        public CorrelationCancelledException(String passId, String message) {
            super(message);
            this.passId = passId;
        }

        public String getPassId() {
            return passId;
        }
    }
}
