package com.z254.prism.correlation;

import com.z254.prism.domain.model.Alert;
import com.z254.prism.domain.model.AlertCluster;
import com.z254.prism.domain.repository.AlertStore;
import com.z254.prism.noise.PatternLibrary;
import com.z254.prism.observability.CorrelationMetrics;
import com.z254.prism.observability.PrismStructuredLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the published cluster set.
 * <p>
 * Publication is Most Recent Completed Wins: a finished pass atomically replaces the clusters
 * it overlaps, recording their ids in {@code mergedFrom}; earlier clusters sharing no member
 * with the new result stay published. Membership is by alert id and is resolved lazily
 * against the store, so evicted alerts disappear from clusters on lookup and clusters left
 * with fewer than two members are dropped.
 */
@Slf4j
@Component
public class ClusterRegistry {

    private final AtomicReference<Published> latest = new AtomicReference<>(Published.EMPTY);
    private final Set<String> seenClusterIds = ConcurrentHashMap.newKeySet();
    private final AlertStore store;
    private final PatternLibrary patternLibrary;
    private final CorrelationMetrics metrics;
    private final PrismStructuredLogger logger;

    public ClusterRegistry(AlertStore store,
                           PatternLibrary patternLibrary,
                           CorrelationMetrics metrics,
                           PrismStructuredLogger logger) {
        this.store = store;
        this.patternLibrary = patternLibrary;
        this.metrics = metrics;
        this.logger = logger;
    }

    /**
     * Publish the clusters of a completed pass.
     *
     * @return the published clusters, with {@code mergedFrom} filled in
     */
    public List<AlertCluster> publish(List<AlertCluster> clusters, String passId, Instant at) {
        Published next = latest.updateAndGet(current -> merge(current, clusters, passId, at));

        List<AlertCluster> published = new ArrayList<>(clusters.size());
        for (AlertCluster cluster : clusters) {
            AlertCluster stored = next.byId.getOrDefault(cluster.getId(), cluster);
            published.add(stored);
            if (seenClusterIds.add(stored.getId())) {
                onNewCluster(stored, passId);
            }
        }
        // ids of absorbed or dropped clusters are forgotten
        seenClusterIds.retainAll(latest.get().byId.keySet());
        return published;
    }

    /**
     * Published clusters with evicted members removed.
     */
    public List<AlertCluster> activeClusters() {
        List<AlertCluster> active = new ArrayList<>();
        for (AlertCluster cluster : latest.get().byId.values()) {
            live(cluster).ifPresent(active::add);
        }
        return active;
    }

    public Optional<AlertCluster> find(String clusterId) {
        AlertCluster cluster = latest.get().byId.get(clusterId);
        return cluster != null ? live(cluster) : Optional.empty();
    }

    /**
     * Distinct alert ids still stored and held by a live cluster.
     */
    public int liveMemberCount() {
        Set<String> members = new HashSet<>();
        for (AlertCluster cluster : activeClusters()) {
            members.addAll(cluster.getAlertIds());
        }
        return members.size();
    }

    int trackedClusterIds() {
        return seenClusterIds.size();
    }

    public Optional<Instant> lastPublishedAt() {
        return Optional.ofNullable(latest.get().publishedAt);
    }

    public Optional<String> lastPassId() {
        return Optional.ofNullable(latest.get().passId);
    }

    private Published merge(Published current, List<AlertCluster> fresh, String passId, Instant at) {
        Map<String, Set<String>> absorbed = new LinkedHashMap<>();
        Map<String, AlertCluster> carried = new LinkedHashMap<>();

        for (AlertCluster previous : current.byId.values()) {
            boolean overlapped = false;
            for (AlertCluster cluster : fresh) {
                if (cluster.getId().equals(previous.getId())) {
                    overlapped = true;
                    absorbed.computeIfAbsent(cluster.getId(), id -> new LinkedHashSet<>())
                            .addAll(previous.getMergedFrom());
                } else if (sharesMember(cluster, previous)) {
                    overlapped = true;
                    absorbed.computeIfAbsent(cluster.getId(), id -> new LinkedHashSet<>())
                            .add(previous.getId());
                }
            }
            if (!overlapped && countLive(previous) >= 2) {
                carried.put(previous.getId(), previous);
            }
        }

        Map<String, AlertCluster> byId = new LinkedHashMap<>();
        for (AlertCluster cluster : fresh) {
            Set<String> mergedFrom = absorbed.getOrDefault(cluster.getId(), Set.of());
            byId.put(cluster.getId(), mergedFrom.isEmpty()
                    ? cluster
                    : cluster.toBuilder().mergedFrom(new LinkedHashSet<>(mergedFrom)).build());
        }
        carried.forEach(byId::putIfAbsent);
        return new Published(byId, at, passId);
    }

    private static boolean sharesMember(AlertCluster left, AlertCluster right) {
        for (String id : left.getAlertIds()) {
            if (right.getAlertIds().contains(id)) {
                return true;
            }
        }
        return false;
    }

    private int countLive(AlertCluster cluster) {
        int live = 0;
        for (String id : cluster.getAlertIds()) {
            if (store.contains(id)) {
                live++;
            }
        }
        return live;
    }

    private Optional<AlertCluster> live(AlertCluster cluster) {
        List<String> survivingIds = new ArrayList<>();
        for (String id : cluster.getAlertIds()) {
            if (store.contains(id)) {
                survivingIds.add(id);
            }
        }
        if (survivingIds.size() < 2) {
            return Optional.empty();
        }
        if (survivingIds.size() == cluster.getAlertIds().size()) {
            return Optional.of(cluster);
        }
        Set<String> surviving = new HashSet<>(survivingIds);
        List<Alert> alerts = cluster.getAlerts().stream()
                .filter(alert -> surviving.contains(alert.getId()))
                .toList();
        return Optional.of(cluster.toBuilder()
                .alertIds(survivingIds)
                .alerts(new ArrayList<>(alerts))
                .rootCauseCandidates(cluster.getRootCauseCandidates().stream()
                        .filter(surviving::contains)
                        .toList())
                .build());
    }

    private void onNewCluster(AlertCluster cluster, String passId) {
        metrics.recordClusterCreated(cluster.size());

        Map<String, Instant> firstByService = new LinkedHashMap<>();
        for (Alert alert : cluster.getAlerts()) {
            firstByService.merge(alert.getService(), alert.getTimestamp(),
                    (a, b) -> a.isBefore(b) ? a : b);
        }
        firstByService.forEach((service, at) -> patternLibrary.recordClusterSighting(List.of(service), at));

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("passId", passId);
        details.put("size", cluster.size());
        details.put("type", cluster.getCorrelationType().wireName());
        details.put("confidence", cluster.getConfidenceScore());
        details.put("rootCauses", String.join(",", cluster.getRootCauseCandidates()));
        if (!cluster.getMergedFrom().isEmpty()) {
            details.put("mergedFrom", String.join(",", cluster.getMergedFrom()));
        }
        logger.logClusterEvent(cluster.getId(),
                cluster.getMergedFrom().isEmpty()
                        ? PrismStructuredLogger.ClusterEventType.CREATED
                        : PrismStructuredLogger.ClusterEventType.MERGED,
                "Cluster published", details);
    }

    private static final class Published {
        private static final Published EMPTY = new Published(Map.of(), null, null);

        private final Map<String, AlertCluster> byId;
        private final Instant publishedAt;
        private final String passId;

        private Published(Map<String, AlertCluster> byId, Instant publishedAt, String passId) {
            this.byId = byId;
            this.publishedAt = publishedAt;
            this.passId = passId;
        }
    }
}
