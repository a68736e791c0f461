package com.z254.prism.domain.repository;

import com.z254.prism.config.PrismProperties;
import com.z254.prism.domain.model.Alert;
import com.z254.prism.domain.model.AlertQuery;
import com.z254.prism.domain.model.IngestResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory alert store bounded by a fixed capacity.
 * <p>
 * Alerts are ordered by (timestamp, admission sequence); when the capacity is exceeded the
 * first entries in that order are evicted, so the store always holds the most recent alerts.
 * Writers take the write lock, readers copy under the read lock.
 */
@Slf4j
@Repository
public class InMemoryAlertStore implements AlertStore {

    private static final Comparator<Entry> ORDER = Comparator
            .comparing((Entry entry) -> entry.alert.getTimestamp())
            .thenComparingLong(entry -> entry.sequence);

    private final int capacity;
    private final Duration repeatWindow;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, Entry> byId = new HashMap<>();
    private final NavigableSet<Entry> byTime = new TreeSet<>(ORDER);
    private final Map<String, Set<String>> byFingerprint = new HashMap<>();
    private long sequence;

    @Autowired
    public InMemoryAlertStore(PrismProperties properties) {
        this(properties.getStore().getCapacity(), properties.getStore().getDedupRepeatWindow());
    }

    public InMemoryAlertStore(int capacity, Duration repeatWindow) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Store capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.repeatWindow = repeatWindow;
    }

    @Override
    public IngestResult ingest(Alert alert) {
        lock.writeLock().lock();
        try {
            Entry sameId = byId.get(alert.getId());
            if (sameId != null) {
                return applyRepeatDelivery(sameId, alert);
            }

            if (!alert.isFiring()) {
                Entry firing = findFiringMatch(alert);
                if (firing != null) {
                    markResolved(firing, resolutionTime(alert));
                    return IngestResult.RESOLVED;
                }
                admit(alert);
                return IngestResult.ACCEPTED;
            }

            Entry duplicate = findDuplicate(alert);
            if (duplicate != null) {
                foldDuplicate(duplicate, alert.getTimestamp());
                return IngestResult.DEDUPLICATED;
            }

            admit(alert);
            return IngestResult.ACCEPTED;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<Alert> findById(String id) {
        lock.readLock().lock();
        try {
            Entry entry = byId.get(id);
            return entry != null ? Optional.of(entry.alert.copy()) : Optional.empty();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public boolean contains(String id) {
        lock.readLock().lock();
        try {
            return byId.containsKey(id);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<Alert> query(AlertQuery query) {
        lock.readLock().lock();
        try {
            List<Alert> result = new ArrayList<>();
            for (Entry entry : byTime) {
                if (query.getTo() != null && entry.alert.getTimestamp().isAfter(query.getTo())) {
                    break;
                }
                if (query.matches(entry.alert)) {
                    result.add(entry.alert.copy());
                }
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<Alert> snapshot(Instant from, Instant to) {
        lock.readLock().lock();
        try {
            List<Alert> result = new ArrayList<>();
            for (Entry entry : byTime) {
                Instant timestamp = entry.alert.getTimestamp();
                if (timestamp.isAfter(to)) {
                    break;
                }
                if (!timestamp.isBefore(from) && entry.alert.isCorrelatable()) {
                    result.add(entry.alert.copy());
                }
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<Alert> findSuppressed() {
        lock.readLock().lock();
        try {
            List<Alert> result = new ArrayList<>();
            for (Entry entry : byTime) {
                if (entry.alert.isSuppressed()) {
                    result.add(entry.alert.copy());
                }
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public boolean updateSuppressed(String id, boolean suppressed) {
        lock.writeLock().lock();
        try {
            Entry entry = byId.get(id);
            if (entry == null) {
                return false;
            }
            entry.alert.setSuppressed(suppressed);
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<Alert> acknowledge(String id, String acknowledgedBy, Instant at) {
        lock.writeLock().lock();
        try {
            Entry entry = byId.get(id);
            if (entry == null) {
                return Optional.empty();
            }
            entry.alert.setAcknowledgedAt(at);
            entry.alert.setAcknowledgedBy(acknowledgedBy);
            return Optional.of(entry.alert.copy());
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<String> evictIfOverCapacity() {
        lock.writeLock().lock();
        try {
            return evictLocked();
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public int size() {
        lock.readLock().lock();
        try {
            return byId.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public int capacity() {
        return capacity;
    }

    private IngestResult applyRepeatDelivery(Entry existing, Alert incoming) {
        if (!incoming.isFiring()) {
            if (existing.alert.isFiring()) {
                markResolved(existing, resolutionTime(incoming));
            }
            return IngestResult.RESOLVED;
        }
        if (existing.alert.isFiring()) {
            foldDuplicate(existing, incoming.getTimestamp());
        } else {
            existing.alert.setDuplicateCount(existing.alert.getDuplicateCount() + 1);
        }
        return IngestResult.DEDUPLICATED;
    }

    private Entry findDuplicate(Alert incoming) {
        Entry best = null;
        for (Entry candidate : candidatesFor(incoming.getFingerprint())) {
            Alert stored = candidate.alert;
            if (!stored.isFiring()) {
                continue;
            }
            Duration gap = Duration.between(stored.getTimestamp(), incoming.getTimestamp()).abs();
            if (gap.compareTo(repeatWindow) > 0) {
                continue;
            }
            if (best == null || ORDER.compare(candidate, best) > 0) {
                best = candidate;
            }
        }
        return best;
    }

    private Entry findFiringMatch(Alert resolution) {
        Entry best = null;
        for (Entry candidate : candidatesFor(resolution.getFingerprint())) {
            Alert stored = candidate.alert;
            if (!stored.isFiring()
                    || !stored.getService().equals(resolution.getService())
                    || !stored.getHost().equals(resolution.getHost())) {
                continue;
            }
            if (best == null || ORDER.compare(candidate, best) > 0) {
                best = candidate;
            }
        }
        return best;
    }

    private List<Entry> candidatesFor(String fingerprint) {
        Set<String> ids = byFingerprint.get(fingerprint);
        if (ids == null) {
            return List.of();
        }
        List<Entry> entries = new ArrayList<>(ids.size());
        for (String id : ids) {
            entries.add(byId.get(id));
        }
        return entries;
    }

    private void foldDuplicate(Entry entry, Instant timestamp) {
        Alert stored = entry.alert;
        if (timestamp != null && timestamp.isAfter(stored.getTimestamp())) {
            // the ordering key changes, so the entry has to be re-inserted
            byTime.remove(entry);
            stored.setTimestamp(timestamp);
            byTime.add(entry);
        }
        stored.setDuplicateCount(stored.getDuplicateCount() + 1);
    }

    private void markResolved(Entry entry, Instant resolvedAt) {
        entry.alert.setStatus(Alert.Status.RESOLVED);
        entry.alert.setResolvedAt(resolvedAt);
        log.debug("Resolved alert {}", entry.alert.getId());
    }

    private static Instant resolutionTime(Alert resolution) {
        return resolution.getResolvedAt() != null ? resolution.getResolvedAt() : resolution.getTimestamp();
    }

    private void admit(Alert alert) {
        Alert stored = alert.copy();
        if (stored.getFirstSeenAt() == null) {
            stored.setFirstSeenAt(stored.getTimestamp());
        }
        if (!stored.isFiring() && stored.getResolvedAt() == null) {
            stored.setResolvedAt(stored.getTimestamp());
        }
        Entry entry = new Entry(stored, sequence++);
        byId.put(stored.getId(), entry);
        byTime.add(entry);
        byFingerprint.computeIfAbsent(stored.getFingerprint(), key -> new LinkedHashSet<>()).add(stored.getId());
        evictLocked();
    }

    private List<String> evictLocked() {
        if (byId.size() <= capacity) {
            return List.of();
        }
        List<String> evicted = new ArrayList<>();
        while (byId.size() > capacity) {
            Entry oldest = byTime.pollFirst();
            if (oldest == null) {
                break;
            }
            String id = oldest.alert.getId();
            byId.remove(id);
            Set<String> ids = byFingerprint.get(oldest.alert.getFingerprint());
            if (ids != null) {
                ids.remove(id);
                if (ids.isEmpty()) {
                    byFingerprint.remove(oldest.alert.getFingerprint());
                }
            }
            evicted.add(id);
        }
        log.debug("Evicted {} alert(s) over capacity {}: {}", evicted.size(), capacity, evicted);
        return evicted;
    }

    private static final class Entry {
        private final Alert alert;
        private final long sequence;

        private Entry(Alert alert, long sequence) {
            this.alert = alert;
            this.sequence = sequence;
        }
    }
}
