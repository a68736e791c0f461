package com.z254.prism.noise;

import com.z254.prism.config.PrismProperties;
import com.z254.prism.domain.model.Alert;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.regex.Pattern;

/**
 * Learned recurring alert signatures.
 * <p>
 * Each ingested alert records one occurrence under its pattern key
 * {@code service|host|normalized title}. Occurrences are kept for the retention period and
 * capped per key. The library also remembers when clusters involving a service were first
 * published, which the predictor uses to tell whether a pattern tends to precede an incident.
 */
@Slf4j
@Component
public class PatternLibrary {

    private static final Pattern DIGITS = Pattern.compile("\\d+");
    private static final Pattern PUNCTUATION = Pattern.compile("[^\\p{L}\\p{N}\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final Duration retention;
    private final int maxOccurrencesPerPattern;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, AlertPattern> patterns = new HashMap<>();
    private final Occurrences allOccurrences = new Occurrences();
    private final Map<String, Occurrences> clusterSightings = new HashMap<>();

    @Autowired
    public PatternLibrary(PrismProperties properties) {
        this(properties.getPrediction().getLookback(), properties.getNoise().getMaxOccurrencesPerPattern());
    }

    public PatternLibrary(Duration retention, int maxOccurrencesPerPattern) {
        this.retention = retention;
        this.maxOccurrencesPerPattern = maxOccurrencesPerPattern;
    }

    /**
     * Lowercase, digit runs to {@code x}, punctuation stripped, whitespace collapsed.
     */
    public static String normalizeTitle(String title) {
        if (title == null) {
            return "";
        }
        String normalized = title.toLowerCase(Locale.ROOT);
        normalized = DIGITS.matcher(normalized).replaceAll("x");
        normalized = PUNCTUATION.matcher(normalized).replaceAll(" ");
        return WHITESPACE.matcher(normalized).replaceAll(" ").trim();
    }

    public static String patternKey(String service, String host, String title) {
        return service + "|" + host + "|" + normalizeTitle(title);
    }

    /**
     * Record one occurrence of the alert's pattern.
     *
     * @return the pattern key
     */
    public String recordOccurrence(Alert alert) {
        String key = patternKey(alert.getService(), alert.getHost(), alert.getTitle());
        Instant at = alert.getTimestamp();

        lock.writeLock().lock();
        try {
            AlertPattern pattern = patterns.computeIfAbsent(key, k -> new AlertPattern(k,
                    alert.getService(), alert.getHost(), normalizeTitle(alert.getTitle()), alert.getTitle()));
            pattern.occurrences.add(at);
            allOccurrences.add(at);
            while (pattern.occurrences.total() > maxOccurrencesPerPattern) {
                Instant dropped = pattern.occurrences.removeOldest();
                allOccurrences.remove(dropped);
            }
            prune(at.minus(retention));
        } finally {
            lock.writeLock().unlock();
        }
        return key;
    }

    /**
     * Note that a cluster involving the given services was published.
     */
    public void recordClusterSighting(Collection<String> services, Instant at) {
        lock.writeLock().lock();
        try {
            for (String service : services) {
                clusterSightings.computeIfAbsent(service, s -> new Occurrences()).add(at);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Occurrence counts over the trailing horizon ending at {@code at}.
     */
    public Frequency frequency(String key, Instant at, Duration horizon) {
        Instant from = at.minus(horizon);
        lock.readLock().lock();
        try {
            AlertPattern pattern = patterns.get(key);
            int keyCount = pattern != null ? pattern.occurrences.countBetween(from, at) : 0;
            int total = allOccurrences.countBetween(from, at);
            return new Frequency(keyCount, total);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Whether a cluster involving the service was seen in {@code [from, to]}.
     */
    public boolean clusterSeenBetween(String service, Instant from, Instant to) {
        lock.readLock().lock();
        try {
            Occurrences sightings = clusterSightings.get(service);
            return sightings != null && sightings.countBetween(from, to) > 0;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Snapshot of the patterns observed for a service.
     */
    public List<PatternView> patternsForService(String service) {
        lock.readLock().lock();
        try {
            List<PatternView> views = new ArrayList<>();
            for (AlertPattern pattern : patterns.values()) {
                if (pattern.service.equals(service)) {
                    views.add(pattern.view());
                }
            }
            views.sort((a, b) -> a.key().compareTo(b.key()));
            return views;
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<PatternView> find(String key) {
        lock.readLock().lock();
        try {
            AlertPattern pattern = patterns.get(key);
            return pattern != null ? Optional.of(pattern.view()) : Optional.empty();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return patterns.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    private void prune(Instant cutoff) {
        if (allOccurrences.isEmpty() || !allOccurrences.oldest().isBefore(cutoff)) {
            return;
        }
        allOccurrences.removeBefore(cutoff);
        patterns.values().removeIf(pattern -> {
            pattern.occurrences.removeBefore(cutoff);
            return pattern.occurrences.isEmpty();
        });
        clusterSightings.values().removeIf(sightings -> {
            sightings.removeBefore(cutoff);
            return sightings.isEmpty();
        });
        log.debug("Pruned pattern history older than {}; {} pattern(s) remain", cutoff, patterns.size());
    }

    /**
     * Occurrence counts of one key and of all keys over a horizon.
     */
    public record Frequency(int keyOccurrences, int totalOccurrences) {

        public double share() {
            return totalOccurrences == 0 ? 0.0 : (double) keyOccurrences / totalOccurrences;
        }
    }

    /**
     * Read-only copy of a pattern.
     */
    public record PatternView(String key, String service, String host, String normalizedTitle,
                              String sampleTitle, List<Instant> occurrences) {}

    private static final class AlertPattern {
        private final String key;
        private final String service;
        private final String host;
        private final String normalizedTitle;
        private final String sampleTitle;
        private final Occurrences occurrences = new Occurrences();

        private AlertPattern(String key, String service, String host, String normalizedTitle, String sampleTitle) {
            this.key = key;
            this.service = service;
            this.host = host;
            this.normalizedTitle = normalizedTitle;
            this.sampleTitle = sampleTitle;
        }

        private PatternView view() {
            return new PatternView(key, service, host, normalizedTitle, sampleTitle, occurrences.toList());
        }
    }

    /**
     * Sorted multiset of instants.
     */
    private static final class Occurrences {
        private final NavigableMap<Instant, Integer> counts = new TreeMap<>();
        private int total;

        void add(Instant at) {
            counts.merge(at, 1, Integer::sum);
            total++;
        }

        void remove(Instant at) {
            Integer count = counts.get(at);
            if (count == null) {
                return;
            }
            if (count == 1) {
                counts.remove(at);
            } else {
                counts.put(at, count - 1);
            }
            total--;
        }

        Instant removeOldest() {
            Instant oldest = counts.firstKey();
            remove(oldest);
            return oldest;
        }

        void removeBefore(Instant cutoff) {
            NavigableMap<Instant, Integer> expired = counts.headMap(cutoff, false);
            for (int count : expired.values()) {
                total -= count;
            }
            expired.clear();
        }

        int countBetween(Instant from, Instant to) {
            if (from.isAfter(to)) {
                return 0;
            }
            int count = 0;
            for (int value : counts.subMap(from, true, to, true).values()) {
                count += value;
            }
            return count;
        }

        Instant oldest() {
            return counts.firstKey();
        }

        boolean isEmpty() {
            return counts.isEmpty();
        }

        int total() {
            return total;
        }

        List<Instant> toList() {
            List<Instant> list = new ArrayList<>(total);
            counts.forEach((at, count) -> {
                for (int i = 0; i < count; i++) {
                    list.add(at);
                }
            });
            return list;
        }
    }
}
