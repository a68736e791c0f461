package com.z254.prism.graph;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Queue;
import java.util.Set;

/**
 * Immutable directed graph of service dependencies.
 * <p>
 * An edge {@code A -> B} means "A depends on B". Failures propagate against the edges: when B
 * fails, its dependents (A) are affected.
 */
public final class ServiceDependencyGraph {

    private static final ServiceDependencyGraph EMPTY = new ServiceDependencyGraph(Map.of(), Map.of());

    /** service -> services it depends on */
    private final Map<String, Set<String>> dependencies;
    /** service -> services depending on it */
    private final Map<String, Set<String>> dependents;

    private ServiceDependencyGraph(Map<String, Set<String>> dependencies, Map<String, Set<String>> dependents) {
        this.dependencies = dependencies;
        this.dependents = dependents;
    }

    public static ServiceDependencyGraph empty() {
        return EMPTY;
    }

    /**
     * Build a graph from a {@code service -> dependencies} mapping.
     *
     * @throws InvalidDependencyException on blank service names or self dependencies
     */
    public static ServiceDependencyGraph of(Map<String, ? extends List<String>> mapping) {
        if (mapping == null) {
            throw new InvalidDependencyException("Dependency mapping must not be null");
        }
        Map<String, Set<String>> forward = new LinkedHashMap<>();
        Map<String, Set<String>> reverse = new LinkedHashMap<>();

        for (Map.Entry<String, ? extends List<String>> entry : mapping.entrySet()) {
            String service = requireName(entry.getKey(), "service");
            Set<String> targets = forward.computeIfAbsent(service, s -> new LinkedHashSet<>());
            if (entry.getValue() == null) {
                continue;
            }
            for (String raw : entry.getValue()) {
                String dependency = requireName(raw, "dependency of " + service);
                if (dependency.equals(service)) {
                    throw new InvalidDependencyException("Service " + service + " cannot depend on itself");
                }
                targets.add(dependency);
                reverse.computeIfAbsent(dependency, s -> new LinkedHashSet<>()).add(service);
            }
        }
        return new ServiceDependencyGraph(freeze(forward), freeze(reverse));
    }

    /**
     * Whether {@code service} has a direct edge to {@code dependency}.
     */
    public boolean dependsOn(String service, String dependency) {
        return dependencies.getOrDefault(service, Set.of()).contains(dependency);
    }

    /**
     * Number of hops a failure of {@code from} needs to reach {@code to}, following dependents.
     *
     * @return empty when {@code to} is not reachable within {@code maxHops}
     */
    public OptionalInt propagationDistance(String from, String to, int maxHops) {
        if (from.equals(to)) {
            return OptionalInt.of(0);
        }
        Map<String, Integer> depth = new HashMap<>();
        Queue<String> queue = new ArrayDeque<>();
        depth.put(from, 0);
        queue.add(from);

        while (!queue.isEmpty()) {
            String current = queue.poll();
            int hops = depth.get(current);
            if (hops >= maxHops) {
                continue;
            }
            for (String next : dependents.getOrDefault(current, Set.of())) {
                if (depth.containsKey(next)) {
                    continue;
                }
                if (next.equals(to)) {
                    return OptionalInt.of(hops + 1);
                }
                depth.put(next, hops + 1);
                queue.add(next);
            }
        }
        return OptionalInt.empty();
    }

    /**
     * Services that transitively depend on {@code service}.
     */
    public Set<String> dependentsOf(String service) {
        return closure(service, dependents);
    }

    /**
     * Services that {@code service} transitively depends on.
     */
    public Set<String> dependenciesOf(String service) {
        return closure(service, dependencies);
    }

    /**
     * Whether {@code service} transitively depends on {@code upstream}.
     */
    public boolean isDownstreamOf(String service, String upstream) {
        return dependenciesOf(service).contains(upstream);
    }

    public Set<String> services() {
        Set<String> services = new LinkedHashSet<>(dependencies.keySet());
        services.addAll(dependents.keySet());
        return services;
    }

    public int edgeCount() {
        return dependencies.values().stream().mapToInt(Set::size).sum();
    }

    public boolean isEmpty() {
        return dependencies.isEmpty() && dependents.isEmpty();
    }

    private static Set<String> closure(String start, Map<String, Set<String>> adjacency) {
        Set<String> reached = new LinkedHashSet<>();
        Queue<String> queue = new ArrayDeque<>();
        queue.add(start);

        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (String next : adjacency.getOrDefault(current, Set.of())) {
                if (!next.equals(start) && reached.add(next)) {
                    queue.add(next);
                }
            }
        }
        return reached;
    }

    private static String requireName(String name, String what) {
        if (name == null || name.isBlank()) {
            throw new InvalidDependencyException("Blank " + what + " in dependency mapping");
        }
        return name.trim();
    }

    private static Map<String, Set<String>> freeze(Map<String, Set<String>> adjacency) {
        Map<String, Set<String>> frozen = new LinkedHashMap<>();
        adjacency.forEach((key, value) -> frozen.put(key, Collections.unmodifiableSet(value)));
        return Collections.unmodifiableMap(frozen);
    }

    /**
     * Thrown for malformed dependency mappings. The current graph is left in place.
     */
    public static class InvalidDependencyException extends RuntimeException {
        public InvalidDependencyException(String message) {
            super(message);
        }
    }
}
