package com.z254.prism.graph;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Copy-on-write holder of the current {@link ServiceDependencyGraph}.
 * <p>
 * Replacing the graph swaps a reference; correlation passes call {@link #current()} once and
 * keep that graph until they finish.
 */
@Slf4j
@Component
public class DependencyGraphHolder {

    private final AtomicReference<ServiceDependencyGraph> graph =
            new AtomicReference<>(ServiceDependencyGraph.empty());

    public ServiceDependencyGraph current() {
        return graph.get();
    }

    /**
     * Validate the mapping and replace the graph wholesale.
     *
     * @throws ServiceDependencyGraph.InvalidDependencyException if the mapping is malformed
     */
    public ServiceDependencyGraph replace(Map<String, ? extends List<String>> mapping) {
        ServiceDependencyGraph next = ServiceDependencyGraph.of(mapping);
        graph.set(next);
        log.info("Service dependency graph replaced: {} services, {} edges",
                next.services().size(), next.edgeCount());
        return next;
    }
}
