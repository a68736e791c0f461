package com.z254.prism.rca;

import com.z254.prism.domain.model.Alert;
import com.z254.prism.graph.ServiceDependencyGraph;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Selects root cause candidates within a cluster.
 * <p>
 * Candidates are the members whose service does not directly depend on another member's
 * service, i.e. the dependency sources of the cluster, ordered by timestamp then id. When the
 * members share no dependency edge at all the earliest alert is the only candidate.
 */
@Component
public class RootCauseAnalyzer {

    static final Comparator<Alert> CHRONOLOGICAL =
            Comparator.comparing(Alert::getTimestamp).thenComparing(Alert::getId);

    public List<String> rootCauseCandidates(List<Alert> members, ServiceDependencyGraph graph) {
        if (members.isEmpty()) {
            return List.of();
        }
        List<Alert> ordered = new ArrayList<>(members);
        ordered.sort(CHRONOLOGICAL);

        boolean anyEdge = false;
        List<String> candidates = new ArrayList<>();
        for (Alert alert : ordered) {
            boolean downstream = false;
            for (Alert other : ordered) {
                if (!other.getService().equals(alert.getService())
                        && graph.dependsOn(alert.getService(), other.getService())) {
                    downstream = true;
                    break;
                }
            }
            if (downstream) {
                anyEdge = true;
            } else {
                candidates.add(alert.getId());
            }
        }

        if (!anyEdge || candidates.isEmpty()) {
            return List.of(ordered.get(0).getId());
        }
        return candidates;
    }
}
