package com.z254.prism.correlation.scoring;

import com.z254.prism.domain.model.Alert;
import com.z254.prism.graph.ServiceDependencyGraph;

import java.util.Collection;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Per-pass state shared by the scorers: the dependency graph captured at pass start and the
 * text vectors of the pass corpus.
 */
public class ScoringContext {

    private final ServiceDependencyGraph graph;
    private final Supplier<Map<String, Map<String, Double>>> vectorSupplier;
    private Map<String, Map<String, Double>> vectors;

    public ScoringContext(ServiceDependencyGraph graph, Supplier<Map<String, Map<String, Double>>> vectorSupplier) {
        this.graph = graph;
        this.vectorSupplier = vectorSupplier;
    }

    /**
     * Context whose text vectors are computed on first use over {@code corpus}.
     */
    public static ScoringContext forCorpus(ServiceDependencyGraph graph, Collection<Alert> corpus,
                                           TfIdfVectorizer vectorizer) {
        return new ScoringContext(graph, () -> vectorizer.vectorize(corpus));
    }

    public ServiceDependencyGraph graph() {
        return graph;
    }

    /**
     * L2-normalized TF-IDF vector of the alert's text, or null if the text has no terms.
     */
    public Map<String, Double> vector(String alertId) {
        if (vectors == null) {
            vectors = vectorSupplier.get();
        }
        return vectors.get(alertId);
    }
}
