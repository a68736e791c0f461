package com.z254.prism.correlation.scoring;

import com.z254.prism.domain.model.Alert;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * TF-IDF vectors over a corpus of alert texts.
 * <p>
 * Terms are lowercased words with punctuation stripped and English stop words removed.
 * Weights use raw term frequency and smoothed idf {@code ln((1 + n) / (1 + df)) + 1}; vectors
 * are L2-normalized so cosine similarity is a dot product.
 */
@Component
public class TfIdfVectorizer {

    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}]+");

    static final Set<String> STOP_WORDS = Set.of(
            "a", "about", "above", "after", "again", "against", "all", "am", "an", "and", "any",
            "are", "as", "at", "be", "because", "been", "before", "being", "below", "between",
            "both", "but", "by", "can", "could", "did", "do", "does", "doing", "down", "during",
            "each", "few", "for", "from", "further", "had", "has", "have", "having", "he", "her",
            "here", "hers", "him", "his", "how", "i", "if", "in", "into", "is", "it", "its",
            "itself", "just", "me", "more", "most", "my", "no", "nor", "not", "now", "of", "off",
            "on", "once", "only", "or", "other", "our", "ours", "out", "over", "own", "same",
            "she", "should", "so", "some", "such", "than", "that", "the", "their", "theirs",
            "them", "then", "there", "these", "they", "this", "those", "through", "to", "too",
            "under", "until", "up", "very", "was", "we", "were", "what", "when", "where", "which",
            "while", "who", "whom", "why", "will", "with", "would", "you", "your", "yours");

    public List<String> tokenize(String text) {
        List<String> terms = new ArrayList<>();
        if (text == null) {
            return terms;
        }
        for (String token : NON_WORD.split(text.toLowerCase(Locale.ROOT))) {
            if (!token.isEmpty() && !STOP_WORDS.contains(token)) {
                terms.add(token);
            }
        }
        return terms;
    }

    /**
     * Vectorize every alert's title and description.
     *
     * @return vectors keyed by alert id; alerts without terms are absent
     */
    public Map<String, Map<String, Double>> vectorize(Collection<Alert> corpus) {
        Map<String, Map<String, Integer>> termCounts = new HashMap<>();
        Map<String, Integer> documentFrequency = new HashMap<>();

        for (Alert alert : corpus) {
            Map<String, Integer> counts = new TreeMap<>();
            for (String term : tokenize(alert.text())) {
                counts.merge(term, 1, Integer::sum);
            }
            termCounts.put(alert.getId(), counts);
            counts.keySet().forEach(term -> documentFrequency.merge(term, 1, Integer::sum));
        }

        int documents = corpus.size();
        Map<String, Map<String, Double>> vectors = new HashMap<>();
        termCounts.forEach((alertId, counts) -> {
            if (counts.isEmpty()) {
                return;
            }
            Map<String, Double> vector = new TreeMap<>();
            double norm = 0;
            for (Map.Entry<String, Integer> entry : counts.entrySet()) {
                double idf = Math.log((1.0 + documents) / (1.0 + documentFrequency.get(entry.getKey()))) + 1.0;
                double weight = entry.getValue() * idf;
                vector.put(entry.getKey(), weight);
                norm += weight * weight;
            }
            double length = Math.sqrt(norm);
            vector.replaceAll((term, weight) -> weight / length);
            vectors.put(alertId, vector);
        });
        return vectors;
    }

    /**
     * Cosine similarity of two L2-normalized vectors.
     */
    public static double cosine(Map<String, Double> left, Map<String, Double> right) {
        Map<String, Double> small = left.size() <= right.size() ? left : right;
        Map<String, Double> large = small == left ? right : left;
        double dot = 0;
        for (Map.Entry<String, Double> entry : small.entrySet()) {
            Double other = large.get(entry.getKey());
            if (other != null) {
                dot += entry.getValue() * other;
            }
        }
        return Math.max(0.0, Math.min(1.0, dot));
    }
}
