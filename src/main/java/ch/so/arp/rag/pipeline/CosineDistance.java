package ch.so.arp.rag.pipeline;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Cosine distance ranking shared by the {@link IndexStore} implementations.
 */
final class CosineDistance {

    private CosineDistance() {
    }

    /**
     * Cosine distance in the range [0, 2]. A zero vector is treated as
     * orthogonal to everything.
     */
    static double between(float[] left, float[] right) {
        double dot = 0.0d;
        double leftNorm = 0.0d;
        double rightNorm = 0.0d;
        for (int i = 0; i < left.length; i++) {
            dot += (double) left[i] * right[i];
            leftNorm += (double) left[i] * left[i];
            rightNorm += (double) right[i] * right[i];
        }
        if (leftNorm == 0.0d || rightNorm == 0.0d) {
            return 1.0d;
        }
        return 1.0d - dot / (Math.sqrt(leftNorm) * Math.sqrt(rightNorm));
    }

    /**
     * Rank entries by distance to the vector. The sort is stable, so entries
     * passed in insertion order keep that order among equal distances.
     */
    static List<IndexEntry> nearest(List<IndexEntry> entriesInInsertionOrder, float[] vector, int limit) {
        if (limit <= 0 || entriesInInsertionOrder.isEmpty()) {
            return List.of();
        }
        List<Candidate> candidates = new ArrayList<>(entriesInInsertionOrder.size());
        for (IndexEntry entry : entriesInInsertionOrder) {
            candidates.add(new Candidate(entry, between(vector, entry.embedding())));
        }
        candidates.sort(Comparator.comparingDouble(Candidate::distance));
        return candidates.stream()
                .limit(limit)
                .map(Candidate::entry)
                .toList();
    }

    static void requireDimensions(int expected, int actual, String what) {
        if (expected != actual) {
            throw new ConfigurationException("Embedding dimension mismatch: collection uses " + expected
                    + " dimensions but " + what + " has " + actual
                    + ". The embedding model of a collection must not change.");
        }
    }

    private record Candidate(IndexEntry entry, double distance) {
    }
}
