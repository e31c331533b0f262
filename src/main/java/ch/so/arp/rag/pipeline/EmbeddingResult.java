package ch.so.arp.rag.pipeline;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Vectors returned by an {@link EmbeddingProvider}, in the order of the texts
 * that were sent.
 */
public record EmbeddingResult(List<float[]> vectors) {

    public EmbeddingResult {
        Objects.requireNonNull(vectors, "vectors");
        vectors = Collections.unmodifiableList(new ArrayList<>(vectors));
    }

    /**
     * Ensures that the result holds one non-empty vector per input text and
     * that all vectors share one dimension.
     *
     * @throws PermanentFailureException if the service answered with a
     *                                   malformed result
     */
    public EmbeddingResult requireSize(int expected) {
        if (vectors.size() != expected) {
            throw new PermanentFailureException(
                    "Embedding service returned " + vectors.size() + " vectors for " + expected + " texts");
        }
        int dimensions = -1;
        for (float[] vector : vectors) {
            if (vector == null || vector.length == 0) {
                throw new PermanentFailureException("Embedding service returned an empty vector");
            }
            if (dimensions >= 0 && vector.length != dimensions) {
                throw new PermanentFailureException("Embedding service returned vectors of mixed dimensions ("
                        + dimensions + " and " + vector.length + ")");
            }
            dimensions = vector.length;
        }
        return this;
    }
}
