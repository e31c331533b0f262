package ch.so.arp.rag.pipeline;

import java.util.List;

/**
 * Strategy abstraction over the external embedding model. Implementations
 * either call a remote embedding API or provide deterministic placeholders that
 * are suited for tests and local development.
 * <p>
 * Implementations convert their own errors into {@link RateLimitException},
 * {@link TransientFailureException}, {@link PermanentFailureException} or
 * {@link ConfigurationException}. Batching and retries are handled by the
 * {@link Embedder}.
 */
public interface EmbeddingProvider {

    /**
     * Create one embedding vector per text.
     *
     * @param texts the texts to embed, never more than the service accepts in
     *              one call
     * @return the vectors in input order
     */
    EmbeddingResult embed(List<String> texts);
}
