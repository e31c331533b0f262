package ch.so.arp.rag.pipeline;

import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds the chunks most similar to a question. An empty collection or a
 * failing embedding call yields an empty result instead of an exception.
 */
public class Retriever {

    private static final Logger LOGGER = LoggerFactory.getLogger(Retriever.class);

    private final Embedder embedder;
    private final IndexStore indexStore;

    public Retriever(Embedder embedder, IndexStore indexStore) {
        this.embedder = Objects.requireNonNull(embedder, "embedder");
        this.indexStore = Objects.requireNonNull(indexStore, "indexStore");
    }

    public List<Chunk> retrieve(String query, int limit) {
        if (indexStore.count() == 0) {
            LOGGER.debug("Collection is empty, nothing to retrieve");
            return List.of();
        }
        float[] embedding;
        try {
            embedding = embedder.embedQuery(query);
        } catch (PermanentFailureException | TransientFailureException ex) {
            LOGGER.warn("Could not embed query, retrieving nothing: {}", ex.getMessage());
            return List.of();
        }
        List<Chunk> chunks = indexStore.query(embedding, limit).stream()
                .map(IndexEntry::toChunk)
                .toList();
        LOGGER.debug("Retrieved {} chunks (limit={})", chunks.size(), limit);
        return chunks;
    }
}
