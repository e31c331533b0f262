package ch.so.arp.rag.pipeline;

import java.util.List;

/**
 * Persistent collection of {@link IndexEntry} elements keyed by their
 * {@link ChunkId}. Writes are idempotent: storing an entry whose id already
 * exists replaces the stored one in place, independent of how entries are
 * grouped into batches. All entries of a collection share one embedding
 * dimension, established by the first write.
 */
public interface IndexStore {

    /**
     * Insert or replace the entries. A batch is applied completely or not at
     * all.
     *
     * @throws ConfigurationException if an embedding does not match the
     *                                dimension of the collection
     */
    void upsert(List<IndexEntry> entries);

    /**
     * Find the entries closest to the vector.
     *
     * @param vector the query embedding
     * @param limit  the maximum amount of entries to return
     * @return entries ordered by ascending cosine distance, ties in insertion
     *         order
     * @throws ConfigurationException if the vector does not match the
     *                                dimension of the collection
     */
    List<IndexEntry> query(float[] vector, int limit);

    int count();

    /**
     * All entries in insertion order.
     */
    List<IndexEntry> entries();

    /**
     * Drop all entries and forget the established dimension.
     */
    void clear();
}
