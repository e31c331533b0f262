package ch.so.arp.rag.pipeline;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link IndexStore} kept in memory. Writers are serialized and publish a new
 * immutable snapshot; readers work on the latest published snapshot without
 * locking.
 */
class InMemoryIndexStore implements IndexStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryIndexStore.class);

    private final ReentrantLock writeLock = new ReentrantLock();

    private volatile Snapshot snapshot = Snapshot.EMPTY;

    @Override
    public void upsert(List<IndexEntry> entries) {
        if (entries.isEmpty()) {
            return;
        }
        writeLock.lock();
        try {
            Snapshot current = snapshot;
            int dimensions = current.dimensions() > 0 ? current.dimensions() : entries.get(0).dimensions();
            for (IndexEntry entry : entries) {
                CosineDistance.requireDimensions(dimensions, entry.dimensions(), "entry " + entry.id());
            }
            Map<ChunkId, IndexEntry> next = new LinkedHashMap<>(current.entries());
            for (IndexEntry entry : entries) {
                next.put(entry.id(), entry);
            }
            snapshot = new Snapshot(Collections.unmodifiableMap(next), dimensions);
            LOGGER.debug("Upserted {} entries, collection now holds {}", entries.size(), next.size());
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public List<IndexEntry> query(float[] vector, int limit) {
        Snapshot current = snapshot;
        if (current.entries().isEmpty()) {
            return List.of();
        }
        CosineDistance.requireDimensions(current.dimensions(), vector.length, "the query vector");
        return CosineDistance.nearest(List.copyOf(current.entries().values()), vector, limit);
    }

    @Override
    public int count() {
        return snapshot.entries().size();
    }

    @Override
    public List<IndexEntry> entries() {
        return List.copyOf(snapshot.entries().values());
    }

    @Override
    public void clear() {
        writeLock.lock();
        try {
            snapshot = Snapshot.EMPTY;
        } finally {
            writeLock.unlock();
        }
    }

    private record Snapshot(Map<ChunkId, IndexEntry> entries, int dimensions) {

        static final Snapshot EMPTY = new Snapshot(Map.of(), 0);
    }
}
