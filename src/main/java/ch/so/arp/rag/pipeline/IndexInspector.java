package ch.so.arp.rag.pipeline;

import java.util.IntSummaryStatistics;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes an {@link IndexReport} over the stored entries: source attribution
 * and chunk size statistics.
 */
public class IndexInspector {

    private static final Logger LOGGER = LoggerFactory.getLogger(IndexInspector.class);

    private final IndexStore indexStore;
    private final int chunkSize;

    public IndexInspector(IndexStore indexStore, int chunkSize) {
        this.indexStore = Objects.requireNonNull(indexStore, "indexStore");
        this.chunkSize = chunkSize;
    }

    public IndexReport inspect() {
        List<IndexEntry> entries = indexStore.entries();
        Map<String, Integer> perSource = new TreeMap<>();
        int missingSource = 0;
        int oversized = 0;
        IntSummaryStatistics lengths = new IntSummaryStatistics();
        for (IndexEntry entry : entries) {
            if (entry.source().isBlank()) {
                missingSource++;
            } else {
                perSource.merge(entry.source(), 1, Integer::sum);
            }
            int length = entry.text().length();
            lengths.accept(length);
            if (length > chunkSize) {
                oversized++;
            }
        }
        if (missingSource > 0) {
            LOGGER.warn("{} entries have no source", missingSource);
        }
        if (oversized > 0) {
            LOGGER.warn("{} entries exceed the chunk size of {} characters", oversized, chunkSize);
        }
        boolean empty = entries.isEmpty();
        return new IndexReport(entries.size(), perSource, missingSource,
                empty ? 0 : lengths.getMin(), empty ? 0 : lengths.getMax(), empty ? 0.0d : lengths.getAverage(),
                oversized);
    }
}
