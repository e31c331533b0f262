package ch.so.arp.rag.pipeline;

import java.util.List;

/**
 * Outcome of {@link RagEngine#ingest(List)}: the number of distinct entries
 * written and the sub-batches that failed. Chunks sharing an id count once.
 */
public record IngestionReport(int ingested, List<FailedBatch> failed) {

    public IngestionReport {
        failed = List.copyOf(failed);
    }

    public boolean isComplete() {
        return failed.isEmpty();
    }
}
