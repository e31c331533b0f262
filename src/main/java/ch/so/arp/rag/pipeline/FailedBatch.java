package ch.so.arp.rag.pipeline;

import java.util.List;

/**
 * Embedding sub-batch that could not be processed during an ingestion run.
 * Re-ingesting the listed sources retries it without duplicating anything.
 */
public record FailedBatch(int batchIndex, int offset, List<ChunkId> chunkIds, List<String> sources, String reason) {

    public FailedBatch {
        chunkIds = List.copyOf(chunkIds);
        sources = List.copyOf(sources);
    }
}
