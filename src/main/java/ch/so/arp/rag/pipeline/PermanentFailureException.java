package ch.so.arp.rag.pipeline;

import java.util.OptionalInt;

/**
 * Failure that is not worth retrying: either the retry budget is exhausted or
 * the service rejected the request. When raised for an embedding sub-batch it
 * carries the index of that batch so callers can isolate it.
 */
public class PermanentFailureException extends RagPipelineException {

    private final Integer batchIndex;

    public PermanentFailureException(String message) {
        this(message, null, null);
    }

    public PermanentFailureException(String message, Throwable cause) {
        this(message, null, cause);
    }

    public PermanentFailureException(String message, Integer batchIndex, Throwable cause) {
        super(message, cause);
        this.batchIndex = batchIndex;
    }

    public OptionalInt getBatchIndex() {
        return batchIndex == null ? OptionalInt.empty() : OptionalInt.of(batchIndex);
    }

    /**
     * Returns a copy of this failure attributed to the given sub-batch.
     */
    PermanentFailureException forBatch(int index) {
        return new PermanentFailureException("Embedding batch " + index + " failed: " + getMessage(), index,
                getCause() != null ? getCause() : this);
    }
}
