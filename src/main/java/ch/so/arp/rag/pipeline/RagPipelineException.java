package ch.so.arp.rag.pipeline;

/**
 * Base class of all failures raised by the pipeline.
 */
public abstract class RagPipelineException extends RuntimeException {

    protected RagPipelineException(String message) {
        super(message);
    }

    protected RagPipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
