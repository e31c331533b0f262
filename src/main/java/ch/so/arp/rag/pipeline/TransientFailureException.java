package ch.so.arp.rag.pipeline;

/**
 * Failure of an external call that may succeed when repeated, for example a
 * timeout or a server error.
 */
public class TransientFailureException extends RagPipelineException {

    public TransientFailureException(String message) {
        super(message);
    }

    public TransientFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
