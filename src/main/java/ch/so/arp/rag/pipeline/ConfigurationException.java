package ch.so.arp.rag.pipeline;

/**
 * Fatal misconfiguration such as missing credentials, invalid chunking
 * parameters or an embedding dimension that does not match the collection.
 * Never retried.
 */
public class ConfigurationException extends RagPipelineException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
