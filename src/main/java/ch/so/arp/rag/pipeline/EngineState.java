package ch.so.arp.rag.pipeline;

/**
 * Lifecycle of a {@link RagEngine}. Querying never changes the collection and
 * returns to {@link #READY}.
 */
public enum EngineState {
    IDLE,
    INGESTING,
    READY,
    QUERYING
}
