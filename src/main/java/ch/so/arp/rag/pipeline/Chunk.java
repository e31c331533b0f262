package ch.so.arp.rag.pipeline;

import java.util.Objects;

/**
 * Bounded segment of a {@link Document}. The sequence is the zero based
 * position of the chunk within its source.
 */
public record Chunk(String source, String content, int sequence) {

    public Chunk {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(content, "content");
        if (sequence < 0) {
            throw new IllegalArgumentException("sequence must not be negative");
        }
    }
}
