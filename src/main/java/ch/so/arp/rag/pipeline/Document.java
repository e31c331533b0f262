package ch.so.arp.rag.pipeline;

import java.util.Objects;

/**
 * Raw document produced by a loader. The source usually is the file name the
 * content was read from.
 */
public record Document(String source, String content) {

    public Document {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(content, "content");
    }
}
