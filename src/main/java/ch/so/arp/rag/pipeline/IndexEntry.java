package ch.so.arp.rag.pipeline;

import java.util.Arrays;
import java.util.Objects;

/**
 * Stored element of a collection: the embedding of a chunk together with its
 * text and the source it was cut from.
 */
public record IndexEntry(ChunkId id, float[] embedding, String text, String source, int sequence) {

    public IndexEntry {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(embedding, "embedding");
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(source, "source");
        if (embedding.length == 0) {
            throw new IllegalArgumentException("embedding must not be empty");
        }
    }

    /**
     * Builds the entry for a chunk using its content addressed id.
     */
    public static IndexEntry of(Chunk chunk, float[] embedding) {
        return new IndexEntry(ChunkId.of(chunk), embedding, chunk.content(), chunk.source(), chunk.sequence());
    }

    public int dimensions() {
        return embedding.length;
    }

    public Chunk toChunk() {
        return new Chunk(source, text, sequence);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof IndexEntry entry)) {
            return false;
        }
        return sequence == entry.sequence
                && id.equals(entry.id)
                && Arrays.equals(embedding, entry.embedding)
                && text.equals(entry.text)
                && source.equals(entry.source);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(id, text, source, sequence);
        return 31 * result + Arrays.hashCode(embedding);
    }

    @Override
    public String toString() {
        return "IndexEntry[id=" + id + ", source=" + source + ", sequence=" + sequence + ", dimensions="
                + embedding.length + "]";
    }
}
