package ch.so.arp.rag.pipeline;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Content addressed identifier of an index entry. The value is derived from
 * the source and the text of a chunk only, never from its position in a batch,
 * so re-ingesting unchanged content always yields the same id.
 * <p>
 * Changing the hash breaks idempotency for every collection persisted with the
 * previous function and therefore requires a full re-ingestion.
 */
public record ChunkId(String value) {

    private static final String PREFIX = "chunk_";

    private static final char SEPARATOR = '\u001f';

    public ChunkId {
        Objects.requireNonNull(value, "value");
        if (value.isBlank()) {
            throw new IllegalArgumentException("value must not be blank");
        }
    }

    public static ChunkId of(Chunk chunk) {
        return of(chunk.source(), chunk.content());
    }

    public static ChunkId of(String source, String content) {
        String key = source + SEPARATOR + content;
        return new ChunkId(PREFIX + HexFormat.of().formatHex(sha256(key)));
    }

    private static byte[] sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return digest.digest(value.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 algorithm not available", ex);
        }
    }

    @Override
    public String toString() {
        return value;
    }
}
