package ch.so.arp.rag.pipeline;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Relational {@link IndexStore} implementation. Entries of one named
 * collection are stored in {@code rag_index_entries}, the dimension of the
 * collection in {@code rag_collections}. The SQL is kept portable so the store
 * runs on an H2 file database as well as on PostgreSQL.
 * <p>
 * Similarity ranking happens in memory: every query loads and parses all
 * vectors of the collection, so its cost grows linearly with the number of
 * entries. There is no approximate nearest neighbour index.
 */
class JdbcIndexStore implements IndexStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(JdbcIndexStore.class);

    private static final String CREATE_COLLECTIONS_SQL = """
            CREATE TABLE IF NOT EXISTS rag_collections (
              collection_name VARCHAR(200) NOT NULL PRIMARY KEY,
              dimensions INTEGER NOT NULL
            )
            """;

    private static final String CREATE_ENTRIES_SQL = """
            CREATE TABLE IF NOT EXISTS rag_index_entries (
              collection_name VARCHAR(200) NOT NULL,
              entry_id VARCHAR(100) NOT NULL,
              insertion_order BIGINT NOT NULL,
              source VARCHAR(2000) NOT NULL,
              chunk_sequence INTEGER NOT NULL,
              content VARCHAR(1000000) NOT NULL,
              embedding VARCHAR(1000000) NOT NULL,
              PRIMARY KEY (collection_name, entry_id)
            )
            """;

    private static final String SELECT_ENTRIES_SQL = """
            SELECT entry_id, source, chunk_sequence, content, embedding
            FROM rag_index_entries
            WHERE collection_name = :collection
            ORDER BY insertion_order
            """;

    private static final String UPDATE_ENTRY_SQL = """
            UPDATE rag_index_entries
            SET source = :source, chunk_sequence = :sequence, content = :content, embedding = :embedding
            WHERE collection_name = :collection AND entry_id = :id
            """;

    private static final String INSERT_ENTRY_SQL = """
            INSERT INTO rag_index_entries
              (collection_name, entry_id, insertion_order, source, chunk_sequence, content, embedding)
            VALUES (:collection, :id, :order, :source, :sequence, :content, :embedding)
            """;

    private final JdbcClient jdbcClient;
    private final TransactionTemplate transactionTemplate;
    private final String collection;
    private final ReentrantLock writeLock = new ReentrantLock();

    JdbcIndexStore(JdbcClient jdbcClient, TransactionTemplate transactionTemplate, String collection) {
        this.jdbcClient = Objects.requireNonNull(jdbcClient, "jdbcClient");
        this.transactionTemplate = Objects.requireNonNull(transactionTemplate, "transactionTemplate");
        this.collection = Objects.requireNonNull(collection, "collection");
        jdbcClient.sql(CREATE_COLLECTIONS_SQL).update();
        jdbcClient.sql(CREATE_ENTRIES_SQL).update();
        LOGGER.info("Index collection '{}' ready with {} entries", collection, count());
    }

    @Override
    public void upsert(List<IndexEntry> entries) {
        if (entries.isEmpty()) {
            return;
        }
        writeLock.lock();
        try {
            transactionTemplate.executeWithoutResult(status -> write(entries));
        } finally {
            writeLock.unlock();
        }
    }

    private void write(List<IndexEntry> entries) {
        int dimensions = establishDimensions(entries.get(0).dimensions());
        for (IndexEntry entry : entries) {
            CosineDistance.requireDimensions(dimensions, entry.dimensions(), "entry " + entry.id());
        }
        long order = jdbcClient.sql("""
                SELECT COALESCE(MAX(insertion_order), 0) FROM rag_index_entries WHERE collection_name = :collection
                """)
                .param("collection", collection)
                .query(Long.class)
                .single();
        int inserted = 0;
        for (IndexEntry entry : entries) {
            String embedding = toVectorLiteral(entry.embedding());
            int updated = jdbcClient.sql(UPDATE_ENTRY_SQL)
                    .param("source", entry.source())
                    .param("sequence", entry.sequence())
                    .param("content", entry.text())
                    .param("embedding", embedding)
                    .param("collection", collection)
                    .param("id", entry.id().value())
                    .update();
            if (updated == 0) {
                jdbcClient.sql(INSERT_ENTRY_SQL)
                        .param("collection", collection)
                        .param("id", entry.id().value())
                        .param("order", ++order)
                        .param("source", entry.source())
                        .param("sequence", entry.sequence())
                        .param("content", entry.text())
                        .param("embedding", embedding)
                        .update();
                inserted++;
            }
        }
        LOGGER.debug("Upserted {} entries into '{}' ({} new)", entries.size(), collection, inserted);
    }

    private int establishDimensions(int candidate) {
        Integer dimensions = storedDimensions();
        if (dimensions != null) {
            return dimensions;
        }
        jdbcClient.sql("INSERT INTO rag_collections (collection_name, dimensions) VALUES (:collection, :dimensions)")
                .param("collection", collection)
                .param("dimensions", candidate)
                .update();
        LOGGER.info("Collection '{}' uses {} embedding dimensions", collection, candidate);
        return candidate;
    }

    private Integer storedDimensions() {
        return jdbcClient.sql("SELECT dimensions FROM rag_collections WHERE collection_name = :collection")
                .param("collection", collection)
                .query(Integer.class)
                .optional()
                .orElse(null);
    }

    @Override
    public List<IndexEntry> query(float[] vector, int limit) {
        Integer dimensions = storedDimensions();
        if (dimensions == null) {
            return List.of();
        }
        CosineDistance.requireDimensions(dimensions, vector.length, "the query vector");
        return CosineDistance.nearest(entries(), vector, limit);
    }

    @Override
    public int count() {
        return jdbcClient.sql("SELECT COUNT(*) FROM rag_index_entries WHERE collection_name = :collection")
                .param("collection", collection)
                .query(Integer.class)
                .single();
    }

    @Override
    public List<IndexEntry> entries() {
        return jdbcClient.sql(SELECT_ENTRIES_SQL)
                .param("collection", collection)
                .query(IndexEntryRowMapper.INSTANCE)
                .list();
    }

    @Override
    public void clear() {
        writeLock.lock();
        try {
            transactionTemplate.executeWithoutResult(status -> {
                jdbcClient.sql("DELETE FROM rag_index_entries WHERE collection_name = :collection")
                        .param("collection", collection)
                        .update();
                jdbcClient.sql("DELETE FROM rag_collections WHERE collection_name = :collection")
                        .param("collection", collection)
                        .update();
            });
            LOGGER.info("Cleared collection '{}'", collection);
        } finally {
            writeLock.unlock();
        }
    }

    static String toVectorLiteral(float[] embedding) {
        StringBuilder builder = new StringBuilder();
        builder.append('[');
        for (int i = 0; i < embedding.length; i++) {
            if (i > 0) {
                builder.append(',');
            }
            builder.append(Float.toString(embedding[i]));
        }
        builder.append(']');
        return builder.toString();
    }

    static float[] parseVectorLiteral(String literal) {
        String body = literal.substring(1, literal.length() - 1);
        String[] parts = body.split(",");
        float[] vector = new float[parts.length];
        for (int i = 0; i < parts.length; i++) {
            vector[i] = Float.parseFloat(parts[i].trim());
        }
        return vector;
    }

    private enum IndexEntryRowMapper implements RowMapper<IndexEntry> {
        INSTANCE;

        @Override
        public IndexEntry mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new IndexEntry(
                    new ChunkId(rs.getString("entry_id")),
                    parseVectorLiteral(rs.getString("embedding")),
                    rs.getString("content"),
                    rs.getString("source"),
                    rs.getInt("chunk_sequence"));
        }
    }
}
