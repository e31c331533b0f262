package ch.so.arp.rag.pipeline;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Coordinates ingestion into the index and question answering on top of it.
 * <p>
 * Ingestion commits every embedding sub-batch as soon as it is embedded; a
 * failing sub-batch is reported and skipped without touching the others.
 * A sub-batch that cannot be stored is reported the same way. Because entry
 * ids are derived from content, an interrupted or partially failed run can
 * simply be repeated.
 * <p>
 * Asking never throws: an empty retrieval is answered with
 * {@link #INSUFFICIENT_INFORMATION} without calling the language model, any
 * other failure with {@link AnswerGenerator#FALLBACK_ANSWER}.
 */
@Service
public class RagEngine {

    private static final Logger LOGGER = LoggerFactory.getLogger(RagEngine.class);

    public static final String INSUFFICIENT_INFORMATION =
            "I couldn't find any relevant information to answer your question.";

    private final TextChunker chunker;
    private final Embedder embedder;
    private final IndexStore indexStore;
    private final Retriever retriever;
    private final AnswerGenerator generator;
    private final IndexInspector inspector;
    private final int topK;

    private final AtomicInteger runningIngestions = new AtomicInteger();
    private final AtomicInteger runningQueries = new AtomicInteger();
    private volatile boolean ingestedOnce;

    public RagEngine(TextChunker chunker, Embedder embedder, IndexStore indexStore, Retriever retriever,
            AnswerGenerator generator, IndexInspector inspector, RagProperties properties) {
        this.chunker = Objects.requireNonNull(chunker, "chunker");
        this.embedder = Objects.requireNonNull(embedder, "embedder");
        this.indexStore = Objects.requireNonNull(indexStore, "indexStore");
        this.retriever = Objects.requireNonNull(retriever, "retriever");
        this.generator = Objects.requireNonNull(generator, "generator");
        this.inspector = Objects.requireNonNull(inspector, "inspector");
        this.topK = properties.getRetrieval().getTopK();
    }

    public IngestionReport ingest(List<Document> documents) {
        runningIngestions.incrementAndGet();
        try {
            List<Chunk> chunks = chunker.chunk(documents);
            List<String> texts = chunks.stream().map(Chunk::content).toList();
            Set<ChunkId> ingested = ConcurrentHashMap.newKeySet();
            ConcurrentLinkedQueue<FailedBatch> failed = new ConcurrentLinkedQueue<>();

            embedder.embedInBatches(texts, new Embedder.BatchCallback() {
                @Override
                public void onSuccess(Embedder.Batch batch, List<float[]> vectors) {
                    List<IndexEntry> entries = new ArrayList<>(vectors.size());
                    for (int i = 0; i < vectors.size(); i++) {
                        entries.add(IndexEntry.of(chunks.get(batch.offset() + i), vectors.get(i)));
                    }
                    try {
                        indexStore.upsert(entries);
                    } catch (ConfigurationException ex) {
                        throw ex;
                    } catch (RuntimeException ex) {
                        LOGGER.warn("Storing batch {} ({} entries at offset {}) failed: {}", batch.index(),
                                entries.size(), batch.offset(), ex.toString());
                        failed.add(toFailedBatch(batch, chunks, "Storing batch " + batch.index() + " failed: " + ex));
                        return;
                    }
                    entries.forEach(entry -> ingested.add(entry.id()));
                    LOGGER.debug("Committed batch {} with {} entries", batch.index(), entries.size());
                }

                @Override
                public void onFailure(Embedder.Batch batch, PermanentFailureException failure) {
                    failed.add(toFailedBatch(batch, chunks, failure.getMessage()));
                }
            });

            List<FailedBatch> failures = failed.stream()
                    .sorted(Comparator.comparingInt(FailedBatch::batchIndex))
                    .toList();
            ingestedOnce = true;
            if (failures.isEmpty()) {
                LOGGER.info("Ingested {} entries from {} documents, collection holds {} entries", ingested.size(),
                        documents.size(), indexStore.count());
            } else {
                LOGGER.warn("Ingested {} entries from {} chunks of {} documents, {} batches failed", ingested.size(),
                        chunks.size(), documents.size(), failures.size());
            }
            return new IngestionReport(ingested.size(), failures);
        } finally {
            runningIngestions.decrementAndGet();
        }
    }

    public String ask(String query) {
        runningQueries.incrementAndGet();
        try {
            List<Chunk> chunks = retriever.retrieve(query, topK);
            if (chunks.isEmpty()) {
                LOGGER.info("No context found for question '{}'", query);
                return INSUFFICIENT_INFORMATION;
            }
            return generator.generate(PromptBuilder.build(query, chunks));
        } catch (RuntimeException ex) {
            LOGGER.error("Failed to answer question '{}': {}", query, ex.getMessage(), ex);
            return AnswerGenerator.FALLBACK_ANSWER;
        } finally {
            runningQueries.decrementAndGet();
        }
    }

    public int count() {
        return indexStore.count();
    }

    public IndexReport inspect() {
        return inspector.inspect();
    }

    /**
     * Drop the whole collection.
     */
    public void reset() {
        indexStore.clear();
        ingestedOnce = false;
        LOGGER.info("Index reset");
    }

    public EngineState state() {
        if (runningIngestions.get() > 0) {
            return EngineState.INGESTING;
        }
        if (runningQueries.get() > 0) {
            return EngineState.QUERYING;
        }
        return ingestedOnce || indexStore.count() > 0 ? EngineState.READY : EngineState.IDLE;
    }

    private FailedBatch toFailedBatch(Embedder.Batch batch, List<Chunk> chunks, String reason) {
        List<Chunk> batchChunks = chunks.subList(batch.offset(), batch.offset() + batch.texts().size());
        return new FailedBatch(batch.index(), batch.offset(),
                batchChunks.stream().map(ChunkId::of).toList(),
                batchChunks.stream().map(Chunk::source).distinct().toList(),
                reason);
    }
}
