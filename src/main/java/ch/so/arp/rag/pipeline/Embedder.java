package ch.so.arp.rag.pipeline;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts texts into vectors through an {@link EmbeddingProvider}. Inputs
 * larger than the provider's batch limit are split into sub-batches which are
 * dispatched to a bounded executor; each sub-batch is retried on its own and
 * fails on its own. Queries go through the same path as a batch of one so that
 * stored and query vectors always come from the same model.
 */
public class Embedder {

    private static final Logger LOGGER = LoggerFactory.getLogger(Embedder.class);

    private final EmbeddingProvider provider;
    private final RetryExecutor retryExecutor;
    private final Executor executor;
    private final int maxBatchSize;

    public Embedder(EmbeddingProvider provider, RetryExecutor retryExecutor, Executor executor, int maxBatchSize) {
        this.provider = Objects.requireNonNull(provider, "provider");
        this.retryExecutor = Objects.requireNonNull(retryExecutor, "retryExecutor");
        this.executor = Objects.requireNonNull(executor, "executor");
        if (maxBatchSize <= 0) {
            throw new ConfigurationException("maxBatchSize must be positive");
        }
        this.maxBatchSize = maxBatchSize;
    }

    /**
     * Embed all texts, preserving their order.
     *
     * @throws PermanentFailureException naming the first sub-batch that could
     *                                   not be embedded
     */
    public List<float[]> embed(List<String> texts) {
        float[][] vectors = new float[texts.size()][];
        ConcurrentLinkedQueue<PermanentFailureException> failures = new ConcurrentLinkedQueue<>();
        embedInBatches(texts, new BatchCallback() {
            @Override
            public void onSuccess(Batch batch, List<float[]> batchVectors) {
                for (int i = 0; i < batchVectors.size(); i++) {
                    vectors[batch.offset() + i] = batchVectors.get(i);
                }
            }

            @Override
            public void onFailure(Batch batch, PermanentFailureException failure) {
                failures.add(failure);
            }
        });
        failures.stream()
                .min(Comparator.comparingInt(failure -> failure.getBatchIndex().orElse(Integer.MAX_VALUE)))
                .ifPresent(failure -> {
                    throw failure;
                });
        return Arrays.asList(vectors);
    }

    public float[] embedQuery(String query) {
        return embed(List.of(query)).get(0);
    }

    /**
     * Embed the texts in sub-batches of at most {@code maxBatchSize} and report
     * every sub-batch to the callback as soon as it is done. Any failure other
     * than a {@link ConfigurationException} is reported to
     * {@link BatchCallback#onFailure} for its batch only. Callbacks may run
     * concurrently on the executor threads. Returns after all sub-batches have
     * been reported.
     *
     * @throws ConfigurationException if the provider or a callback reports a
     *                                misconfiguration
     */
    public void embedInBatches(List<String> texts, BatchCallback callback) {
        Objects.requireNonNull(callback, "callback");
        List<Batch> batches = partition(texts);
        if (batches.size() > 1) {
            LOGGER.debug("Split {} texts into {} embedding batches of at most {}", texts.size(), batches.size(),
                    maxBatchSize);
        }
        List<CompletableFuture<Void>> futures = new ArrayList<>(batches.size());
        for (Batch batch : batches) {
            futures.add(CompletableFuture.runAsync(() -> process(batch, callback), executor));
        }
        try {
            CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new)).join();
        } catch (CompletionException ex) {
            if (ex.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw ex;
        }
    }

    public int getMaxBatchSize() {
        return maxBatchSize;
    }

    private void process(Batch batch, BatchCallback callback) {
        List<float[]> vectors;
        try {
            vectors = retryExecutor.execute("Embedding request",
                    () -> provider.embed(batch.texts()).requireSize(batch.texts().size())).vectors();
        } catch (ConfigurationException ex) {
            throw ex;
        } catch (PermanentFailureException ex) {
            fail(batch, callback, ex);
            return;
        } catch (RuntimeException ex) {
            fail(batch, callback, new PermanentFailureException("Unexpected embedding failure: " + ex, ex));
            return;
        }
        callback.onSuccess(batch, vectors);
    }

    private void fail(Batch batch, BatchCallback callback, PermanentFailureException failure) {
        LOGGER.warn("Embedding batch {} ({} texts at offset {}) failed: {}", batch.index(), batch.texts().size(),
                batch.offset(), failure.getMessage());
        callback.onFailure(batch, failure.forBatch(batch.index()));
    }

    private List<Batch> partition(List<String> texts) {
        List<Batch> batches = new ArrayList<>();
        for (int offset = 0; offset < texts.size(); offset += maxBatchSize) {
            int end = Math.min(texts.size(), offset + maxBatchSize);
            batches.add(new Batch(batches.size(), offset, List.copyOf(texts.subList(offset, end))));
        }
        return batches;
    }

    /**
     * Slice of the input texts sent to the provider in one call.
     *
     * @param index  position of the batch in the dispatch order
     * @param offset index of the first text of the batch in the input
     * @param texts  the texts of the batch
     */
    public record Batch(int index, int offset, List<String> texts) {
    }

    /**
     * Receives the outcome of every sub-batch.
     */
    public interface BatchCallback {

        void onSuccess(Batch batch, List<float[]> vectors);

        void onFailure(Batch batch, PermanentFailureException failure);
    }
}
