package ch.so.arp.rag.pipeline;

import java.nio.file.Path;
import java.time.Duration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Settings of the ingestion and retrieval pipeline.
 */
@Validated
@ConfigurationProperties(prefix = "rag")
public class RagProperties {

    @Valid
    private final Chunking chunking = new Chunking();

    @Valid
    private final Embedding embedding = new Embedding();

    @Valid
    private final Retry retry = new Retry();

    @Valid
    private final Retrieval retrieval = new Retrieval();

    @Valid
    private final Generation generation = new Generation();

    @Valid
    private final Store store = new Store();

    @Valid
    private final Ingest ingest = new Ingest();

    public Chunking getChunking() {
        return chunking;
    }

    public Embedding getEmbedding() {
        return embedding;
    }

    public Retry getRetry() {
        return retry;
    }

    public Retrieval getRetrieval() {
        return retrieval;
    }

    public Generation getGeneration() {
        return generation;
    }

    public Store getStore() {
        return store;
    }

    public Ingest getIngest() {
        return ingest;
    }

    public static class Chunking {

        /**
         * Maximum number of characters of a chunk, overlap included.
         */
        @Positive
        private int size = 1000;

        /**
         * Characters of the previous chunk repeated at the start of the next one.
         */
        @PositiveOrZero
        private int overlap = 200;

        public int getSize() {
            return size;
        }

        public void setSize(int size) {
            this.size = size;
        }

        public int getOverlap() {
            return overlap;
        }

        public void setOverlap(int overlap) {
            this.overlap = overlap;
        }
    }

    public static class Embedding {

        /**
         * Largest number of texts the embedding service accepts per call.
         */
        @Positive
        private int maxBatchSize = 16;

        /**
         * Number of embedding calls running in parallel during ingestion.
         */
        @Positive
        private int concurrency = 4;

        /**
         * Vector size of the deterministic offline embeddings.
         */
        @Positive
        private int dimensions = 1536;

        public int getMaxBatchSize() {
            return maxBatchSize;
        }

        public void setMaxBatchSize(int maxBatchSize) {
            this.maxBatchSize = maxBatchSize;
        }

        public int getConcurrency() {
            return concurrency;
        }

        public void setConcurrency(int concurrency) {
            this.concurrency = concurrency;
        }

        public int getDimensions() {
            return dimensions;
        }

        public void setDimensions(int dimensions) {
            this.dimensions = dimensions;
        }
    }

    public static class Retry {

        @Positive
        private int maxAttempts = 5;

        @NotNull
        private Duration initialDelay = Duration.ofMillis(500);

        @NotNull
        private Duration maxDelay = Duration.ofSeconds(30);

        @DecimalMin("1.0")
        private double multiplier = 2.0d;

        /**
         * Extra factor applied to the delay when the service reports a rate limit.
         */
        @DecimalMin("1.0")
        private double rateLimitMultiplier = 2.0d;

        public RetryPolicy toPolicy() {
            return new RetryPolicy(maxAttempts, initialDelay, maxDelay, multiplier, rateLimitMultiplier);
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getInitialDelay() {
            return initialDelay;
        }

        public void setInitialDelay(Duration initialDelay) {
            this.initialDelay = initialDelay;
        }

        public Duration getMaxDelay() {
            return maxDelay;
        }

        public void setMaxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
        }

        public double getMultiplier() {
            return multiplier;
        }

        public void setMultiplier(double multiplier) {
            this.multiplier = multiplier;
        }

        public double getRateLimitMultiplier() {
            return rateLimitMultiplier;
        }

        public void setRateLimitMultiplier(double rateLimitMultiplier) {
            this.rateLimitMultiplier = rateLimitMultiplier;
        }
    }

    public static class Retrieval {

        /**
         * Number of chunks handed to the language model per question.
         */
        @Positive
        private int topK = 3;

        public int getTopK() {
            return topK;
        }

        public void setTopK(int topK) {
            this.topK = topK;
        }
    }

    public static class Generation {

        @DecimalMin("0.0")
        @DecimalMax("2.0")
        private double temperature = 0.7d;

        @Positive
        private int maxTokens = 1000;

        public double getTemperature() {
            return temperature;
        }

        public void setTemperature(double temperature) {
            this.temperature = temperature;
        }

        public int getMaxTokens() {
            return maxTokens;
        }

        public void setMaxTokens(int maxTokens) {
            this.maxTokens = maxTokens;
        }
    }

    public static class Store {

        /**
         * Name of the collection all entries are written to.
         */
        @NotBlank
        private String collection = "documents";

        public String getCollection() {
            return collection;
        }

        public void setCollection(String collection) {
            this.collection = collection;
        }
    }

    public static class Ingest {

        /**
         * Ingest the data directory on startup when the collection is empty.
         */
        private boolean onStartup = false;

        @NotNull
        private Path dataDir = Path.of("data");

        public boolean isOnStartup() {
            return onStartup;
        }

        public void setOnStartup(boolean onStartup) {
            this.onStartup = onStartup;
        }

        public Path getDataDir() {
            return dataDir;
        }

        public void setDataDir(Path dataDir) {
            this.dataDir = dataDir;
        }
    }
}
