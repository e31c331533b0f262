package ch.so.arp.rag.pipeline;

import java.net.http.HttpClient;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.web.client.RestClient;

/**
 * Central configuration wiring the pipeline components together. It exposes
 * toggles that decide whether mocked or real infrastructure components should
 * be used.
 */
@Configuration
@EnableConfigurationProperties({ RagProperties.class, OpenAiClientProperties.class })
public class RagConfiguration {

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean(name = "embeddingExecutor")
    public ExecutorService embeddingExecutor(RagProperties properties) {
        return Executors.newFixedThreadPool(properties.getEmbedding().getConcurrency(),
                new CustomizableThreadFactory("embedding-"));
    }

    @Bean
    @ConditionalOnMissingBean
    public Sleeper sleeper() {
        return Sleeper.THREAD;
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryExecutor retryExecutor(RagProperties properties, Sleeper sleeper) {
        return new RetryExecutor(properties.getRetry().toPolicy(), sleeper);
    }

    @Bean
    @ConditionalOnProperty(name = "rag.mock-openai", havingValue = "true", matchIfMissing = true)
    public EmbeddingProvider deterministicEmbeddingProvider(RagProperties properties) {
        return new DeterministicEmbeddingProvider(properties.getEmbedding().getDimensions());
    }

    @Bean
    @ConditionalOnProperty(name = "rag.mock-openai", havingValue = "false")
    public EmbeddingProvider openAiEmbeddingProvider(OpenAiClientProperties properties) {
        return new OpenAiEmbeddingProvider(openAiRestClient(properties), properties);
    }

    @Bean
    @ConditionalOnProperty(name = "rag.mock-openai", havingValue = "true", matchIfMissing = true)
    public LlmClient mockLlmClient() {
        return new MockLlmClient();
    }

    @Bean
    @ConditionalOnProperty(name = "rag.mock-openai", havingValue = "false")
    public LlmClient openAiLlmClient(OpenAiClientProperties openAiProperties, RagProperties properties) {
        return new OpenAiLlmClient(openAiRestClient(openAiProperties), openAiProperties,
                properties.getGeneration().getTemperature(), properties.getGeneration().getMaxTokens());
    }

    @Bean
    @ConditionalOnProperty(name = "rag.mock-index-store", havingValue = "true", matchIfMissing = true)
    public IndexStore inMemoryIndexStore() {
        return new InMemoryIndexStore();
    }

    @Bean
    @ConditionalOnProperty(name = "rag.mock-index-store", havingValue = "false")
    public IndexStore jdbcIndexStore(JdbcClient jdbcClient, TransactionTemplate transactionTemplate,
            RagProperties properties) {
        return new JdbcIndexStore(jdbcClient, transactionTemplate, properties.getStore().getCollection());
    }

    @Bean
    @ConditionalOnMissingBean
    public TextChunker textChunker(RagProperties properties) {
        return new TextChunker(properties.getChunking().getSize(), properties.getChunking().getOverlap());
    }

    @Bean
    @ConditionalOnMissingBean
    public Embedder embedder(EmbeddingProvider embeddingProvider, RetryExecutor retryExecutor,
            @Qualifier("embeddingExecutor") ExecutorService embeddingExecutor, RagProperties properties) {
        return new Embedder(embeddingProvider, retryExecutor, embeddingExecutor,
                properties.getEmbedding().getMaxBatchSize());
    }

    @Bean
    @ConditionalOnMissingBean
    public Retriever retriever(Embedder embedder, IndexStore indexStore) {
        return new Retriever(embedder, indexStore);
    }

    @Bean
    @ConditionalOnMissingBean
    public AnswerGenerator answerGenerator(LlmClient llmClient, RetryExecutor retryExecutor) {
        return new AnswerGenerator(llmClient, retryExecutor);
    }

    @Bean
    @ConditionalOnMissingBean
    public IndexInspector indexInspector(IndexStore indexStore, RagProperties properties) {
        return new IndexInspector(indexStore, properties.getChunking().getSize());
    }

    @Bean
    @ConditionalOnMissingBean
    public DocumentLoader documentLoader() {
        return new TextFileDocumentLoader();
    }

    @Bean
    @ConditionalOnProperty(name = "rag.ingest.on-startup", havingValue = "true")
    public StartupIngestionRunner startupIngestionRunner(RagEngine ragEngine, DocumentLoader documentLoader,
            RagProperties properties) {
        return new StartupIngestionRunner(ragEngine, documentLoader, properties.getIngest().getDataDir());
    }

    private static RestClient.Builder openAiRestClient(OpenAiClientProperties properties) {
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(properties.getConnectTimeout())
                .build();
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(properties.getReadTimeout());
        return RestClient.builder().requestFactory(requestFactory);
    }
}
