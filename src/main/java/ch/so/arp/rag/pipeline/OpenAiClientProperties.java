package ch.so.arp.rag.pipeline;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.EnvironmentAware;
import org.springframework.core.env.Environment;
import org.springframework.util.StringUtils;

/**
 * Simple configuration properties describing how to connect to OpenAI. The
 * same embedding model serves ingestion and queries.
 */
@ConfigurationProperties(prefix = "rag.openai")
public class OpenAiClientProperties implements EnvironmentAware {

    /**
     * API key that authorises requests against the OpenAI service.
     */
    private String apiKey;

    /**
     * Base URL for the API. Defaults to the public OpenAI endpoint.
     */
    private String baseUrl = "https://api.openai.com/v1";

    /**
     * Name of the embedding model. Changing it requires re-ingesting the collection.
     */
    private String embeddingModel = "text-embedding-ada-002";

    /**
     * Name of the chat model that should be used.
     */
    private String chatModel = "gpt-4o";

    private Duration connectTimeout = Duration.ofSeconds(10);

    private Duration readTimeout = Duration.ofSeconds(60);

    private Environment environment;

    public String getApiKey() {
        if (StringUtils.hasText(apiKey)) {
            return apiKey;
        }
        return environment != null ? environment.getProperty("OPENAI_API_KEY") : null;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getEmbeddingModel() {
        return embeddingModel;
    }

    public void setEmbeddingModel(String embeddingModel) {
        this.embeddingModel = embeddingModel;
    }

    public String getChatModel() {
        return chatModel;
    }

    public void setChatModel(String chatModel) {
        this.chatModel = chatModel;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public void setConnectTimeout(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
    }

    public Duration getReadTimeout() {
        return readTimeout;
    }

    public void setReadTimeout(Duration readTimeout) {
        this.readTimeout = readTimeout;
    }

    @Override
    public void setEnvironment(Environment environment) {
        this.environment = environment;
    }
}
