package ch.so.arp.rag.pipeline;

import java.util.Comparator;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * {@link EmbeddingProvider} calling the OpenAI compatible {@code /embeddings}
 * endpoint with a batch of texts.
 */
class OpenAiEmbeddingProvider implements EmbeddingProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(OpenAiEmbeddingProvider.class);

    private final RestClient restClient;
    private final String model;

    OpenAiEmbeddingProvider(RestClient.Builder builder, OpenAiClientProperties properties) {
        if (!StringUtils.hasText(properties.getApiKey())) {
            throw new ConfigurationException(
                    "Property 'rag.openai.api-key' or OPENAI_API_KEY must be provided when mocks are disabled");
        }
        this.model = properties.getEmbeddingModel();
        this.restClient = builder
                .baseUrl(properties.getBaseUrl())
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.getApiKey())
                .build();
    }

    @Override
    public EmbeddingResult embed(List<String> texts) {
        LOGGER.debug("Requesting {} embeddings with model {}", texts.size(), model);
        EmbeddingResponse response;
        try {
            response = restClient.post()
                    .uri("/embeddings")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(new EmbeddingRequest(model, texts))
                    .retrieve()
                    .body(EmbeddingResponse.class);
        } catch (RestClientException ex) {
            throw OpenAiErrorTranslator.translate("Embedding request", ex);
        }
        if (response == null || response.data() == null) {
            throw new PermanentFailureException("Embedding service returned no data");
        }
        List<float[]> vectors = response.data().stream()
                .sorted(Comparator.comparingInt(EmbeddingData::index))
                .map(EmbeddingData::embedding)
                .toList();
        return new EmbeddingResult(vectors).requireSize(texts.size());
    }

    record EmbeddingRequest(String model, List<String> input) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record EmbeddingResponse(List<EmbeddingData> data) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record EmbeddingData(int index, float[] embedding) {
    }
}
