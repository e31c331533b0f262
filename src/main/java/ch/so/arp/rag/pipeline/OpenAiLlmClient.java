package ch.so.arp.rag.pipeline;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * {@link LlmClient} calling the OpenAI compatible {@code /chat/completions}
 * endpoint.
 */
class OpenAiLlmClient implements LlmClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(OpenAiLlmClient.class);

    private final RestClient restClient;
    private final String model;
    private final double temperature;
    private final int maxTokens;

    OpenAiLlmClient(RestClient.Builder builder, OpenAiClientProperties properties, double temperature,
            int maxTokens) {
        if (!StringUtils.hasText(properties.getApiKey())) {
            throw new ConfigurationException(
                    "Property 'rag.openai.api-key' or OPENAI_API_KEY must be provided when mocks are disabled");
        }
        this.model = properties.getChatModel();
        this.temperature = temperature;
        this.maxTokens = maxTokens;
        this.restClient = builder
                .baseUrl(properties.getBaseUrl())
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.getApiKey())
                .build();
    }

    @Override
    public CompletionResult complete(String systemPrompt, String userPrompt) {
        LOGGER.debug("Requesting completion with model {} ({} prompt characters)", model, userPrompt.length());
        ChatCompletionRequest request = new ChatCompletionRequest(model,
                List.of(new Message("system", systemPrompt), new Message("user", userPrompt)), temperature,
                maxTokens);
        ChatCompletionResponse response;
        try {
            response = restClient.post()
                    .uri("/chat/completions")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(request)
                    .retrieve()
                    .body(ChatCompletionResponse.class);
        } catch (RestClientException ex) {
            throw OpenAiErrorTranslator.translate("Completion request", ex);
        }
        if (response == null || response.choices() == null || response.choices().isEmpty()
                || response.choices().get(0).message() == null) {
            throw new PermanentFailureException("Completion service returned no choices");
        }
        String content = response.choices().get(0).message().content();
        return new CompletionResult(content == null ? "" : content);
    }

    record ChatCompletionRequest(String model, List<Message> messages, double temperature,
            @JsonProperty("max_tokens") int maxTokens) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Message(String role, String content) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ChatCompletionResponse(List<Choice> choices) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Choice(Message message) {
    }
}
