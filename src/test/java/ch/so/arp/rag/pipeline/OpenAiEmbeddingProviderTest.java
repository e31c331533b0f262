package ch.so.arp.rag.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

class OpenAiEmbeddingProviderTest {

    private static final String EMBEDDINGS_URL = "https://example.invalid/v1/embeddings";

    private MockRestServiceServer server;
    private OpenAiEmbeddingProvider provider;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        provider = new OpenAiEmbeddingProvider(builder, properties("test-key"));
    }

    static OpenAiClientProperties properties(String apiKey) {
        OpenAiClientProperties properties = new OpenAiClientProperties();
        properties.setApiKey(apiKey);
        properties.setBaseUrl("https://example.invalid/v1");
        return properties;
    }

    @Test
    void sendsTheBatchAndOrdersVectorsByIndex() {
        server.expect(requestTo(EMBEDDINGS_URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer test-key"))
                .andExpect(jsonPath("$.model").value("text-embedding-ada-002"))
                .andExpect(jsonPath("$.input[0]").value("alpha"))
                .andExpect(jsonPath("$.input[1]").value("beta"))
                .andRespond(withSuccess("""
                        {"object":"list","data":[
                          {"object":"embedding","index":1,"embedding":[0.0,1.0]},
                          {"object":"embedding","index":0,"embedding":[1.0,0.0]}
                        ],"model":"text-embedding-ada-002"}
                        """, MediaType.APPLICATION_JSON));

        EmbeddingResult result = provider.embed(List.of("alpha", "beta"));

        assertThat(result.vectors()).hasSize(2);
        assertThat(result.vectors().get(0)).containsExactly(1.0f, 0.0f);
        assertThat(result.vectors().get(1)).containsExactly(0.0f, 1.0f);
        server.verify();
    }

    @Test
    void rejectsResultsWithTooFewVectors() {
        server.expect(requestTo(EMBEDDINGS_URL))
                .andRespond(withSuccess("{\"data\":[{\"index\":0,\"embedding\":[1.0]}]}",
                        MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> provider.embed(List.of("alpha", "beta")))
                .isInstanceOf(PermanentFailureException.class)
                .hasMessageContaining("1 vectors for 2 texts");
    }

    @Test
    void reportsRateLimitsWithRetryAfterHeader() {
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.RETRY_AFTER, "7");
        server.expect(requestTo(EMBEDDINGS_URL))
                .andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS).headers(headers));

        assertThatThrownBy(() -> provider.embed(List.of("alpha")))
                .isInstanceOfSatisfying(RateLimitException.class,
                        ex -> assertThat(ex.getRetryAfter()).contains(Duration.ofSeconds(7)));
    }

    @Test
    void readsRetryHintFromTheErrorMessage() {
        server.expect(requestTo(EMBEDDINGS_URL))
                .andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"error\":{\"message\":\"Rate limit reached. Please retry after 20 seconds.\"}}"));

        assertThatThrownBy(() -> provider.embed(List.of("alpha")))
                .isInstanceOfSatisfying(RateLimitException.class,
                        ex -> assertThat(ex.getRetryAfter()).contains(Duration.ofSeconds(20)));
    }

    @Test
    void ignoresRetryHintsTooLargeToParse() {
        server.expect(requestTo(EMBEDDINGS_URL))
                .andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"error\":{\"message\":\"Please retry after 99999999999999999999 seconds.\"}}"));

        assertThatThrownBy(() -> provider.embed(List.of("alpha")))
                .isInstanceOfSatisfying(RateLimitException.class,
                        ex -> assertThat(ex.getRetryAfter()).isEmpty());
    }

    @Test
    void treatsServerErrorsAsTransient() {
        server.expect(requestTo(EMBEDDINGS_URL)).andRespond(withStatus(HttpStatus.INTERNAL_SERVER_ERROR));

        assertThatThrownBy(() -> provider.embed(List.of("alpha")))
                .isExactlyInstanceOf(TransientFailureException.class)
                .hasMessageContaining("HTTP 500");
    }

    @Test
    void treatsConnectionProblemsAsTransient() {
        server.expect(requestTo(EMBEDDINGS_URL)).andRespond(request -> {
            throw new IOException("connection reset");
        });

        assertThatThrownBy(() -> provider.embed(List.of("alpha")))
                .isExactlyInstanceOf(TransientFailureException.class);
    }

    @Test
    void treatsBadRequestsAsPermanent() {
        server.expect(requestTo(EMBEDDINGS_URL))
                .andRespond(withStatus(HttpStatus.BAD_REQUEST)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"error\":{\"message\":\"input too long\"}}"));

        assertThatThrownBy(() -> provider.embed(List.of("alpha")))
                .isInstanceOf(PermanentFailureException.class)
                .hasMessageContaining("input too long");
    }

    @Test
    void treatsRejectedCredentialsAsConfigurationError() {
        server.expect(requestTo(EMBEDDINGS_URL)).andRespond(withStatus(HttpStatus.UNAUTHORIZED));

        assertThatThrownBy(() -> provider.embed(List.of("alpha")))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("API key");
    }

    @Test
    void requiresAnApiKey() {
        assertThatThrownBy(() -> new OpenAiEmbeddingProvider(RestClient.builder(), properties(null)))
                .isInstanceOf(ConfigurationException.class);
    }
}
