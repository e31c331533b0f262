package ch.so.arp.rag.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

class AnswerGeneratorTest {

    private final List<Duration> sleeps = new ArrayList<>();
    private final RetryExecutor retryExecutor = new RetryExecutor(RetryPolicy.defaults(), sleeps::add);
    private final LlmClient llmClient = mock(LlmClient.class);
    private final AnswerGenerator generator = new AnswerGenerator(llmClient, retryExecutor);

    @Test
    void returnsTheStrippedCompletion() {
        when(llmClient.complete(AnswerGenerator.SYSTEM_PROMPT, "prompt"))
                .thenReturn(new CompletionResult("\n  Dogs are canines.  \n"));

        assertThat(generator.generate("prompt")).isEqualTo("Dogs are canines.");
    }

    @Test
    void retriesTransientFailures() {
        when(llmClient.complete(anyString(), anyString()))
                .thenThrow(new TransientFailureException("timeout"))
                .thenReturn(new CompletionResult("answer"));

        assertThat(generator.generate("prompt")).isEqualTo("answer");
        assertThat(sleeps).containsExactly(Duration.ofMillis(500));
    }

    @Test
    void fallsBackAfterExhaustingRetries() {
        when(llmClient.complete(anyString(), anyString())).thenThrow(new TransientFailureException("timeout"));

        assertThat(generator.generate("prompt")).isEqualTo(AnswerGenerator.FALLBACK_ANSWER);
        verify(llmClient, times(RetryPolicy.defaults().maxAttempts())).complete(anyString(), anyString());
    }

    @Test
    void fallsBackOnConfigurationErrors() {
        when(llmClient.complete(anyString(), anyString())).thenThrow(new ConfigurationException("missing key"));

        assertThat(generator.generate("prompt")).isEqualTo(AnswerGenerator.FALLBACK_ANSWER);
        assertThat(sleeps).isEmpty();
    }

    @Test
    void mockClientEchoesTheContext() {
        AnswerGenerator mocked = new AnswerGenerator(new MockLlmClient(), retryExecutor);

        String answer = mocked.generate(PromptBuilder.build("q", List.of(new Chunk("a.txt", "alpha", 0))));

        assertThat(answer).startsWith("[mocked answer]").contains("Source: a.txt").contains("alpha");
    }
}
