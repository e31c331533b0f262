package ch.so.arp.rag.pipeline;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a grounded prompt into an answer. This is the user facing end of the
 * pipeline: failures are logged and replaced by {@link #FALLBACK_ANSWER}.
 */
public class AnswerGenerator {

    private static final Logger LOGGER = LoggerFactory.getLogger(AnswerGenerator.class);

    public static final String SYSTEM_PROMPT =
            "You are a helpful assistant that answers questions based on provided context.";

    public static final String FALLBACK_ANSWER = "Sorry, I encountered an error while generating an answer.";

    private final LlmClient llmClient;
    private final RetryExecutor retryExecutor;

    public AnswerGenerator(LlmClient llmClient, RetryExecutor retryExecutor) {
        this.llmClient = Objects.requireNonNull(llmClient, "llmClient");
        this.retryExecutor = Objects.requireNonNull(retryExecutor, "retryExecutor");
    }

    public String generate(String prompt) {
        try {
            CompletionResult result = retryExecutor.execute("Completion request",
                    () -> llmClient.complete(SYSTEM_PROMPT, prompt));
            return result.text().strip();
        } catch (RuntimeException ex) {
            LOGGER.error("Failed to generate answer: {}", ex.getMessage(), ex);
            return FALLBACK_ANSWER;
        }
    }
}
