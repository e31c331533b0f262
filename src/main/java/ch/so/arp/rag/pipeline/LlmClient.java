package ch.so.arp.rag.pipeline;

/**
 * Abstraction over the language model integration. Implementations can either
 * invoke the real OpenAI API or return predictable responses for testing.
 * Failures are reported with the pipeline's exception types.
 */
public interface LlmClient {

    /**
     * Complete a chat consisting of a system instruction and one user message.
     *
     * @param systemPrompt fixed instruction framing the assistant
     * @param userPrompt   the grounded prompt
     * @return the generated text
     */
    CompletionResult complete(String systemPrompt, String userPrompt);
}
