package ch.so.arp.rag.pipeline;

/**
 * Deterministic {@link LlmClient} used in tests and local development where the
 * OpenAI API should not be contacted. It answers with the context section of
 * the prompt so the retrieved passages stay visible.
 */
class MockLlmClient implements LlmClient {

    private static final String CONTEXT_START = "---CONTEXT---";
    private static final String CONTEXT_END = "---END CONTEXT---";

    @Override
    public CompletionResult complete(String systemPrompt, String userPrompt) {
        int start = userPrompt.indexOf(CONTEXT_START);
        int end = userPrompt.indexOf(CONTEXT_END);
        if (start < 0 || end < start) {
            return new CompletionResult("[mocked answer] " + PromptBuilder.REFUSAL_PHRASE);
        }
        String context = userPrompt.substring(start + CONTEXT_START.length(), end).strip();
        return new CompletionResult("[mocked answer] Provide an API key to reach the real OpenAI service. "
                + "Relevant context: " + context);
    }
}
