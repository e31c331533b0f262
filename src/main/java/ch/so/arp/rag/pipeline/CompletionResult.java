package ch.so.arp.rag.pipeline;

import java.util.Objects;

/**
 * Text returned by an {@link LlmClient}.
 */
public record CompletionResult(String text) {

    public CompletionResult {
        Objects.requireNonNull(text, "text");
    }
}
