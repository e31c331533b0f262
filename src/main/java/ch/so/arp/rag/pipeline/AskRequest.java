package ch.so.arp.rag.pipeline;

import jakarta.validation.constraints.NotBlank;

/**
 * Body of a question sent to {@link RagController}.
 */
public record AskRequest(@NotBlank String question) {
}
