package ch.so.arp.rag.pipeline;

import java.util.List;
import java.util.StringJoiner;

/**
 * Builds the grounded instruction sent to the language model. The output only
 * depends on its arguments.
 */
public final class PromptBuilder {

    public static final String REFUSAL_PHRASE =
            "I don't have enough information in the provided context to answer this question.";

    static final String CHUNK_DELIMITER = "\n\n---\n\n";

    private PromptBuilder() {
    }

    public static String build(String query, List<Chunk> chunks) {
        StringJoiner context = new StringJoiner(CHUNK_DELIMITER);
        chunks.forEach(chunk -> context.add(formatChunk(chunk)));
        return """
                Answer the following question based ONLY on the provided context.

                If the answer is not in the context, reply with "%s"

                Do not use any prior knowledge or make assumptions beyond what is explicitly stated in the context.

                ---CONTEXT---
                %s
                ---END CONTEXT---

                QUESTION: %s

                ANSWER:""".formatted(REFUSAL_PHRASE, context, query);
    }

    private static String formatChunk(Chunk chunk) {
        return "Source: " + chunk.source() + "\n" + chunk.content();
    }
}
