package ch.so.arp.rag.pipeline;

public record AnswerResponse(String answer) {
}
