package ch.so.arp.rag.pipeline;

public record CountResponse(int count) {
}
