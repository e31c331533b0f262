package ch.so.arp.rag.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import org.junit.jupiter.api.Test;

class TextChunkerTest {

    private final TextChunker chunker = new TextChunker(1000, 200);

    @Test
    void returnsNothingForNoDocuments() {
        assertThat(chunker.chunk(List.of(), 100, 10)).isEmpty();
    }

    @Test
    void returnsNothingForEmptyOrBlankContent() {
        List<Chunk> chunks = chunker.chunk(List.of(new Document("empty.txt", ""), new Document("blank.txt", " \n\n ")),
                100, 10);

        assertThat(chunks).isEmpty();
    }

    @Test
    void rejectsOverlapNotSmallerThanSize() {
        List<Document> documents = List.of(new Document("a.txt", "text"));

        assertThatThrownBy(() -> chunker.chunk(documents, 100, 100)).isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> chunker.chunk(documents, 100, 150)).isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> new TextChunker(50, 50)).isInstanceOf(ConfigurationException.class);
    }

    @Test
    void rejectsNonPositiveSizeAndNegativeOverlap() {
        List<Document> documents = List.of(new Document("a.txt", "text"));

        assertThatThrownBy(() -> chunker.chunk(documents, 0, 0)).isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> chunker.chunk(documents, 10, -1)).isInstanceOf(ConfigurationException.class);
    }

    @Test
    void keepsShortContentInOneChunkWithoutOverlap() {
        List<Chunk> chunks = chunker.chunk(List.of(new Document("cat.txt", "This is about cats.")), 100, 20);

        assertThat(chunks).containsExactly(new Chunk("cat.txt", "This is about cats.", 0));
    }

    @Test
    void splitsLongContentIntoBoundedChunksTaggedWithTheirSource() {
        String content = String.join(" ", Collections.nCopies(120, "Sentence number one is here."));

        List<Chunk> chunks = chunker.chunk(List.of(new Document("lecture.txt", content)), 200, 40);

        assertThat(chunks).hasSizeGreaterThanOrEqualTo(2);
        assertThat(chunks).allSatisfy(chunk -> {
            assertThat(chunk.content().length()).isLessThanOrEqualTo(200);
            assertThat(chunk.source()).isEqualTo("lecture.txt");
        });
        assertThat(chunks).extracting(Chunk::sequence)
                .containsExactlyElementsOf(IntStream.range(0, chunks.size()).boxed().toList());
    }

    @Test
    void prefersParagraphBreaks() {
        String first = "A".repeat(60) + "\n\n";
        String second = "B".repeat(60);

        List<Chunk> chunks = chunker.chunk(List.of(new Document("doc.txt", first + second)), 100, 0);

        assertThat(chunks).extracting(Chunk::content).containsExactly(first, second);
    }

    @Test
    void fallsBackToSentencesWhenParagraphsAreTooLarge() {
        String sentenceOne = "First sentence " + "x".repeat(40) + ". ";
        String sentenceTwo = "Second sentence " + "y".repeat(40) + ". ";
        String sentenceThree = "Third sentence " + "z".repeat(40) + ".";

        List<Chunk> chunks = chunker.chunk(
                List.of(new Document("doc.txt", sentenceOne + sentenceTwo + sentenceThree)), 80, 0);

        assertThat(chunks).extracting(Chunk::content).containsExactly(sentenceOne, sentenceTwo, sentenceThree);
    }

    @Test
    void prefixesEachFollowingChunkWithTheTailOfItsPredecessor() {
        String first = "A".repeat(60) + "\n\n";
        String second = "B".repeat(60);

        List<Chunk> chunks = chunker.chunk(List.of(new Document("doc.txt", first + second)), 100, 10);

        assertThat(chunks).hasSize(2);
        assertThat(chunks.get(0).content()).isEqualTo(first);
        assertThat(chunks.get(1).content()).isEqualTo("A".repeat(8) + "\n\n" + second);
    }

    @Test
    void cutsRawCharactersWhenThereIsNoSeparator() {
        List<Chunk> chunks = chunker.chunk(List.of(new Document("blob.txt", "x".repeat(250))), 100, 20);

        assertThat(chunks).extracting(chunk -> chunk.content().length()).containsExactly(80, 100, 100, 30);
    }

    @Test
    void piecesConcatenateBackToTheContentWithoutOverlap() {
        String content = """
                Retrieval augmented generation combines search with generation. It grounds answers in documents.

                Chunking splits documents into pieces! Does it keep the text intact? It should.
                Each line may be long enough to require another split at whitespace boundaries.
                """;

        List<Chunk> chunks = chunker.chunk(List.of(new Document("rag.md", content)), 60, 0);

        assertThat(chunks).allSatisfy(chunk -> assertThat(chunk.content().length()).isLessThanOrEqualTo(60));
        assertThat(chunks.stream().map(Chunk::content).collect(Collectors.joining())).isEqualTo(content);
    }

    @Test
    void usesConfiguredDefaults() {
        TextChunker small = new TextChunker(50, 10);

        List<Chunk> chunks = small.chunk(List.of(new Document("a.txt", "word ".repeat(40))));

        assertThat(chunks).hasSizeGreaterThan(1);
        assertThat(chunks).allSatisfy(chunk -> assertThat(chunk.content().length()).isLessThanOrEqualTo(50));
    }

    @Test
    void numbersChunksPerDocument() {
        List<Chunk> chunks = chunker.chunk(List.of(
                new Document("a.txt", "a".repeat(150)),
                new Document("b.txt", "b".repeat(150))), 100, 0);

        assertThat(chunks).extracting(Chunk::source, Chunk::sequence).containsExactly(
                tuple("a.txt", 0),
                tuple("a.txt", 1),
                tuple("b.txt", 0),
                tuple("b.txt", 1));
    }
}
