package ch.so.arp.rag.pipeline;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits documents into overlapping, size bounded chunks. Text is cut at the
 * largest separator that yields pieces of the allowed size: paragraph breaks
 * first, then line breaks, sentence ends, whitespace and finally raw
 * characters. Separators stay attached to the piece they terminate, so the
 * pieces of a document concatenate back to its content.
 * <p>
 * Every chunk after the first one of a document starts with the trailing
 * {@code overlap} characters of its predecessor.
 */
public class TextChunker {

    private static final Logger LOGGER = LoggerFactory.getLogger(TextChunker.class);

    private static final List<Pattern> SEPARATORS = List.of(
            Pattern.compile("\\n{2,}"),
            Pattern.compile("\\n"),
            Pattern.compile("(?<=[.!?])\\s+"),
            Pattern.compile("\\s+"));

    private final int defaultSize;
    private final int defaultOverlap;

    public TextChunker(int defaultSize, int defaultOverlap) {
        validate(defaultSize, defaultOverlap);
        this.defaultSize = defaultSize;
        this.defaultOverlap = defaultOverlap;
    }

    public List<Chunk> chunk(List<Document> documents) {
        return chunk(documents, defaultSize, defaultOverlap);
    }

    public List<Chunk> chunk(List<Document> documents, int size, int overlap) {
        validate(size, overlap);
        List<Chunk> chunks = new ArrayList<>();
        for (Document document : documents) {
            chunks.addAll(chunkDocument(document, size, overlap));
        }
        LOGGER.debug("Chunked {} documents into {} chunks (size={}, overlap={})", documents.size(), chunks.size(),
                size, overlap);
        return chunks;
    }

    private List<Chunk> chunkDocument(Document document, int size, int overlap) {
        String content = document.content();
        if (content.isBlank()) {
            return List.of();
        }
        if (content.length() <= size) {
            return List.of(new Chunk(document.source(), content, 0));
        }

        List<String> pieces = split(content, 0, size - overlap);
        List<Chunk> chunks = new ArrayList<>(pieces.size());
        String previous = null;
        for (String piece : pieces) {
            String text = previous == null ? piece : tail(previous, overlap) + piece;
            chunks.add(new Chunk(document.source(), text, chunks.size()));
            previous = text;
        }
        return chunks;
    }

    private List<String> split(String text, int level, int limit) {
        if (text.length() <= limit) {
            return List.of(text);
        }
        if (level >= SEPARATORS.size()) {
            return hardSplit(text, limit);
        }
        List<String> parts = splitKeepingSeparator(text, SEPARATORS.get(level));
        if (parts.size() == 1) {
            return split(text, level + 1, limit);
        }

        List<String> pieces = new ArrayList<>();
        StringBuilder buffer = new StringBuilder();
        for (String part : parts) {
            if (part.length() > limit) {
                flush(buffer, pieces);
                pieces.addAll(split(part, level + 1, limit));
                continue;
            }
            if (buffer.length() + part.length() > limit) {
                flush(buffer, pieces);
            }
            buffer.append(part);
        }
        flush(buffer, pieces);
        return pieces;
    }

    private List<String> splitKeepingSeparator(String text, Pattern separator) {
        List<String> parts = new ArrayList<>();
        Matcher matcher = separator.matcher(text);
        int start = 0;
        while (matcher.find()) {
            if (matcher.end() == 0 || matcher.end() >= text.length()) {
                continue;
            }
            parts.add(text.substring(start, matcher.end()));
            start = matcher.end();
        }
        parts.add(text.substring(start));
        return parts;
    }

    private List<String> hardSplit(String text, int limit) {
        List<String> pieces = new ArrayList<>();
        for (int start = 0; start < text.length(); start += limit) {
            pieces.add(text.substring(start, Math.min(text.length(), start + limit)));
        }
        return pieces;
    }

    private void flush(StringBuilder buffer, List<String> pieces) {
        if (buffer.length() > 0) {
            pieces.add(buffer.toString());
            buffer.setLength(0);
        }
    }

    private String tail(String text, int overlap) {
        if (overlap == 0) {
            return "";
        }
        return text.substring(Math.max(0, text.length() - overlap));
    }

    private static void validate(int size, int overlap) {
        if (size <= 0) {
            throw new ConfigurationException("Chunk size must be positive but was " + size);
        }
        if (overlap < 0) {
            throw new ConfigurationException("Chunk overlap must not be negative but was " + overlap);
        }
        if (overlap >= size) {
            throw new ConfigurationException(
                    "Chunk overlap (" + overlap + ") must be smaller than the chunk size (" + size + ")");
        }
    }
}
