package ch.so.arp.rag.pipeline;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads plain text and markdown files below a directory. The source of each
 * document is the file path relative to that directory.
 */
class TextFileDocumentLoader implements DocumentLoader {

    private static final Logger LOGGER = LoggerFactory.getLogger(TextFileDocumentLoader.class);

    private static final Set<String> EXTENSIONS = Set.of(".txt", ".md");

    @Override
    public List<Document> load(Path directory) throws IOException {
        List<Path> files;
        try (Stream<Path> paths = Files.walk(directory)) {
            files = paths.filter(Files::isRegularFile)
                    .filter(TextFileDocumentLoader::isSupported)
                    .sorted()
                    .toList();
        }
        List<Document> documents = new ArrayList<>(files.size());
        for (Path file : files) {
            String content = Files.readString(file, StandardCharsets.UTF_8);
            String source = directory.relativize(file).toString().replace('\\', '/');
            if (content.isBlank()) {
                LOGGER.warn("Skipping empty file {}", source);
                continue;
            }
            documents.add(new Document(source, content));
        }
        LOGGER.info("Loaded {} documents from {}", documents.size(), directory);
        return documents;
    }

    private static boolean isSupported(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return EXTENSIONS.stream().anyMatch(name::endsWith);
    }
}
