package ch.so.arp.rag.pipeline;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;

/**
 * Fills an empty collection from the data directory when the application
 * starts. A collection that already holds entries is left alone.
 */
class StartupIngestionRunner implements ApplicationRunner {

    private static final Logger LOGGER = LoggerFactory.getLogger(StartupIngestionRunner.class);

    private final RagEngine ragEngine;
    private final DocumentLoader documentLoader;
    private final Path dataDir;

    StartupIngestionRunner(RagEngine ragEngine, DocumentLoader documentLoader, Path dataDir) {
        this.ragEngine = ragEngine;
        this.documentLoader = documentLoader;
        this.dataDir = dataDir;
    }

    @Override
    public void run(ApplicationArguments args) throws IOException {
        int existing = ragEngine.count();
        if (existing > 0) {
            LOGGER.info("Collection already holds {} entries, skipping startup ingestion", existing);
            return;
        }
        if (!Files.isDirectory(dataDir)) {
            LOGGER.warn("Data directory {} does not exist, nothing to ingest", dataDir.toAbsolutePath());
            return;
        }
        List<Document> documents = documentLoader.load(dataDir);
        if (documents.isEmpty()) {
            LOGGER.warn("No documents found in {}", dataDir.toAbsolutePath());
            return;
        }
        IngestionReport report = ragEngine.ingest(documents);
        if (!report.isComplete()) {
            LOGGER.warn("Startup ingestion left {} failed batches, ingest the affected sources again to retry",
                    report.failed().size());
        }
    }
}
