package ch.so.arp.rag.pipeline;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Produces the documents to ingest from a directory. Loaders must not emit a
 * document for a file they failed to read.
 */
public interface DocumentLoader {

    List<Document> load(Path directory) throws IOException;
}
