package ch.so.arp.rag.pipeline;

import java.util.List;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoint exposing ingestion, question answering and inspection of the
 * index.
 */
@RestController
@RequestMapping(path = "/api", produces = MediaType.APPLICATION_JSON_VALUE)
@Validated
public class RagController {

    private final RagEngine ragEngine;

    public RagController(RagEngine ragEngine) {
        this.ragEngine = ragEngine;
    }

    @PostMapping(path = "/documents", consumes = MediaType.APPLICATION_JSON_VALUE)
    public IngestionReport ingest(@RequestBody List<Document> documents) {
        return ragEngine.ingest(documents);
    }

    @PostMapping(path = "/ask", consumes = MediaType.APPLICATION_JSON_VALUE)
    public AnswerResponse ask(@Valid @RequestBody AskRequest request) {
        return new AnswerResponse(ragEngine.ask(request.question()));
    }

    @GetMapping("/documents/count")
    public CountResponse count() {
        return new CountResponse(ragEngine.count());
    }

    @GetMapping("/documents/report")
    public IndexReport report() {
        return ragEngine.inspect();
    }

    @DeleteMapping("/documents")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void reset() {
        ragEngine.reset();
    }
}
