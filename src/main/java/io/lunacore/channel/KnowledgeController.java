package io.lunacore.channel;

import io.lunacore.config.LunaProperties;
import io.lunacore.knowledge.IndexStatus;
import io.lunacore.knowledge.KnowledgeBase;
import io.lunacore.knowledge.KnowledgeIngestionService;
import io.lunacore.knowledge.RetrievedChunk;
import org.jobrunr.jobs.JobId;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST API for document ingestion, index rebuilds and retrieval.
 */
@RestController
@RequestMapping("/api/knowledge")
public class KnowledgeController {

    private final KnowledgeBase knowledgeBase;
    private final KnowledgeIngestionService ingestionService;
    private final LunaProperties.Knowledge settings;

    public KnowledgeController(KnowledgeBase knowledgeBase, KnowledgeIngestionService ingestionService,
                               LunaProperties properties) {
        this.knowledgeBase = knowledgeBase;
        this.ingestionService = ingestionService;
        this.settings = properties.knowledge();
    }

    /**
     * Ingests text synchronously. The index is rebuilt only when {@code rebuild} is set.
     */
    @PostMapping("/documents")
    public ResponseEntity<Map<String, Object>> ingest(@RequestBody IngestRequest request,
                                                      @RequestParam(defaultValue = "false") boolean rebuild) {
        String documentId = knowledgeBase.ingestText(request.source(), request.text());
        if (rebuild) {
            knowledgeBase.rebuildIndex();
        }
        return ResponseEntity.ok(Map.of("documentId", documentId, "indexRebuilt", rebuild));
    }

    /**
     * Enqueues background ingestion of a text file on the server.
     */
    @PostMapping("/documents/file")
    public ResponseEntity<Map<String, String>> ingestFile(@RequestBody IngestFileRequest request) {
        JobId jobId = ingestionService.enqueueFile(request.path(), request.source());
        return ResponseEntity.accepted().body(Map.of("status", "enqueued", "jobId", jobId.toString()));
    }

    @PostMapping("/index")
    public ResponseEntity<Map<String, Integer>> rebuild() {
        return ResponseEntity.ok(Map.of("chunks", knowledgeBase.rebuildIndex()));
    }

    @GetMapping("/index")
    public ResponseEntity<IndexStatus> status() {
        return ResponseEntity.ok(knowledgeBase.indexStatus());
    }

    @GetMapping("/search")
    public ResponseEntity<List<RetrievedChunk>> search(@RequestParam String query,
                                                       @RequestParam(required = false) Integer k,
                                                       @RequestParam(required = false) Double minScore) {
        return ResponseEntity.ok(knowledgeBase.retrieve(query,
                k != null ? k : settings.topK(),
                minScore != null ? minScore : settings.minScore()));
    }

    public record IngestRequest(String source, String text) {}

    public record IngestFileRequest(String path, String source) {}
}
