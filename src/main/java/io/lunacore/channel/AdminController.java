package io.lunacore.channel;

import io.lunacore.knowledge.KnowledgeBase;
import io.lunacore.memory.FactStore;
import io.lunacore.setup.ResetService;
import io.lunacore.storage.LunaDatabase;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Health and maintenance endpoints.
 */
@RestController
@RequestMapping("/api")
public class AdminController {

    private final LunaDatabase database;
    private final FactStore factStore;
    private final KnowledgeBase knowledgeBase;
    private final ResetService resetService;

    public AdminController(LunaDatabase database, FactStore factStore, KnowledgeBase knowledgeBase,
                           ResetService resetService) {
        this.database = database;
        this.factStore = factStore;
        this.knowledgeBase = knowledgeBase;
        this.resetService = resetService;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        if (!database.healthCheck()) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(Map.of("status", "down", "service", "luna-core"));
        }
        return ResponseEntity.ok(Map.of(
                "status", "ok",
                "service", "luna-core",
                "memories", factStore.count(),
                "documents", knowledgeBase.documentCount()
        ));
    }

    /**
     * Irreversibly clears memories, turns and sessions, and optionally the knowledge base.
     */
    @PostMapping("/admin/reset")
    public ResponseEntity<Map<String, Object>> reset(@RequestParam(defaultValue = "false") boolean includeKnowledge) {
        resetService.resetAll(includeKnowledge);
        return ResponseEntity.ok(Map.of("status", "reset", "knowledgeCleared", includeKnowledge));
    }
}
