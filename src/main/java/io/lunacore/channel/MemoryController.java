package io.lunacore.channel;

import io.lunacore.memory.FactStore;
import io.lunacore.memory.MemoryEntry;
import io.lunacore.memory.MemorySeedLoader;
import io.lunacore.memory.SeedResult;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST API for the fact store.
 */
@RestController
@RequestMapping("/api/memories")
public class MemoryController {

    private final FactStore factStore;
    private final MemorySeedLoader seedLoader;

    public MemoryController(FactStore factStore, MemorySeedLoader seedLoader) {
        this.factStore = factStore;
        this.seedLoader = seedLoader;
    }

    /**
     * Lists pinned memories, oldest first.
     */
    @GetMapping("/pinned")
    public ResponseEntity<List<MemoryEntry>> pinned(@RequestParam(defaultValue = "30") int limit) {
        return ResponseEntity.ok(factStore.getPinned(limit));
    }

    /**
     * Lists all memories, pinned first.
     */
    @GetMapping
    public ResponseEntity<List<MemoryEntry>> list(@RequestParam(defaultValue = "200") int limit) {
        return ResponseEntity.ok(factStore.list(limit));
    }

    @PutMapping
    public ResponseEntity<Map<String, Object>> upsert(@RequestBody UpsertRequest request) {
        double score = request.score() != null ? request.score() : 1.0;
        boolean pinned = Boolean.TRUE.equals(request.pinned());
        factStore.upsert(request.key(), request.value(), score, pinned);
        return ResponseEntity.ok(Map.of("status", "stored", "key", request.key().strip(), "pinned", pinned));
    }

    @DeleteMapping("/{key}")
    public ResponseEntity<Map<String, Object>> forget(@PathVariable String key) {
        int removed = factStore.forget(key);
        if (removed == 0) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(Map.of("status", "forgotten", "key", key, "removed", removed));
    }

    @DeleteMapping("/{key}/pin")
    public ResponseEntity<Map<String, String>> unpin(@PathVariable String key) {
        if (!factStore.unpin(key)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(Map.of("status", "unpinned", "key", key));
    }

    /**
     * Loads pinned facts from a CSV body ({@code key,value} rows).
     */
    @PostMapping(value = "/seed", consumes = {"text/csv", "text/plain"})
    public ResponseEntity<SeedResult> seed(@RequestBody String csv,
                                           @RequestParam(defaultValue = "false") boolean reset) {
        return ResponseEntity.ok(seedLoader.load(csv, reset));
    }

    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> status() {
        return ResponseEntity.ok(Map.of(
                "totalCount", factStore.count(),
                "nonPinnedCount", factStore.countNonPinned()
        ));
    }

    /**
     * Request body for storing a memory.
     */
    public record UpsertRequest(String key, String value, Double score, Boolean pinned) {}
}
