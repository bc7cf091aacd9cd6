package io.lunacore.channel;

import io.lunacore.ledger.Session;
import io.lunacore.ledger.Turn;
import io.lunacore.ledger.TurnLatencies;
import io.lunacore.ledger.TurnLedger;
import io.lunacore.ledger.TurnRole;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST API for sessions and the append-only turn log.
 */
@RestController
@RequestMapping("/api/sessions")
public class SessionController {

    private final TurnLedger turnLedger;

    public SessionController(TurnLedger turnLedger) {
        this.turnLedger = turnLedger;
    }

    @PostMapping
    public ResponseEntity<Session> startSession(@RequestBody(required = false) StartSessionRequest request) {
        Map<String, Object> metadata = request != null ? request.metadata() : null;
        if (request != null && request.id() != null && !request.id().isBlank()) {
            return ResponseEntity.ok(turnLedger.startSession(request.id(), metadata));
        }
        return ResponseEntity.ok(turnLedger.startSession(metadata));
    }

    @GetMapping
    public ResponseEntity<List<Session>> listSessions() {
        return ResponseEntity.ok(turnLedger.listSessions());
    }

    @PostMapping("/{sessionId}/turns")
    public ResponseEntity<Turn> addTurn(@PathVariable String sessionId, @RequestBody AddTurnRequest request) {
        var latencies = new TurnLatencies(request.asrMs(), request.llmMs(), request.ttsMs());
        return ResponseEntity.ok(turnLedger.addTurn(sessionId, TurnRole.fromString(request.role()),
                request.text(), latencies));
    }

    /**
     * Lists turns in insertion order; {@code limit} returns only the most recent ones.
     */
    @GetMapping("/{sessionId}/turns")
    public ResponseEntity<List<Turn>> turns(@PathVariable String sessionId,
                                            @RequestParam(required = false) Integer limit) {
        if (limit != null) {
            return ResponseEntity.ok(turnLedger.getRecentTurns(sessionId, limit));
        }
        return ResponseEntity.ok(turnLedger.getSessionTurns(sessionId));
    }

    public record StartSessionRequest(String id, Map<String, Object> metadata) {}

    public record AddTurnRequest(String role, String text, long asrMs, long llmMs, long ttsMs) {}
}
