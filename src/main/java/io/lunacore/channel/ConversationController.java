package io.lunacore.channel;

import io.lunacore.core.ConversationRecorder;
import io.lunacore.core.MemoryCommandHandler;
import io.lunacore.core.PromptAssembler;
import io.lunacore.ledger.Turn;
import io.lunacore.ledger.TurnLatencies;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Optional;

/**
 * Endpoints the voice pipeline calls around each language model round trip.
 * The pipeline asks for a prompt before calling the model and records the finished turn afterwards.
 */
@RestController
@RequestMapping("/api/conversation")
public class ConversationController {

    private final PromptAssembler promptAssembler;
    private final MemoryCommandHandler memoryCommands;
    private final ConversationRecorder recorder;

    public ConversationController(PromptAssembler promptAssembler, MemoryCommandHandler memoryCommands,
                                  ConversationRecorder recorder) {
        this.promptAssembler = promptAssembler;
        this.memoryCommands = memoryCommands;
        this.recorder = recorder;
    }

    /**
     * Returns either a local reply (memory listing command) or the prompt to send to the model.
     */
    @PostMapping("/prompt")
    public ResponseEntity<PromptResponse> prompt(@RequestBody PromptRequest request) {
        Optional<String> localReply = memoryCommands.handle(request.utterance());
        if (localReply.isPresent()) {
            return ResponseEntity.ok(new PromptResponse(null, localReply.get()));
        }
        return ResponseEntity.ok(new PromptResponse(promptAssembler.assemble(request.utterance()), null));
    }

    @PostMapping("/turns")
    public ResponseEntity<List<Turn>> record(@RequestBody RecordTurnRequest request) {
        var latencies = new TurnLatencies(request.asrMs(), request.llmMs(), request.ttsMs());
        return ResponseEntity.ok(recorder.recordTurn(request.sessionId(), request.userText(),
                request.assistantText(), latencies));
    }

    public record PromptRequest(String utterance) {}

    /**
     * Exactly one of {@code prompt} and {@code localReply} is set.
     */
    public record PromptResponse(String prompt, String localReply) {}

    public record RecordTurnRequest(String sessionId, String userText, String assistantText,
                                    long asrMs, long llmMs, long ttsMs) {}
}
