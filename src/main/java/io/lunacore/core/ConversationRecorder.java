package io.lunacore.core;

import io.lunacore.capture.FactCaptureService;
import io.lunacore.ledger.Turn;
import io.lunacore.ledger.TurnEntry;
import io.lunacore.ledger.TurnLatencies;
import io.lunacore.ledger.TurnLedger;
import io.lunacore.ledger.TurnRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Logs a completed turn and offers the user utterance to fact capture.
 */
@Component
public class ConversationRecorder {

    private static final Logger log = LoggerFactory.getLogger(ConversationRecorder.class);

    private final TurnLedger turnLedger;
    private final FactCaptureService factCapture;

    public ConversationRecorder(TurnLedger turnLedger, FactCaptureService factCapture) {
        this.turnLedger = turnLedger;
        this.factCapture = factCapture;
    }

    /**
     * Appends the user and assistant turns in one ledger transaction. Latencies are attached to the
     * assistant turn, which is where the pipeline measures them.
     *
     * @return the two appended turns, user first
     */
    public List<Turn> recordTurn(String sessionId, String userText, String assistantText, TurnLatencies latencies) {
        List<Turn> turns = turnLedger.addTurns(sessionId, List.of(
                new TurnEntry(TurnRole.USER, userText, TurnLatencies.NONE),
                new TurnEntry(TurnRole.ASSISTANT, assistantText, latencies)));

        int captured = factCapture.capture(userText);
        if (captured > 0) {
            log.debug("Captured {} facts from session '{}'", captured, sessionId);
        }
        return turns;
    }
}
