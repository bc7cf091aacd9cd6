package io.lunacore.capture;

import io.lunacore.core.InvalidInputException;
import io.lunacore.memory.FactStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Feeds user utterances through a {@link FactExtractor} and stores the candidates as non-pinned
 * memories. Each write goes through {@link FactStore#addNonPinned}, so cap enforcement always follows.
 */
public class FactCaptureService {

    private static final Logger log = LoggerFactory.getLogger(FactCaptureService.class);

    private final FactExtractor extractor;
    private final FactStore factStore;
    private final boolean enabled;

    public FactCaptureService(FactExtractor extractor, FactStore factStore, boolean enabled) {
        this.extractor = extractor;
        this.factStore = factStore;
        this.enabled = enabled;
    }

    /**
     * Extracts and stores facts from one utterance.
     *
     * @return number of facts written; 0 when capture is disabled
     */
    public int capture(String utterance) {
        if (!enabled) {
            return 0;
        }

        List<CandidateFact> candidates = extractor.extract(utterance);
        int written = 0;
        for (CandidateFact fact : candidates) {
            double score = Math.max(0.0, fact.confidence());
            try {
                factStore.addNonPinned(fact.key(), fact.value(), score);
                written++;
                log.debug("Captured fact: {} = {}", fact.key(), fact.value());
            } catch (InvalidInputException e) {
                log.debug("Skipping malformed candidate fact '{}': {}", fact.key(), e.getMessage());
            }
        }
        return written;
    }

    public boolean isEnabled() {
        return enabled;
    }
}
