package io.lunacore.capture;

import java.util.List;

/**
 * Maps one user utterance to candidate facts. Implementations never write to storage themselves;
 * {@link FactCaptureService} owns the write side.
 */
@FunctionalInterface
public interface FactExtractor {

    List<CandidateFact> extract(String utterance);
}
