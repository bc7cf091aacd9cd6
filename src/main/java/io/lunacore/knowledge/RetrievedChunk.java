package io.lunacore.knowledge;

/**
 * A retrieval hit: the chunk text with its relevance score and provenance.
 */
public record RetrievedChunk(String documentId, String source, int sequenceNo, String text, double score) {}
