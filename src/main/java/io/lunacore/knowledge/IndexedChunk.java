package io.lunacore.knowledge;

/**
 * A persisted chunk as loaded for indexing.
 *
 * @param chunkId    storage row id; reflects ingestion order
 * @param documentId owning document
 * @param source     source label of the owning document
 * @param sequenceNo position of the chunk inside its document
 * @param text       chunk text
 */
public record IndexedChunk(long chunkId, String documentId, String source, int sequenceNo, String text) {}
