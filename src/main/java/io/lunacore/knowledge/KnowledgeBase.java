package io.lunacore.knowledge;

import java.util.List;

/**
 * Offline keyword retrieval over ingested text.
 *
 * <p>Documents are stored as ordered, immutable chunks. Retrieval runs against an in-memory index
 * that is only rebuilt on request; chunks ingested after the last rebuild are invisible to
 * {@link #retrieve} until {@link #rebuildIndex()} runs again.</p>
 */
public interface KnowledgeBase {

    /**
     * Splits {@code text} into chunks and stores them as a new document.
     *
     * @param sourceLabel where the text came from, must not be empty
     * @param text        text to ingest, must not be blank
     * @return the new document id
     */
    String ingestText(String sourceLabel, String text);

    /**
     * Loads every stored chunk and atomically publishes a fresh index.
     *
     * @return number of chunks indexed
     */
    int rebuildIndex();

    /**
     * Ranks chunks against {@code query}. Returns an empty list, never an error, when the index is
     * empty or has not been built.
     *
     * @param query    free text
     * @param k        maximum number of hits
     * @param minScore hits scoring below this are dropped
     */
    List<RetrievedChunk> retrieve(String query, int k, double minScore);

    /**
     * {@link #retrieve(String, int, double)} with the configured result count and minimum score.
     */
    List<RetrievedChunk> retrieve(String query);

    IndexStatus indexStatus();

    int documentCount();

    /**
     * Irreversibly removes all documents and chunks and publishes an empty index.
     */
    void deleteAll();
}
