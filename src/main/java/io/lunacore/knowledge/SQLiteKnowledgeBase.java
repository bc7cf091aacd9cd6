package io.lunacore.knowledge;

import io.lunacore.core.InvalidInputException;
import io.lunacore.storage.LunaDatabase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * SQLite-backed document store with an in-memory Lucene BM25 index.
 *
 * <p>Each rebuild produces an immutable {@link Bm25Index} snapshot published through an
 * {@link AtomicReference}: concurrent readers see either the previous or the new snapshot, never a
 * partially built one. A replaced snapshot stays open until the searches holding it finish.</p>
 */
public class SQLiteKnowledgeBase implements KnowledgeBase {

    private static final Logger log = LoggerFactory.getLogger(SQLiteKnowledgeBase.class);

    private final LunaDatabase database;
    private final DocumentChunker chunker;
    private final Clock clock;
    private final int defaultTopK;
    private final double defaultMinScore;
    private final double k1;
    private final double b;

    private final AtomicReference<Bm25Index> index = new AtomicReference<>();
    private final AtomicLong ingestGeneration = new AtomicLong();
    private final AtomicBoolean unbuiltWarningLogged = new AtomicBoolean();
    private final Object rebuildLock = new Object();

    public SQLiteKnowledgeBase(LunaDatabase database, DocumentChunker chunker, Clock clock,
                               int defaultTopK, double defaultMinScore, double k1, double b) {
        this.database = database;
        this.chunker = chunker;
        this.clock = clock;
        this.defaultTopK = defaultTopK;
        this.defaultMinScore = defaultMinScore;
        this.k1 = k1;
        this.b = b;
    }

    @Override
    public String ingestText(String sourceLabel, String text) {
        String source = InvalidInputException.requireText(sourceLabel, "sourceLabel");
        List<String> chunks = chunker.chunk(text);
        if (chunks.isEmpty()) {
            throw new InvalidInputException("'text' must not be empty");
        }

        String documentId = UUID.randomUUID().toString();
        long now = clock.millis();

        database.write(conn -> {
            try (var stmt = conn.prepareStatement(
                    "INSERT INTO documents (id, source, created_at) VALUES (?, ?, ?)")) {
                stmt.setString(1, documentId);
                stmt.setString(2, source);
                stmt.setLong(3, now);
                stmt.executeUpdate();
            }
            try (var stmt = conn.prepareStatement(
                    "INSERT INTO chunks (document_id, sequence_no, text) VALUES (?, ?, ?)")) {
                for (int i = 0; i < chunks.size(); i++) {
                    stmt.setString(1, documentId);
                    stmt.setInt(2, i);
                    stmt.setString(3, chunks.get(i));
                    stmt.addBatch();
                }
                stmt.executeBatch();
            }
            return null;
        }, ingestGeneration::incrementAndGet);

        log.info("Ingested document {} from '{}' as {} chunks", documentId, source, chunks.size());
        return documentId;
    }

    @Override
    public int rebuildIndex() {
        synchronized (rebuildLock) {
            LoadedCorpus corpus = database.read(conn -> {
                long generation = ingestGeneration.get();
                var sql = """
                    SELECT c.id, c.document_id, d.source, c.sequence_no, c.text
                    FROM chunks c
                    JOIN documents d ON d.id = c.document_id
                    ORDER BY c.id ASC
                    """;
                List<IndexedChunk> chunks = new ArrayList<>();
                try (var stmt = conn.prepareStatement(sql);
                     var rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        chunks.add(new IndexedChunk(
                                rs.getLong(1),
                                rs.getString(2),
                                rs.getString(3),
                                rs.getInt(4),
                                rs.getString(5)
                        ));
                    }
                }
                return new LoadedCorpus(chunks, generation);
            });

            Bm25Index rebuilt = Bm25Index.build(corpus.chunks(), k1, b, corpus.generation(), clock.instant());
            publish(rebuilt);
            log.info("Rebuilt retrieval index over {} chunks", rebuilt.size());
            return rebuilt.size();
        }
    }

    @Override
    public List<RetrievedChunk> retrieve(String query, int k, double minScore) {
        List<String> tokens = ChunkAnalyzer.tokenize(query);
        while (true) {
            Bm25Index current = index.get();
            if (current == null) {
                if (unbuiltWarningLogged.compareAndSet(false, true)) {
                    log.warn("Retrieval requested before the index was built; returning no results");
                }
                return List.of();
            }
            if (!current.tryAcquire()) {
                // replaced and closed since we read it
                continue;
            }
            try {
                List<RetrievedChunk> hits = current.search(tokens, k, minScore);
                log.debug("Retrieved {} chunks for {} query tokens", hits.size(), tokens.size());
                return hits;
            } finally {
                current.release();
            }
        }
    }

    @Override
    public List<RetrievedChunk> retrieve(String query) {
        return retrieve(query, defaultTopK, defaultMinScore);
    }

    @Override
    public IndexStatus indexStatus() {
        Bm25Index current = index.get();
        if (current == null) {
            return new IndexStatus(false, documentCount() > 0, 0, null);
        }
        boolean stale = current.generation() != ingestGeneration.get();
        return new IndexStatus(true, stale, current.size(), current.builtAt());
    }

    @Override
    public int documentCount() {
        return database.read(conn -> {
            try (var stmt = conn.createStatement();
                 var rs = stmt.executeQuery("SELECT COUNT(*) FROM documents")) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        });
    }

    @Override
    public void deleteAll() {
        synchronized (rebuildLock) {
            database.write(conn -> {
                try (var stmt = conn.createStatement()) {
                    stmt.executeUpdate("DELETE FROM chunks");
                    stmt.executeUpdate("DELETE FROM documents");
                }
                return null;
            }, () -> publish(Bm25Index.build(List.of(), k1, b,
                    ingestGeneration.incrementAndGet(), clock.instant())));
        }
        log.info("Deleted all documents and chunks");
    }

    private void publish(Bm25Index rebuilt) {
        Bm25Index previous = index.getAndSet(rebuilt);
        if (previous != null) {
            previous.release();
        }
    }

    private record LoadedCorpus(List<IndexedChunk> chunks, long generation) {}
}
