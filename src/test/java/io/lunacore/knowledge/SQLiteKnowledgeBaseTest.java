package io.lunacore.knowledge;

import io.lunacore.MutableClock;
import io.lunacore.core.InvalidInputException;
import io.lunacore.storage.LunaDatabase;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class SQLiteKnowledgeBaseTest {

    @TempDir
    Path tempDir;

    private LunaDatabase database;
    private SQLiteKnowledgeBase knowledgeBase;

    @BeforeEach
    void setUp() {
        database = new LunaDatabase(tempDir.resolve("luna.db").toString());
        database.init();
        knowledgeBase = new SQLiteKnowledgeBase(database, new DocumentChunker(1200), new MutableClock(),
                5, 0.0, 1.5, 0.75);
    }

    @AfterEach
    void tearDown() {
        database.close();
    }

    @Test
    void shouldReturnEmptyBeforeFirstRebuild() {
        knowledgeBase.ingestText("manual", "Audio output goes through the headphone jack.");

        assertTrue(knowledgeBase.retrieve("audio").isEmpty());
        IndexStatus status = knowledgeBase.indexStatus();
        assertFalse(status.built());
        assertTrue(status.stale());
        assertNull(status.builtAt());
    }

    @Test
    void shouldRetrieveAfterRebuild() {
        knowledgeBase.ingestText("manual", "Audio output goes through the headphone jack.");
        knowledgeBase.ingestText("recipes", "Boil water before adding the pasta.");

        assertEquals(2, knowledgeBase.rebuildIndex());
        List<RetrievedChunk> hits = knowledgeBase.retrieve("headphone audio");

        assertEquals(1, hits.size());
        assertEquals("manual", hits.get(0).source());
        assertEquals(0, hits.get(0).sequenceNo());
    }

    @Test
    void shouldNotSeeNewDocumentsUntilNextRebuild() {
        knowledgeBase.ingestText("a", "The quick brown fox.");
        knowledgeBase.rebuildIndex();
        knowledgeBase.ingestText("b", "Zebras are striped.");

        assertTrue(knowledgeBase.retrieve("zebras").isEmpty());
        assertTrue(knowledgeBase.indexStatus().stale());

        knowledgeBase.rebuildIndex();
        assertEquals(1, knowledgeBase.retrieve("zebras").size());
        assertFalse(knowledgeBase.indexStatus().stale());
    }

    @Test
    void shouldStoreChunksInOrder() {
        String text = "x".repeat(800) + "\n\n" + "y".repeat(800) + "\n\n" + "z".repeat(800);
        String documentId = knowledgeBase.ingestText("long", text);

        List<Integer> sequence = database.read(conn -> {
            try (var stmt = conn.prepareStatement(
                    "SELECT sequence_no FROM chunks WHERE document_id = ? ORDER BY sequence_no")) {
                stmt.setString(1, documentId);
                try (var rs = stmt.executeQuery()) {
                    var numbers = new java.util.ArrayList<Integer>();
                    while (rs.next()) {
                        numbers.add(rs.getInt(1));
                    }
                    return numbers;
                }
            }
        });
        assertEquals(List.of(0, 1, 2), sequence);
    }

    @Test
    void shouldReturnSameResultsForSameQuery() {
        knowledgeBase.ingestText("a", "red fox jumps");
        knowledgeBase.ingestText("b", "red dog sleeps");
        knowledgeBase.ingestText("c", "blue fox runs");
        knowledgeBase.rebuildIndex();

        assertEquals(knowledgeBase.retrieve("red fox", 3, 0.0), knowledgeBase.retrieve("red fox", 3, 0.0));
    }

    @Test
    void shouldApplyMinScore() {
        knowledgeBase.ingestText("a", "red fox jumps");
        knowledgeBase.rebuildIndex();

        assertEquals(1, knowledgeBase.retrieve("fox", 5, 0.0).size());
        assertTrue(knowledgeBase.retrieve("fox", 5, 100.0).isEmpty());
    }

    @Test
    void shouldAnswerFromReplacementSnapshotAfterRebuild() {
        knowledgeBase.ingestText("manual", "Charge the Pi over USB-C.");
        knowledgeBase.rebuildIndex();
        assertEquals(1, knowledgeBase.retrieve("usb c").size());

        knowledgeBase.ingestText("manual", "The USB-C port also carries audio.");
        knowledgeBase.rebuildIndex();

        List<RetrievedChunk> hits = knowledgeBase.retrieve("USB-C audio");
        assertEquals(2, hits.size());
        assertTrue(hits.get(0).text().contains("audio"));
    }

    @Test
    void shouldRejectEmptyInput() {
        assertThrows(InvalidInputException.class, () -> knowledgeBase.ingestText("", "text"));
        assertThrows(InvalidInputException.class, () -> knowledgeBase.ingestText("src", "  \n\n "));
        assertEquals(0, knowledgeBase.documentCount());
    }

    @Test
    void shouldBuildEmptyIndexFromEmptyStore() {
        assertEquals(0, knowledgeBase.rebuildIndex());
        assertTrue(knowledgeBase.retrieve("anything").isEmpty());
        assertTrue(knowledgeBase.indexStatus().built());
    }

    @Test
    void shouldClearDocumentsAndIndex() {
        knowledgeBase.ingestText("a", "red fox jumps");
        knowledgeBase.rebuildIndex();

        knowledgeBase.deleteAll();

        assertEquals(0, knowledgeBase.documentCount());
        assertTrue(knowledgeBase.retrieve("fox").isEmpty());
        assertEquals(0, knowledgeBase.indexStatus().chunkCount());
        assertFalse(knowledgeBase.indexStatus().stale());
    }

    @Test
    void shouldServeRetrievalWhileRebuilding() throws Exception {
        for (int i = 0; i < 20; i++) {
            knowledgeBase.ingestText("doc" + i, "shared term plus unique" + i);
        }
        knowledgeBase.rebuildIndex();

        ExecutorService pool = Executors.newFixedThreadPool(3);
        try {
            Future<?> rebuilder = pool.submit(() -> {
                for (int i = 0; i < 20; i++) {
                    knowledgeBase.rebuildIndex();
                }
            });
            Future<Integer> reader = pool.submit(() -> {
                int answered = 0;
                for (int i = 0; i < 200; i++) {
                    // Every published snapshot holds all 20 documents
                    assertEquals(5, knowledgeBase.retrieve("shared").size());
                    answered++;
                }
                return answered;
            });
            rebuilder.get(30, TimeUnit.SECONDS);
            assertEquals(200, reader.get(30, TimeUnit.SECONDS));
        } finally {
            pool.shutdown();
        }
    }
}
