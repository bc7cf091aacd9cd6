package io.lunacore.ledger;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.lunacore.MutableClock;
import io.lunacore.core.InvalidInputException;
import io.lunacore.core.StorageException;
import io.lunacore.storage.LunaDatabase;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SQLiteTurnLedgerTest {

    @TempDir
    Path tempDir;

    private final MutableClock clock = new MutableClock();
    private LunaDatabase database;
    private SQLiteTurnLedger ledger;

    @BeforeEach
    void setUp() {
        database = new LunaDatabase(tempDir.resolve("luna.db").toString());
        database.init();
        ledger = new SQLiteTurnLedger(database, new ObjectMapper(), clock);
    }

    @AfterEach
    void tearDown() {
        database.close();
    }

    @Test
    void shouldAppendTurnsInOrder() {
        ledger.startSession("s1", Map.of("device", "kitchen"));
        Turn user = ledger.addTurn("s1", TurnRole.USER, "What time is it?", TurnLatencies.NONE);
        Turn assistant = ledger.addTurn("s1", TurnRole.ASSISTANT, "It is noon.", new TurnLatencies(120, 800, 300));

        assertTrue(assistant.id() > user.id());
        List<Turn> turns = ledger.getSessionTurns("s1");
        assertEquals(2, turns.size());
        assertEquals(TurnRole.USER, turns.get(0).role());
        assertEquals("It is noon.", turns.get(1).text());
        assertEquals(1220, turns.get(1).latencies().totalMs());
    }

    @Test
    void shouldCreateSessionImplicitlyOnFirstTurn() {
        ledger.addTurn("implicit", TurnRole.USER, "hello", null);

        List<Session> sessions = ledger.listSessions();
        assertEquals(1, sessions.size());
        assertEquals("implicit", sessions.get(0).id());
        assertTrue(sessions.get(0).metadata().isEmpty());
    }

    @Test
    void shouldKeepTurnsWhenSessionIsRestarted() {
        ledger.startSession("s1", Map.of("v", 1));
        ledger.addTurn("s1", TurnRole.USER, "first", TurnLatencies.NONE);
        clock.advance(Duration.ofMinutes(1));

        ledger.startSession("s1", Map.of("v", 2));

        assertEquals(1, ledger.getSessionTurns("s1").size());
        assertEquals(2, ledger.listSessions().get(0).metadata().get("v"));
    }

    @Test
    void shouldReturnMostRecentTurnsOldestFirst() {
        for (int i = 0; i < 5; i++) {
            ledger.addTurn("s1", TurnRole.USER, "turn " + i, TurnLatencies.NONE);
        }

        List<Turn> recent = ledger.getRecentTurns("s1", 2);
        assertEquals(List.of("turn 3", "turn 4"), recent.stream().map(Turn::text).toList());
        assertTrue(ledger.getRecentTurns("s1", 0).isEmpty());
    }

    @Test
    void shouldGenerateSessionIds() {
        Session a = ledger.startSession(null);
        Session b = ledger.startSession(Map.of());

        assertNotEquals(a.id(), b.id());
        assertEquals(2, ledger.listSessions().size());
    }

    @Test
    void shouldIsolateSessions() {
        ledger.addTurn("a", TurnRole.USER, "for a", TurnLatencies.NONE);
        ledger.addTurn("b", TurnRole.USER, "for b", TurnLatencies.NONE);

        assertEquals(List.of("for a"), ledger.getSessionTurns("a").stream().map(Turn::text).toList());
        assertTrue(ledger.getSessionTurns("unknown").isEmpty());
    }

    @Test
    void shouldRejectInvalidTurns() {
        assertThrows(InvalidInputException.class, () -> ledger.addTurn("", TurnRole.USER, "x", null));
        assertThrows(InvalidInputException.class, () -> ledger.addTurn("s1", null, "x", null));
        assertThrows(InvalidInputException.class, () -> ledger.addTurn("s1", TurnRole.USER, null, null));
        assertThrows(InvalidInputException.class, () -> new TurnLatencies(-1, 0, 0));
        assertThrows(InvalidInputException.class, () -> ledger.getRecentTurns("s1", -1));
        assertTrue(ledger.listSessions().isEmpty());
    }

    @Test
    void shouldParseRoles() {
        assertEquals(TurnRole.USER, TurnRole.fromString(" User "));
        assertEquals(TurnRole.ASSISTANT, TurnRole.fromString("assistant"));
        assertThrows(InvalidInputException.class, () -> TurnRole.fromString("system"));
    }

    @Test
    void shouldAppendExchangeInOneCall() {
        var latencies = new TurnLatencies(90, 650, 200);

        List<Turn> turns = ledger.addTurns("s1", List.of(
                new TurnEntry(TurnRole.USER, "Turn on the lights", null),
                new TurnEntry(TurnRole.ASSISTANT, "Done.", latencies)));

        assertEquals(2, turns.size());
        assertTrue(turns.get(0).id() < turns.get(1).id());
        assertEquals(TurnLatencies.NONE, turns.get(0).latencies());
        assertEquals(turns, ledger.getSessionTurns("s1"));
        assertEquals(1, ledger.listSessions().size());
    }

    @Test
    void shouldStoreNothingWhenAnyEntryIsInvalid() {
        assertThrows(InvalidInputException.class, () -> ledger.addTurns("s1", List.of(
                new TurnEntry(TurnRole.USER, "hello", null),
                new TurnEntry(TurnRole.ASSISTANT, null, null))));
        assertThrows(InvalidInputException.class, () -> ledger.addTurns("s1", List.of()));

        assertTrue(ledger.getSessionTurns("s1").isEmpty());
        assertTrue(ledger.listSessions().isEmpty());
    }

    @Test
    void shouldRollBackFirstTurnWhenSecondInsertFails() {
        database.write(conn -> {
            try (var stmt = conn.createStatement()) {
                stmt.execute("""
                    CREATE TRIGGER reject_failing_reply BEFORE INSERT ON turns
                    WHEN NEW.text = 'unwritable'
                    BEGIN SELECT RAISE(ABORT, 'rejected'); END
                    """);
            }
            return null;
        });

        assertThrows(StorageException.class, () -> ledger.addTurns("s1", List.of(
                new TurnEntry(TurnRole.USER, "hello", null),
                new TurnEntry(TurnRole.ASSISTANT, "unwritable", null))));

        assertTrue(ledger.getSessionTurns("s1").isEmpty());
        assertTrue(ledger.listSessions().isEmpty());
    }
}
