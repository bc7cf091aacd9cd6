package io.lunacore.storage;

import io.lunacore.core.StorageConfigurationException;
import io.lunacore.core.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Single SQLite database shared by the fact store, the turn ledger and the knowledge base.
 *
 * <p>Schema:</p>
 * <ul>
 *   <li>{@code sessions}: conversation sessions with JSON metadata</li>
 *   <li>{@code turns}: append-only conversation log with per-stage latencies</li>
 *   <li>{@code memories}: key/value facts, unique on (key, pinned)</li>
 *   <li>{@code documents} / {@code chunks}: ingested text, chunk order kept per document</li>
 * </ul>
 *
 * <p>Writers are serialized through the write half of a read/write lock and run inside one
 * transaction, so no reader ever sees a partially applied write.</p>
 */
public class LunaDatabase {

    private static final Logger log = LoggerFactory.getLogger(LunaDatabase.class);

    private final Path dbPath;
    private final ReadWriteLock lock = new ReentrantReadWriteLock(true);
    private Connection connection;

    public LunaDatabase(String dbPath) {
        if (dbPath == null || dbPath.isBlank()) {
            throw new StorageConfigurationException("Storage path must not be empty");
        }
        this.dbPath = Path.of(dbPath).toAbsolutePath();
    }

    public void init() {
        if (Files.isDirectory(dbPath)) {
            throw new StorageConfigurationException("Storage path is a directory: " + dbPath);
        }
        Path parent = dbPath.getParent();
        try {
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new StorageConfigurationException("Cannot create storage directory: " + parent, e);
        }

        try {
            connection = DriverManager.getConnection("jdbc:sqlite:" + dbPath);
            try (var stmt = connection.createStatement()) {
                stmt.execute("PRAGMA journal_mode=WAL");
                stmt.execute("PRAGMA synchronous=NORMAL");
                stmt.execute("PRAGMA temp_store=MEMORY");
                stmt.execute("PRAGMA foreign_keys=ON");
                stmt.execute("PRAGMA busy_timeout=5000");
            }
            createSchema();
            log.info("Luna database opened at: {}", dbPath);
        } catch (SQLException e) {
            throw new StorageConfigurationException("Cannot open SQLite database at " + dbPath, e);
        }
    }

    private void createSchema() throws SQLException {
        try (var stmt = connection.createStatement()) {
            stmt.execute("""
                CREATE TABLE IF NOT EXISTS sessions (
                    id TEXT PRIMARY KEY,
                    started_at INTEGER NOT NULL,
                    metadata TEXT
                )
                """);

            stmt.execute("""
                CREATE TABLE IF NOT EXISTS turns (
                    id INTEGER PRIMARY KEY AUTOINCREMENT,
                    session_id TEXT NOT NULL,
                    role TEXT NOT NULL,
                    text TEXT NOT NULL,
                    asr_latency_ms INTEGER NOT NULL DEFAULT 0,
                    llm_latency_ms INTEGER NOT NULL DEFAULT 0,
                    tts_latency_ms INTEGER NOT NULL DEFAULT 0,
                    created_at INTEGER NOT NULL,
                    FOREIGN KEY (session_id) REFERENCES sessions(id)
                )
                """);

            stmt.execute("""
                CREATE INDEX IF NOT EXISTS idx_turns_session ON turns(session_id, id)
                """);

            stmt.execute("""
                CREATE TABLE IF NOT EXISTS memories (
                    id INTEGER PRIMARY KEY AUTOINCREMENT,
                    key TEXT NOT NULL,
                    value TEXT NOT NULL,
                    score REAL NOT NULL DEFAULT 1.0,
                    pinned INTEGER NOT NULL DEFAULT 0,
                    created_at INTEGER NOT NULL,
                    UNIQUE (key, pinned)
                )
                """);

            stmt.execute("""
                CREATE INDEX IF NOT EXISTS idx_memories_pinned_created ON memories(pinned, created_at, id)
                """);

            stmt.execute("""
                CREATE TABLE IF NOT EXISTS documents (
                    id TEXT PRIMARY KEY,
                    source TEXT NOT NULL,
                    created_at INTEGER NOT NULL
                )
                """);

            stmt.execute("""
                CREATE TABLE IF NOT EXISTS chunks (
                    id INTEGER PRIMARY KEY AUTOINCREMENT,
                    document_id TEXT NOT NULL,
                    sequence_no INTEGER NOT NULL,
                    text TEXT NOT NULL,
                    FOREIGN KEY (document_id) REFERENCES documents(id),
                    UNIQUE (document_id, sequence_no)
                )
                """);
        }
    }

    /**
     * Runs read-only work. Concurrent readers are allowed; writers are excluded.
     */
    public <T> T read(SqlWork<T> work) {
        lock.readLock().lock();
        try {
            return work.execute(requireOpen());
        } catch (SQLException e) {
            throw new StorageException("Storage read failed: " + e.getMessage(), e);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Runs work in a single transaction while holding the writer lock.
     * The transaction is rolled back when the work throws.
     */
    public <T> T write(SqlWork<T> work) {
        lock.writeLock().lock();
        try {
            Connection conn = requireOpen();
            conn.setAutoCommit(false);
            try {
                T result = work.execute(conn);
                conn.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                rollbackQuietly(conn, e);
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StorageException("Storage write failed: " + e.getMessage(), e);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Runs work while holding the writer lock, then the supplied callback before the lock is released.
     * Lets callers make in-memory state changes atomic with the committed write.
     */
    public <T> T write(SqlWork<T> work, Runnable afterCommit) {
        lock.writeLock().lock();
        try {
            T result = write(work);
            afterCommit.run();
            return result;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Rebuilds the database file to reclaim space left by deletes.
     */
    public void compact() {
        lock.writeLock().lock();
        try (var stmt = requireOpen().createStatement()) {
            stmt.execute("PRAGMA wal_checkpoint(TRUNCATE)");
            stmt.execute("VACUUM");
            log.info("Compacted database: {}", dbPath);
        } catch (SQLException e) {
            throw new StorageException("Storage compaction failed: " + e.getMessage(), e);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean healthCheck() {
        try {
            return read(conn -> {
                try (var stmt = conn.createStatement();
                     var rs = stmt.executeQuery("SELECT 1")) {
                    return rs.next();
                }
            });
        } catch (StorageException e) {
            return false;
        }
    }

    public Path path() {
        return dbPath;
    }

    public void close() {
        if (connection != null) {
            try {
                connection.close();
                log.info("Luna database closed");
            } catch (SQLException e) {
                log.error("Failed to close SQLite connection", e);
            }
        }
    }

    private Connection requireOpen() throws SQLException {
        if (connection == null || connection.isClosed()) {
            throw new SQLException("Database is not open: " + dbPath);
        }
        return connection;
    }

    private void rollbackQuietly(Connection conn, Exception cause) {
        try {
            conn.rollback();
        } catch (SQLException rollbackFailure) {
            cause.addSuppressed(rollbackFailure);
        }
    }
}
