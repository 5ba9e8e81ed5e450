package io.hivememory.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The engine's single embedded SQLite database.
 *
 * <p>One connection in WAL mode, guarded by a reentrant lock: every unit of work
 * runs with the lock held, and {@link #write(SqlWork)} wraps it in a transaction.
 * Nested writes join the outer transaction.</p>
 *
 * <p>Core tables are created by {@link #open()}; optional tables are created on
 * first use through {@link #ensureTable(SchemaTable)}.</p>
 */
public class MemoryDatabase implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MemoryDatabase.class);

    private final String dbPath;
    private final ReentrantLock lock = new ReentrantLock();
    private final Set<SchemaTable> migrated = ConcurrentHashMap.newKeySet();
    private Connection connection;
    private boolean inTransaction;

    public MemoryDatabase(String dbPath) {
        this.dbPath = dbPath;
    }

    /**
     * Opens the database under {@code directory}, creating the directory if needed.
     */
    public static MemoryDatabase inDirectory(Path directory) {
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            log.error("Failed to create memory directory: {}", directory, e);
        }
        return new MemoryDatabase(directory.resolve("hive.db").toString());
    }

    public void open() {
        lock.lock();
        try {
            if (connection != null) {
                return;
            }
            connection = DriverManager.getConnection("jdbc:sqlite:" + dbPath);
            try (var stmt = connection.createStatement()) {
                stmt.execute("PRAGMA journal_mode=WAL");
                stmt.execute("PRAGMA busy_timeout=5000");
            }
            migrateLegacyColumns();
            for (SchemaTable table : SchemaTable.values()) {
                if (table.isCore()) {
                    createTable(table);
                }
            }
            log.info("MemoryDatabase opened at: {}", dbPath);
        } catch (SQLException e) {
            log.error("Failed to open memory database at {}", dbPath, e);
            throw new StorageException("Memory database initialization failed", e);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs {@code work} with the connection lock held, outside any explicit transaction.
     */
    public <T> T read(SqlWork<T> work) {
        lock.lock();
        try {
            return work.execute(requireConnection());
        } catch (SQLException e) {
            throw new StorageException("Read failed: " + e.getMessage(), e);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs {@code work} atomically. Either every statement commits or none does.
     */
    public <T> T write(SqlWork<T> work) {
        lock.lock();
        try {
            Connection conn = requireConnection();
            if (inTransaction) {
                return work.execute(conn);
            }
            inTransaction = true;
            conn.setAutoCommit(false);
            try {
                T result = work.execute(conn);
                conn.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                rollbackQuietly(conn, e);
                throw e;
            } finally {
                inTransaction = false;
                conn.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StorageException("Write failed: " + e.getMessage(), e);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Creates {@code table} and its indexes if they do not exist yet. Idempotent and cheap
     * after the first call.
     */
    public void ensureTable(SchemaTable table) {
        if (migrated.contains(table)) {
            return;
        }
        lock.lock();
        try {
            if (!migrated.contains(table)) {
                createTable(table);
                log.debug("Ensured table {}", table.tableName());
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to create table " + table.tableName(), e);
        } finally {
            lock.unlock();
        }
    }

    public boolean healthCheck() {
        lock.lock();
        try (var stmt = requireConnection().createStatement();
             var rs = stmt.executeQuery("SELECT 1")) {
            return rs.next();
        } catch (SQLException | StorageException e) {
            return false;
        } finally {
            lock.unlock();
        }
    }

    public String getPath() {
        return dbPath;
    }

    @Override
    public void close() {
        lock.lock();
        try {
            if (connection != null) {
                connection.close();
                connection = null;
                migrated.clear();
                log.info("MemoryDatabase closed");
            }
        } catch (SQLException e) {
            log.error("Failed to close SQLite connection", e);
        } finally {
            lock.unlock();
        }
    }

    private void createTable(SchemaTable table) throws SQLException {
        try (var stmt = requireConnection().createStatement()) {
            for (String sql : table.ddl()) {
                stmt.execute(sql);
            }
        }
        migrated.add(table);
    }

    /**
     * Older database files predate the modification-tracking columns. Runs before the
     * core DDL because the indexes reference those columns.
     */
    private void migrateLegacyColumns() throws SQLException {
        ensureColumn("memory_entries", "ttl_seconds", "INTEGER NOT NULL DEFAULT 0");
        ensureColumn("memory_entries", "updated_at", "INTEGER NOT NULL DEFAULT 0");
        ensureColumn("memory_entries", "last_modified", "INTEGER NOT NULL DEFAULT 0");
        ensureColumn("memory_entries", "origin_node", "TEXT");
    }

    private void ensureColumn(String table, String column, String definition) throws SQLException {
        Set<String> columns = new HashSet<>();
        try (var stmt = requireConnection().createStatement();
             var rs = stmt.executeQuery("PRAGMA table_info(" + table + ")")) {
            while (rs.next()) {
                columns.add(rs.getString("name"));
            }
        }
        if (!columns.isEmpty() && !columns.contains(column)) {
            try (var stmt = requireConnection().createStatement()) {
                stmt.execute("ALTER TABLE " + table + " ADD COLUMN " + column + " " + definition);
            }
            log.info("Added missing column {}.{}", table, column);
        }
    }

    private Connection requireConnection() {
        if (connection == null) {
            throw new StorageException("Memory database not opened", null);
        }
        return connection;
    }

    private static void rollbackQuietly(Connection conn, Exception cause) {
        try {
            conn.rollback();
        } catch (SQLException e) {
            cause.addSuppressed(e);
        }
    }
}
