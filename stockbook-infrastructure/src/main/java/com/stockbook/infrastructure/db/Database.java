package com.stockbook.infrastructure.db;

import com.stockbook.application.config.ConfigKey;
import com.stockbook.application.persistence.ConnectionUnavailableException;
import com.stockbook.application.persistence.PersistenceException;
import com.stockbook.application.persistence.TransactionException;
import com.stockbook.application.ports.ConfigPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * SQLite file store: hands out configured connections and owns the schema.
 */
public class Database {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    public static final String DEFAULT_PATH = "data/stockbook.db";
    public static final int DEFAULT_BUSY_TIMEOUT_MS = 5000;

    private static final String SCHEMA = """
        CREATE TABLE IF NOT EXISTS stock (
          id INTEGER PRIMARY KEY AUTOINCREMENT,
          symbol TEXT NOT NULL UNIQUE,
          name TEXT NOT NULL DEFAULT '',
          industry_group TEXT,
          grade TEXT CHECK (grade IN ('A', 'B', 'C')),
          notes TEXT NOT NULL DEFAULT '',
          created_at TEXT NOT NULL,
          updated_at TEXT NOT NULL
        );

        CREATE TABLE IF NOT EXISTS portfolio (
          id INTEGER PRIMARY KEY AUTOINCREMENT,
          name TEXT NOT NULL,
          description TEXT NOT NULL DEFAULT '',
          max_positions INTEGER NOT NULL,
          max_risk_per_trade TEXT NOT NULL,
          is_active INTEGER NOT NULL DEFAULT 1,
          created_at TEXT NOT NULL,
          updated_at TEXT NOT NULL
        );

        CREATE TABLE IF NOT EXISTS stock_transaction (
          id INTEGER PRIMARY KEY AUTOINCREMENT,
          portfolio_id INTEGER NOT NULL REFERENCES portfolio(id),
          stock_id INTEGER NOT NULL REFERENCES stock(id),
          type TEXT NOT NULL CHECK (type IN ('buy', 'sell')),
          quantity TEXT NOT NULL,
          price TEXT NOT NULL,
          transaction_date TEXT NOT NULL,
          notes TEXT NOT NULL DEFAULT '',
          created_at TEXT NOT NULL,
          updated_at TEXT NOT NULL
        );

        CREATE TABLE IF NOT EXISTS target (
          id INTEGER PRIMARY KEY AUTOINCREMENT,
          stock_id INTEGER NOT NULL REFERENCES stock(id),
          portfolio_id INTEGER NOT NULL REFERENCES portfolio(id),
          pivot_price TEXT NOT NULL,
          failure_price TEXT NOT NULL,
          notes TEXT NOT NULL DEFAULT '',
          status TEXT NOT NULL DEFAULT 'active' CHECK (status IN ('active', 'hit', 'failed', 'cancelled')),
          created_at TEXT NOT NULL,
          updated_at TEXT NOT NULL
        );

        CREATE TABLE IF NOT EXISTS portfolio_balance (
          id INTEGER PRIMARY KEY AUTOINCREMENT,
          portfolio_id INTEGER NOT NULL REFERENCES portfolio(id),
          balance_date TEXT NOT NULL,
          withdrawals TEXT NOT NULL,
          deposits TEXT NOT NULL,
          final_balance TEXT NOT NULL,
          index_change TEXT,
          created_at TEXT NOT NULL,
          updated_at TEXT NOT NULL,
          UNIQUE (portfolio_id, balance_date)
        );

        CREATE TABLE IF NOT EXISTS journal_entry (
          id INTEGER PRIMARY KEY AUTOINCREMENT,
          portfolio_id INTEGER REFERENCES portfolio(id) ON DELETE SET NULL,
          stock_id INTEGER REFERENCES stock(id) ON DELETE SET NULL,
          transaction_id INTEGER REFERENCES stock_transaction(id) ON DELETE SET NULL,
          entry_date TEXT NOT NULL,
          title TEXT,
          content TEXT NOT NULL,
          tags TEXT NOT NULL DEFAULT '[]',
          created_at TEXT NOT NULL,
          updated_at TEXT NOT NULL
        );

        CREATE INDEX IF NOT EXISTS idx_tx_portfolio_stock ON stock_transaction(portfolio_id, stock_id);
        CREATE INDEX IF NOT EXISTS idx_tx_date ON stock_transaction(transaction_date);
        CREATE INDEX IF NOT EXISTS idx_target_portfolio_stock ON target(portfolio_id, stock_id);
        CREATE INDEX IF NOT EXISTS idx_target_status ON target(status);
        CREATE INDEX IF NOT EXISTS idx_journal_date ON journal_entry(entry_date);
        """;

    private final Path path;
    private final String url;
    private final int busyTimeoutMs;
    private final AtomicBoolean schemaReady = new AtomicBoolean(false);

    public Database(Path path) {
        this(path, DEFAULT_BUSY_TIMEOUT_MS);
    }

    public Database(Path path, int busyTimeoutMs) {
        if (path == null) throw new IllegalArgumentException("Database path is required");
        if (busyTimeoutMs < 0) throw new IllegalArgumentException("busyTimeoutMs must be >= 0");
        this.path = path;
        this.url = "jdbc:sqlite:" + path;
        this.busyTimeoutMs = busyTimeoutMs;
        ensureDataDir();
    }

    public static Database fromConfig(ConfigPort config) {
        String p = config.get(ConfigKey.DB_PATH.key(), DEFAULT_PATH);
        int timeout = config.getInt(ConfigKey.DB_BUSY_TIMEOUT_MS.key(), DEFAULT_BUSY_TIMEOUT_MS);
        return new Database(Path.of(p.trim()), timeout);
    }

    public Path path() { return path; }
    public String url() { return url; }

    private void ensureDataDir() {
        Path parent = path.toAbsolutePath().getParent();
        if (parent == null) return;
        try {
            Files.createDirectories(parent);
        } catch (IOException e) {
            throw new ConnectionUnavailableException("Failed to create database directory " + parent, e);
        }
    }

    /**
     * Opens a new connection with foreign keys, WAL and the busy timeout applied. The caller closes it.
     */
    public Connection acquire() {
        Connection c = null;
        try {
            c = DriverManager.getConnection(url);
            try (Statement st = c.createStatement()) {
                st.execute("PRAGMA foreign_keys=ON;");
                st.execute("PRAGMA journal_mode=WAL;");
                st.execute("PRAGMA busy_timeout=" + busyTimeoutMs + ";");
            }
            return c;
        } catch (SQLException e) {
            ConnectionUnavailableException ex = new ConnectionUnavailableException("Failed to connect to SQLite: " + url, e);
            closeQuietly(c, ex);
            throw ex;
        }
    }

    /**
     * Runs {@code work} in its own transaction: commit on success, rollback on any failure,
     * connection always closed.
     */
    public <T> T withinTransaction(String operation, SqlWork<T> work) {
        Connection c = acquire();
        try {
            c.setAutoCommit(false);
            T result = work.apply(c);
            try {
                c.commit();
            } catch (SQLException e) {
                throw new TransactionException(operation + ": commit failed", e);
            }
            return result;
        } catch (SQLException e) {
            PersistenceException ex = SqlErrors.translate(operation, e);
            rollbackQuietly(c, ex);
            throw ex;
        } catch (RuntimeException | Error e) {
            rollbackQuietly(c, e);
            throw e;
        } finally {
            closeQuietly(c, null);
        }
    }

    /** Creates tables and indexes. Runs once per instance; later calls do nothing. */
    public void initSchema() {
        if (!schemaReady.compareAndSet(false, true)) return;
        try (Connection c = acquire(); Statement st = c.createStatement()) {
            for (String sql : SCHEMA.split(";")) {
                if (!sql.isBlank()) st.execute(sql);
            }
            log.info("Schema ready at {}", path);
        } catch (SQLException e) {
            schemaReady.set(false);
            throw new PersistenceException("initSchema() error", e);
        } catch (RuntimeException e) {
            schemaReady.set(false);
            throw e;
        }
    }

    private static void rollbackQuietly(Connection c, Throwable primary) {
        try {
            c.rollback();
        } catch (SQLException e) {
            log.warn("Rollback failed: {}", e.getMessage());
            primary.addSuppressed(e);
        }
    }

    static void closeQuietly(Connection c, Throwable primary) {
        if (c == null) return;
        try {
            c.close();
        } catch (SQLException e) {
            log.warn("Failed to close connection: {}", e.getMessage());
            if (primary != null) primary.addSuppressed(e);
        }
    }
}
