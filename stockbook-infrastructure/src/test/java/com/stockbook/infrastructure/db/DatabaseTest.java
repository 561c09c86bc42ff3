package com.stockbook.infrastructure.db;

import com.stockbook.application.persistence.ConnectionUnavailableException;
import com.stockbook.application.persistence.PersistenceException;
import com.stockbook.application.ports.ConfigPort;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class DatabaseTest {

    @TempDir
    Path dir;

    @Test
    void createsParentDirectoryAndSchema() throws Exception {
        Database db = new Database(dir.resolve("nested/book.db"));
        assertThat(Files.isDirectory(dir.resolve("nested"))).isTrue();

        db.initSchema();
        db.initSchema();

        List<String> tables = new ArrayList<>();
        try (Connection c = db.acquire(); Statement st = c.createStatement();
             ResultSet rs = st.executeQuery("SELECT name FROM sqlite_master WHERE type='table' AND name NOT LIKE 'sqlite_%'")) {
            while (rs.next()) tables.add(rs.getString(1));
        }
        assertThat(tables).containsExactlyInAnyOrder(
                "stock", "portfolio", "stock_transaction", "target", "portfolio_balance", "journal_entry");
    }

    @Test
    void connectionsEnforceForeignKeys() throws Exception {
        Database db = new Database(dir.resolve("fk.db"));
        try (Connection c = db.acquire(); Statement st = c.createStatement();
             ResultSet rs = st.executeQuery("PRAGMA foreign_keys")) {
            assertThat(rs.next()).isTrue();
            assertThat(rs.getInt(1)).isEqualTo(1);
        }
    }

    @Test
    void withinTransactionRollsBackOnFailure() throws Exception {
        Database db = new Database(dir.resolve("tx.db"));
        db.initSchema();

        assertThatThrownBy(() -> db.withinTransaction("insert then fail", c -> {
            try (Statement st = c.createStatement()) {
                st.executeUpdate("INSERT INTO stock(symbol, name, created_at, updated_at) VALUES('AAPL','Apple','t','t')");
            }
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class).hasMessage("boom");

        int count = db.withinTransaction("count", c -> {
            try (Statement st = c.createStatement(); ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM stock")) {
                rs.next();
                return rs.getInt(1);
            }
        });
        assertThat(count).isZero();
    }

    @Test
    void sqlErrorsAreTranslated() {
        Database db = new Database(dir.resolve("err.db"));
        db.initSchema();

        assertThatThrownBy(() -> db.withinTransaction("bad sql", c -> {
            try (Statement st = c.createStatement()) {
                return st.executeUpdate("INSERT INTO nowhere VALUES(1)");
            }
        })).isInstanceOf(PersistenceException.class).hasMessageStartingWith("bad sql failed");
    }

    @Test
    void unusableParentDirectoryFailsFast() throws Exception {
        Path blocker = Files.writeString(dir.resolve("blocker"), "not a directory");

        assertThatThrownBy(() -> new Database(blocker.resolve("book.db")))
                .isInstanceOf(ConnectionUnavailableException.class)
                .hasMessageContaining("database directory");
    }

    @Test
    void directoryInPlaceOfDatabaseFileIsUnavailable() throws Exception {
        Path folder = Files.createDirectory(dir.resolve("book.db"));
        Database db = new Database(folder);

        assertThatThrownBy(db::acquire)
                .isInstanceOf(ConnectionUnavailableException.class)
                .hasMessageContaining("jdbc:sqlite:" + folder);
        assertThatThrownBy(db::initSchema).isInstanceOf(ConnectionUnavailableException.class);
    }

    @Test
    void fromConfigReadsPathAndTimeout() {
        ConfigPort config = mock(ConfigPort.class);
        Path file = dir.resolve("cfg/stockbook.db");
        when(config.get(eq("db.path"), anyString())).thenReturn(file.toString());
        when(config.getInt(eq("db.busyTimeoutMs"), anyInt())).thenReturn(250);

        Database db = Database.fromConfig(config);

        assertThat(db.path()).isEqualTo(file);
        assertThat(db.url()).isEqualTo("jdbc:sqlite:" + file);
    }
}
