package com.stockbook.infrastructure.db;

import com.stockbook.domain.money.CurrencyCode;
import com.stockbook.domain.money.CurrencyMismatchException;
import com.stockbook.domain.money.Money;

import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.LongConsumer;

/**
 * JDBC plumbing shared by the SQLite repositories. Money and quantities are stored as plain
 * decimal text so nothing passes through a double; dates are ISO-8601 text.
 */
abstract class SqliteRepository {

    protected final ConnectionHandle handle;
    protected final CurrencyCode currency;

    protected SqliteRepository(ConnectionHandle handle, CurrencyCode currency) {
        this.handle = Objects.requireNonNull(handle, "handle");
        this.currency = Objects.requireNonNull(currency, "currency");
    }

    public boolean isTransactional() {
        return handle.isTransactional();
    }

    protected <T> Optional<T> queryOne(String operation, String sql, RowMapper<T> mapper, Object... args) {
        return handle.execute(operation, c -> {
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                bind(ps, args);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? Optional.of(mapper.map(rs)) : Optional.<T>empty();
                }
            }
        });
    }

    protected <T> List<T> queryList(String operation, String select, SqlWhere where, String orderBy,
                                    Integer limit, Integer offset, RowMapper<T> mapper) {
        String sql = select + where.finish(orderBy, limit, offset);
        return handle.execute(operation, c -> {
            List<T> out = new ArrayList<>();
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                where.bind(ps);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) out.add(mapper.map(rs));
                }
            }
            return out;
        });
    }

    /**
     * Ids come only from the first insert; an entity that already has one is not inserted again.
     */
    protected static void requireNew(Long id, String what) {
        if (id != null) {
            throw new IllegalStateException(what + " is already stored with id " + id);
        }
    }

    /** Gives the entity its new id, taken back again if the surrounding transaction rolls back. */
    protected void assigned(long id, LongConsumer assign, Runnable clear) {
        assign.accept(id);
        handle.onRollback(clear);
    }

    /** Runs an UPDATE or DELETE and reports whether any row matched. */
    protected boolean change(String operation, String sql, Object... args) {
        return handle.execute(operation, c -> {
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                bind(ps, args);
                return ps.executeUpdate() > 0;
            }
        });
    }

    /** Executes an INSERT and returns the new row id. */
    protected static long insert(Connection c, String sql, Object... args) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            bind(ps, args);
            ps.executeUpdate();
        }
        try (Statement st = c.createStatement(); ResultSet rs = st.executeQuery("SELECT last_insert_rowid()")) {
            if (rs.next()) return rs.getLong(1);
        }
        throw new SQLException("Failed to obtain id of the new row");
    }

    protected static void bind(PreparedStatement ps, Object... args) throws SQLException {
        for (int i = 0; i < args.length; i++) {
            ps.setObject(i + 1, args[i]);
        }
    }

    protected static String now() {
        return Instant.now().toString();
    }

    /** Column text for a money value; only the store currency can be written. */
    protected String text(Money m) {
        if (m.currency() != currency) {
            throw new CurrencyMismatchException("store", currency, m.currency());
        }
        return m.amount().toPlainString();
    }

    protected static String text(BigDecimal v) {
        return v == null ? null : v.toPlainString();
    }

    protected static String text(LocalDate d) {
        return d.toString();
    }

    protected Money money(ResultSet rs, String column) throws SQLException {
        return Money.of(new BigDecimal(rs.getString(column)), currency);
    }

    protected static BigDecimal decimal(ResultSet rs, String column) throws SQLException {
        String v = rs.getString(column);
        return v == null ? null : new BigDecimal(v);
    }

    protected static LocalDate date(ResultSet rs, String column) throws SQLException {
        return LocalDate.parse(rs.getString(column));
    }

    protected static Long nullableLong(ResultSet rs, String column) throws SQLException {
        long v = rs.getLong(column);
        return rs.wasNull() ? null : v;
    }
}
