package com.stockbook.infrastructure.db;

import com.stockbook.application.ports.TargetFilter;
import com.stockbook.application.ports.TargetRepository;
import com.stockbook.domain.money.CurrencyCode;
import com.stockbook.domain.target.Target;
import com.stockbook.domain.target.TargetStatus;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

public class SqliteTargetRepository extends SqliteRepository implements TargetRepository {

    private static final String SELECT =
            "SELECT id,stock_id,portfolio_id,pivot_price,failure_price,notes,status FROM target";

    public SqliteTargetRepository(ConnectionHandle handle, CurrencyCode currency) {
        super(handle, currency);
    }

    @Override
    public long create(Target t) {
        requireNew(t.id(), "Target");
        String now = now();
        String pivot = text(t.pivotPrice());
        String failure = text(t.failurePrice());
        long id = handle.execute("create target", c -> insert(c, """
                INSERT INTO target(stock_id, portfolio_id, pivot_price, failure_price, notes, status, created_at, updated_at)
                VALUES(?,?,?,?,?,?,?,?)
                """,
                t.stockId(), t.portfolioId(), pivot, failure, t.notes(), t.status().code(), now, now));
        assigned(id, t::assignId, t::clearId);
        return id;
    }

    @Override
    public Optional<Target> getById(long id) {
        return queryOne("get target", SELECT + " WHERE id=?", this::map, id);
    }

    @Override
    public List<Target> list(TargetFilter filter) {
        TargetFilter f = filter == null ? TargetFilter.all() : filter;
        SqlWhere where = new SqlWhere()
                .eq("portfolio_id", f.portfolioId())
                .eq("stock_id", f.stockId())
                .eq("status", f.status() == null ? null : f.status().code());
        return queryList("list targets", SELECT, where, "id", f.limit(), f.offset(), this::map);
    }

    @Override
    public List<Target> listActive() {
        return list(TargetFilter.all().withStatus(TargetStatus.ACTIVE));
    }

    @Override
    public boolean update(long id, Target t) {
        String pivot = text(t.pivotPrice());
        String failure = text(t.failurePrice());
        return change("update target " + id, """
                UPDATE target SET stock_id=?, portfolio_id=?, pivot_price=?, failure_price=?, notes=?, status=?, updated_at=?
                WHERE id=?
                """,
                t.stockId(), t.portfolioId(), pivot, failure, t.notes(), t.status().code(), now(), id);
    }

    @Override
    public boolean updateStatus(long id, TargetStatus status) {
        Objects.requireNonNull(status, "status");
        return change("update target status " + id,
                "UPDATE target SET status=?, updated_at=? WHERE id=?", status.code(), now(), id);
    }

    @Override
    public boolean delete(long id) {
        return change("delete target " + id, "DELETE FROM target WHERE id=?", id);
    }

    private Target map(ResultSet rs) throws SQLException {
        return Target.restore(
                rs.getLong("id"),
                rs.getLong("stock_id"),
                rs.getLong("portfolio_id"),
                money(rs, "pivot_price"),
                money(rs, "failure_price"),
                rs.getString("notes"),
                TargetStatus.fromCode(rs.getString("status"))
        );
    }
}
