package com.stockbook.infrastructure.db;

import com.stockbook.application.ports.BalanceFilter;
import com.stockbook.application.ports.PortfolioBalanceRepository;
import com.stockbook.domain.money.CurrencyCode;
import com.stockbook.domain.portfolio.PortfolioBalance;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public class SqlitePortfolioBalanceRepository extends SqliteRepository implements PortfolioBalanceRepository {

    private static final String SELECT = """
            SELECT id,portfolio_id,balance_date,withdrawals,deposits,final_balance,index_change
            FROM portfolio_balance""";

    public SqlitePortfolioBalanceRepository(ConnectionHandle handle, CurrencyCode currency) {
        super(handle, currency);
    }

    /** Upsert keyed on (portfolio_id, balance_date). */
    @Override
    public long create(PortfolioBalance b) {
        requireNew(b.id(), "Balance of " + b.balanceDate());
        String now = now();
        String withdrawals = text(b.withdrawals());
        String deposits = text(b.deposits());
        String finalBalance = text(b.finalBalance());
        String date = text(b.balanceDate());
        long id = handle.execute("save balance", c -> {
            try (PreparedStatement ps = c.prepareStatement("""
                    INSERT INTO portfolio_balance(portfolio_id, balance_date, withdrawals, deposits, final_balance,
                                                  index_change, created_at, updated_at)
                    VALUES(?,?,?,?,?,?,?,?)
                    ON CONFLICT(portfolio_id, balance_date) DO UPDATE SET
                      withdrawals=excluded.withdrawals,
                      deposits=excluded.deposits,
                      final_balance=excluded.final_balance,
                      index_change=excluded.index_change,
                      updated_at=excluded.updated_at
                    """)) {
                bind(ps, b.portfolioId(), date, withdrawals, deposits, finalBalance, text(b.indexChange()), now, now);
                ps.executeUpdate();
            }
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT id FROM portfolio_balance WHERE portfolio_id=? AND balance_date=?")) {
                bind(ps, b.portfolioId(), date);
                try (ResultSet rs = ps.executeQuery()) {
                    if (rs.next()) return rs.getLong(1);
                }
            }
            throw new SQLException("Balance row missing after upsert: portfolio=" + b.portfolioId() + " date=" + date);
        });
        assigned(id, b::assignId, b::clearId);
        return id;
    }

    @Override
    public Optional<PortfolioBalance> getById(long id) {
        return queryOne("get balance", SELECT + " WHERE id=?", this::map, id);
    }

    @Override
    public Optional<PortfolioBalance> getByPortfolioAndDate(long portfolioId, LocalDate date) {
        return queryOne("get balance by date", SELECT + " WHERE portfolio_id=? AND balance_date=?", this::map,
                portfolioId, text(date));
    }

    @Override
    public List<PortfolioBalance> list(BalanceFilter filter) {
        BalanceFilter f = filter == null ? BalanceFilter.all() : filter;
        SqlWhere where = new SqlWhere()
                .eq("portfolio_id", f.portfolioId())
                .onOrAfter("balance_date", f.from())
                .onOrBefore("balance_date", f.to());
        return queryList("list balances", SELECT, where, "balance_date, id", f.limit(), f.offset(), this::map);
    }

    @Override
    public List<PortfolioBalance> history(long portfolioId, int limit) {
        SqlWhere where = new SqlWhere().eq("portfolio_id", portfolioId);
        return queryList("balance history", SELECT, where, "balance_date DESC, id DESC",
                limit > 0 ? limit : 30, null, this::map);
    }

    @Override
    public Optional<PortfolioBalance> latest(long portfolioId) {
        List<PortfolioBalance> last = history(portfolioId, 1);
        return last.isEmpty() ? Optional.empty() : Optional.of(last.get(0));
    }

    @Override
    public boolean update(long id, PortfolioBalance b) {
        String withdrawals = text(b.withdrawals());
        String deposits = text(b.deposits());
        String finalBalance = text(b.finalBalance());
        return change("update balance " + id, """
                UPDATE portfolio_balance
                SET portfolio_id=?, balance_date=?, withdrawals=?, deposits=?, final_balance=?, index_change=?, updated_at=?
                WHERE id=?
                """,
                b.portfolioId(), text(b.balanceDate()), withdrawals, deposits, finalBalance, text(b.indexChange()),
                now(), id);
    }

    @Override
    public boolean delete(long id) {
        return change("delete balance " + id, "DELETE FROM portfolio_balance WHERE id=?", id);
    }

    private PortfolioBalance map(ResultSet rs) throws SQLException {
        return PortfolioBalance.restore(
                rs.getLong("id"),
                rs.getLong("portfolio_id"),
                date(rs, "balance_date"),
                money(rs, "withdrawals"),
                money(rs, "deposits"),
                money(rs, "final_balance"),
                decimal(rs, "index_change")
        );
    }
}
