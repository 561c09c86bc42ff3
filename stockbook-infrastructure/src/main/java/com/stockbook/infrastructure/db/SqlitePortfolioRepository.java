package com.stockbook.infrastructure.db;

import com.stockbook.application.ports.PortfolioFilter;
import com.stockbook.application.ports.PortfolioRepository;
import com.stockbook.domain.money.CurrencyCode;
import com.stockbook.domain.portfolio.Portfolio;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

public class SqlitePortfolioRepository extends SqliteRepository implements PortfolioRepository {

    private static final String SELECT =
            "SELECT id,name,description,max_positions,max_risk_per_trade,is_active FROM portfolio";

    public SqlitePortfolioRepository(ConnectionHandle handle, CurrencyCode currency) {
        super(handle, currency);
    }

    @Override
    public long create(Portfolio p) {
        requireNew(p.id(), "Portfolio '" + p.name() + "'");
        String now = now();
        long id = handle.execute("create portfolio", c -> insert(c, """
                INSERT INTO portfolio(name, description, max_positions, max_risk_per_trade, is_active, created_at, updated_at)
                VALUES(?,?,?,?,?,?,?)
                """,
                p.name(), p.description(), p.maxPositions(), text(p.maxRiskPerTrade()), p.isActive() ? 1 : 0, now, now));
        assigned(id, p::assignId, p::clearId);
        return id;
    }

    @Override
    public Optional<Portfolio> getById(long id) {
        return queryOne("get portfolio", SELECT + " WHERE id=?", SqlitePortfolioRepository::map, id);
    }

    @Override
    public List<Portfolio> list(PortfolioFilter filter) {
        PortfolioFilter f = filter == null ? PortfolioFilter.all() : filter;
        SqlWhere where = new SqlWhere()
                .contains("name", f.name())
                .eq("is_active", f.active() == null ? null : (f.active() ? 1 : 0));
        return queryList("list portfolios", SELECT, where, "name, id", f.limit(), f.offset(),
                SqlitePortfolioRepository::map);
    }

    @Override
    public List<Portfolio> listActive() {
        return list(PortfolioFilter.activeOnly());
    }

    @Override
    public boolean update(long id, Portfolio p) {
        return change("update portfolio " + id, """
                UPDATE portfolio SET name=?, description=?, max_positions=?, max_risk_per_trade=?, is_active=?, updated_at=?
                WHERE id=?
                """,
                p.name(), p.description(), p.maxPositions(), text(p.maxRiskPerTrade()), p.isActive() ? 1 : 0, now(), id);
    }

    @Override
    public boolean deactivate(long id) {
        return change("deactivate portfolio " + id,
                "UPDATE portfolio SET is_active=0, updated_at=? WHERE id=?", now(), id);
    }

    @Override
    public boolean delete(long id) {
        return change("delete portfolio " + id, "DELETE FROM portfolio WHERE id=?", id);
    }

    private static Portfolio map(ResultSet rs) throws SQLException {
        return Portfolio.restore(
                rs.getLong("id"),
                rs.getString("name"),
                rs.getString("description"),
                rs.getInt("max_positions"),
                decimal(rs, "max_risk_per_trade"),
                rs.getInt("is_active") == 1
        );
    }
}
