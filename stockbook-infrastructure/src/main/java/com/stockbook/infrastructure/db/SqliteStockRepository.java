package com.stockbook.infrastructure.db;

import com.stockbook.application.ports.StockFilter;
import com.stockbook.application.ports.StockRepository;
import com.stockbook.domain.money.CurrencyCode;
import com.stockbook.domain.stock.Grade;
import com.stockbook.domain.stock.Stock;
import com.stockbook.domain.stock.Symbol;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

public class SqliteStockRepository extends SqliteRepository implements StockRepository {

    private static final String SELECT = "SELECT id,symbol,name,industry_group,grade,notes FROM stock";

    public SqliteStockRepository(ConnectionHandle handle, CurrencyCode currency) {
        super(handle, currency);
    }

    @Override
    public long create(Stock stock) {
        requireNew(stock.id(), "Stock " + stock.symbol());
        String now = now();
        long id = handle.execute("create stock " + stock.symbol(), c -> insert(c, """
                INSERT INTO stock(symbol, name, industry_group, grade, notes, created_at, updated_at)
                VALUES(?,?,?,?,?,?,?)
                """,
                stock.symbol().value(), stock.name(), stock.industryGroup(), gradeCode(stock.grade()),
                stock.notes(), now, now));
        assigned(id, stock::assignId, stock::clearId);
        return id;
    }

    @Override
    public Optional<Stock> getById(long id) {
        return queryOne("get stock", SELECT + " WHERE id=?", SqliteStockRepository::map, id);
    }

    @Override
    public Optional<Stock> getBySymbol(String symbol) {
        return queryOne("get stock by symbol", SELECT + " WHERE symbol=?", SqliteStockRepository::map,
                Symbol.normalize(symbol));
    }

    @Override
    public boolean existsBySymbol(String symbol) {
        return queryOne("stock exists", "SELECT 1 FROM stock WHERE symbol=?", rs -> Boolean.TRUE,
                Symbol.normalize(symbol)).isPresent();
    }

    @Override
    public List<Stock> list(StockFilter filter) {
        StockFilter f = filter == null ? StockFilter.all() : filter;
        SqlWhere where = new SqlWhere()
                .contains("symbol", f.symbol())
                .contains("name", f.name())
                .contains("industry_group", f.industryGroup())
                .eq("grade", gradeCode(f.grade()));
        return queryList("list stocks", SELECT, where, "symbol", f.limit(), f.offset(), SqliteStockRepository::map);
    }

    /** Symbol is not updatable. */
    @Override
    public boolean update(long id, Stock stock) {
        return change("update stock " + id,
                "UPDATE stock SET name=?, industry_group=?, grade=?, notes=?, updated_at=? WHERE id=?",
                stock.name(), stock.industryGroup(), gradeCode(stock.grade()), stock.notes(), now(), id);
    }

    @Override
    public boolean delete(long id) {
        return change("delete stock " + id, "DELETE FROM stock WHERE id=?", id);
    }

    private static String gradeCode(Grade g) {
        return g == null ? null : g.name();
    }

    private static Stock map(ResultSet rs) throws SQLException {
        return Stock.restore(
                rs.getLong("id"),
                Symbol.of(rs.getString("symbol")),
                rs.getString("name"),
                rs.getString("industry_group"),
                Grade.parseNullable(rs.getString("grade")),
                rs.getString("notes")
        );
    }
}
