package com.stockbook.infrastructure.db;

import com.stockbook.application.ports.StockTransactionRepository;
import com.stockbook.application.ports.TransactionFilter;
import com.stockbook.domain.money.CurrencyCode;
import com.stockbook.domain.money.Quantity;
import com.stockbook.domain.trade.StockTransaction;
import com.stockbook.domain.trade.TransactionType;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

public class SqliteStockTransactionRepository extends SqliteRepository implements StockTransactionRepository {

    private static final String SELECT = """
            SELECT id,portfolio_id,stock_id,type,quantity,price,transaction_date,notes
            FROM stock_transaction""";

    public SqliteStockTransactionRepository(ConnectionHandle handle, CurrencyCode currency) {
        super(handle, currency);
    }

    @Override
    public long create(StockTransaction t) {
        requireNew(t.id(), "Transaction");
        String now = now();
        String price = text(t.price());
        long id = handle.execute("create transaction", c -> insert(c, """
                INSERT INTO stock_transaction(portfolio_id, stock_id, type, quantity, price, transaction_date, notes,
                                              created_at, updated_at)
                VALUES(?,?,?,?,?,?,?,?,?)
                """,
                t.portfolioId(), t.stockId(), t.type().code(), t.quantity().value().toPlainString(), price,
                text(t.transactionDate()), t.notes(), now, now));
        assigned(id, t::assignId, t::clearId);
        return id;
    }

    @Override
    public Optional<StockTransaction> getById(long id) {
        return queryOne("get transaction", SELECT + " WHERE id=?", this::map, id);
    }

    @Override
    public List<StockTransaction> list(TransactionFilter filter) {
        TransactionFilter f = filter == null ? TransactionFilter.all() : filter;
        SqlWhere where = new SqlWhere()
                .eq("portfolio_id", f.portfolioId())
                .eq("stock_id", f.stockId())
                .eq("type", f.type() == null ? null : f.type().code())
                .onOrAfter("transaction_date", f.from())
                .onOrBefore("transaction_date", f.to());
        return queryList("list transactions", SELECT, where, "transaction_date, id", f.limit(), f.offset(), this::map);
    }

    @Override
    public boolean update(long id, StockTransaction t) {
        String price = text(t.price());
        return change("update transaction " + id, """
                UPDATE stock_transaction
                SET portfolio_id=?, stock_id=?, type=?, quantity=?, price=?, transaction_date=?, notes=?, updated_at=?
                WHERE id=?
                """,
                t.portfolioId(), t.stockId(), t.type().code(), t.quantity().value().toPlainString(), price,
                text(t.transactionDate()), t.notes(), now(), id);
    }

    @Override
    public boolean delete(long id) {
        return change("delete transaction " + id, "DELETE FROM stock_transaction WHERE id=?", id);
    }

    private StockTransaction map(ResultSet rs) throws SQLException {
        return StockTransaction.restore(
                rs.getLong("id"),
                rs.getLong("portfolio_id"),
                rs.getLong("stock_id"),
                TransactionType.fromCode(rs.getString("type")),
                Quantity.of(rs.getString("quantity")),
                money(rs, "price"),
                date(rs, "transaction_date"),
                rs.getString("notes")
        );
    }
}
